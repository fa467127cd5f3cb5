package dev.blanke.formfields.expression;

import java.util.Objects;

import org.objectweb.asm.Type;

/**
 * Converts the value of its {@code operand} to a different {@code type}.
 *
 * @param operand The expression whose value is converted.
 *
 * @param kind How the value is converted.
 *
 * @param type The type of the converted value.
 */
public record ConversionExpression(AccessorExpression operand, Kind kind, Type type) implements AccessorExpression {

    public ConversionExpression {
        Objects.requireNonNull(operand);
        Objects.requireNonNull(kind);
        Objects.requireNonNull(type);
    }

    @Override
    public <R> R accept(final ExpressionVisitor<R> visitor) {
        return visitor.visitConversion(this);
    }

    public enum Kind {

        /**
         * A primitive value is wrapped using e.g. {@link Integer#valueOf(int)}, as happens when a lambda returning a
         * primitive property implements a generic functional interface.
         */
        BOXING,

        /**
         * A {@code checkcast} instruction, emitted for explicit casts as well as for values returned by methods whose
         * generic return type has been erased.
         */
        CAST
    }
}
