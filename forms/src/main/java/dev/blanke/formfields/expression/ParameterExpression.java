package dev.blanke.formfields.expression;

import java.util.Objects;

import org.objectweb.asm.Type;

/**
 * Reads an argument of the method implementing an accessor.
 * <p>
 * As accessors take no arguments of their own, every argument of the implementing method is a value captured when
 * the lambda was created: {@code this} for lambdas referring to instance members of the enclosing class, followed by
 * any captured local variables. For bound method references, the sole argument is the receiver.
 *
 * @param index The zero-based position of the argument, counting {@code this} for instance methods.
 *
 * @param type The declared type of the argument.
 */
public record ParameterExpression(int index, Type type) implements AccessorExpression {

    public ParameterExpression {
        if (index < 0)
            throw new IllegalArgumentException("Negative parameter index %d".formatted(index));
        Objects.requireNonNull(type);
    }

    @Override
    public <R> R accept(final ExpressionVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }
}
