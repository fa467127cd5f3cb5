package dev.blanke.formfields.expression;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * Reads a field.
 *
 * @param target The expression producing the object whose field is read, or {@code null} for static fields.
 *
 * @param field The field being read.
 */
public record FieldAccessExpression(@Nullable AccessorExpression target, FieldReference field)
        implements AccessorExpression {

    public FieldAccessExpression {
        Objects.requireNonNull(field);
    }

    public boolean isStatic() {
        return target == null;
    }

    @Override
    public <R> R accept(final ExpressionVisitor<R> visitor) {
        return visitor.visitFieldAccess(this);
    }
}
