package dev.blanke.formfields.expression;

import org.jetbrains.annotations.Nullable;

/**
 * Pushes a constant value.
 *
 * @param value {@code null}, a boxed primitive, a {@link String}, or an {@link org.objectweb.asm.Type} denoting a class
 *              literal.
 */
public record ConstantExpression(@Nullable Object value) implements AccessorExpression {

    @Override
    public <R> R accept(final ExpressionVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
