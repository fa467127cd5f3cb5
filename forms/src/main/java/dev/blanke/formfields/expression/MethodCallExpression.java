package dev.blanke.formfields.expression;

import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * Invokes a method which returns a value.
 *
 * @param target The expression producing the receiver of the invocation, or {@code null} for static methods.
 *
 * @param method The method being invoked.
 *
 * @param arguments The expressions producing the arguments, in declaration order.
 */
public record MethodCallExpression(@Nullable AccessorExpression target, MethodReference method,
                                   List<AccessorExpression> arguments) implements AccessorExpression {

    public MethodCallExpression {
        Objects.requireNonNull(method);
        arguments = List.copyOf(arguments);
    }

    public boolean isStatic() {
        return target == null;
    }

    @Override
    public <R> R accept(final ExpressionVisitor<R> visitor) {
        return visitor.visitMethodCall(this);
    }
}
