package dev.blanke.formfields.analysis;

import java.util.Objects;

import dev.blanke.formfields.expression.AccessorExpression;

/**
 * The result of analyzing the implementation of an accessor.
 *
 * @param expression The complete expression computed by the accessor.
 *
 * @param target The sub-expression producing the object whose field or property is read. Evaluating it yields the
 *               model of a {@link dev.blanke.formfields.FieldIdentifier}.
 *
 * @param fieldName The name of the field or property being read.
 */
public record ResolvedAccessor(AccessorExpression expression, AccessorExpression target, String fieldName) {

    public ResolvedAccessor {
        Objects.requireNonNull(expression);
        Objects.requireNonNull(target);
        Objects.requireNonNull(fieldName);
    }
}
