package dev.blanke.formfields.expression;

/**
 * A visitor to walk {@link AccessorExpression} trees.
 *
 * @param <R> The type of the result produced for each visited node.
 */
public interface ExpressionVisitor<R> {

    R visitParameter(ParameterExpression parameter);

    R visitConstant(ConstantExpression constant);

    R visitFieldAccess(FieldAccessExpression fieldAccess);

    R visitMethodCall(MethodCallExpression methodCall);

    R visitConversion(ConversionExpression conversion);
}
