package dev.blanke.formfields.expression;

/**
 * A node of the expression tree recovered from the compiled body of an {@link dev.blanke.formfields.Accessor}.
 * <p>
 * The set of node types is closed: {@link ParameterExpression}, {@link ConstantExpression},
 * {@link FieldAccessExpression}, {@link MethodCallExpression}, and {@link ConversionExpression}. Anything a body does
 * beyond what these nodes can express is rejected while parsing.
 *
 * @see ExpressionVisitor
 */
public interface AccessorExpression {

    <R> R accept(ExpressionVisitor<R> visitor);
}
