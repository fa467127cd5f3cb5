package dev.blanke.formfields.expression;

import java.util.stream.Collectors;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.Type;

/**
 * Renders an {@link AccessorExpression} as Java-like source text for use in diagnostics.
 * <p>
 * Captured values are printed as {@code $0}, {@code $1}, and so on, as the names of the captured variables are not
 * retained in the compiled lambda.
 */
public final class ExpressionPrinter implements ExpressionVisitor<String> {

    private static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    private ExpressionPrinter() {
    }

    public static String print(final AccessorExpression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitParameter(final ParameterExpression parameter) {
        return "$" + parameter.index();
    }

    @Override
    public String visitConstant(final ConstantExpression constant) {
        final Object value = constant.value();
        if (value instanceof String string)
            return '"' + string + '"';
        if (value instanceof Type type)
            return simpleName(type) + ".class";
        return String.valueOf(value);
    }

    @Override
    public String visitFieldAccess(final FieldAccessExpression fieldAccess) {
        return qualifier(fieldAccess.target(), fieldAccess.field().owner()) + '.' + fieldAccess.field().name();
    }

    @Override
    public String visitMethodCall(final MethodCallExpression methodCall) {
        final var arguments = methodCall.arguments().stream()
            .map(argument -> argument.accept(this))
            .collect(Collectors.joining(", ", "(", ")"));
        return qualifier(methodCall.target(), methodCall.method().owner()) + '.' + methodCall.method().name()
            + arguments;
    }

    @Override
    public String visitConversion(final ConversionExpression conversion) {
        return '(' + simpleName(conversion.type()) + ") " + conversion.operand().accept(this);
    }

    private String qualifier(final @Nullable AccessorExpression target, final String owner) {
        return (target != null) ? target.accept(this) : simpleName(Type.getObjectType(owner));
    }

    private static String simpleName(final Type type) {
        final var className = type.getClassName();
        return className.substring(className.lastIndexOf('.') + 1);
    }
}
