package dev.blanke.formfields.analysis;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.Type;

import dev.blanke.formfields.UnsupportedExpressionException;
import dev.blanke.formfields.expression.AccessorExpression;
import dev.blanke.formfields.expression.ConstantExpression;
import dev.blanke.formfields.expression.ConversionExpression;
import dev.blanke.formfields.expression.ExpressionPrinter;
import dev.blanke.formfields.expression.ExpressionVisitor;
import dev.blanke.formfields.expression.FieldAccessExpression;
import dev.blanke.formfields.expression.MethodCallExpression;
import dev.blanke.formfields.expression.ParameterExpression;

/**
 * Evaluates the target sub-expression of an accessor to obtain the model a field or property is read from.
 * <p>
 * Parameters are bound to the values captured by the lambda, while field reads and method invocations are carried out
 * reflectively. Each node is evaluated exactly once.
 */
public final class TargetEvaluator implements ExpressionVisitor<Object> {

    private final Object[] arguments;

    private final @Nullable ClassLoader classLoader;

    /**
     * @param arguments The captured values, in the order of the implementation method's arguments.
     *
     * @param classLoader The class loader of the class declaring the accessor, used to resolve referenced classes.
     */
    public TargetEvaluator(final Object[] arguments, final @Nullable ClassLoader classLoader) {
        this.arguments   = Objects.requireNonNull(arguments);
        this.classLoader = classLoader;
    }

    public @Nullable Object evaluate(final AccessorExpression expression) {
        return expression.accept(this);
    }

    @Override
    public Object visitParameter(final ParameterExpression parameter) {
        if (parameter.index() >= arguments.length) {
            throw new UnsupportedExpressionException("The accessor captured %d values but reads value %d."
                .formatted(arguments.length, parameter.index()));
        }
        return arguments[parameter.index()];
    }

    @Override
    public Object visitConstant(final ConstantExpression constant) {
        if (constant.value() instanceof Type type)
            return loadClass(type);
        return constant.value();
    }

    @Override
    public Object visitFieldAccess(final FieldAccessExpression fieldAccess) {
        final Object target = (fieldAccess.target() != null) ? fieldAccess.target().accept(this) : null;
        final var reference = fieldAccess.field();
        try {
            final var field = Members.findField(loadClass(Type.getObjectType(reference.owner())), reference.name());
            field.trySetAccessible();
            return field.get(target);
        } catch (final ReflectiveOperationException exception) {
            throw cannotEvaluate(fieldAccess, exception);
        }
    }

    @Override
    public Object visitMethodCall(final MethodCallExpression methodCall) {
        final Object target = (methodCall.target() != null) ? methodCall.target().accept(this) : null;
        final var argumentValues = methodCall.arguments().stream()
            .map(argument -> argument.accept(this))
            .toArray();

        final var reference = methodCall.method();
        final var argumentTypes = reference.argumentTypes();
        final var parameterTypes = new Class<?>[argumentTypes.length];
        for (int index = 0; index < argumentTypes.length; ++index) {
            parameterTypes[index] = loadClass(argumentTypes[index]);
            argumentValues[index] = narrow(argumentValues[index], parameterTypes[index]);
        }
        try {
            final var method = Members.findMethod(
                loadClass(Type.getObjectType(reference.owner())), reference.name(), parameterTypes);
            method.trySetAccessible();
            return method.invoke(target, argumentValues);
        } catch (final InvocationTargetException exception) {
            final var cause = exception.getCause();
            if (cause instanceof RuntimeException runtimeException)
                throw runtimeException;
            if (cause instanceof Error error)
                throw error;
            throw new UndeclaredThrowableException(cause);
        } catch (final ReflectiveOperationException exception) {
            throw cannotEvaluate(methodCall, exception);
        }
    }

    @Override
    public Object visitConversion(final ConversionExpression conversion) {
        final Object value = conversion.operand().accept(this);
        if (conversion.kind() == ConversionExpression.Kind.CAST)
            return loadClass(conversion.type()).cast(value);
        // Reflection already returns primitive values in their boxed form, only int constants need narrowing.
        return narrow(value, loadClass(conversion.type()));
    }

    /**
     * Converts an {@link Integer} to the {@code type} it stands for. The JVM pushes {@code boolean}, {@code char},
     * {@code byte}, and {@code short} constants as {@code int}s, whereas reflection expects their own wrapper classes.
     *
     * @param value The evaluated value.
     *
     * @param type A primitive type or wrapper class expected in place of the {@code value}.
     *
     * @return The converted value, or the {@code value} itself if no conversion applies.
     */
    static @Nullable Object narrow(final @Nullable Object value, final Class<?> type) {
        if (!(value instanceof Integer integer))
            return value;
        if ((type == boolean.class) || (type == Boolean.class))
            return integer != 0;
        if ((type == char.class) || (type == Character.class))
            return (char) integer.intValue();
        if ((type == byte.class) || (type == Byte.class))
            return integer.byteValue();
        if ((type == short.class) || (type == Short.class))
            return integer.shortValue();
        return value;
    }

    private Class<?> loadClass(final Type type) {
        try {
            return Members.toClass(type, classLoader);
        } catch (final ClassNotFoundException exception) {
            throw new UnsupportedExpressionException(
                "Cannot load class %s referenced by the accessor.".formatted(type.getClassName()), exception);
        }
    }

    private static UnsupportedExpressionException cannotEvaluate(final AccessorExpression expression,
                                                                 final ReflectiveOperationException exception) {
        return new UnsupportedExpressionException(
            "Cannot evaluate %s.".formatted(ExpressionPrinter.print(expression)), exception);
    }
}
