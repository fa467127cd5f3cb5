package dev.blanke.formfields.analysis;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.invoke.SerializedLambda;
import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.atomic.AtomicReference;

import org.jetbrains.annotations.Nullable;

import dev.blanke.formfields.Accessor;
import dev.blanke.formfields.UnsupportedExpressionException;

/**
 * Turns an {@link Accessor} into the object it reads from and the name of the field or property it reads.
 * <p>
 * The analysis of an accessor's implementation depends only on the class of the lambda, so it is performed once per
 * lambda class and cached. The target expression is evaluated anew for each accessor instance, as instances of the
 * same lambda class differ in their captured values.
 */
public final class AccessorResolver {

    /**
     * The analysis results per lambda class.
     * <p>
     * A {@link ClassValue} does not prevent the lambda classes from being unloaded. Concurrent first calls for the same
     * class may analyze the accessor twice, which is harmless, as the outcome is the same.
     */
    private static final ClassValue<AtomicReference<ResolvedAccessor>> RESOLVED_ACCESSORS = new ClassValue<>() {
        @Override
        protected AtomicReference<ResolvedAccessor> computeValue(final Class<?> lambdaClass) {
            return new AtomicReference<>();
        }
    };

    private static final Logger LOGGER = System.getLogger(AccessorResolver.class.getName());

    // Prevent instantiation of utility class.
    private AccessorResolver() {
    }

    /**
     * Analyzes the provided {@code accessor} and evaluates the expression producing the object it reads from.
     *
     * @param accessor A lambda expression or a bound method reference.
     *
     * @return The object read from, which may be {@code null}, along with the name of the field or property read.
     *
     * @throws UnsupportedExpressionException If the {@code accessor} is not a lambda expression or method reference or
     *                                        does not read a single field or property of an object.
     */
    public static BoundAccessor resolve(final Accessor<?> accessor) {
        final var lambdaClass      = accessor.getClass();
        final var serializedLambda = serialize(accessor);
        final var classLoader      = lambdaClass.getClassLoader();

        final var cachedAccessor = RESOLVED_ACCESSORS.get(lambdaClass);
        var resolvedAccessor = cachedAccessor.get();
        if (resolvedAccessor == null) {
            final var implementation = LambdaImplementation.of(serializedLambda);
            LOGGER.log(Level.DEBUG, "Analyzing accessor implementation {0}.", implementation);

            resolvedAccessor =
                new AccessorAnalyzer(new ClassLoaderClassFileLocator(classLoader)).analyze(implementation);
            cachedAccessor.set(resolvedAccessor);
        }

        final var capturedValues = new Object[serializedLambda.getCapturedArgCount()];
        for (int index = 0; index < capturedValues.length; ++index) {
            capturedValues[index] = serializedLambda.getCapturedArg(index);
        }
        final Object target = new TargetEvaluator(capturedValues, classLoader).evaluate(resolvedAccessor.target());
        return new BoundAccessor(target, resolvedAccessor.fieldName());
    }

    /**
     * Obtains the {@link SerializedLambda} describing the provided {@code accessor} by invoking the
     * {@code writeReplace} method generated for serializable lambdas.
     */
    private static SerializedLambda serialize(final Accessor<?> accessor) {
        final Object replacement;
        try {
            final var writeReplace = accessor.getClass().getDeclaredMethod("writeReplace");
            writeReplace.setAccessible(true);
            replacement = writeReplace.invoke(accessor);
        } catch (final NoSuchMethodException exception) {
            throw notALambda(accessor, exception);
        } catch (final IllegalAccessException | InvocationTargetException | RuntimeException exception) {
            throw new UnsupportedExpressionException(
                "Cannot inspect the accessor %s.".formatted(accessor.getClass().getName()), exception);
        }
        if (replacement instanceof SerializedLambda serializedLambda)
            return serializedLambda;
        throw notALambda(accessor, null);
    }

    private static UnsupportedExpressionException notALambda(final Accessor<?> accessor,
                                                             final @Nullable Exception cause) {
        return new UnsupportedExpressionException("The accessor %s is neither a lambda expression nor a method reference."
            .formatted(accessor.getClass().getName()), cause);
    }

    /**
     * An accessor whose target expression has been evaluated.
     *
     * @param target The object the accessor reads from, or {@code null} if the target expression evaluated to
     *               {@code null}.
     *
     * @param fieldName The name of the field or property read.
     */
    public record BoundAccessor(@Nullable Object target, String fieldName) {
    }
}
