package dev.blanke.formfields;

import java.io.Serializable;
import java.util.function.Supplier;

/**
 * A parameterless accessor reading a single field or property of some object, such as
 * {@code () -> model.getName()}, {@code () -> model.name}, or {@code model::getName}.
 * <p>
 * Accessors are never invoked by {@link FieldIdentifier#of(Accessor)}. Instead, the compiled body of the lambda or
 * the referenced method is analyzed, which is possible because the compiler emits a
 * {@link java.lang.invoke.SerializedLambda} for every lambda targeting a {@link Serializable} functional interface.
 *
 * @param <T> The type of the field or property being read.
 */
@FunctionalInterface
public interface Accessor<T> extends Supplier<T>, Serializable {
}
