package dev.blanke.formfields;

import java.util.Objects;

/**
 * Thrown when a {@link FieldIdentifier} cannot be constructed from the provided arguments.
 * <p>
 * In contrast to a plain {@link IllegalArgumentException}, the name of the offending constructor parameter is
 * retained and can be queried via {@link #parameterName()}.
 */
public final class InvalidArgumentException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String parameterName;

    public InvalidArgumentException(final String parameterName, final String message) {
        super(message);

        this.parameterName = Objects.requireNonNull(parameterName);
    }

    /**
     * Creates an {@code InvalidArgumentException} reporting that the parameter with the given name has been passed
     * {@code null}.
     *
     * @param parameterName The name of the parameter which must not be {@code null}.
     *
     * @return A new {@code InvalidArgumentException} for the given {@code parameterName}.
     */
    static InvalidArgumentException forNull(final String parameterName) {
        return new InvalidArgumentException(parameterName,
            "Value cannot be null. (Parameter '%s')".formatted(parameterName));
    }

    /**
     * Returns the name of the parameter which caused the construction of the {@link FieldIdentifier} to fail.
     *
     * @return {@code "model"}, {@code "fieldName"}, or {@code "accessor"}.
     */
    public String parameterName() {
        return parameterName;
    }
}
