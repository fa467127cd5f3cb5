package dev.blanke.formfields;

/**
 * Thrown if an {@link Accessor} does not describe a read of a single field or property on some object.
 *
 * @see FieldIdentifier#of(Accessor)
 */
public final class UnsupportedExpressionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnsupportedExpressionException(final String message) {
        super(message);
    }

    public UnsupportedExpressionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
