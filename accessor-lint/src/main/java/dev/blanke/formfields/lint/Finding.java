package dev.blanke.formfields.lint;

import java.util.Objects;

import dev.blanke.formfields.UnsupportedExpressionException;
import dev.blanke.formfields.analysis.ResolvedAccessor;

/**
 * The outcome of analyzing a single {@link AccessorSite}.
 *
 * @param site The inspected accessor.
 *
 * @param supported Whether {@link dev.blanke.formfields.FieldIdentifier#of} accepts the accessor.
 *
 * @param detail The name of the field or property read by a supported accessor, or the reason an accessor is not
 *               supported.
 */
public record Finding(AccessorSite site, boolean supported, String detail) {

    public Finding {
        Objects.requireNonNull(site);
        Objects.requireNonNull(detail);
    }

    static Finding resolved(final AccessorSite site, final ResolvedAccessor resolvedAccessor) {
        return new Finding(site, true, resolvedAccessor.fieldName());
    }

    static Finding rejected(final AccessorSite site, final UnsupportedExpressionException exception) {
        return new Finding(site, false, exception.getMessage());
    }
}
