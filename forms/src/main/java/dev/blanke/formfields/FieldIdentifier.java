package dev.blanke.formfields;

import dev.blanke.formfields.analysis.AccessorResolver;

/**
 * Uniquely identifies a single field that can be edited, such as a property of a model object.
 * <p>
 * Two {@code FieldIdentifier}s are equal if they refer to the very same model instance and have the same, case-sensitive
 * field name. The model's own {@link Object#equals(Object)} and {@link Object#hashCode()} are never consulted, so
 * mutating a model does not affect identifiers referring to it, and identifiers can be used as keys of hash-based
 * collections, e.g. to associate validation messages with fields.
 *
 * @param model The object that owns the field. Must not be {@code null} or an instance of a value-based class.
 *
 * @param fieldName The name of the editable field. Must not be {@code null}, but may be empty.
 */
public record FieldIdentifier(Object model, String fieldName) {

    public FieldIdentifier {
        if (model == null)
            throw InvalidArgumentException.forNull("model");
        /*
         * Separately boxed copies of the same value are not guaranteed to be the same instance, which would break
         * equality.
         */
        if (ReferenceTypes.isValueBased(model.getClass())) {
            throw new InvalidArgumentException("model", """
                The model must be a reference-typed object. Instances of the value-based class %s do not have a \
                stable identity.""".formatted(model.getClass().getName()));
        }
        if (fieldName == null)
            throw InvalidArgumentException.forNull("fieldName");
    }

    /**
     * Creates a {@code FieldIdentifier} for the field or property read by the provided {@code accessor}, e.g.
     * <pre>{@code
     * FieldIdentifier.of(() -> person.getFirstName()); // (person, "firstName")
     * FieldIdentifier.of(() -> person.lastName);       // (person, "lastName")
     * FieldIdentifier.of(person::getAge);              // (person, "age")
     * }</pre>
     * The {@code accessor} is analyzed rather than invoked: only the expression producing the model ({@code person}
     * above) is evaluated, the field or property itself is not read.
     *
     * @param accessor A lambda expression or bound method reference reading a single field, JavaBeans property, or
     *                 record component.
     *
     * @return The identifier of the field or property read by the {@code accessor}.
     *
     * @throws UnsupportedExpressionException If the {@code accessor} does anything other than reading a field or
     *                                        property, such as invoking a method with arguments, indexing an array,
     *                                        or reading a static member.
     *
     * @throws InvalidArgumentException If the {@code accessor} reads from a {@code null} or value-based object.
     */
    public static FieldIdentifier of(final Accessor<?> accessor) {
        if (accessor == null)
            throw InvalidArgumentException.forNull("accessor");

        final var boundAccessor = AccessorResolver.resolve(accessor);
        return new FieldIdentifier(boundAccessor.target(), boundAccessor.fieldName());
    }

    @Override
    public boolean equals(final Object object) {
        return (this == object) || (object instanceof FieldIdentifier other)
            && (model == other.model)
            && fieldName.equals(other.fieldName);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(model) + fieldName.hashCode();
    }

    @Override
    public String toString() {
        return "FieldIdentifier[model=%s@%x, fieldName=%s]".formatted(
            model.getClass().getName(), System.identityHashCode(model), fieldName);
    }
}
