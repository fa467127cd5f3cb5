package dev.blanke.formfields.expression;

import static java.util.Objects.requireNonNull;

/**
 * Denotes a 3-tuple which uniquely identifies a field in a program.
 *
 * @param owner The internal name of the class defining the field.
 *
 * @param name The name of the field.
 *
 * @param descriptor A descriptor describing the type of the field.
 */
public record FieldReference(String owner, String name, String descriptor) {

    public FieldReference {
        requireNonNull(owner);
        requireNonNull(name);
        requireNonNull(descriptor);
    }
}
