package dev.blanke.formfields.lint;

import java.util.Objects;

import dev.blanke.formfields.analysis.LambdaImplementation;

/**
 * An {@code invokedynamic} instruction creating an {@link dev.blanke.formfields.Accessor}.
 *
 * @param className The fully qualified name of the class containing the instruction.
 *
 * @param methodName The name of the method containing the instruction.
 *
 * @param line The source line of the instruction, or {@code 0} if the class file lacks line number information.
 *
 * @param implementation The lambda body or referenced method implementing the accessor.
 */
public record AccessorSite(String className, String methodName, int line, LambdaImplementation implementation) {

    public AccessorSite {
        Objects.requireNonNull(className);
        Objects.requireNonNull(methodName);
        Objects.requireNonNull(implementation);
    }

    /**
     * Returns a human-readable location of the form {@code com.example.Person.nameField:42}.
     */
    public String location() {
        final var location = className + '.' + methodName;
        return (line > 0) ? location + ':' + line : location;
    }
}
