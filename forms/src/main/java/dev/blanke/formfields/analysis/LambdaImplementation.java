package dev.blanke.formfields.analysis;

import java.lang.invoke.SerializedLambda;

import org.objectweb.asm.Handle;

import static java.util.Objects.requireNonNull;

/**
 * Identifies the method a lambda expression or method reference delegates to.
 * <p>
 * The same information is available at run time through {@link SerializedLambda} and ahead of time through the
 * implementation {@link Handle} passed to {@link java.lang.invoke.LambdaMetafactory} by an {@code invokedynamic}
 * instruction, which allows the analysis of accessors in both situations.
 *
 * @param kind The method handle kind used to invoke the implementation, e.g. {@link org.objectweb.asm.Opcodes#H_INVOKESTATIC}.
 *
 * @param owner The internal name of the class declaring the implementation method.
 *
 * @param name The name of the implementation method.
 *
 * @param descriptor The descriptor of the implementation method.
 */
public record LambdaImplementation(int kind, String owner, String name, String descriptor) {

    /**
     * The prefix javac uses for the names of the synthetic methods containing lambda bodies.
     */
    private static final String LAMBDA_BODY_PREFIX = "lambda$";

    public LambdaImplementation {
        requireNonNull(owner);
        requireNonNull(name);
        requireNonNull(descriptor);
    }

    public static LambdaImplementation of(final SerializedLambda serializedLambda) {
        return new LambdaImplementation(serializedLambda.getImplMethodKind(), serializedLambda.getImplClass(),
            serializedLambda.getImplMethodName(), serializedLambda.getImplMethodSignature());
    }

    public static LambdaImplementation of(final Handle implementationHandle) {
        return new LambdaImplementation(implementationHandle.getTag(), implementationHandle.getOwner(),
            implementationHandle.getName(), implementationHandle.getDesc());
    }

    /**
     * Checks whether the implementation method is a synthetic method holding the body of a lambda expression, as
     * opposed to a method named by a method reference.
     *
     * @return {@code true} if this implementation belongs to a lambda expression.
     */
    public boolean isLambdaBody() {
        return name.startsWith(LAMBDA_BODY_PREFIX);
    }

    @Override
    public String toString() {
        return owner.replace('/', '.') + '.' + name + descriptor;
    }
}
