package dev.blanke.formfields.expression;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import static java.util.Objects.requireNonNull;

/**
 * Denotes a 4-tuple which uniquely identifies an invocation of a specific method in a program.
 *
 * @param opcode The opcode that is used to invoke the method. See {@link org.objectweb.asm.Opcodes}.
 *
 * @param owner The internal name of the class defining the invoked method.
 *
 * @param name The name of the method being invoked.
 *
 * @param descriptor A descriptor specifying the parameter and return types of the invoked method as a string.
 */
public record MethodReference(int opcode, String owner, String name, String descriptor) {

    public MethodReference {
        requireNonNull(owner);
        requireNonNull(name);
        requireNonNull(descriptor);
    }

    public boolean isStatic() {
        return opcode == Opcodes.INVOKESTATIC;
    }

    public Type returnType() {
        return Type.getReturnType(descriptor);
    }

    public Type[] argumentTypes() {
        return Type.getArgumentTypes(descriptor);
    }
}
