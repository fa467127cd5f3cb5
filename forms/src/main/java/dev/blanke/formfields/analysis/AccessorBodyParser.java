package dev.blanke.formfields.analysis;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.objectweb.asm.util.Printer;

import dev.blanke.formfields.UnsupportedExpressionException;
import dev.blanke.formfields.expression.AccessorExpression;
import dev.blanke.formfields.expression.ConstantExpression;
import dev.blanke.formfields.expression.ConversionExpression;
import dev.blanke.formfields.expression.FieldAccessExpression;
import dev.blanke.formfields.expression.FieldReference;
import dev.blanke.formfields.expression.MethodCallExpression;
import dev.blanke.formfields.expression.MethodReference;
import dev.blanke.formfields.expression.ParameterExpression;

import static org.objectweb.asm.Opcodes.*;

/**
 * Recovers an {@link AccessorExpression} tree from the compiled body of a lambda expression by executing its
 * instructions symbolically: instead of values, the operand stack holds the expressions which would have produced
 * them.
 * <p>
 * Only straight-line code made up of argument loads, constants, field reads, method invocations, and casts, which
 * ends in an {@code areturn}, is understood. Every other instruction causes an {@link UnsupportedExpressionException}.
 */
final class AccessorBodyParser {

    /**
     * Internal names of the wrapper classes whose {@code valueOf} method is used by javac for boxing conversions.
     */
    private static final Set<String> WRAPPER_CLASSES = Set.of(
        "java/lang/Boolean",
        "java/lang/Character",
        "java/lang/Byte",
        "java/lang/Short",
        "java/lang/Integer",
        "java/lang/Long",
        "java/lang/Float",
        "java/lang/Double");

    private final String owner;

    private final MethodNode method;

    /**
     * The types of the method's arguments, including the type of {@code this} for instance methods.
     */
    private final Type[] parameterTypes;

    /**
     * Maps local variable slots to the index of the argument stored in that slot. {@code long} and {@code double}
     * arguments occupy two slots.
     */
    private final Map<Integer, Integer> parameterIndices = new HashMap<>();

    AccessorBodyParser(final String owner, final MethodNode method) {
        this.owner  = owner;
        this.method = method;

        final var argumentTypes = Type.getArgumentTypes(method.desc);
        if ((method.access & ACC_STATIC) != 0) {
            parameterTypes = argumentTypes;
        } else {
            parameterTypes = new Type[argumentTypes.length + 1];
            parameterTypes[0] = Type.getObjectType(owner);
            System.arraycopy(argumentTypes, 0, parameterTypes, 1, argumentTypes.length);
        }
        int slot = 0;
        for (int index = 0; index < parameterTypes.length; ++index) {
            parameterIndices.put(slot, index);
            slot += parameterTypes[index].getSize();
        }
    }

    AccessorExpression parse() {
        final Deque<AccessorExpression> stack = new ArrayDeque<>();

        for (final AbstractInsnNode instruction : method.instructions) {
            final int opcode = instruction.getOpcode();
            // Labels, line numbers, and frames are pseudo-instructions without an opcode.
            if (opcode < 0)
                continue;

            switch (opcode) {
                case ALOAD, ILOAD, LLOAD, FLOAD, DLOAD -> stack.push(parseLoad((VarInsnNode) instruction));
                case ACONST_NULL -> stack.push(new ConstantExpression(null));
                case ICONST_M1, ICONST_0, ICONST_1, ICONST_2, ICONST_3, ICONST_4, ICONST_5 ->
                    stack.push(new ConstantExpression(opcode - ICONST_0));
                case LCONST_0, LCONST_1 -> stack.push(new ConstantExpression((long) (opcode - LCONST_0)));
                case FCONST_0, FCONST_1, FCONST_2 -> stack.push(new ConstantExpression((float) (opcode - FCONST_0)));
                case DCONST_0, DCONST_1 -> stack.push(new ConstantExpression((double) (opcode - DCONST_0)));
                case BIPUSH, SIPUSH -> stack.push(new ConstantExpression(((IntInsnNode) instruction).operand));
                case LDC -> stack.push(parseLdc((LdcInsnNode) instruction));
                case GETSTATIC, GETFIELD -> {
                    final var fieldInstruction = (FieldInsnNode) instruction;
                    final var target = (opcode == GETFIELD) ? pop(stack) : null;
                    stack.push(new FieldAccessExpression(target,
                        new FieldReference(fieldInstruction.owner, fieldInstruction.name, fieldInstruction.desc)));
                }
                case INVOKEVIRTUAL, INVOKESPECIAL, INVOKESTATIC, INVOKEINTERFACE ->
                    stack.push(parseInvocation((MethodInsnNode) instruction, stack));
                case CHECKCAST -> stack.push(new ConversionExpression(pop(stack), ConversionExpression.Kind.CAST,
                    Type.getObjectType(((TypeInsnNode) instruction).desc)));
                case ARETURN -> {
                    final var result = pop(stack);
                    if (!stack.isEmpty())
                        throw unsupported("leaves values on the operand stack");
                    return result;
                }
                default -> throw unsupported("contains the unsupported instruction " + Printer.OPCODES[opcode]);
            }
        }
        throw unsupported("does not return a reference");
    }

    private ParameterExpression parseLoad(final VarInsnNode instruction) {
        final var index = parameterIndices.get(instruction.var);
        if (index == null)
            throw unsupported("reads the local variable in slot " + instruction.var);
        return new ParameterExpression(index, parameterTypes[index]);
    }

    private ConstantExpression parseLdc(final LdcInsnNode instruction) {
        final Object constant = instruction.cst;
        if ((constant instanceof Type type) && (type.getSort() == Type.METHOD))
            throw unsupported("loads a method type constant");
        if ((constant instanceof Type) || (constant instanceof String) || (constant instanceof Number))
            return new ConstantExpression(constant);
        throw unsupported("loads the unsupported constant " + constant);
    }

    private AccessorExpression parseInvocation(final MethodInsnNode instruction,
                                               final Deque<AccessorExpression> stack) {
        final var invoked = new MethodReference(instruction.getOpcode(), instruction.owner, instruction.name,
            instruction.desc);
        if (invoked.name().equals("<init>"))
            throw unsupported("invokes the constructor of " + instruction.owner.replace('/', '.'));
        if (invoked.returnType().getSort() == Type.VOID)
            throw unsupported("invokes the void method " + instruction.name);

        final var arguments = new AccessorExpression[invoked.argumentTypes().length];
        for (int index = arguments.length - 1; index >= 0; --index) {
            arguments[index] = pop(stack);
        }
        if (isBoxing(invoked))
            return new ConversionExpression(arguments[0], ConversionExpression.Kind.BOXING, invoked.returnType());

        final var target = invoked.isStatic() ? null : pop(stack);
        return new MethodCallExpression(target, invoked, List.of(arguments));
    }

    private static boolean isBoxing(final MethodReference method) {
        if (!method.isStatic() || !method.name().equals("valueOf") || !WRAPPER_CLASSES.contains(method.owner()))
            return false;
        final var argumentTypes = method.argumentTypes();
        return (argumentTypes.length == 1)
            && (argumentTypes[0].getSort() >= Type.BOOLEAN) && (argumentTypes[0].getSort() <= Type.DOUBLE)
            && method.returnType().getInternalName().equals(method.owner());
    }

    private AccessorExpression pop(final Deque<AccessorExpression> stack) {
        if (stack.isEmpty())
            throw unsupported("manipulates the operand stack in an unsupported way");
        return stack.pop();
    }

    private UnsupportedExpressionException unsupported(final String reason) {
        return new UnsupportedExpressionException("The accessor body %s.%s%s %s.".formatted(
            owner.replace('/', '.'), method.name, method.desc, reason));
    }
}
