package dev.blanke.formfields.analysis;

import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;

import org.objectweb.asm.Type;
import org.objectweb.asm.tree.MethodNode;

import dev.blanke.formfields.UnsupportedExpressionException;
import dev.blanke.formfields.expression.AccessorExpression;
import dev.blanke.formfields.expression.ConstantExpression;
import dev.blanke.formfields.expression.ConversionExpression;
import dev.blanke.formfields.expression.FieldAccessExpression;
import dev.blanke.formfields.expression.FieldReference;
import dev.blanke.formfields.expression.MethodCallExpression;
import dev.blanke.formfields.expression.MethodReference;
import dev.blanke.formfields.expression.ParameterExpression;

import static org.junit.jupiter.api.Assertions.*;

import static org.objectweb.asm.Opcodes.*;

final class AccessorBodyParserTest {

    private static final String OWNER = "test/Accessors";

    private static final String MODEL = "test/Model";

    private static final Type MODEL_TYPE = Type.getObjectType(MODEL);

    private static final String STATIC_BODY = "(Ltest/Model;)Ljava/lang/Object;";

    private static AccessorExpression parse(final int access, final String descriptor,
                                            final Consumer<MethodNode> body) {
        final var method = new MethodNode(access, "lambda$test$0", descriptor, null, null);
        body.accept(method);
        return new AccessorBodyParser(OWNER, method).parse();
    }

    private static UnsupportedExpressionException assertUnsupported(final String descriptor,
                                                                    final Consumer<MethodNode> body) {
        return assertThrows(UnsupportedExpressionException.class,
            () -> parse(ACC_PRIVATE | ACC_STATIC | ACC_SYNTHETIC, descriptor, body));
    }

    @Test
    void testParseFieldRead() {
        final var expression = parse(ACC_PRIVATE | ACC_STATIC | ACC_SYNTHETIC, STATIC_BODY, method -> {
            method.visitVarInsn(ALOAD, 0);
            method.visitFieldInsn(GETFIELD, MODEL, "name", "Ljava/lang/String;");
            method.visitInsn(ARETURN);
        });
        assertEquals(new FieldAccessExpression(new ParameterExpression(0, MODEL_TYPE),
            new FieldReference(MODEL, "name", "Ljava/lang/String;")), expression);
    }

    @Test
    void testParseBoxedGetter() {
        final var expression = parse(ACC_PRIVATE | ACC_STATIC | ACC_SYNTHETIC, STATIC_BODY, method -> {
            method.visitVarInsn(ALOAD, 0);
            method.visitMethodInsn(INVOKEVIRTUAL, MODEL, "getAge", "()I", false);
            method.visitMethodInsn(INVOKESTATIC, "java/lang/Integer", "valueOf", "(I)Ljava/lang/Integer;", false);
            method.visitInsn(ARETURN);
        });
        final var getAge = new MethodCallExpression(new ParameterExpression(0, MODEL_TYPE),
            new MethodReference(INVOKEVIRTUAL, MODEL, "getAge", "()I"), List.of());
        assertEquals(new ConversionExpression(getAge, ConversionExpression.Kind.BOXING,
            Type.getObjectType("java/lang/Integer")), expression);
    }

    @Test
    void testParseCast() {
        final var expression = parse(ACC_PRIVATE | ACC_STATIC | ACC_SYNTHETIC, "(Ltest/Model;)Ljava/lang/String;",
            method -> {
                method.visitVarInsn(ALOAD, 0);
                method.visitMethodInsn(INVOKEVIRTUAL, MODEL, "getValue", "()Ljava/lang/Object;", false);
                method.visitTypeInsn(CHECKCAST, "java/lang/String");
                method.visitInsn(ARETURN);
            });
        final var conversion = assertInstanceOf(ConversionExpression.class, expression);
        assertEquals(ConversionExpression.Kind.CAST, conversion.kind());
        assertEquals(Type.getType(String.class), conversion.type());
        assertInstanceOf(MethodCallExpression.class, conversion.operand());
    }

    @Test
    void testParseMethodCallArguments() {
        final var expression = parse(ACC_PRIVATE | ACC_STATIC | ACC_SYNTHETIC, STATIC_BODY, method -> {
            method.visitVarInsn(ALOAD, 0);
            method.visitInsn(ICONST_2);
            method.visitLdcInsn("key");
            method.visitMethodInsn(INVOKEVIRTUAL, MODEL, "child", "(ILjava/lang/String;)Ltest/Model;", false);
            method.visitInsn(ARETURN);
        });
        final var methodCall = assertInstanceOf(MethodCallExpression.class, expression);
        assertEquals(new ParameterExpression(0, MODEL_TYPE), methodCall.target());
        assertEquals(List.of(new ConstantExpression(2), new ConstantExpression("key")), methodCall.arguments());
    }

    @Test
    void testParseStaticMethodCall() {
        final var expression = parse(ACC_PRIVATE | ACC_STATIC | ACC_SYNTHETIC, "()Ljava/lang/Object;", method -> {
            method.visitMethodInsn(INVOKESTATIC, MODEL, "current", "()Ltest/Model;", false);
            method.visitInsn(ARETURN);
        });
        final var methodCall = assertInstanceOf(MethodCallExpression.class, expression);
        assertTrue(methodCall.isStatic());
        assertNull(methodCall.target());
    }

    @Test
    void testParseInstanceBodyLoadsThis() {
        final var expression = parse(ACC_PRIVATE | ACC_SYNTHETIC, "()Ljava/lang/Object;", method -> {
            method.visitVarInsn(ALOAD, 0);
            method.visitFieldInsn(GETFIELD, OWNER, "name", "Ljava/lang/String;");
            method.visitInsn(ARETURN);
        });
        final var fieldAccess = assertInstanceOf(FieldAccessExpression.class, expression);
        assertEquals(new ParameterExpression(0, Type.getObjectType(OWNER)), fieldAccess.target());
    }

    @Test
    void testParseWideArgumentSlots() {
        // The long argument occupies slots 0 and 1, the model is stored in slot 2.
        final var expression = parse(ACC_PRIVATE | ACC_STATIC | ACC_SYNTHETIC, "(JLtest/Model;)Ljava/lang/Object;",
            method -> {
                method.visitVarInsn(ALOAD, 2);
                method.visitFieldInsn(GETFIELD, MODEL, "name", "Ljava/lang/String;");
                method.visitInsn(ARETURN);
            });
        final var fieldAccess = assertInstanceOf(FieldAccessExpression.class, expression);
        assertEquals(new ParameterExpression(1, MODEL_TYPE), fieldAccess.target());
    }

    @Test
    void testRejectArithmetic() {
        final var exception = assertUnsupported(STATIC_BODY, method -> {
            method.visitVarInsn(ALOAD, 0);
            method.visitMethodInsn(INVOKEVIRTUAL, MODEL, "getAge", "()I", false);
            method.visitInsn(ICONST_1);
            method.visitInsn(IADD);
            method.visitMethodInsn(INVOKESTATIC, "java/lang/Integer", "valueOf", "(I)Ljava/lang/Integer;", false);
            method.visitInsn(ARETURN);
        });
        assertTrue(exception.getMessage().contains("IADD"));
        assertTrue(exception.getMessage().contains("test.Accessors.lambda$test$0"));
    }

    @Test
    void testRejectLocalVariableStore() {
        final var exception = assertUnsupported(STATIC_BODY, method -> {
            method.visitVarInsn(ALOAD, 0);
            method.visitVarInsn(ASTORE, 1);
            method.visitVarInsn(ALOAD, 1);
            method.visitInsn(ARETURN);
        });
        assertTrue(exception.getMessage().contains("ASTORE"));
    }

    @Test
    void testRejectNonArgumentSlot() {
        final var exception = assertUnsupported(STATIC_BODY, method -> {
            method.visitVarInsn(ALOAD, 1);
            method.visitInsn(ARETURN);
        });
        assertTrue(exception.getMessage().contains("slot 1"));
    }

    @Test
    void testRejectConstructorInvocation() {
        assertUnsupported("()Ljava/lang/Object;", method -> {
            method.visitTypeInsn(NEW, MODEL);
            method.visitInsn(DUP);
            method.visitMethodInsn(INVOKESPECIAL, MODEL, "<init>", "()V", false);
            method.visitInsn(ARETURN);
        });
    }

    @Test
    void testRejectValuesLeftOnStack() {
        final var exception = assertUnsupported(STATIC_BODY, method -> {
            method.visitVarInsn(ALOAD, 0);
            method.visitVarInsn(ALOAD, 0);
            method.visitInsn(ARETURN);
        });
        assertTrue(exception.getMessage().contains("operand stack"));
    }

    @Test
    void testRejectMissingReturn() {
        assertUnsupported(STATIC_BODY, method -> method.visitVarInsn(ALOAD, 0));
    }

    @Test
    void testRejectEmptyStack() {
        assertUnsupported(STATIC_BODY, method -> method.visitInsn(ARETURN));
    }
}
