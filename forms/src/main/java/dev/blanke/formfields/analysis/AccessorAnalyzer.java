package dev.blanke.formfields.analysis;

import java.util.List;

import org.objectweb.asm.Type;

import dev.blanke.formfields.UnsupportedExpressionException;
import dev.blanke.formfields.expression.AccessorExpression;
import dev.blanke.formfields.expression.ConversionExpression;
import dev.blanke.formfields.expression.ExpressionPrinter;
import dev.blanke.formfields.expression.FieldAccessExpression;
import dev.blanke.formfields.expression.MethodCallExpression;
import dev.blanke.formfields.expression.MethodReference;
import dev.blanke.formfields.expression.ParameterExpression;

import static org.objectweb.asm.Opcodes.*;

/**
 * Statically analyzes the implementation of an accessor to find out which field or property it reads and which
 * sub-expression produces the object the member is read from.
 * <p>
 * An accessor is supported if its expression, after seeing through at most one {@link ConversionExpression}, is
 * <ul>
 *   <li>a read of an instance field, or</li>
 *   <li>an invocation of a property getter on some object (see {@link PropertyNames}).</li>
 * </ul>
 * The target of the read may be an arbitrary expression which is understood by the {@link AccessorBodyParser}.
 */
public final class AccessorAnalyzer {

    private final ClassFileLocator classFileLocator;

    private final PropertyNames propertyNames;

    /**
     * @param classFileLocator Used to locate the class files declaring lambda bodies and to recognize accessors of
     *                         record components.
     */
    public AccessorAnalyzer(final ClassFileLocator classFileLocator) {
        this.classFileLocator = classFileLocator;
        this.propertyNames    = new PropertyNames(classFileLocator);
    }

    /**
     * Analyzes the provided accessor {@code implementation} without executing it.
     *
     * @param implementation The method implementing the accessor.
     *
     * @return The field name and the target expression of the accessor.
     *
     * @throws UnsupportedExpressionException If the implementation does not read a single field or property of an
     *                                        object.
     */
    public ResolvedAccessor analyze(final LambdaImplementation implementation) {
        final var expression = implementation.isLambdaBody()
            ? parseLambdaBody(implementation)
            : describeMethodReference(implementation);
        return resolve(implementation, expression);
    }

    private AccessorExpression parseLambdaBody(final LambdaImplementation implementation) {
        final var classNode = classFileLocator.locate(implementation.owner());
        if (classNode == null) {
            throw new UnsupportedExpressionException("Cannot locate the class file of %s declaring the accessor %s."
                .formatted(implementation.owner().replace('/', '.'), implementation));
        }
        final var method = classNode.methods.stream()
            .filter(candidate -> candidate.name.equals(implementation.name())
                && candidate.desc.equals(implementation.descriptor()))
            .findFirst()
            .orElseThrow(() -> new UnsupportedExpressionException(
                "The class file of %s does not declare the accessor %s."
                    .formatted(implementation.owner().replace('/', '.'), implementation)));
        return new AccessorBodyParser(classNode.name, method).parse();
    }

    /**
     * Describes a method reference as an invocation of the referenced method on the captured receiver.
     */
    private static AccessorExpression describeMethodReference(final LambdaImplementation implementation) {
        final int opcode = switch (implementation.kind()) {
            case H_INVOKEVIRTUAL   -> INVOKEVIRTUAL;
            case H_INVOKEINTERFACE -> INVOKEINTERFACE;
            case H_INVOKESPECIAL   -> INVOKESPECIAL;
            case H_INVOKESTATIC -> throw new UnsupportedExpressionException(
                "The static method reference %s does not provide a model.".formatted(implementation));
            case H_NEWINVOKESPECIAL -> throw new UnsupportedExpressionException(
                "The constructor reference %s does not read a field or property.".formatted(implementation));
            default -> throw new UnsupportedExpressionException(
                "The method handle kind %d of %s is not supported.".formatted(implementation.kind(), implementation));
        };
        final var receiver = new ParameterExpression(0, Type.getObjectType(implementation.owner()));
        return new MethodCallExpression(receiver,
            new MethodReference(opcode, implementation.owner(), implementation.name(), implementation.descriptor()),
            List.of());
    }

    private ResolvedAccessor resolve(final LambdaImplementation implementation, final AccessorExpression expression) {
        // See through exactly one conversion, e.g. the boxing of a primitive property value.
        final var member = (expression instanceof ConversionExpression conversion) ? conversion.operand() : expression;

        if ((member instanceof FieldAccessExpression fieldAccess) && !fieldAccess.isStatic())
            return new ResolvedAccessor(expression, fieldAccess.target(), fieldAccess.field().name());

        if (member instanceof MethodCallExpression methodCall) {
            final var propertyName = propertyNames.propertyName(methodCall);
            if (propertyName != null)
                return new ResolvedAccessor(expression, methodCall.target(), propertyName);
        }
        throw new UnsupportedExpressionException(
            "The accessor %s does not read a field or property of an object: %s"
                .formatted(implementation, ExpressionPrinter.print(expression)));
    }
}
