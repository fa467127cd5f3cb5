package dev.blanke.formfields.lint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Type;

import dev.blanke.formfields.Accessor;
import dev.blanke.formfields.analysis.LambdaImplementation;

/**
 * Collects the {@code invokedynamic} instructions of a class which create {@link Accessor}s.
 * <p>
 * As {@code Accessor} extends {@link java.io.Serializable}, javac bootstraps these instructions with
 * {@link java.lang.invoke.LambdaMetafactory#altMetafactory}, passing the implementation method handle as the second
 * bootstrap method argument.
 */
final class AccessorSiteClassVisitor extends ClassVisitor {

    private static final String LAMBDA_METAFACTORY = "java/lang/invoke/LambdaMetafactory";

    private static final String ALT_METAFACTORY = "altMetafactory";

    private static final String ACCESSOR = Type.getInternalName(Accessor.class);

    private final List<AccessorSite> accessorSites = new ArrayList<>();

    private String className;

    AccessorSiteClassVisitor(final int api) {
        super(api);
    }

    @Override
    public void visit(final int version, final int access, final String name, final String signature,
                      final String superName, final String[] interfaces) {
        className = name.replace('/', '.');
    }

    @Override
    public MethodVisitor visitMethod(final int access, final String name, final String descriptor,
                                     final String signature, final String[] exceptions) {
        return new AccessorSiteMethodVisitor(api, name);
    }

    List<AccessorSite> getAccessorSites() {
        return Collections.unmodifiableList(accessorSites);
    }

    private final class AccessorSiteMethodVisitor extends MethodVisitor {

        private final String methodName;

        private int line;

        AccessorSiteMethodVisitor(final int api, final String methodName) {
            super(api);

            this.methodName = methodName;
        }

        @Override
        public void visitLineNumber(final int line, final Label start) {
            this.line = line;
        }

        @Override
        public void visitInvokeDynamicInsn(final String name, final String descriptor,
                                           final Handle bootstrapMethodHandle,
                                           final Object... bootstrapMethodArguments) {
            if (!bootstrapMethodHandle.getOwner().equals(LAMBDA_METAFACTORY)
                    || !bootstrapMethodHandle.getName().equals(ALT_METAFACTORY))
                return;
            final var producedType = Type.getReturnType(descriptor);
            if ((producedType.getSort() != Type.OBJECT) || !producedType.getInternalName().equals(ACCESSOR))
                return;

            if ((bootstrapMethodArguments.length > 1)
                    && (bootstrapMethodArguments[1] instanceof Handle implementationHandle)) {
                accessorSites.add(new AccessorSite(className, methodName, line,
                    LambdaImplementation.of(implementationHandle)));
            }
        }
    }
}
