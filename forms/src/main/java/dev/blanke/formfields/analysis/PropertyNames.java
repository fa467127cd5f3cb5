package dev.blanke.formfields.analysis;

import java.beans.Introspector;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.Type;

import dev.blanke.formfields.expression.MethodCallExpression;

/**
 * Decides whether a method invocation reads a property and derives the name of that property.
 * <p>
 * A property read is an instance method invocation without arguments returning a value, whose method either follows
 * the JavaBeans naming convention ({@code getName()}, or {@code isActive()} returning {@code boolean}) or is the
 * accessor of a record component.
 */
final class PropertyNames {

    private final ClassFileLocator classFileLocator;

    PropertyNames(final ClassFileLocator classFileLocator) {
        this.classFileLocator = classFileLocator;
    }

    /**
     * Returns the name of the property read by the provided {@code methodCall}.
     *
     * @return The property name, or {@code null} if the {@code methodCall} is not a property read.
     */
    @Nullable String propertyName(final MethodCallExpression methodCall) {
        final var method = methodCall.method();
        if (methodCall.isStatic() || !methodCall.arguments().isEmpty())
            return null;

        final var returnType = method.returnType();
        if (returnType.getSort() == Type.VOID)
            return null;

        final var name = method.name();
        if (hasPrefix(name, "get") && !name.equals("getClass"))
            return Introspector.decapitalize(name.substring(3));
        if (hasPrefix(name, "is") && (returnType.getSort() == Type.BOOLEAN))
            return Introspector.decapitalize(name.substring(2));
        return isRecordComponentAccessor(method.owner(), name, returnType) ? name : null;
    }

    /**
     * Checks whether the {@code name} consists of the {@code prefix} followed by an upper-case character.
     */
    private static boolean hasPrefix(final String name, final String prefix) {
        return (name.length() > prefix.length()) && name.startsWith(prefix)
            && Character.isUpperCase(name.charAt(prefix.length()));
    }

    private boolean isRecordComponentAccessor(final String owner, final String name, final Type returnType) {
        final var classNode = classFileLocator.locate(owner);
        if ((classNode == null) || (classNode.recordComponents == null))
            return false;
        return classNode.recordComponents.stream()
            .anyMatch(component -> component.name.equals(name)
                && component.descriptor.equals(returnType.getDescriptor()));
    }
}
