package dev.blanke.formfields.analysis;

import java.lang.reflect.Field;
import java.lang.reflect.Method;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.Type;

/**
 * A utility class resolving the classes and members referenced by bytecode to their reflective counterparts.
 */
final class Members {

    // Prevent instantiation of utility class.
    private Members() {
    }

    /**
     * Returns the {@link Class} denoted by the provided {@code type}.
     *
     * @param type A primitive, array, or object type.
     *
     * @param classLoader The class loader used to load object types, or {@code null} for the bootstrap class loader.
     *
     * @throws ClassNotFoundException If the class cannot be located by the {@code classLoader}.
     */
    static Class<?> toClass(final Type type, final @Nullable ClassLoader classLoader) throws ClassNotFoundException {
        return switch (type.getSort()) {
            case Type.BOOLEAN -> boolean.class;
            case Type.CHAR    -> char.class;
            case Type.BYTE    -> byte.class;
            case Type.SHORT   -> short.class;
            case Type.INT     -> int.class;
            case Type.FLOAT   -> float.class;
            case Type.LONG    -> long.class;
            case Type.DOUBLE  -> double.class;
            // Class.forName expects array names of the form "[Ljava.lang.String;".
            case Type.ARRAY   -> Class.forName(type.getDescriptor().replace('/', '.'), false, classLoader);
            case Type.OBJECT  -> Class.forName(type.getClassName(), false, classLoader);
            default -> throw new IllegalArgumentException("Type %s does not denote a class".formatted(type));
        };
    }

    /**
     * Resolves the field named {@code name} as seen from the class {@code owner}, searching the entire class
     * hierarchy.
     */
    static Field findField(final Class<?> owner, final String name) throws NoSuchFieldException {
        Class<?> cursor = owner;
        while (cursor != null) {
            try {
                return cursor.getDeclaredField(name);
            } catch (final NoSuchFieldException exception) {
                cursor = cursor.getSuperclass();
            }
        }
        // Public fields declared by interfaces, i.e. constants.
        return owner.getField(name);
    }

    /**
     * Resolves the method named {@code name} with the given {@code parameterTypes} as seen from the class
     * {@code owner}, searching superclasses before falling back to public and interface methods.
     */
    static Method findMethod(final Class<?> owner, final String name, final Class<?>[] parameterTypes)
            throws NoSuchMethodException {
        Class<?> cursor = owner;
        while (cursor != null) {
            try {
                return cursor.getDeclaredMethod(name, parameterTypes);
            } catch (final NoSuchMethodException exception) {
                cursor = cursor.getSuperclass();
            }
        }
        return owner.getMethod(name, parameterTypes);
    }
}
