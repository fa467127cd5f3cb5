package dev.blanke.formfields.analysis;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.tree.ClassNode;

/**
 * Looks up the parsed class file of a class by its internal name.
 */
@FunctionalInterface
public interface ClassFileLocator {

    /**
     * Locates and parses the class file of the class with the provided {@code internalName}.
     *
     * @param internalName The internal name of the class, e.g. {@code java/lang/String}.
     *
     * @return The parsed class file, or {@code null} if no class file could be found.
     */
    @Nullable ClassNode locate(String internalName);

    /**
     * Returns a {@code ClassFileLocator} which consults the {@code fallback} for classes this locator cannot find.
     */
    default ClassFileLocator orElse(final ClassFileLocator fallback) {
        return internalName -> {
            final var classNode = locate(internalName);
            return (classNode != null) ? classNode : fallback.locate(internalName);
        };
    }

    /**
     * Parses the provided class file bytes into a {@link ClassNode}, retaining debug information such as line numbers
     * but skipping stack map frames.
     */
    static ClassNode parse(final byte[] classFile) {
        final var classNode = new ClassNode();
        new ClassReader(classFile).accept(classNode, ClassReader.SKIP_FRAMES);
        return classNode;
    }
}
