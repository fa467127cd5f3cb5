package dev.blanke.formfields.lint;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.tree.ClassNode;

import dev.blanke.formfields.analysis.ClassFileLocator;

/**
 * Locates class files below a class path root, which may be a directory or the root of a jar file system.
 */
final class PathClassFileLocator implements ClassFileLocator {

    private static final String CLASS_FILE_EXTENSION = ".class";

    private final Path root;

    PathClassFileLocator(final Path root) {
        this.root = root;
    }

    @Override
    public @Nullable ClassNode locate(final String internalName) {
        final var classFile = root.resolve(internalName + CLASS_FILE_EXTENSION);
        if (!Files.isRegularFile(classFile))
            return null;
        try {
            return ClassFileLocator.parse(Files.readAllBytes(classFile));
        } catch (final IOException exception) {
            throw new UncheckedIOException(exception);
        }
    }
}
