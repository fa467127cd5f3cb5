package dev.blanke.formfields.analysis;

import java.io.IOException;
import java.io.UncheckedIOException;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.tree.ClassNode;

/**
 * Locates class files as resources of a {@link ClassLoader}.
 */
public final class ClassLoaderClassFileLocator implements ClassFileLocator {

    private static final String CLASS_FILE_EXTENSION = ".class";

    /**
     * The class loader to query, or {@code null} to use the system class loader.
     */
    private final @Nullable ClassLoader classLoader;

    public ClassLoaderClassFileLocator(final @Nullable ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public @Nullable ClassNode locate(final String internalName) {
        final var resourceName = internalName + CLASS_FILE_EXTENSION;
        try (final var inputStream = (classLoader != null)
                ? classLoader.getResourceAsStream(resourceName)
                : ClassLoader.getSystemResourceAsStream(resourceName)) {
            if (inputStream == null)
                return null;
            return ClassFileLocator.parse(inputStream.readAllBytes());
        } catch (final IOException exception) {
            throw new UncheckedIOException(exception);
        }
    }
}
