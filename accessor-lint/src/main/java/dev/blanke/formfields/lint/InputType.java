package dev.blanke.formfields.lint;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.ClassReader;

import dev.blanke.formfields.analysis.ClassFileLocator;

/**
 * Contains the logic for the inspection of artifacts of different formats.
 * <p>
 * {@link InputType#determine(Path)} can be used to retrieve the correct {@code InputType} to be used for the input file
 * located at the provided path.
 */
enum InputType {

    /**
     * Enables the inspection of a single {@code .class} file outside the context of a jar file or similar.
     * <p>
     * Lambda bodies are usually declared by the class containing the lambda expression. Other classes, such as records
     * whose components are read, are located relative to the class file if it resides in a package directory.
     */
    CLASS {
        @Override
        List<Finding> inspect(final AccessorLint lint) throws IOException {
            final var input     = lint.getArguments().getInput();
            final var classFile = Files.readAllBytes(input);
            final var reader    = new ClassReader(classFile);

            if (!lint.getArguments().matchesIncludePattern(reader.getClassName().replace('/', '.')))
                return List.of();

            final var root = classPathRoot(input, reader.getClassName());
            final ClassFileLocator classFileLocator = (root != null)
                ? new PathClassFileLocator(root)
                : internalName -> internalName.equals(reader.getClassName()) ? ClassFileLocator.parse(classFile) : null;
            return lint.inspect(reader, classFileLocator);
        }

        /**
         * Derives the directory from which the package directories of the class with the given {@code internalName}
         * start, e.g. {@code build/classes} for {@code build/classes/com/example/Person.class}.
         *
         * @return The class path root, or {@code null} if the class file does not reside in its package directory.
         */
        private static @Nullable Path classPathRoot(final Path classFile, final String internalName) {
            final var absolutePath = classFile.toAbsolutePath().normalize();
            final var packageDepth = internalName.split("/").length;
            if (!absolutePath.endsWith(internalName + CLASS_FILE_EXTENSION))
                return null;

            var root = absolutePath;
            for (int index = 0; (index < packageDepth) && (root != null); ++index) {
                root = root.getParent();
            }
            return root;
        }
    },

    /**
     * Enables the inspection of the {@code .class} files located within a jar file.
     */
    JAR {
        @Override
        List<Finding> inspect(final AccessorLint lint) throws IOException {
            try (final var inputFS = FileSystems.newFileSystem(lint.getArguments().getInput())) {
                return inspectClassFiles(lint, inputFS.getPath("/"));
            }
        }
    },

    /**
     * Enables the inspection of a directory containing {@code .class} files in their package directories, such as the
     * output directory of a build.
     */
    DIRECTORY {
        @Override
        List<Finding> inspect(final AccessorLint lint) throws IOException {
            return inspectClassFiles(lint, lint.getArguments().getInput());
        }
    };

    private static final String CLASS_FILE_EXTENSION = ".class";

    private static final Logger LOGGER = System.getLogger(InputType.class.getName());

    /**
     * Inspects the input by treating it as the current {@code InputType}.
     *
     * @param lint The lint instance containing the arguments and enabling the inspection of single classes.
     *
     * @return The findings for all accessors found in included classes.
     *
     * @throws IOException If reading the input fails.
     */
    abstract List<Finding> inspect(AccessorLint lint) throws IOException;

    /**
     * Walks through the class path {@code root}, inspecting all class files whose class names match
     * {@link Arguments#matchesIncludePattern(String)}.
     *
     * @param lint The lint containing the parsed {@link Arguments}.
     *
     * @param root The directory containing the class files in their package directories.
     *
     * @return The findings of all inspected class files, in the order in which they were visited.
     *
     * @throws IOException If reading a class file fails.
     */
    private static List<Finding> inspectClassFiles(final AccessorLint lint, final Path root) throws IOException {
        final var classFileLocator = new PathClassFileLocator(root);
        final var findings = new ArrayList<Finding>();

        try (final var fileStream = Files.walk(root)) {
            fileStream
                .filter(path -> Files.isRegularFile(path) && path.toString().endsWith(CLASS_FILE_EXTENSION))
                .sorted()
                .forEach(path -> {
                    try {
                        final var reader = new ClassReader(Files.readAllBytes(path));
                        if (lint.getArguments().matchesIncludePattern(reader.getClassName().replace('/', '.')))
                            findings.addAll(lint.inspect(reader, classFileLocator));
                        else
                            LOGGER.log(Level.DEBUG, "Skipping {0}.", path);
                    } catch (final IOException exception) {
                        throw new UncheckedIOException(exception);
                    }
                });
        } catch (final UncheckedIOException exception) {
            throw exception.getCause(); // Re-throw wrapped original exception.
        }
        return findings;
    }

    /**
     * Determines the correct {@code InputType} to be used for the file located at the provided {@code path} by checking
     * whether it is a directory or by checking the content of the file.
     *
     * @param path Path of the file or directory that should be inspected.
     *
     * @return An {@code InputType} capable of inspecting the file at the {@code path}.
     *
     * @throws IOException If reading the file located at the {@code path} fails.
     */
    static InputType determine(final Path path) throws IOException {
        if (Files.isDirectory(path))
            return DIRECTORY;
        try (final var inputStream = new DataInputStream(Files.newInputStream(path))) {
            // Check for the magic number of .class files and treat input as jar file if it is not a .class file.
            return (inputStream.readInt() == 0xCAFEBABE) ? CLASS : JAR;
        }
    }
}
