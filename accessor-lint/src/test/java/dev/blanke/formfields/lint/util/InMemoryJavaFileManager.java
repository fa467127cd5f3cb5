package dev.blanke.formfields.lint.util;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.JavaFileObject.Kind;
import javax.tools.SimpleJavaFileObject;

/**
 * A {@link JavaFileManager} implementation which avoids writing to the filesystem and keeps the compiled class files
 * entirely in memory. The class files can be accessed using {@link #getClassFiles()}.
 */
public final class InMemoryJavaFileManager extends ForwardingJavaFileManager<JavaFileManager> {

    /**
     * The compiled class files keyed by the binary name of their class, e.g. {@code sample.Person$Address}.
     */
    private final Map<String, ClassFileObject> classFiles = new LinkedHashMap<>();

    /**
     * The {@link URI} passed to {@link JavaFileObject} implementations used by this class, which is required due to
     * the contract of {@link JavaFileObject#toUri()}.
     */
    private static final URI MEMORY_URI = URI.create("memory:///");

    /**
     * @param fileManager The {@link JavaFileManager} to which operations other than writing output should be delegated.
     */
    public InMemoryJavaFileManager(final JavaFileManager fileManager) {
        super(fileManager);
    }

    @Override
    public JavaFileObject getJavaFileForOutput(final Location location, final String className, final Kind kind,
                                               final FileObject sibling) {
        final var classFile = new ClassFileObject(kind);
        classFiles.put(className, classFile);
        return classFile;
    }

    /**
     * Returns the bytes of all class files written by the compiler, in the order in which they were written.
     */
    public Map<String, byte[]> getClassFiles() {
        final var classFileBytes = new LinkedHashMap<String, byte[]>();
        classFiles.forEach((className, classFile) -> classFileBytes.put(className, classFile.getBytes()));
        return classFileBytes;
    }

    public static final class SourceFileObject extends SimpleJavaFileObject {

        private final CharSequence source;

        public SourceFileObject(final CharSequence source) {
            super(MEMORY_URI, Kind.SOURCE);

            this.source = Objects.requireNonNull(source);
        }

        @Override
        public CharSequence getCharContent(final boolean ignoreEncodingErrors) {
            return source;
        }

        @Override
        public boolean isNameCompatible(final String simpleName, final Kind kind) {
            // Public classes would otherwise have to be declared in a file named after them.
            return true;
        }
    }

    private static final class ClassFileObject extends SimpleJavaFileObject {

        private final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();

        ClassFileObject(final Kind kind) {
            super(MEMORY_URI, kind);
        }

        @Override
        public OutputStream openOutputStream() {
            return outputStream;
        }

        byte[] getBytes() {
            return outputStream.toByteArray();
        }
    }
}
