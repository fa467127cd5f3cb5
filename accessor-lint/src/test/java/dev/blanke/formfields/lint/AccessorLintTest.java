package dev.blanke.formfields.lint;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.intellij.lang.annotations.Language;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.*;

import static dev.blanke.formfields.lint.util.JavaSources.compile;
import static dev.blanke.formfields.lint.util.JavaSources.writeClassDirectory;
import static dev.blanke.formfields.lint.util.JavaSources.writeJar;

final class AccessorLintTest {

    @Language("JAVA")
    private static final String MIXED_SOURCE = """
        package sample;

        import dev.blanke.formfields.FieldIdentifier;

        public class Person {
            private String name;

            public int age;

            private Address address;

            public String getName() {
                return name;
            }

            FieldIdentifier nameField() {
                return FieldIdentifier.of(() -> getName());
            }

            FieldIdentifier ageField() {
                return FieldIdentifier.of(() -> age);
            }

            FieldIdentifier cityField() {
                return FieldIdentifier.of(() -> address.city());
            }

            FieldIdentifier trimmedNameField() {
                return FieldIdentifier.of(() -> name.trim());
            }
        }

        record Address(String city) {
        }
        """;

    @Language("JAVA")
    private static final String SUPPORTED_SOURCE = """
        package sample;

        import dev.blanke.formfields.FieldIdentifier;

        public class Order {
            private String number;

            public String getNumber() {
                return number;
            }

            FieldIdentifier numberField() {
                return FieldIdentifier.of(this::getNumber);
            }
        }
        """;

    @TempDir
    Path temporaryDirectory;

    private Path report;

    @BeforeEach
    void setUp() {
        report = temporaryDirectory.resolve("report.txt");
    }

    private int lint(final Path input, final String... options) {
        final var args = new ArrayList<>(List.of(input.toString(), "--output", report.toString()));
        args.addAll(List.of(options));
        return new CommandLine(new AccessorLint()).execute(args.toArray(String[]::new));
    }

    private String readReport() throws IOException {
        return Files.readString(report);
    }

    private Path writeClasses(final String source) throws IOException {
        final var classDirectory = temporaryDirectory.resolve("classes");
        writeClassDirectory(compile(source), classDirectory);
        return classDirectory;
    }

    @Nested
    final class DirectoryInput {

        @Test
        void testReportUnsupportedAccessor() throws IOException {
            assertEquals(AccessorLint.EXIT_CODE_UNSUPPORTED, lint(writeClasses(MIXED_SOURCE)));

            final var reportContent = readReport();
            assertTrue(reportContent.contains("sample.Person.nameField"));
            assertTrue(reportContent.contains("reads 'name'"));
            assertTrue(reportContent.contains("reads 'age'"));
            assertTrue(reportContent.contains("reads 'city'"));
            assertTrue(reportContent.contains("FAIL  sample.Person.trimmedNameField"));
            assertTrue(reportContent.contains("3 supported, 1 unsupported."));
        }

        @Test
        void testReportSupportedAccessors() throws IOException {
            assertEquals(AccessorLint.EXIT_CODE_SUPPORTED, lint(writeClasses(SUPPORTED_SOURCE)));

            final var reportContent = readReport();
            assertTrue(reportContent.contains("OK    sample.Order.numberField"));
            assertTrue(reportContent.contains("1 supported, 0 unsupported."));
        }

        @Test
        void testIncludePattern() throws IOException {
            assertEquals(AccessorLint.EXIT_CODE_SUPPORTED, lint(writeClasses(MIXED_SOURCE), "-I", "other.*"));

            final var reportContent = readReport();
            assertTrue(reportContent.contains("No accessors found."));
            assertTrue(reportContent.contains("0 supported, 0 unsupported."));
        }

        @Test
        void testCustomReportTemplate() throws IOException {
            final var template = temporaryDirectory.resolve("count.ftl");
            Files.writeString(template, "${report.supportedCount()}/${report.findings()?size}");

            lint(writeClasses(MIXED_SOURCE), "--report-template", template.toString());
            assertEquals("3/4", readReport());
        }
    }

    @Nested
    final class JarInput {

        @Test
        void testReportUnsupportedAccessor() throws IOException {
            final var jarFile = temporaryDirectory.resolve("sample.jar");
            writeJar(compile(MIXED_SOURCE), jarFile);

            assertEquals(AccessorLint.EXIT_CODE_UNSUPPORTED, lint(jarFile));
            assertTrue(readReport().contains("3 supported, 1 unsupported."));
        }
    }

    @Nested
    final class ClassInput {

        @Test
        void testReportUnsupportedAccessor() throws IOException {
            final Map<String, byte[]> classFiles = compile(MIXED_SOURCE);
            writeClassDirectory(classFiles, temporaryDirectory.resolve("classes"));
            final var classFile = temporaryDirectory.resolve("classes/sample/Person.class");

            // The record class is located relative to the class file.
            assertEquals(AccessorLint.EXIT_CODE_UNSUPPORTED, lint(classFile));
            assertTrue(readReport().contains("3 supported, 1 unsupported."));
        }

        @Test
        void testReportDetachedClassFile() throws IOException {
            final var classFile = temporaryDirectory.resolve("Order.class");
            Files.write(classFile, compile(SUPPORTED_SOURCE).get("sample.Order"));

            assertEquals(AccessorLint.EXIT_CODE_SUPPORTED, lint(classFile));
            assertTrue(readReport().contains("1 supported, 0 unsupported."));
        }
    }

    @Test
    void testMissingInput() {
        assertEquals(AccessorLint.EXIT_CODE_IO_ERROR, lint(temporaryDirectory.resolve("missing.jar")));
    }
}
