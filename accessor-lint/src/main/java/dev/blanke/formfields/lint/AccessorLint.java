package dev.blanke.formfields.lint;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import dev.blanke.formfields.UnsupportedExpressionException;
import dev.blanke.formfields.analysis.AccessorAnalyzer;
import dev.blanke.formfields.analysis.ClassFileLocator;
import dev.blanke.formfields.analysis.ClassLoaderClassFileLocator;
import dev.blanke.formfields.lint.template.FreeMarkerTemplateEngine;
import dev.blanke.formfields.lint.template.ReportModel;
import dev.blanke.formfields.lint.template.TemplateEngine;

/**
 * The {@code AccessorLint} class serves as the entry point to the lint tool via {@link #main(String...)} and
 * {@link #call()}.
 * <p>
 * It finds the {@link dev.blanke.formfields.Accessor}s created by compiled classes and checks ahead of time whether
 * {@link dev.blanke.formfields.FieldIdentifier#of} would accept them, using the same analysis which is performed at
 * run time.
 * <p>
 * See {@link InputType} for the handling of the different kinds of input.
 */
@Command(
    name                     = "accessor-lint",
    mixinStandardHelpOptions = true,
    description              = "Reports accessor lambdas which cannot be turned into field identifiers.")
public final class AccessorLint implements Callable<Integer> {

    static final int EXIT_CODE_SUPPORTED = 0;

    static final int EXIT_CODE_UNSUPPORTED = 1;

    static final int EXIT_CODE_IO_ERROR = 2;

    /**
     * The parsed command-line arguments passed to the lint.
     *
     * @implNote The {@code @Mixin} annotation allows this class to define {@link #call()} while keeping the fields
     *           representing options and parameters in the {@link Arguments} class.
     */
    @Mixin
    private Arguments arguments = new Arguments();

    /**
     * The template engine which renders the findings into the report.
     */
    private final TemplateEngine templateEngine = new FreeMarkerTemplateEngine();

    /**
     * Locates classes which are not part of the input, such as JDK classes or libraries on the lint's own class path.
     */
    private static final ClassFileLocator CLASS_PATH_LOCATOR =
        new ClassLoaderClassFileLocator(AccessorLint.class.getClassLoader());

    private static final int ASM_API_VERSION = Opcodes.ASM9;

    private static final Logger LOGGER = System.getLogger(AccessorLint.class.getName());

    /**
     * Launches the lint tool by delegating command-line argument parsing to Picocli, running the {@link #call()}
     * method, and exiting with the returned exit code.
     *
     * @param args The command-line arguments parsed into an {@link Arguments} instance by Picocli.
     */
    public static void main(final String... args) {
        final int exitCode = new CommandLine(new AccessorLint()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Inspects the input by delegating to the correct {@link InputType#inspect(AccessorLint)} implementation and
     * renders the findings using the report template.
     * <p>
     * The report is written to {@link Arguments#getOutput()} or {@link System#out}, while errors are written to
     * {@link System#err}.
     *
     * @return {@value #EXIT_CODE_SUPPORTED} if every accessor is supported, {@value #EXIT_CODE_UNSUPPORTED} if at
     *         least one is not, or {@value #EXIT_CODE_IO_ERROR} if reading the input or writing the report failed.
     *
     * @throws Exception If an unexpected exception not associated with an exit code occurs, such as an error in the
     *                   report template.
     */
    @Override
    public Integer call() throws Exception {
        try {
            final var findings = InputType.determine(arguments.getInput()).inspect(this);
            writeReport(new ReportModel(arguments.getInput().toString(), findings));

            return findings.stream().allMatch(Finding::supported) ? EXIT_CODE_SUPPORTED : EXIT_CODE_UNSUPPORTED;
        } catch (final IOException | UncheckedIOException exception) {
            System.err.printf("Cannot inspect '%s': %s%n", arguments.getInput(), exception.getMessage());
            return EXIT_CODE_IO_ERROR;
        }
    }

    /**
     * Finds the accessors created by the class represented by the provided {@code reader} and analyzes each of them.
     *
     * @param reader The {@link ClassReader} representing the class to inspect.
     *
     * @param classFileLocator Locates the other classes of the input, in particular those declaring lambda bodies.
     *                         Classes not found by it are looked up on the lint's own class path.
     *
     * @return One finding per accessor, in the order in which they appear in the class file.
     */
    List<Finding> inspect(final ClassReader reader, final ClassFileLocator classFileLocator) {
        LOGGER.log(Level.INFO, "Inspecting {0}...", reader.getClassName().replace('/', '.'));

        final var visitor = new AccessorSiteClassVisitor(ASM_API_VERSION);
        reader.accept(visitor, ClassReader.SKIP_FRAMES);

        final var analyzer = new AccessorAnalyzer(classFileLocator.orElse(CLASS_PATH_LOCATOR));
        final var findings = new ArrayList<Finding>();
        for (final var site : visitor.getAccessorSites()) {
            try {
                findings.add(Finding.resolved(site, analyzer.analyze(site.implementation())));
            } catch (final UnsupportedExpressionException exception) {
                LOGGER.log(Level.WARNING, "Unsupported accessor in {0}: {1}", site.location(),
                    exception.getMessage());
                findings.add(Finding.rejected(site, exception));
            }
        }
        return findings;
    }

    private void writeReport(final ReportModel report) throws Exception {
        try (final var templateReader = arguments.getReportTemplateReader()) {
            final var output = arguments.getOutput();
            if (output == null) {
                // Do not close System.out.
                final var writer = new PrintWriter(System.out);
                templateEngine.process(templateReader, report, writer);
                writer.flush();
                return;
            }
            try (final Writer writer = Files.newBufferedWriter(output)) {
                templateEngine.process(templateReader, report, writer);
            }
        }
    }

    // region Getters
    Arguments getArguments() {
        return arguments;
    }
    // endregion
}
