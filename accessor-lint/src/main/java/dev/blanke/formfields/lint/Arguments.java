package dev.blanke.formfields.lint;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Encapsulates the command-line arguments that can be passed to the accessor lint.
 */
public final class Arguments {

    //region Input/output
    @Parameters(
        index       = "0",
        description = "The .class file, .jar file, or class directory whose accessors should be checked.")
    private Path input;

    public @NotNull Path getInput() {
        return input;
    }

    @Option(
        names       = { "-o", "--output" },
        description = "Write the report to file instead of standard output.")
    private Path output;

    /**
     * Returns the {@link Path} to which the report should be written.
     *
     * @return The value of the {@code --output} option, or {@code null} if the report should be written to
     *         {@link System#out}.
     */
    public @Nullable Path getOutput() {
        return output;
    }
    //endregion

    //region Includes
    /**
     * A list of predicates matching class names to decide whether the respective classes should be inspected.
     *
     * @see #setIncludePatterns(List)
     */
    private List<Predicate<String>> includePatternMatchPredicates = List.of();

    @Option(
        names       = { "-I", "--include" },
        description = """
            A glob-like pattern to limit the inspection to matched fully qualified class names.
            E.g. 'com.example.forms.*'. May be repeated.
            """,
        paramLabel = "<pattern>")
    private void setIncludePatterns(final List<String> includePatterns) {
        includePatternMatchPredicates = includePatterns.stream()
            // Convert glob-like pattern to regex by escaping dots and replacing '*'.
            .map(includePattern -> Pattern.compile(includePattern.replace(".", "\\.").replace("*", ".*")))
            .map(Pattern::asMatchPredicate)
            .toList();
    }

    /**
     * Checks whether the provided fully qualified class name matches at least one include pattern, in which case the
     * class will be inspected.
     *
     * @param className A fully qualified class name, e.g. {@code com.example.forms.Person}.
     *
     * @return {@code true} if no include pattern was given or the {@code className} matches one of them, otherwise
     *         {@code false}.
     */
    public boolean matchesIncludePattern(final String className) {
        return includePatternMatchPredicates.isEmpty()
            || includePatternMatchPredicates.stream().anyMatch(predicate -> predicate.test(className));
    }
    //endregion

    @Option(
        names       = { "--report-template" },
        description = """
            Apache FreeMarker template file used to render the report.
            The findings will be passed to the template as 'report' parameter.
            Defaults to the plain-text template packaged with the JAR if unspecified.
            """,
        paramLabel = "<file>")
    private Path reportTemplate;

    public @NotNull Reader getReportTemplateReader() throws IOException {
        if (reportTemplate != null)
            return Files.newBufferedReader(reportTemplate);

        final var templateStream = Objects.requireNonNull(getClass().getResourceAsStream("/report.txt.ftl"));
        return new BufferedReader(new InputStreamReader(templateStream, StandardCharsets.UTF_8));
    }
}
