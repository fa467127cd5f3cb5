package dev.blanke.formfields.lint.template;

import java.util.List;
import java.util.Objects;

import dev.blanke.formfields.lint.Finding;

/**
 * The report model encapsulates the fields that are available in the context of the report template.
 *
 * @param input The inspected {@code .class} file, jar file, or directory, as given on the command line.
 *
 * @param findings One {@link Finding} per accessor found in the inspected classes, in class file order.
 */
public record ReportModel(String input, List<Finding> findings) {

    public ReportModel {
        Objects.requireNonNull(input);
        findings = List.copyOf(findings);
    }

    public long supportedCount() {
        return findings.stream().filter(Finding::supported).count();
    }

    public long unsupportedCount() {
        return findings.size() - supportedCount();
    }
}
