package dev.blanke.formfields.lint.template;

import java.io.Reader;
import java.io.Writer;

/**
 * A {@code TemplateEngine} allows the combination of a template file with a {@link ReportModel} in order to produce a
 * report.
 */
public interface TemplateEngine {

    /**
     * Combines the provided {@code templateReader} and {@code report}, writing the rendered report to the
     * {@code outputWriter}.
     *
     * @param templateReader The template to populate. Its syntax is implementation-dependent.
     *
     * @param report The findings which can be accessed within the template.
     *
     * @param outputWriter A writer to which the rendered report should be written.
     *
     * @throws Exception if an exception occurs reading or populating the template.
     */
    void process(Reader templateReader, ReportModel report, Writer outputWriter) throws Exception;
}
