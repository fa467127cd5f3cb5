package dev.blanke.formfields.lint.template;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.DefaultObjectWrapperBuilder;
import freemarker.template.Template;
import freemarker.template.TemplateException;

import static freemarker.template.Configuration.VERSION_2_3_31;

/**
 * Denotes an implementation of the {@link TemplateEngine} interface which uses Apache FreeMarker as backend.
 * <p>
 * The {@link ReportModel} is available as {@code report} inside the template. Records are exposed as beans, so their
 * components are read by calling the accessor methods, e.g. {@code report.findings()}.
 *
 * @see <a href="https://freemarker.apache.org/">FreeMarker Java Template Engine</a>
 */
public final class FreeMarkerTemplateEngine implements TemplateEngine {

    private static final String TEMPLATE_NAME = "report";

    private static final Configuration CONFIGURATION;

    static {
        final var configuration = new Configuration(VERSION_2_3_31);

        // Enable support for java.lang.Iterable.
        final var objectWrapperBuilder =
            new DefaultObjectWrapperBuilder(configuration.getIncompatibleImprovements());
        objectWrapperBuilder.setIterableSupport(true);
        configuration.setObjectWrapper(objectWrapperBuilder.build());

        // Prevent formatting of numbers, e.g. line numbers.
        configuration.setNumberFormat("computer");

        CONFIGURATION = configuration;
    }

    @Override
    public void process(final Reader templateReader, final ReportModel report, final Writer outputWriter)
            throws IOException, TemplateException {
        final var template = new Template(TEMPLATE_NAME, templateReader, CONFIGURATION);
        template.process(Map.of("report", report), outputWriter);
    }
}
