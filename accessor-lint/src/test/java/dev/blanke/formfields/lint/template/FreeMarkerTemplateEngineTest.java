package dev.blanke.formfields.lint.template;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class FreeMarkerTemplateEngineTest {

    private final TemplateEngine templateEngine = new FreeMarkerTemplateEngine();

    private String render(final Reader template, final ReportModel report) throws Exception {
        final var output = new StringWriter();
        templateEngine.process(template, report, output);
        return output.toString();
    }

    @Test
    void testRenderEmptyReport() throws Exception {
        final var stream = Objects.requireNonNull(FreeMarkerTemplateEngine.class.getResourceAsStream("/report.txt.ftl"));
        try (final var template = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            final var report = render(template, new ReportModel("classes", List.of()));

            assertTrue(report.contains("Accessor lint report for classes"));
            assertTrue(report.contains("No accessors found."));
            assertTrue(report.contains("0 supported, 0 unsupported."));
        }
    }

    @Test
    void testNumbersAreNotGrouped() throws Exception {
        assertEquals("12345", render(new StringReader("${12345}"), new ReportModel("classes", List.of())));
    }
}
