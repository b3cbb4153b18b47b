package me.bechberger.mcpprobe.view;

import me.bechberger.mcpprobe.model.Report;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ViewRenderer implementation that uses Handlebars templates for TEXT and HTML output.
 * Extends AbstractViewRenderer to inherit JSON/YAML serialization.
 *
 * @param <R> the report type this renderer handles
 */
public abstract class HandlebarsViewRenderer<R extends Report> extends AbstractViewRenderer {

    private final String templateName;
    private final Class<R> reportType;

    /**
     * Create a renderer with the same template name for both CLI and HTML (different paths)
     */
    protected HandlebarsViewRenderer(String name, String templateName, Class<R> reportType) {
        super(name);
        this.templateName = templateName;
        this.reportType = reportType;
    }

    @Override
    public Class<R> getReportType() {
        return reportType;
    }

    @Override
    protected String renderText(@NotNull Report report, @NotNull OutputOptions options) {
        try {
            return HandlebarsEngine.getInstance().render(templateName, buildContext(cast(report), options), options);
        } catch (IOException e) {
            throw new RuntimeException("Failed to render CLI template: " + templateName, e);
        }
    }

    @Override
    protected String renderHtml(@NotNull Report report, @NotNull OutputOptions options) {
        OutputOptions htmlOptions = OutputOptions.builder()
                .format(OutputFormat.HTML)
                .noColor()
                .verbose(options.isVerbose())
                .build();
        try {
            return HandlebarsEngine.getInstance().render(templateName, buildContext(cast(report), htmlOptions), htmlOptions);
        } catch (IOException e) {
            throw new RuntimeException("Failed to render HTML template: " + templateName, e);
        }
    }

    private R cast(Report report) {
        if (!reportType.isInstance(report)) {
            throw new IllegalArgumentException(getName() + " cannot render " + report.getClass().getSimpleName());
        }
        return reportType.cast(report);
    }

    /**
     * Build the context map for template rendering.
     * Subclasses add their report's data.
     */
    protected Map<String, Object> buildContext(@NotNull R report, @NotNull OutputOptions options) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("summary", report.getSummary());
        context.put("successful", report.isSuccessful());
        context.put("colorEnabled", options.isColorEnabled());
        context.put("verbose", options.isVerbose());
        return context;
    }
}
