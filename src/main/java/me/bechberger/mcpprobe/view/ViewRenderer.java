package me.bechberger.mcpprobe.view;

import me.bechberger.mcpprobe.model.Report;
import org.jetbrains.annotations.NotNull;

/**
 * Interface for rendering reports to various output formats.
 */
public interface ViewRenderer {

    /**
     * Get the name of this renderer
     */
    @NotNull String getName();

    /**
     * Check if this renderer supports the given output format
     */
    boolean supports(@NotNull OutputFormat format);

    /**
     * Render the report to a string
     *
     * @param report  The report to render
     * @param options Output options (format, colors, etc.)
     * @return The rendered output
     */
    @NotNull String render(@NotNull Report report, @NotNull OutputOptions options);

    /**
     * Get the report type this renderer can handle
     */
    default Class<? extends Report> getReportType() {
        return Report.class;
    }
}
