package me.bechberger.mcpprobe.view;

import me.bechberger.mcpprobe.model.Report;
import me.bechberger.mcpprobe.view.views.ComprehensiveReportView;
import me.bechberger.mcpprobe.view.views.SecurityScanView;
import me.bechberger.mcpprobe.view.views.ValidationReportView;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Selects the renderer for a report type.
 */
public class ViewRendererFactory {

    private static final List<ViewRenderer> RENDERERS = List.of(
            new ValidationReportView(),
            new ComprehensiveReportView(),
            new SecurityScanView());

    private ViewRendererFactory() {
    }

    @Nullable
    public static ViewRenderer getRenderer(@NotNull Report report, @NotNull OutputFormat format) {
        for (ViewRenderer renderer : RENDERERS) {
            if (renderer.getReportType().isInstance(report) && renderer.supports(format)) {
                return renderer;
            }
        }
        return null;
    }

    /**
     * Render a report using its renderer, or its summary if there is none
     */
    @NotNull
    public static String render(@NotNull Report report, @NotNull OutputOptions options) {
        ViewRenderer renderer = getRenderer(report, options.getFormat());
        if (renderer == null) {
            return report.getSummary();
        }
        return renderer.render(report, options);
    }
}
