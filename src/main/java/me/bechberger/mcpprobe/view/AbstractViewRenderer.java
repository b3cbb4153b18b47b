package me.bechberger.mcpprobe.view;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.bechberger.mcpprobe.model.Report;
import org.jetbrains.annotations.NotNull;

/**
 * Abstract base class for view renderers providing common functionality.
 * Handles JSON and YAML serialization via Jackson; subclasses implement TEXT and HTML.
 */
public abstract class AbstractViewRenderer implements ViewRenderer {

    private static final ObjectMapper JSON_MAPPER = createJsonMapper();
    private static final ObjectMapper YAML_MAPPER = createYamlMapper();

    private final String name;

    protected AbstractViewRenderer(String name) {
        this.name = name;
    }

    private static ObjectMapper createJsonMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private static ObjectMapper createYamlMapper() {
        YAMLFactory factory = YAMLFactory.builder()
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
        ObjectMapper mapper = new ObjectMapper(factory);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public @NotNull String getName() {
        return name;
    }

    @Override
    public boolean supports(@NotNull OutputFormat format) {
        return true;
    }

    @Override
    public @NotNull String render(@NotNull Report report, @NotNull OutputOptions options) {
        return switch (options.getFormat()) {
            case JSON -> renderJson(report, options);
            case YAML -> renderYaml(report, options);
            case HTML -> renderHtml(report, options);
            case TEXT -> renderText(report, options);
        };
    }

    /**
     * Render report as JSON
     */
    protected String renderJson(@NotNull Report report, @NotNull OutputOptions options) {
        try {
            return JSON_MAPPER.writeValueAsString(createRenderModel(report, options));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to render JSON", e);
        }
    }

    /**
     * Render report as YAML
     */
    protected String renderYaml(@NotNull Report report, @NotNull OutputOptions options) {
        try {
            return YAML_MAPPER.writeValueAsString(createRenderModel(report, options));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to render YAML", e);
        }
    }

    protected abstract String renderText(@NotNull Report report, @NotNull OutputOptions options);

    protected abstract String renderHtml(@NotNull Report report, @NotNull OutputOptions options);

    /**
     * Create a model object for JSON/YAML serialization.
     * Override this to customize the serialized structure.
     */
    protected Object createRenderModel(@NotNull Report report, @NotNull OutputOptions options) {
        return report;
    }
}
