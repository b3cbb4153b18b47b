package me.bechberger.mcpprobe.view;

import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Options;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;
import com.github.jknack.handlebars.io.TemplateLoader;
import me.bechberger.mcpprobe.security.IssueSeverity;
import org.fusesource.jansi.Ansi;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Singleton wrapper around Handlebars template engine.
 * Provides template loading, caching, and custom helpers for CLI/HTML output.
 */
public class HandlebarsEngine {

    private static volatile HandlebarsEngine instance;

    private final Handlebars cliHandlebars;
    private final Handlebars htmlHandlebars;
    private final Map<String, Template> templateCache = new ConcurrentHashMap<>();

    private HandlebarsEngine() {
        TemplateLoader cliLoader = new ClassPathTemplateLoader("/templates/cli", ".hbs");
        TemplateLoader htmlLoader = new ClassPathTemplateLoader("/templates/html", ".hbs");

        // Only HTML output escapes values
        this.cliHandlebars = new Handlebars(cliLoader).with(EscapingStrategy.NOOP).prettyPrint(true);
        this.htmlHandlebars = new Handlebars(htmlLoader).prettyPrint(true);

        registerHelpers(cliHandlebars);
        registerHelpers(htmlHandlebars);
    }

    public static HandlebarsEngine getInstance() {
        if (instance == null) {
            synchronized (HandlebarsEngine.class) {
                if (instance == null) {
                    instance = new HandlebarsEngine();
                }
            }
        }
        return instance;
    }

    /**
     * Handlebars instance for CLI templates
     */
    public Handlebars getHandlebars() {
        return cliHandlebars;
    }

    public void clearCache() {
        templateCache.clear();
    }

    private Handlebars getHandlebarsForFormat(OutputFormat format) {
        return format == OutputFormat.HTML ? htmlHandlebars : cliHandlebars;
    }

    /**
     * Get a compiled template by name for the specified format
     */
    public Template getTemplate(String name, OutputFormat format) throws IOException {
        String cacheKey = format.name() + "/" + name;
        try {
            return templateCache.computeIfAbsent(cacheKey, k -> {
                try {
                    return getHandlebarsForFormat(format).compile(name);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to compile template: " + k, e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Render a template with the given context and output options
     */
    public String render(String templateName, Map<String, Object> context, OutputOptions options) throws IOException {
        Map<String, Object> fullContext = new HashMap<>(context);
        fullContext.put("options", options);
        fullContext.put("colorEnabled", options.isColorEnabled());
        fullContext.put("verbose", options.isVerbose());

        Template template = getTemplate(templateName, options.getFormat());
        return template.apply(fullContext);
    }

    private void registerHelpers(Handlebars hb) {
        hb.registerHelper("red", colorHelper(Ansi.Color.RED));
        hb.registerHelper("green", colorHelper(Ansi.Color.GREEN));
        hb.registerHelper("yellow", colorHelper(Ansi.Color.YELLOW));
        hb.registerHelper("cyan", colorHelper(Ansi.Color.CYAN));

        hb.registerHelper("bold", (Object text, Options options) -> {
            String textStr = text != null ? text.toString() : "";
            if (getColorEnabled(options)) {
                return Ansi.ansi().bold().a(textStr).reset().toString();
            }
            return textStr;
        });

        hb.registerHelper("dim", (Object text, Options options) -> {
            String textStr = text != null ? text.toString() : "";
            if (getColorEnabled(options)) {
                return Ansi.ansi().a(Ansi.Attribute.INTENSITY_FAINT).a(textStr).reset().toString();
            }
            return textStr;
        });

        // PASS/FAIL marker for a boolean
        hb.registerHelper("status", (Boolean passed, Options options) -> {
            String text = Boolean.TRUE.equals(passed) ? options.hash("pass", "PASS") : options.hash("fail", "FAIL");
            if (!getColorEnabled(options)) return text;
            return Boolean.TRUE.equals(passed)
                    ? Ansi.ansi().fgGreen().a(text).reset().toString()
                    : Ansi.ansi().fgRed().a(text).reset().toString();
        });

        hb.registerHelper("severityColor", (Object value, Options options) -> {
            if (value == null) return "";
            IssueSeverity severity = value instanceof IssueSeverity s ? s : IssueSeverity.valueOf(value.toString());
            String text = severity.name();
            if (!getColorEnabled(options)) return text;

            return switch (severity) {
                case CRITICAL -> Ansi.ansi().bold().fgRed().a(text).reset().toString();
                case HIGH -> Ansi.ansi().fgRed().a(text).reset().toString();
                case MEDIUM -> Ansi.ansi().fgYellow().a(text).reset().toString();
                case LOW -> Ansi.ansi().fgCyan().a(text).reset().toString();
            };
        });

        hb.registerHelper("pad", (Object text, Options options) -> {
            int width = options.hash("width", 20);
            String align = options.hash("align", "left");
            String textStr = text != null ? text.toString() : "";
            return "right".equals(align)
                    ? String.format("%" + width + "s", textStr)
                    : String.format("%-" + width + "s", textStr);
        });

        hb.registerHelper("repeat", (Object text, Options options) -> {
            int count = options.hash("count", 1);
            String textStr = text != null ? text.toString() : "";
            return textStr.repeat(count);
        });

        hb.registerHelper("ifGt", (Number a, Options options) -> {
            Number b = options.param(0, 0);
            if (a != null && a.doubleValue() > b.doubleValue()) {
                return options.fn();
            }
            return options.inverse();
        });

        // Fixed-point numbers (use US locale for consistent decimal separator)
        hb.registerHelper("fixed", (Object value, Options options) -> {
            if (!(value instanceof Number number)) return "n/a";
            int digits = options.hash("digits", 1);
            return String.format(Locale.US, "%." + digits + "f", number.doubleValue());
        });

        hb.registerHelper("formatPercent", (Object value, Options options) -> {
            if (!(value instanceof Number number)) return "0%";
            return String.format(Locale.US, "%.1f%%", number.doubleValue() * 100);
        });

        hb.registerHelper("lowercase", (Object text, Options options) -> {
            if (text == null) return "";
            return text.toString().toLowerCase();
        });
    }

    private Helper<Object> colorHelper(Ansi.Color color) {
        return (Object text, Options options) -> {
            String textStr = text != null ? text.toString() : "";
            if (getColorEnabled(options)) {
                return Ansi.ansi().fg(color).a(textStr).reset().toString();
            }
            return textStr;
        };
    }

    private boolean getColorEnabled(Options options) {
        Boolean colorParam = options.hash("color");
        if (colorParam != null) return colorParam;

        Object colorEnabled = options.context.get("colorEnabled");
        if (colorEnabled instanceof Boolean) return (Boolean) colorEnabled;

        Object opts = options.context.get("options");
        if (opts instanceof OutputOptions) {
            return ((OutputOptions) opts).isColorEnabled();
        }
        return false;
    }
}
