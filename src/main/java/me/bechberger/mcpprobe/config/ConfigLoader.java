package me.bechberger.mcpprobe.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ProbeConfig} from YAML or JSON files. JSON is read by the YAML parser as well.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper(YAMLFactory.builder().build())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ConfigLoader() {
    }

    /**
     * @throws IOException if the file is missing, unreadable or has unknown or mistyped fields
     */
    public static @NotNull ProbeConfig load(@NotNull Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Config file not found: " + file);
        }
        if (Files.size(file) == 0) {
            return ProbeConfig.EMPTY;
        }
        ProbeConfig config = MAPPER.readValue(file.toFile(), ProbeConfig.class);
        log.debug("Loaded config from {}: {}", file, config);
        return config != null ? config : ProbeConfig.EMPTY;
    }
}
