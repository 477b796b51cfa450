package de.bsommerfeld.threadcrawler.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.threadcrawler.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link GlobalConfig} as TOML.
 *
 * <p>
 * A missing file is not an error: the defaults are written to the given path
 * so the user has a template to edit, and the defaults are returned.
 * A file that exists but cannot be parsed is fatal and surfaces as
 * {@link ConfigInvalidException}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String APP_NAME = "thread-crawler";
    public static final String CONFIG_PROPERTY = "crawler.config";
    private static final String CONFIG_FILE = "config.toml";

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Location of the configuration file: the {@code crawler.config} system
     * property if set, otherwise {@code config.toml} inside the application
     * data directory.
     */
    public static Path defaultLocation() {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Path.of(override);
        }
        return StorageUtils.getAppDataDir(APP_NAME).resolve(CONFIG_FILE);
    }

    public static GlobalConfig load(Path path) {
        if (!Files.exists(path)) {
            GlobalConfig defaults = new GlobalConfig();
            try {
                save(defaults, path);
                LOG.info("No configuration found, wrote defaults to {}", path);
            } catch (IOException e) {
                LOG.warn("Could not write default configuration to {}: {}", path, e.getMessage());
            }
            return defaults;
        }

        try {
            GlobalConfig config = MAPPER.readValue(path.toFile(), GlobalConfig.class);
            LOG.info("Loaded configuration from {}", path);
            return config;
        } catch (IOException e) {
            throw new ConfigInvalidException("Failed to parse configuration " + path, e);
        }
    }

    public static void save(GlobalConfig config, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
    }
}
