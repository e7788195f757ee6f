package im.arun.copybook.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "config.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final CopybookConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private CopybookConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), CopybookConfig.class);
                }
                logger.warn("Config file {} not found, falling back to {}", configPath, DEFAULT_RESOURCE);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, CopybookConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new CopybookConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new CopybookConfig();
        }
    }

    public CopybookConfig load() {
        return load(null);
    }

    public CopybookConfig load(Map<String, Object> userOptions) {
        CopybookConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        // Merge user options into config
        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "output_format":
                    case "outputFormat":
                        if (value instanceof OutputFormat) {
                            config.setOutputFormat((OutputFormat) value);
                        } else if (value instanceof String) {
                            config.setOutputFormat(OutputFormat.fromName((String) value));
                        }
                        break;
                    case "nested":
                        config.setNested(parseBoolean(value));
                        break;
                    case "fixed_format":
                    case "fixedFormat":
                        config.setFixedFormat(parseBoolean(value));
                        break;
                    case "text_area_end":
                    case "textAreaEnd":
                        if (value instanceof Integer) config.setTextAreaEnd((Integer) value);
                        break;
                    case "include_timestamp":
                    case "includeTimestamp":
                        config.setIncludeTimestamp(parseBoolean(value));
                        break;
                    case "max_workers":
                    case "maxWorkers":
                        if (value instanceof Integer) config.setMaxWorkers((Integer) value);
                        break;
                    case "log_directory":
                    case "logDirectory":
                        config.setLogDirectory(value != null ? value.toString() : null);
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (IllegalArgumentException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private CopybookConfig copyConfig(CopybookConfig source) {
        CopybookConfig copy = new CopybookConfig();
        copy.setOutputFormat(source.getOutputFormat());
        copy.setNested(source.isNested());
        copy.setFixedFormat(source.isFixedFormat());
        copy.setTextAreaEnd(source.getTextAreaEnd());
        copy.setIncludeTimestamp(source.isIncludeTimestamp());
        copy.setLogDirectory(source.getLogDirectory());
        copy.setMaxWorkers(source.getMaxWorkers());
        return copy;
    }
}
