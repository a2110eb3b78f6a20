package im.arun.markuptree.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.markuptree.model.AttributeStyle;
import im.arun.markuptree.render.FormattingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MarkupTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private MarkupTreeConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled configuration
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), MarkupTreeConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, MarkupTreeConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new MarkupTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new MarkupTreeConfig();
        }
    }

    public MarkupTreeConfig load(Map<String, Object> userOptions) {
        MarkupTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        // Merge user options into config
        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "formatting":
                        if (value instanceof String) {
                            // reject unknown modes here rather than at render time
                            config.setFormatting(FormattingMode.fromKey((String) value).getKey());
                        } else if (value instanceof FormattingMode) {
                            config.setFormatting(((FormattingMode) value).getKey());
                        }
                        break;
                    case "indent_unit":
                    case "indentUnit":
                        if (value instanceof String) config.setIndentUnit((String) value);
                        break;
                    case "attribute_style":
                    case "attributeStyle":
                        if (value instanceof AttributeStyle) {
                            config.setAttributeStyle((AttributeStyle) value);
                        } else if (value instanceof String) {
                            config.setAttributeStyle(AttributeStyle.valueOf(((String) value).toUpperCase(Locale.ROOT)));
                        }
                        break;
                    case "include_entry_point":
                    case "includeEntryPoint":
                        config.setIncludeEntryPoint(parseBoolean(value));
                        break;
                    case "input_format":
                    case "inputFormat":
                        if (value instanceof String) config.setInputFormat(((String) value).toLowerCase(Locale.ROOT));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (IllegalArgumentException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
                throw e;
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

    private MarkupTreeConfig copyConfig(MarkupTreeConfig source) {
        MarkupTreeConfig copy = new MarkupTreeConfig();
        copy.setFormatting(source.getFormatting());
        copy.setIndentUnit(source.getIndentUnit());
        copy.setAttributeStyle(source.getAttributeStyle());
        copy.setIncludeEntryPoint(source.isIncludeEntryPoint());
        copy.setInputFormat(source.getInputFormat());
        return copy;
    }
}
