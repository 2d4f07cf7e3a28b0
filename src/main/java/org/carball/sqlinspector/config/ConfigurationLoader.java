package org.carball.sqlinspector.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "SQL_INSPECTOR_";
    static final String CLI_PREFIX = "--inspector.";

    static final List<String> SETTINGS = List.of(
            "secret-key",
            "read-only-keyword",
            "cache-capacity",
            "grouping-mode",
            "execution-available",
            "internal-frame-prefixes",
            "rendering-keywords",
            "jdbc-url");

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public InspectorConfig loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public InspectorConfig loadConfiguration(Path configFile, String[] args) {
        log.debug("Loading configuration");

        InspectorConfig.InspectorConfigBuilder builder = InspectorConfig.builder();

        // 1. YAML file, if one was given
        if (configFile != null) {
            applyConfigFile(builder, configFile);
        }

        // 2. Environment variables
        applyEnvironmentVariables(builder);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        InspectorConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyConfigFile(InspectorConfig.InspectorConfigBuilder builder, Path configFile) {
        if (!Files.exists(configFile)) {
            log.warn("Inspector config file not found: {}, using defaults", configFile);
            return;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            JsonNode root = mapper.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Inspector config file {} is empty or not a mapping, using defaults", configFile);
                return;
            }

            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String name = field.getKey().toLowerCase(Locale.ROOT).replace('_', '-');
                applySetting(builder, name, asSettingValue(field.getValue()), configFile.toString());
            }
            log.info("Loaded inspector configuration from: {}", configFile);
        } catch (IOException e) {
            log.error("Failed to load inspector config from {}: {}, using defaults", configFile, e.getMessage());
        }
    }

    private void applyEnvironmentVariables(InspectorConfig.InspectorConfigBuilder builder) {
        for (String setting : SETTINGS) {
            String variable = toEnvironmentVariable(setting);
            if (environment.containsKey(variable)) {
                applySetting(builder, setting, environment.get(variable), variable);
            }
        }
    }

    private void applyCLIArguments(InspectorConfig.InspectorConfigBuilder builder, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            if (arg.startsWith(CLI_PREFIX)) {
                applySetting(builder, arg.substring(CLI_PREFIX.length()), args[i + 1], arg);
                i++;
            }
        }
    }

    private void applySetting(InspectorConfig.InspectorConfigBuilder builder, String name, String value, String source) {
        try {
            switch (name) {
                case "secret-key":
                    builder.secretKey(value);
                    break;
                case "read-only-keyword":
                    builder.readOnlyKeyword(value.trim());
                    break;
                case "cache-capacity":
                    builder.cacheCapacity(Integer.parseInt(value.trim()));
                    break;
                case "grouping-mode":
                    builder.groupingMode(GroupingMode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
                    break;
                case "execution-available":
                    builder.executionAvailable(Boolean.parseBoolean(value.trim()));
                    break;
                case "internal-frame-prefixes":
                    builder.internalFramePrefixes(splitList(value));
                    break;
                case "rendering-keywords":
                    builder.renderingKeywords(splitList(value));
                    break;
                case "jdbc-url":
                    builder.jdbcUrl(value.trim());
                    break;
                default:
                    log.warn("Ignoring unknown setting '{}' from {}", name, source);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}: {}. Expected one of {}", source, value, Arrays.toString(GroupingMode.values()));
        }
    }

    private static String asSettingValue(JsonNode node) {
        if (node.isArray()) {
            List<String> items = new ArrayList<>();
            node.forEach(item -> items.add(item.asText()));
            return String.join(",", items);
        }
        return node.asText();
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toList());
    }

    static String toEnvironmentVariable(String setting) {
        return ENV_PREFIX + setting.toUpperCase(Locale.ROOT).replace('-', '_');
    }

    /**
     * Returns help text for inspector configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Inspector Configuration Options:

            CLI Arguments:
              --inspector.secret-key <text>               Secret used to sign query tokens (required)
              --inspector.read-only-keyword <word>        Statements starting with this word may be re-run (default: select)
              --inspector.cache-capacity <num>            Recent inspections kept for later lookup (default: 5)
              --inspector.grouping-mode <mode>            statement | statement_with_parameters (default: statement)
              --inspector.execution-available <bool>      Enable select-again and explain (default: false)
              --inspector.internal-frame-prefixes <list>  Comma-separated packages hidden from shortened stacks
              --inspector.rendering-keywords <list>       Comma-separated markers of template-rendering frames
              --inspector.jdbc-url <url>                  Database used to re-run verified statements

            Environment Variables:
              SQL_INSPECTOR_SECRET_KEY                    Same as --inspector.secret-key
              SQL_INSPECTOR_READ_ONLY_KEYWORD             Same as --inspector.read-only-keyword
              SQL_INSPECTOR_CACHE_CAPACITY                Same as --inspector.cache-capacity
              SQL_INSPECTOR_GROUPING_MODE                 Same as --inspector.grouping-mode
              SQL_INSPECTOR_EXECUTION_AVAILABLE           Same as --inspector.execution-available
              SQL_INSPECTOR_INTERNAL_FRAME_PREFIXES       Same as --inspector.internal-frame-prefixes
              SQL_INSPECTOR_RENDERING_KEYWORDS            Same as --inspector.rendering-keywords
              SQL_INSPECTOR_JDBC_URL                      Same as --inspector.jdbc-url

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML config file (--config)
              4. Built-in defaults
            """;
    }
}
