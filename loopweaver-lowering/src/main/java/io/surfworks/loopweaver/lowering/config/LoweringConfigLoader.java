package io.surfworks.loopweaver.lowering.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves LoweringConfig.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>Config file ({@code ~/.config/loopweaver/lowering.json})</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>Example file:
 * <pre>{@code
 * {
 *   "validateResult": true,
 *   "dumpLoweredNodes": false,
 *   "loopBodyGraphName": "loop-body-graph",
 *   "branchGraphName": "if-body-graph"
 * }
 * }</pre>
 */
public final class LoweringConfigLoader {

    private static final Logger LOG = Logger.getLogger(LoweringConfigLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private LoweringConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * <p>If the config file doesn't exist, returns defaults.
     *
     * @return the loaded configuration
     */
    public static LoweringConfig load() {
        return load(LoweringConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * <p>Missing keys keep their default. An unreadable or malformed file is
     * logged and yields the defaults.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static LoweringConfig load(Path configFile) {
        LoweringConfig config = LoweringConfig.defaults();

        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }

        return config;
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(LoweringConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("validateResult", config.validateResult());
        root.put("dumpLoweredNodes", config.dumpLoweredNodes());
        root.put("loopBodyGraphName", config.loopBodyGraphName());
        root.put("branchGraphName", config.branchGraphName());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static LoweringConfig loadFromFile(Path configFile, LoweringConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring lowering config " + configFile + ": top level is not a JSON object");
                return base;
            }

            return new LoweringConfig(
                    getBooleanOrDefault(root, "validateResult", base.validateResult()),
                    getBooleanOrDefault(root, "dumpLoweredNodes", base.dumpLoweredNodes()),
                    getStringOrDefault(root, "loopBodyGraphName", base.loopBodyGraphName()),
                    getStringOrDefault(root, "branchGraphName", base.branchGraphName())
            );

        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable lowering config " + configFile, e);
            return base;
        }
    }

    private static boolean getBooleanOrDefault(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.asBoolean() : defaultValue;
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : defaultValue;
    }
}
