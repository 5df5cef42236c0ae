package io.surfworks.loopweaver.lowering.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the lowering pass.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>Values set by the caller through the {@code with*} methods (highest priority)</li>
 *   <li>Config file ({@code ~/.config/loopweaver/lowering.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param validateResult    run the structural validator over every lowered graph
 * @param dumpLoweredNodes  log lowered graphs as JSON at FINE level
 * @param loopBodyGraphName name given to generated loop body graphs
 * @param branchGraphName   name given to generated branch graphs
 */
public record LoweringConfig(
        boolean validateResult,
        boolean dumpLoweredNodes,
        String loopBodyGraphName,
        String branchGraphName
) {

    /** Default name of generated loop body graphs */
    public static final String DEFAULT_LOOP_BODY_GRAPH_NAME = "loop-body-graph";

    /** Default name of generated branch graphs */
    public static final String DEFAULT_BRANCH_GRAPH_NAME = "if-body-graph";

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "loopweaver"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "lowering.json";

    public LoweringConfig {
        Objects.requireNonNull(loopBodyGraphName, "loopBodyGraphName cannot be null");
        Objects.requireNonNull(branchGraphName, "branchGraphName cannot be null");

        if (loopBodyGraphName.isBlank()) {
            throw new IllegalArgumentException("loopBodyGraphName cannot be blank");
        }
        if (branchGraphName.isBlank()) {
            throw new IllegalArgumentException("branchGraphName cannot be blank");
        }
    }

    /**
     * Returns the default configuration: validation on, JSON dump off.
     */
    public static LoweringConfig defaults() {
        return new LoweringConfig(
                true,
                false,
                DEFAULT_LOOP_BODY_GRAPH_NAME,
                DEFAULT_BRANCH_GRAPH_NAME
        );
    }

    /**
     * Returns the path to the default config file.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public LoweringConfig withValidateResult(boolean validate) {
        return new LoweringConfig(validate, dumpLoweredNodes, loopBodyGraphName, branchGraphName);
    }

    public LoweringConfig withDumpLoweredNodes(boolean dump) {
        return new LoweringConfig(validateResult, dump, loopBodyGraphName, branchGraphName);
    }

    public LoweringConfig withLoopBodyGraphName(String name) {
        return new LoweringConfig(validateResult, dumpLoweredNodes, name, branchGraphName);
    }

    public LoweringConfig withBranchGraphName(String name) {
        return new LoweringConfig(validateResult, dumpLoweredNodes, loopBodyGraphName, name);
    }
}
