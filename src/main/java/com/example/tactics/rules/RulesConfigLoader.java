package com.example.tactics.rules;

import com.example.tactics.grid.DiagonalPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Reads a {@link RulesConfig} from YAML.
 * <p>
 * Example:
 * <pre>
 * preset: full_2024
 * flanking_advantage: true
 * diagonal_policy: alternating
 * grid:
 *   width: 12
 *   height: 10
 * </pre>
 * Keys that are absent keep the value of the preset (or of the defaults when
 * no preset is named).
 */
public class RulesConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(RulesConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/config/rules.yaml";

    /**
     * Load the configuration from the default classpath resource.
     */
    public RulesConfig load() {
        return loadFromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a classpath resource. A missing resource
     * yields the default configuration.
     *
     * @throws RulesDataException if the resource exists but cannot be parsed
     */
    public RulesConfig loadFromResource(String resourcePath) {
        try (InputStream is = RulesConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("Rules config resource not found: {}, using defaults", resourcePath);
                return RulesConfig.defaults();
            }
            return loadFromStream(is, resourcePath);
        } catch (IOException e) {
            throw new RulesDataException("Failed to read " + resourcePath, e);
        }
    }

    public RulesConfig loadFromStream(InputStream in, String source) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new RulesDataException("Malformed YAML in " + source, e);
        }
        if (doc == null) {
            return RulesConfig.defaults();
        }
        if (!(doc instanceof Map)) {
            throw new RulesDataException(source + ": top level must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) doc;
        RulesConfig config = fromMap(data);
        logger.info("Loaded rules config from {}: {}", source, config);
        return config;
    }

    /**
     * Build a configuration from an already-parsed YAML mapping.
     */
    public RulesConfig fromMap(Map<String, Object> data) {
        RulesConfig base = RulesConfig.defaults();
        String presetName = YamlValues.getString(data, "preset", null);
        if (presetName != null) {
            base = RulesConfig.preset(presetName).orElseGet(() -> {
                logger.warn("Unknown rules preset '{}', using defaults", presetName);
                return RulesConfig.defaults();
            });
        }

        BaseRuleset ruleset = data.containsKey("base_ruleset")
                ? BaseRuleset.fromString(YamlValues.getString(data, "base_ruleset", null))
                : base.getBaseRuleset();

        // Player-only criticals follow the edition unless set explicitly
        boolean playerOnlyCrits = data.containsKey("base_ruleset")
                ? ruleset == BaseRuleset.RULES_2024
                : base.isPlayerOnlyCriticals();
        playerOnlyCrits = YamlValues.getBoolean(data, "player_only_criticals", playerOnlyCrits);

        DiagonalPolicy policy = data.containsKey("diagonal_policy")
                ? DiagonalPolicy.fromString(YamlValues.getString(data, "diagonal_policy", null))
                : base.getDiagonalPolicy();

        Map<String, Object> grid = YamlValues.getMap(data, "grid");

        return new RulesConfig(
                ruleset,
                playerOnlyCrits,
                YamlValues.getBoolean(data, "critical_damage_max_first_die", base.isCriticalDamageMaxFirstDie()),
                YamlValues.getBoolean(data, "flanking_advantage", base.isFlankingAdvantage()),
                YamlValues.getBoolean(data, "massive_damage_instant_death", base.isMassiveDamageInstantDeath()),
                policy,
                YamlValues.getInt(grid, "width", base.getGridWidth()),
                YamlValues.getInt(grid, "height", base.getGridHeight()),
                YamlValues.getInt(grid, "cell_size", base.getCellSize()));
    }
}
