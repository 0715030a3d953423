package com.example.tactics;

import com.example.tactics.grid.DiagonalPolicy;
import com.example.tactics.rules.BaseRuleset;
import com.example.tactics.rules.RulesConfig;
import com.example.tactics.rules.RulesConfigLoader;
import com.example.tactics.rules.RulesDataException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RulesConfigLoader and the built-in presets.
 */
public class RulesConfigLoaderTest {

    private final RulesConfigLoader loader = new RulesConfigLoader();

    private RulesConfig parse(String yaml) {
        return loader.loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test");
    }

    // === Presets ===

    @Test
    void testDefaultsAreBg3Style() {
        RulesConfig config = RulesConfig.defaults();
        assertEquals(BaseRuleset.RULES_2014, config.getBaseRuleset());
        assertFalse(config.isPlayerOnlyCriticals());
        assertFalse(config.isFlankingAdvantage());
        assertTrue(config.isMassiveDamageInstantDeath());
        assertEquals(DiagonalPolicy.CHEBYSHEV, config.getDiagonalPolicy());
        assertEquals(8, config.getGridWidth());
        assertEquals(5, config.getCellSize());
    }

    @Test
    void testPresets() {
        assertEquals(3, RulesConfig.presetNames().size());
        assertEquals(DiagonalPolicy.ALTERNATING,
                RulesConfig.preset("classic_2014").orElseThrow().getDiagonalPolicy());
        RulesConfig full = RulesConfig.preset(" FULL_2024 ").orElseThrow();
        assertTrue(full.isPlayerOnlyCriticals());
        assertTrue(full.isCriticalDamageMaxFirstDie());
        assertTrue(RulesConfig.preset("homebrew").isEmpty());
    }

    @Test
    void testWithCopiesLeaveOriginalAlone() {
        RulesConfig base = RulesConfig.defaults();
        RulesConfig flanking = base.withFlankingAdvantage(true).withGridSize(12, 10);
        assertTrue(flanking.isFlankingAdvantage());
        assertEquals(12, flanking.getGridWidth());
        assertFalse(base.isFlankingAdvantage());
        assertEquals(8, base.getGridWidth());
    }

    // === Loading ===

    @Test
    void testLoadDefaultResource() {
        RulesConfig config = loader.load();
        assertEquals(BaseRuleset.RULES_2014, config.getBaseRuleset());
        assertEquals(DiagonalPolicy.CHEBYSHEV, config.getDiagonalPolicy());
        assertEquals(8, config.getGridHeight());
        assertEquals(RulesConfig.defaults().toString(), config.toString());
    }

    @Test
    void testPresetAloneSuppliesEveryValue() {
        RulesConfig config = loader.fromMap(Map.of("preset", "full_2024"));
        assertEquals(RulesConfig.preset("full_2024").orElseThrow().toString(), config.toString());
        assertTrue(config.isPlayerOnlyCriticals());
    }

    @Test
    void testMissingResourceGivesDefaults() {
        RulesConfig config = loader.loadFromResource("/config/does-not-exist.yaml");
        assertEquals(RulesConfig.defaults().toString(), config.toString());
    }

    @Test
    void testPresetWithOverrides() {
        RulesConfig config = parse("preset: classic_2014\nflanking_advantage: true\ngrid:\n  width: 12\n");
        assertEquals(DiagonalPolicy.ALTERNATING, config.getDiagonalPolicy());
        assertTrue(config.isFlankingAdvantage());
        assertEquals(12, config.getGridWidth());
        assertEquals(8, config.getGridHeight());
    }

    @Test
    void testBaseRulesetDrivesPlayerOnlyCrits() {
        assertTrue(parse("base_ruleset: \"2024\"\n").isPlayerOnlyCriticals());
        assertFalse(parse("base_ruleset: \"2024\"\nplayer_only_criticals: false\n").isPlayerOnlyCriticals());
    }

    @Test
    void testUnknownValuesFallBack() {
        RulesConfig config = parse("preset: homebrew\ndiagonal_policy: hexes\n");
        assertEquals(DiagonalPolicy.CHEBYSHEV, config.getDiagonalPolicy());
        assertEquals(BaseRuleset.RULES_2014, config.getBaseRuleset());
    }

    @Test
    void testEmptyDocumentGivesDefaults() {
        assertEquals(RulesConfig.defaults().toString(), parse("").toString());
    }

    @Test
    void testMalformedYamlThrows() {
        assertThrows(RulesDataException.class, () -> parse("grid: [unclosed\n"));
    }

    @Test
    void testTopLevelListThrows() {
        RulesDataException e = assertThrows(RulesDataException.class, () -> parse("- one\n- two\n"));
        assertTrue(e.getMessage().contains("mapping"));
    }
}
