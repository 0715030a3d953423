package com.example.tactics.rules;

import com.example.tactics.grid.CombatGrid;
import com.example.tactics.grid.DiagonalPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of rule variant toggles for an encounter.
 * <p>
 * A config is built once (from a preset or {@code rules.yaml}) and handed to
 * the components that need it; nothing reads it from global state.
 */
public final class RulesConfig {

    private final BaseRuleset baseRuleset;
    private final boolean playerOnlyCriticals;
    private final boolean criticalDamageMaxFirstDie;
    private final boolean flankingAdvantage;
    private final boolean massiveDamageInstantDeath;
    private final DiagonalPolicy diagonalPolicy;
    private final int gridWidth;
    private final int gridHeight;
    private final int cellSize;

    public RulesConfig(BaseRuleset baseRuleset, boolean playerOnlyCriticals, boolean criticalDamageMaxFirstDie,
                       boolean flankingAdvantage, boolean massiveDamageInstantDeath, DiagonalPolicy diagonalPolicy,
                       int gridWidth, int gridHeight, int cellSize) {
        this.baseRuleset = baseRuleset != null ? baseRuleset : BaseRuleset.RULES_2014;
        this.playerOnlyCriticals = playerOnlyCriticals;
        this.criticalDamageMaxFirstDie = criticalDamageMaxFirstDie;
        this.flankingAdvantage = flankingAdvantage;
        this.massiveDamageInstantDeath = massiveDamageInstantDeath;
        this.diagonalPolicy = diagonalPolicy != null ? diagonalPolicy : DiagonalPolicy.CHEBYSHEV;
        this.gridWidth = gridWidth > 0 ? gridWidth : CombatGrid.DEFAULT_WIDTH;
        this.gridHeight = gridHeight > 0 ? gridHeight : CombatGrid.DEFAULT_HEIGHT;
        this.cellSize = cellSize > 0 ? cellSize : CombatGrid.DEFAULT_CELL_SIZE;
    }

    // ========== Presets ==========

    public static final String PRESET_BG3_STYLE = "bg3_style";
    public static final String PRESET_CLASSIC_2014 = "classic_2014";
    public static final String PRESET_FULL_2024 = "full_2024";

    private static final Map<String, RulesConfig> PRESETS;
    static {
        Map<String, RulesConfig> presets = new LinkedHashMap<>();
        presets.put(PRESET_BG3_STYLE, new RulesConfig(BaseRuleset.RULES_2014, false, false, false, true,
                DiagonalPolicy.CHEBYSHEV, 8, 8, 5));
        presets.put(PRESET_CLASSIC_2014, new RulesConfig(BaseRuleset.RULES_2014, false, false, false, true,
                DiagonalPolicy.ALTERNATING, 8, 8, 5));
        presets.put(PRESET_FULL_2024, new RulesConfig(BaseRuleset.RULES_2024, true, true, false, true,
                DiagonalPolicy.CHEBYSHEV, 8, 8, 5));
        PRESETS = Collections.unmodifiableMap(presets);
    }

    /** The default configuration: 2014 rules played the BG3 way. */
    public static RulesConfig defaults() {
        return PRESETS.get(PRESET_BG3_STYLE);
    }

    public static Optional<RulesConfig> preset(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(PRESETS.get(name.trim().toLowerCase()));
    }

    public static Set<String> presetNames() {
        return PRESETS.keySet();
    }

    // ========== Accessors ==========

    public BaseRuleset getBaseRuleset() { return baseRuleset; }

    /** Only player-controlled attackers deal extra critical damage. */
    public boolean isPlayerOnlyCriticals() { return playerOnlyCriticals; }

    /** On a critical the first doubled die counts as its maximum face. */
    public boolean isCriticalDamageMaxFirstDie() { return criticalDamageMaxFirstDie; }

    public boolean isFlankingAdvantage() { return flankingAdvantage; }

    /** Damage left over after dropping to 0 HP that is at least max HP kills outright. */
    public boolean isMassiveDamageInstantDeath() { return massiveDamageInstantDeath; }

    public DiagonalPolicy getDiagonalPolicy() { return diagonalPolicy; }
    public int getGridWidth() { return gridWidth; }
    public int getGridHeight() { return gridHeight; }
    public int getCellSize() { return cellSize; }

    // ========== Copies ==========

    public RulesConfig withPlayerOnlyCriticals(boolean value) {
        return new RulesConfig(baseRuleset, value, criticalDamageMaxFirstDie, flankingAdvantage,
                massiveDamageInstantDeath, diagonalPolicy, gridWidth, gridHeight, cellSize);
    }

    public RulesConfig withCriticalDamageMaxFirstDie(boolean value) {
        return new RulesConfig(baseRuleset, playerOnlyCriticals, value, flankingAdvantage,
                massiveDamageInstantDeath, diagonalPolicy, gridWidth, gridHeight, cellSize);
    }

    public RulesConfig withFlankingAdvantage(boolean value) {
        return new RulesConfig(baseRuleset, playerOnlyCriticals, criticalDamageMaxFirstDie, value,
                massiveDamageInstantDeath, diagonalPolicy, gridWidth, gridHeight, cellSize);
    }

    public RulesConfig withDiagonalPolicy(DiagonalPolicy value) {
        return new RulesConfig(baseRuleset, playerOnlyCriticals, criticalDamageMaxFirstDie, flankingAdvantage,
                massiveDamageInstantDeath, value, gridWidth, gridHeight, cellSize);
    }

    public RulesConfig withGridSize(int width, int height) {
        return new RulesConfig(baseRuleset, playerOnlyCriticals, criticalDamageMaxFirstDie, flankingAdvantage,
                massiveDamageInstantDeath, diagonalPolicy, width, height, cellSize);
    }

    /** A fresh grid sized and priced by this configuration. */
    public CombatGrid newGrid() {
        return new CombatGrid(gridWidth, gridHeight, cellSize, diagonalPolicy);
    }

    @Override
    public String toString() {
        return "RulesConfig[" + baseRuleset.getYear()
                + ", playerOnlyCrits=" + playerOnlyCriticals
                + ", maxFirstDie=" + criticalDamageMaxFirstDie
                + ", flanking=" + flankingAdvantage
                + ", diagonals=" + diagonalPolicy
                + ", grid=" + gridWidth + "x" + gridHeight + "@" + cellSize + "]";
    }
}
