package com.example.tactics.status;

/**
 * Immutable exhaustion level in [0, 6]. Level 6 is death.
 */
public final class ExhaustionState {

    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 6;

    private static final ExhaustionState[] LEVELS = new ExhaustionState[MAX_LEVEL + 1];
    static {
        for (int i = MIN_LEVEL; i <= MAX_LEVEL; i++) {
            LEVELS[i] = new ExhaustionState(i);
        }
    }

    private static final String[] DESCRIPTIONS = {
        "Not exhausted",
        "Disadvantage on ability checks",
        "Disadvantage on ability checks, speed halved",
        "Disadvantage on ability checks, attacks, and saves; speed halved",
        "Disadvantage on ability checks, attacks, and saves; speed halved; max HP halved",
        "Disadvantage on ability checks, attacks, and saves; speed 0; max HP halved",
        "Death"
    };

    private final int level;

    private ExhaustionState(int level) {
        this.level = level;
    }

    /**
     * The state for a level, clamped to [0, 6].
     */
    public static ExhaustionState of(int level) {
        return LEVELS[Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level))];
    }

    public static ExhaustionState none() {
        return LEVELS[MIN_LEVEL];
    }

    public int getLevel() { return level; }

    public boolean isExhausted() { return level > MIN_LEVEL; }

    public boolean isDead() { return level >= MAX_LEVEL; }

    public ExhaustionModifiers getModifiers() {
        return ExhaustionModifiers.forLevel(level);
    }

    public boolean hasDisadvantageOn(RollType type) {
        return getModifiers().hasDisadvantageOn(type);
    }

    /**
     * Speed after exhaustion, rounded down.
     */
    public int speedFor(int baseSpeed) {
        return (int) (baseSpeed * getModifiers().speedMultiplier());
    }

    /**
     * Hit point maximum after exhaustion, rounded down but never below 1.
     */
    public int maxHpFor(int baseMaxHp) {
        return Math.max(1, (int) (baseMaxHp * getModifiers().maxHpMultiplier()));
    }

    public String describe() {
        return DESCRIPTIONS[level];
    }

    @Override
    public String toString() {
        return "Exhaustion " + level;
    }
}
