package com.example.tactics.status;

/**
 * Combined effect of all exhaustion levels up to the current one.
 *
 * @param abilityCheckDisadvantage from level 1
 * @param attackDisadvantage from level 3
 * @param savingThrowDisadvantage from level 3
 * @param speedMultiplier 0.5 from level 2, 0 from level 5
 * @param maxHpMultiplier 0.5 from level 4
 * @param dead at level 6
 */
public record ExhaustionModifiers(boolean abilityCheckDisadvantage, boolean attackDisadvantage,
                                  boolean savingThrowDisadvantage, double speedMultiplier,
                                  double maxHpMultiplier, boolean dead) {

    public static final ExhaustionModifiers NONE = new ExhaustionModifiers(false, false, false, 1.0, 1.0, false);

    /**
     * Effects of a given level, cumulative over all lower levels.
     */
    public static ExhaustionModifiers forLevel(int level) {
        if (level <= 0) return NONE;
        return new ExhaustionModifiers(
                level >= 1,
                level >= 3,
                level >= 3,
                level >= 5 ? 0.0 : (level >= 2 ? 0.5 : 1.0),
                level >= 4 ? 0.5 : 1.0,
                level >= 6);
    }

    public boolean hasDisadvantageOn(RollType type) {
        switch (type) {
            case ABILITY_CHECK:
                return abilityCheckDisadvantage;
            case ATTACK_ROLL:
                return attackDisadvantage;
            case SAVING_THROW:
                return savingThrowDisadvantage;
            default:
                return false;
        }
    }
}
