package com.example.tactics.status;

/**
 * Transition functions for exhaustion. Levels are clamped to [0, 6]; once a
 * creature reaches level 6 it is dead and no transition lowers it again.
 */
public final class Exhaustion {

    private Exhaustion() {}

    public static ExhaustionChange gain(ExhaustionState state, int amount) {
        if (state.isDead()) {
            return new ExhaustionChange(state, state, false, "Already dead from exhaustion");
        }
        ExhaustionState next = ExhaustionState.of(state.getLevel() + Math.max(0, amount));
        if (next.isDead()) {
            return new ExhaustionChange(state, next, true, "Died from exhaustion!");
        }
        int gained = next.getLevel() - state.getLevel();
        String message = gained > 0
                ? "Gained " + gained + " exhaustion level(s). Now at level " + next.getLevel() + "."
                : "No exhaustion gained.";
        return new ExhaustionChange(state, next, false, message);
    }

    public static ExhaustionChange reduce(ExhaustionState state, int amount) {
        if (state.isDead()) {
            return new ExhaustionChange(state, state, false, "Exhaustion death cannot be reversed");
        }
        ExhaustionState next = ExhaustionState.of(state.getLevel() - Math.max(0, amount));
        int reduced = state.getLevel() - next.getLevel();
        String message = reduced > 0
                ? "Reduced exhaustion by " + reduced + " level(s). Now at level " + next.getLevel() + "."
                : "No exhaustion to reduce.";
        return new ExhaustionChange(state, next, false, message);
    }

    /**
     * A long rest removes one level, but only with adequate food and drink.
     */
    public static ExhaustionChange recoverOnRest(ExhaustionState state, boolean hasFoodAndDrink) {
        if (!hasFoodAndDrink) {
            return new ExhaustionChange(state, state, false, "No recovery without food and drink.");
        }
        return reduce(state, 1);
    }
}
