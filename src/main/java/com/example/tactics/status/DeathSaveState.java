package com.example.tactics.status;

/**
 * Immutable death-save tally. Counters are clamped to [0, 3].
 */
public final class DeathSaveState {

    public static final int MAX_MARKS = 3;

    private static final DeathSaveState CONSCIOUS = new DeathSaveState(DeathSavePhase.CONSCIOUS, 0, 0);
    private static final DeathSaveState FRESH_DYING = new DeathSaveState(DeathSavePhase.DYING, 0, 0);

    private final DeathSavePhase phase;
    private final int successes;
    private final int failures;

    private DeathSaveState(DeathSavePhase phase, int successes, int failures) {
        this.phase = phase;
        this.successes = successes;
        this.failures = failures;
    }

    /**
     * Build a state, clamping out-of-range counters.
     */
    public static DeathSaveState of(DeathSavePhase phase, int successes, int failures) {
        return new DeathSaveState(phase != null ? phase : DeathSavePhase.CONSCIOUS, clamp(successes), clamp(failures));
    }

    public static DeathSaveState conscious() {
        return CONSCIOUS;
    }

    /** A creature that has just dropped to 0 HP. */
    public static DeathSaveState dying() {
        return FRESH_DYING;
    }

    public DeathSavePhase getPhase() { return phase; }
    public int getSuccesses() { return successes; }
    public int getFailures() { return failures; }

    public boolean isDying() { return phase == DeathSavePhase.DYING; }
    public boolean isStable() { return phase == DeathSavePhase.STABLE; }
    public boolean isDead() { return phase == DeathSavePhase.DEAD; }
    public boolean isConscious() { return phase == DeathSavePhase.CONSCIOUS; }

    /** At 0 HP but alive. */
    public boolean isDown() {
        return phase == DeathSavePhase.DYING || phase == DeathSavePhase.STABLE;
    }

    static int clamp(int count) {
        return Math.max(0, Math.min(MAX_MARKS, count));
    }

    /**
     * Status line such as "Dying - 1 successes, 2 failures".
     */
    public String describe() {
        switch (phase) {
            case DEAD:
                return "Dead";
            case STABLE:
                return "Unconscious but stable";
            case CONSCIOUS:
                return "Conscious";
            default:
                if (successes == 0 && failures == 0) {
                    return "Dying - no death saves yet";
                }
                return "Dying - " + successes + " successes, " + failures + " failures";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeathSaveState)) return false;
        DeathSaveState other = (DeathSaveState) o;
        return phase == other.phase && successes == other.successes && failures == other.failures;
    }

    @Override
    public int hashCode() {
        return (phase.hashCode() * 31 + successes) * 31 + failures;
    }

    @Override
    public String toString() {
        return "DeathSaveState[" + phase + ", " + successes + "/" + failures + "]";
    }
}
