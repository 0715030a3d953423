package com.example.tactics.status;

import java.util.Optional;

/**
 * Result of trying to stabilize a creature, with the state afterwards.
 */
public class StabilizationResult {

    private final boolean success;
    private final StabilizationMethod method;
    private final DeathSaveState state;
    private final Integer roll;
    private final String description;

    StabilizationResult(boolean success, StabilizationMethod method, DeathSaveState state, Integer roll,
                        String description) {
        this.success = success;
        this.method = method;
        this.state = state;
        this.roll = roll;
        this.description = description;
    }

    public boolean isSuccess() { return success; }
    public StabilizationMethod getMethod() { return method; }
    public DeathSaveState getState() { return state; }

    /** The Medicine roll, when one was used. */
    public Optional<Integer> getRoll() { return Optional.ofNullable(roll); }

    public String getDescription() { return description; }

    @Override
    public String toString() {
        return "StabilizationResult[" + (success ? "success" : "failure") + ", " + method + ": " + description + "]";
    }
}
