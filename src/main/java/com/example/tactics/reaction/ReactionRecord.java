package com.example.tactics.reaction;

import java.util.Optional;

/**
 * Read-only view of one combatant's reaction state.
 */
public record ReactionRecord(String combatantId, boolean available, boolean usedThisRound,
                             ReadiedAction readiedAction) {

    public Optional<ReadiedAction> getReadiedAction() {
        return Optional.ofNullable(readiedAction);
    }
}
