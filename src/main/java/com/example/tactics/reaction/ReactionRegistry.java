package com.example.tactics.reaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks the once-per-round reaction of every combatant in one encounter.
 * <p>
 * A combatant is registered on entering combat and unregistered on leaving.
 * Its reaction is spent by {@link #useReaction} and restored only by
 * {@link #resetForTurn} at the start of its own turn.
 */
public class ReactionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ReactionRegistry.class);

    // Insertion order keeps eligible-reactor listings deterministic
    private final Map<String, ReactionState> states = new LinkedHashMap<>();

    private static final class ReactionState {
        boolean available = true;
        ReadiedAction readiedAction;
    }

    // ========== Lifecycle ==========

    /**
     * Start tracking a combatant with its reaction available. Registering an
     * already known combatant leaves its state untouched.
     */
    public void register(String combatantId) {
        if (combatantId == null) return;
        states.putIfAbsent(combatantId, new ReactionState());
    }

    /**
     * Stop tracking a combatant.
     * @return true if the combatant was registered
     */
    public boolean unregister(String combatantId) {
        return combatantId != null && states.remove(combatantId) != null;
    }

    public boolean isRegistered(String combatantId) {
        return combatantId != null && states.containsKey(combatantId);
    }

    // ========== Reaction use ==========

    public boolean hasReaction(String combatantId) {
        ReactionState state = states.get(combatantId);
        return state != null && state.available;
    }

    /**
     * Spend a combatant's reaction.
     * @return false, with no side effect, if it was already spent or the combatant is unknown
     */
    public boolean useReaction(String combatantId) {
        ReactionState state = states.get(combatantId);
        if (state == null || !state.available) {
            return false;
        }
        state.available = false;
        logger.debug("{} used their reaction", combatantId);
        return true;
    }

    /**
     * Restore a combatant's reaction at the start of its turn.
     */
    public void resetForTurn(String combatantId) {
        ReactionState state = states.get(combatantId);
        if (state == null) return;
        state.available = true;
    }

    // ========== Readied actions ==========

    /**
     * @return false if the combatant is not registered
     */
    public boolean setReadiedAction(String combatantId, ReadiedAction action) {
        ReactionState state = states.get(combatantId);
        if (state == null || action == null) return false;
        state.readiedAction = action;
        return true;
    }

    public void clearReadiedAction(String combatantId) {
        ReactionState state = states.get(combatantId);
        if (state != null) {
            state.readiedAction = null;
        }
    }

    public Optional<ReadiedAction> getReadiedAction(String combatantId) {
        ReactionState state = states.get(combatantId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.readiedAction);
    }

    /**
     * Release a readied action: spends the reaction and clears the action together.
     *
     * @return the action, or empty if nothing was readied or the reaction is already spent
     */
    public Optional<ReadiedAction> triggerReadiedAction(String combatantId) {
        ReactionState state = states.get(combatantId);
        if (state == null || state.readiedAction == null || !state.available) {
            return Optional.empty();
        }
        ReadiedAction action = state.readiedAction;
        state.readiedAction = null;
        state.available = false;
        return Optional.of(action);
    }

    // ========== Queries ==========

    public Optional<ReactionRecord> getRecord(String combatantId) {
        ReactionState state = states.get(combatantId);
        if (state == null) return Optional.empty();
        return Optional.of(new ReactionRecord(combatantId, state.available, !state.available, state.readiedAction));
    }

    /**
     * Those candidates that still hold their reaction, in the candidates' order.
     */
    public List<String> filterAvailable(Collection<String> candidates) {
        List<String> result = new ArrayList<>();
        for (String id : candidates) {
            if (hasReaction(id)) result.add(id);
        }
        return result;
    }

    /**
     * Reactions a combatant could take against a trigger, given the reactions it knows.
     * Empty when its reaction is spent.
     */
    public List<ReactionType> availableReactions(String combatantId, ReactionTrigger trigger, Set<ReactionType> known) {
        List<ReactionType> result = new ArrayList<>();
        if (!hasReaction(combatantId) || known == null) return result;
        for (ReactionType type : ReactionType.values()) {
            if (known.contains(type) && type.answers(trigger)) {
                result.add(type);
            }
        }
        if (trigger != null && getReadiedAction(combatantId).map(a -> a.trigger() == trigger).orElse(false)
                && !result.contains(ReactionType.READIED_ACTION)) {
            result.add(ReactionType.READIED_ACTION);
        }
        return result;
    }

    public int size() {
        return states.size();
    }
}
