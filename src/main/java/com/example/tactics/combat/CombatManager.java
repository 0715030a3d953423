package com.example.tactics.combat;

import com.example.tactics.dice.DiceRoller;
import com.example.tactics.grid.CombatGrid;
import com.example.tactics.rules.RulesConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps track of running combat encounters.
 * <p>
 * Each manager is an ordinary object holding its own sessions; create one per
 * game server or test. Individual {@link Combat} sessions are not thread-safe,
 * but different sessions can be driven from different threads.
 */
public class CombatManager {

    private static final Logger logger = LoggerFactory.getLogger(CombatManager.class);

    /** All active combats, keyed by combat ID */
    private final Map<Long, Combat> activeCombats = new ConcurrentHashMap<>();

    /** Combat ID generator */
    private final AtomicLong combatIdGenerator = new AtomicLong(1);

    private final RulesConfig rules;
    private final DiceRoller dice;

    public CombatManager(RulesConfig rules, DiceRoller dice) {
        this.rules = rules;
        this.dice = dice;
    }

    public CombatManager(RulesConfig rules) {
        this(rules, new DiceRoller());
    }

    public RulesConfig getRules() {
        return rules;
    }

    /**
     * Start tracking a new combat on a grid built from the rules configuration.
     */
    public Combat createCombat() {
        return createCombat(rules.newGrid());
    }

    /**
     * Start tracking a new combat on a prepared grid.
     */
    public Combat createCombat(CombatGrid grid) {
        long id = combatIdGenerator.getAndIncrement();
        Combat combat = new Combat(id, rules, dice, grid);
        activeCombats.put(id, combat);
        logger.info("Created combat {} on a {}x{} grid", id, grid.getWidth(), grid.getHeight());
        return combat;
    }

    public Optional<Combat> getCombat(long combatId) {
        return Optional.ofNullable(activeCombats.get(combatId));
    }

    public Collection<Combat> getActiveCombats() {
        return Collections.unmodifiableCollection(activeCombats.values());
    }

    public int getActiveCombatCount() {
        return activeCombats.size();
    }

    /**
     * End a combat and stop tracking it.
     *
     * @return false if no such combat is tracked
     */
    public boolean endCombat(long combatId) {
        Combat combat = activeCombats.remove(combatId);
        if (combat == null) return false;
        combat.end();
        logger.info("Removed combat {}", combatId);
        return true;
    }

    /**
     * End every tracked combat.
     */
    public void shutdown() {
        for (Long id : activeCombats.keySet()) {
            endCombat(id);
        }
    }
}
