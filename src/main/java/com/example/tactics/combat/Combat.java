package com.example.tactics.combat;

import com.example.tactics.dice.D20Outcome;
import com.example.tactics.dice.DamageOutcome;
import com.example.tactics.dice.DiceRoller;
import com.example.tactics.grid.CombatGrid;
import com.example.tactics.grid.GridCell;
import com.example.tactics.grid.GridPosition;
import com.example.tactics.grid.JumpResult;
import com.example.tactics.grid.JumpType;
import com.example.tactics.grid.LineOfSight;
import com.example.tactics.grid.Pathfinder;
import com.example.tactics.grid.PathfindingResult;
import com.example.tactics.grid.TerrainEffects;
import com.example.tactics.reaction.ReactionRegistry;
import com.example.tactics.reaction.ReactionResolver;
import com.example.tactics.reaction.ReactionResult;
import com.example.tactics.reaction.ReactionTrigger;
import com.example.tactics.reaction.ReactionType;
import com.example.tactics.reaction.ReadiedAction;
import com.example.tactics.rules.DamageType;
import com.example.tactics.rules.MonsterProfile;
import com.example.tactics.rules.RulesConfig;
import com.example.tactics.rules.WeaponProfile;
import com.example.tactics.status.DeathSaveOutcome;
import com.example.tactics.status.DeathSavePhase;
import com.example.tactics.status.DeathSaveResult;
import com.example.tactics.status.DeathSaveState;
import com.example.tactics.status.DeathSaveTransition;
import com.example.tactics.status.DeathSaves;
import com.example.tactics.status.Exhaustion;
import com.example.tactics.status.ExhaustionChange;
import com.example.tactics.status.ExhaustionState;
import com.example.tactics.status.MedicineCheck;
import com.example.tactics.status.RollType;
import com.example.tactics.status.StabilizationMethod;
import com.example.tactics.status.StabilizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A single combat encounter.
 * <p>
 * The session owns its grid, reaction registry, death-save and exhaustion
 * state for every combatant, the initiative order and the combat log. It
 * composes the pathfinder, the resolution engine and the status transition
 * functions; it is not thread-safe and expects one caller to drive the turns.
 */
public class Combat {

    private static final Logger logger = LoggerFactory.getLogger(Combat.class);

    /** Spell range of Counterspell and Hellish Rebuke, in feet. */
    public static final int REACTION_SPELL_RANGE = 60;

    private static final List<ReactionTrigger> HIT_TRIGGERS = List.of(
            ReactionTrigger.BEING_ATTACKED, ReactionTrigger.BEING_HIT, ReactionTrigger.TAKING_DAMAGE);
    private static final Set<ReactionType> DAMAGE_REDUCING = EnumSet.of(
            ReactionType.UNCANNY_DODGE, ReactionType.ABSORB_ELEMENTS);

    /** Unique identifier for this combat instance */
    private final long combatId;

    private final RulesConfig rules;
    private final DiceRoller dice;
    private final CombatCalculator calculator;

    private final CombatGrid grid;
    private final Pathfinder pathfinder;
    private final LineOfSight lineOfSight;
    private final TerrainEffects terrainEffects;
    private final ReactionRegistry reactions = new ReactionRegistry();
    private final ReactionResolver reactionResolver;
    private final OpportunityAttackDetector opportunityAttacks;

    /** Current state of the combat */
    private CombatState state = CombatState.INITIALIZING;

    /** All combatants, keyed by id, in the order they joined */
    private final Map<String, Combatant> combatants = new LinkedHashMap<>();

    private final Map<String, DeathSaveState> deathSaves = new HashMap<>();
    private final Map<String, ExhaustionState> exhaustion = new HashMap<>();

    /** Current round number (starts at 1 once combat begins) */
    private int currentRound = 0;

    /** Combatants in initiative order */
    private final List<Combatant> initiativeOrder = new ArrayList<>();

    /** Index into initiative order for whose turn it is, -1 before the first turn */
    private int currentTurnIndex = -1;

    /** Log of all combat events (for recap) */
    private final List<CombatEvent> combatLog = new ArrayList<>();

    public Combat(long combatId, RulesConfig rules, DiceRoller dice) {
        this(combatId, rules, dice, rules.newGrid());
    }

    public Combat(long combatId, RulesConfig rules, DiceRoller dice, CombatGrid grid) {
        this.combatId = combatId;
        this.rules = rules;
        this.dice = dice;
        this.calculator = new CombatCalculator(dice, rules);
        this.grid = grid;
        this.pathfinder = new Pathfinder(grid);
        this.lineOfSight = new LineOfSight(grid);
        this.terrainEffects = new TerrainEffects(grid);
        this.opportunityAttacks = new OpportunityAttackDetector(pathfinder, reactions);
        this.reactionResolver = new ReactionResolver(dice);
    }

    // ========== Getters ==========

    public long getCombatId() { return combatId; }
    public CombatState getState() { return state; }
    public boolean isActive() { return state == CombatState.ACTIVE; }
    public boolean hasEnded() { return state == CombatState.ENDED; }
    public int getCurrentRound() { return currentRound; }
    public RulesConfig getRules() { return rules; }
    public DiceRoller getDice() { return dice; }
    public CombatCalculator getCalculator() { return calculator; }
    public CombatGrid getGrid() { return grid; }
    public Pathfinder getPathfinder() { return pathfinder; }
    public ReactionRegistry getReactions() { return reactions; }

    public List<CombatEvent> getCombatLog() {
        return Collections.unmodifiableList(combatLog);
    }

    // ========== Combatant Management ==========

    /**
     * Place a combatant on the grid and register its reaction and status state.
     *
     * @return false if combat has ended, the id is taken, or the cell cannot hold it
     */
    public boolean addCombatant(Combatant combatant, GridPosition position) {
        if (combatant == null || state == CombatState.ENDED) return false;
        if (combatants.containsKey(combatant.getId())) {
            logger.debug("Combat {}: {} is already in combat", combatId, combatant.getId());
            return false;
        }
        Optional<GridCell> cell = grid.getCell(position);
        if (cell.isEmpty() || !cell.get().isEnterable()) {
            logger.debug("Combat {}: cannot place {} at {}", combatId, combatant.getId(), position);
            return false;
        }

        grid.setOccupant(position, combatant.getId());
        reactions.register(combatant.getId());
        deathSaves.put(combatant.getId(), DeathSaveState.conscious());
        exhaustion.put(combatant.getId(), ExhaustionState.none());
        combatants.put(combatant.getId(), combatant);

        if (state == CombatState.ACTIVE) {
            combatant.setInitiative(calculator.rollInitiative(combatant.getDexterityModifier()));
            int index = 0;
            while (index < initiativeOrder.size() && compareInitiative(initiativeOrder.get(index), combatant) <= 0) {
                index++;
            }
            initiativeOrder.add(index, combatant);
            if (index <= currentTurnIndex) {
                currentTurnIndex++;
            }
        }

        logEvent(CombatEvent.Type.JOIN, combatant.getId(), combatant.getName() + " enters combat at " + position + "!");
        return true;
    }

    /**
     * Add a monster from its stat block.
     *
     * @return the new combatant, empty if it could not be placed
     */
    public Optional<Combatant> addMonster(String combatantId, MonsterProfile monster, int alliance,
                                          GridPosition position) {
        if (monster == null) return Optional.empty();
        Combatant combatant = Combatant.fromMonster(combatantId, monster, alliance);
        return addCombatant(combatant, position) ? Optional.of(combatant) : Optional.empty();
    }

    /**
     * Take a combatant out of combat, clearing its grid cell, reaction and status state together.
     *
     * @return false if no such combatant
     */
    public boolean removeCombatant(String combatantId) {
        Combatant removed = combatants.remove(combatantId);
        if (removed == null) return false;

        grid.clearOccupant(combatantId);
        reactions.unregister(combatantId);
        deathSaves.remove(combatantId);
        exhaustion.remove(combatantId);

        int index = initiativeOrder.indexOf(removed);
        if (index >= 0) {
            initiativeOrder.remove(index);
            if (index <= currentTurnIndex) {
                currentTurnIndex--;
            }
        }

        logEvent(CombatEvent.Type.LEAVE, combatantId, removed.getName() + " is no longer in combat.");
        return true;
    }

    public Optional<Combatant> getCombatant(String combatantId) {
        return Optional.ofNullable(combatants.get(combatantId));
    }

    public Collection<Combatant> getCombatants() {
        return Collections.unmodifiableCollection(combatants.values());
    }

    public Optional<GridPosition> getPosition(String combatantId) {
        return grid.findCombatant(combatantId);
    }

    public Optional<DeathSaveState> getDeathSaveState(String combatantId) {
        return Optional.ofNullable(deathSaves.get(combatantId));
    }

    public Optional<ExhaustionState> getExhaustion(String combatantId) {
        return Optional.ofNullable(exhaustion.get(combatantId));
    }

    /**
     * Hostile combatants that are still alive.
     */
    public List<Combatant> getValidTargets(Combatant attacker) {
        return combatants.values().stream()
                .filter(c -> c.isHostileTo(attacker))
                .filter(c -> !isDead(c))
                .collect(Collectors.toList());
    }

    /**
     * Speed after exhaustion, in length units.
     */
    public int getEffectiveSpeed(String combatantId) {
        Combatant c = combatants.get(combatantId);
        if (c == null) return 0;
        return exhaustionOf(c).speedFor(c.getSpeed());
    }

    public int getRemainingMovement(String combatantId) {
        Combatant c = combatants.get(combatantId);
        if (c == null) return 0;
        return Math.max(0, getEffectiveSpeed(combatantId) - c.getMovementUsed());
    }

    /**
     * Hit point maximum after exhaustion.
     */
    public int getEffectiveMaxHp(String combatantId) {
        Combatant c = combatants.get(combatantId);
        if (c == null) return 0;
        return exhaustionOf(c).maxHpFor(c.getMaxHp());
    }

    // ========== Turn Management ==========

    /**
     * Roll initiative (d20 + Dexterity modifier) and order combatants from highest to lowest.
     * Ties go to the higher Dexterity modifier, then to whoever joined first.
     *
     * @return false if combat was already started or nobody has joined
     */
    public boolean start() {
        if (state != CombatState.INITIALIZING || combatants.isEmpty()) return false;

        for (Combatant c : combatants.values()) {
            c.setInitiative(calculator.rollInitiative(c.getDexterityModifier()));
        }
        initiativeOrder.clear();
        initiativeOrder.addAll(combatants.values());
        initiativeOrder.sort(this::compareInitiative);

        state = CombatState.ACTIVE;
        currentRound = 1;
        currentTurnIndex = -1;

        logger.info("Combat {} started with {} combatants", combatId, combatants.size());
        logEvent(CombatEvent.Type.SESSION, null, "=== COMBAT BEGINS ===");
        logEvent(CombatEvent.Type.ROUND, null, "--- Round " + currentRound + " ---");
        return true;
    }

    private int compareInitiative(Combatant a, Combatant b) {
        int cmp = Integer.compare(b.getInitiative(), a.getInitiative());
        if (cmp != 0) return cmp;
        return Integer.compare(b.getDexterityModifier(), a.getDexterityModifier());
    }

    public List<Combatant> getInitiativeOrder() {
        return Collections.unmodifiableList(initiativeOrder);
    }

    /**
     * Advance to the next living combatant in initiative order, starting a new
     * round after the last one. The new actor's reaction is restored and its
     * movement and Disengage are cleared.
     *
     * @return the combatant whose turn it now is, empty if nobody can take a turn
     */
    public Optional<Combatant> beginNextTurn() {
        if (state != CombatState.ACTIVE || initiativeOrder.isEmpty()) return Optional.empty();

        for (int attempts = 0; attempts < initiativeOrder.size(); attempts++) {
            currentTurnIndex++;
            if (currentTurnIndex >= initiativeOrder.size()) {
                currentTurnIndex = 0;
                currentRound++;
                logEvent(CombatEvent.Type.ROUND, null, "--- Round " + currentRound + " ---");
            }
            Combatant next = initiativeOrder.get(currentTurnIndex);
            if (isDead(next)) continue;

            reactions.resetForTurn(next.getId());
            next.resetForNewTurn();
            logEvent(CombatEvent.Type.TURN, next.getId(), next.getName() + "'s turn.");
            return Optional.of(next);
        }
        return Optional.empty();
    }

    /**
     * The combatant whose turn it is.
     */
    public Optional<Combatant> getCurrentCombatant() {
        if (currentTurnIndex < 0 || currentTurnIndex >= initiativeOrder.size()) {
            return Optional.empty();
        }
        return Optional.of(initiativeOrder.get(currentTurnIndex));
    }

    /**
     * Take the Disengage action: movement for the rest of the turn provokes
     * no opportunity attacks except from Sentinel.
     */
    public boolean disengage(String combatantId) {
        Combatant c = combatants.get(combatantId);
        if (c == null || !canAct(c)) return false;
        c.setDisengaged(true);
        logEvent(CombatEvent.Type.MOVE, combatantId, c.getName() + " disengages.");
        return true;
    }

    // ========== Movement ==========

    /**
     * Move a combatant along the cheapest path to {@code destination} within its
     * remaining movement. Occupancy is updated, opportunity attacks are reported
     * (not resolved), drops of 10 ft or more along the way are falls, and a
     * hazard at the destination deals its damage. A prone combatant crawls,
     * paying double for every step.
     */
    public MoveResult moveCombatant(String combatantId, GridPosition destination) {
        if (state == CombatState.ENDED) return MoveResult.failure("Combat has ended", 0);
        Combatant mover = combatants.get(combatantId);
        if (mover == null) return MoveResult.failure("Unknown combatant", 0);
        if (!canAct(mover)) return MoveResult.failure(mover.getName() + " cannot move", 0);

        Optional<GridPosition> from = grid.findCombatant(combatantId);
        if (from.isEmpty()) return MoveResult.failure("Not on the grid", 0);

        int budget = getRemainingMovement(combatantId);
        int costFactor = mover.isProne() ? 2 : 1;
        PathfindingResult path = pathfinder.findPath(from.get(), destination, budget / costFactor);
        if (!path.isSuccess()) {
            logger.debug("Combat {}: {} cannot move to {}: {}", combatId, combatantId, destination, path.getReason());
            return MoveResult.failure(path.getReason(), budget);
        }
        if (path.getSteps() == 0) {
            return MoveResult.moved(path.getPath(), 0, budget, List.of(), List.of());
        }

        List<OpportunityAttack> provoked = opportunityAttacks.detect(mover, path.getPath(), enemiesOf(mover));

        int cost = path.getTotalCost() * costFactor;
        grid.setOccupant(destination, combatantId);
        mover.addMovementUsed(cost);
        logEvent(CombatEvent.Type.MOVE, combatantId, mover.getName() + (mover.isProne() ? " crawls " : " moves ")
                + from.get() + " -> " + destination + " (" + cost + " ft)");
        logOpportunities(mover, provoked);

        List<HazardOutcome> hazards = new ArrayList<>();
        List<GridPosition> steps = path.getPath();
        for (int i = 1; i < steps.size() && !isDead(mover); i++) {
            terrainEffects.checkFall(steps.get(i - 1), steps.get(i))
                    .ifPresent(fall -> hazards.add(resolveHazard(mover, fall)));
        }
        if (!isDead(mover)) {
            terrainEffects.checkHazard(destination).ifPresent(h -> hazards.add(resolveHazard(mover, h)));
        }

        return MoveResult.moved(path.getPath(), cost, getRemainingMovement(combatantId), provoked, hazards);
    }

    /**
     * Jump straight to {@code destination}, passing over whatever lies between.
     * Distance and height are limited by Strength; the jump and any running
     * start are paid from the remaining movement. Leaving an enemy's reach
     * still provokes, and landing well below the take-off cell is a fall.
     */
    public MoveResult jump(String combatantId, GridPosition destination, JumpType type, boolean runningStart) {
        if (state == CombatState.ENDED) return MoveResult.failure("Combat has ended", 0);
        Combatant jumper = combatants.get(combatantId);
        if (jumper == null) return MoveResult.failure("Unknown combatant", 0);
        if (!canAct(jumper)) return MoveResult.failure(jumper.getName() + " cannot move", 0);

        int remaining = getRemainingMovement(combatantId);
        if (jumper.isProne()) return MoveResult.failure(jumper.getName() + " must stand up first", remaining);
        Optional<GridPosition> from = grid.findCombatant(combatantId);
        if (from.isEmpty()) return MoveResult.failure("Not on the grid", remaining);

        JumpType kind = type != null ? type : JumpType.LONG;
        JumpResult result = terrainEffects.attemptJump(combatantId, from.get(), destination,
                jumper.getStrengthScore(), jumper.getStrengthModifier(), runningStart, kind);
        if (!result.isSuccess()) {
            return MoveResult.failure(result.getDescription(), remaining);
        }
        if (result.getMovementCost() > remaining) {
            return MoveResult.failure("Not enough movement (" + result.getMovementCost() + " ft needed, "
                    + remaining + " ft left)", remaining);
        }

        List<GridPosition> path = List.of(from.get(), destination);
        List<OpportunityAttack> provoked = opportunityAttacks.detect(jumper, path, enemiesOf(jumper));

        grid.setOccupant(destination, combatantId);
        jumper.addMovementUsed(result.getMovementCost());
        logEvent(CombatEvent.Type.MOVE, combatantId, jumper.getName() + " jumps " + from.get() + " -> "
                + destination + " (" + kind.getDisplayName() + ": " + result.getDescription() + ")");
        logOpportunities(jumper, provoked);

        List<HazardOutcome> hazards = new ArrayList<>();
        terrainEffects.checkFall(from.get(), destination).ifPresent(fall -> hazards.add(resolveHazard(jumper, fall)));
        if (!isDead(jumper)) {
            terrainEffects.checkHazard(destination).ifPresent(h -> hazards.add(resolveHazard(jumper, h)));
        }
        return MoveResult.jumped(path, getRemainingMovement(combatantId), provoked, hazards, result);
    }

    /**
     * Stand up from prone, spending half the combatant's speed.
     *
     * @return false if it is not prone, cannot act, or lacks the movement
     */
    public boolean standUp(String combatantId) {
        Combatant c = combatants.get(combatantId);
        if (c == null || !c.isProne() || !canAct(c)) return false;
        int speed = getEffectiveSpeed(combatantId);
        int cost = speed / 2;
        if (speed == 0 || getRemainingMovement(combatantId) < cost) return false;

        c.addMovementUsed(cost);
        c.setProne(false);
        logEvent(CombatEvent.Type.MOVE, combatantId, c.getName() + " stands up (" + cost + " ft)");
        return true;
    }

    private List<Combatant> enemiesOf(Combatant mover) {
        return combatants.values().stream()
                .filter(c -> c.isHostileTo(mover))
                .filter(this::canAct)
                .collect(Collectors.toList());
    }

    private void logOpportunities(Combatant mover, List<OpportunityAttack> provoked) {
        for (OpportunityAttack oa : provoked) {
            logEvent(CombatEvent.Type.REACTION, oa.reactorId(),
                    nameOf(oa.reactorId()) + " may make an opportunity attack against " + mover.getName());
        }
    }

    /**
     * Apply a hazard to a combatant. A fall is avoided by flyers and hoverers;
     * otherwise it deals bludgeoning damage and leaves the faller prone.
     */
    private HazardOutcome resolveHazard(Combatant c, TerrainEffects.Hazard hazard) {
        String id = c.getId();
        if (hazard.isFall()) {
            Optional<String> avoided = TerrainEffects.fallAvoidedBy(c.isFlying(), c.isHovering(), !canAct(c));
            if (avoided.isPresent()) {
                logEvent(CombatEvent.Type.HAZARD, id, c.getName() + " does not fall (" + avoided.get() + ")");
                return new HazardOutcome(hazard, null, avoided.get(), c.isProne());
            }
            int rolled = dice.rollTotal(hazard.damageNotation());
            logEvent(CombatEvent.Type.HAZARD, id, c.getName() + ": " + hazard.description() + " and lands prone");
            c.setProne(true);
            DamageReport report = applyDamage(id, rolled, DamageType.BLUDGEONING, false).orElse(null);
            return new HazardOutcome(hazard, report, null, true);
        }

        DamageOutcome rolled = dice.rollDamage(hazard.damageNotation());
        logEvent(CombatEvent.Type.HAZARD, id, c.getName() + ": " + hazard.description());
        DamageReport report = applyDamage(id, rolled.getTotal(), DamageType.fromString(hazard.damageType()), false)
                .orElse(null);
        return new HazardOutcome(hazard, report, null, c.isProne());
    }

    // ========== Attacks ==========

    public AttackResult attack(String attackerId, String targetId) {
        return attack(attackerId, targetId, false, false, null);
    }

    public AttackResult attack(String attackerId, String targetId, boolean advantage, boolean disadvantage) {
        return attack(attackerId, targetId, advantage, disadvantage, null);
    }

    /**
     * Attack with the attacker's weapon.
     * <p>
     * Reach or range, cover, elevation, flanking (when enabled), prone
     * combatants, exhaustion and a downed target's vulnerability are all
     * applied here before the roll.
     *
     * @param defense reaction the target takes if its trigger comes up: Shield,
     *                Parry, Uncanny Dodge or Absorb Elements against a hit,
     *                Riposte against a melee miss. Null for none. It is only
     *                taken if the target knows it and still has its reaction.
     */
    public AttackResult attack(String attackerId, String targetId, boolean advantage, boolean disadvantage,
                               ReactionType defense) {
        if (state == CombatState.ENDED) return AttackResult.failure("Combat has ended");
        Combatant attacker = combatants.get(attackerId);
        Combatant target = combatants.get(targetId);
        if (attacker == null || target == null) return AttackResult.failure("Unknown combatant");
        if (attacker == target) return AttackResult.failure("Cannot attack self");
        if (!canAct(attacker)) return AttackResult.failure(attacker.getName() + " cannot act");
        if (isDead(target)) return AttackResult.failure(target.getName() + " is already dead");

        Optional<GridPosition> from = grid.findCombatant(attackerId);
        Optional<GridPosition> to = grid.findCombatant(targetId);
        if (from.isEmpty() || to.isEmpty()) return AttackResult.failure("Not on the grid");
        return resolveAttack(attacker, target, from.get(), to.get(), advantage, disadvantage, defense);
    }

    private AttackResult resolveAttack(Combatant attacker, Combatant target, GridPosition aPos, GridPosition tPos,
                                       boolean advantage, boolean disadvantage, ReactionType defense) {
        String attackerId = attacker.getId();
        String targetId = target.getId();
        WeaponProfile weapon = attacker.getWeapon();
        int squares = aPos.chebyshevDistance(tPos);
        if (weapon.isRanged()) {
            int bonus = terrainEffects.getElevationRangeBonus(aPos, tPos);
            int longRange = weapon.getLongRange() > 0 ? weapon.getLongRange() + bonus : 0;
            CombatCalculator.RangeCheck range = CombatCalculator.checkRange(aPos, tPos,
                    weapon.getNormalRange() + bonus, longRange, grid.getCellSize());
            if (!range.inLongRange()) return AttackResult.failure("Target out of range");
            if (range.requiresDisadvantage() || hostileAdjacent(attacker, aPos)) {
                disadvantage = true;
            }
        } else if (squares > pathfinder.reachInSquares(attacker.getReach())) {
            return AttackResult.failure("Target out of reach");
        }

        int cover = lineOfSight.getCover(aPos, tPos);
        if (cover >= LineOfSight.TOTAL_COVER) return AttackResult.failure("Target has total cover");

        if (exhaustionOf(attacker).hasDisadvantageOn(RollType.ATTACK_ROLL) || attacker.isProne()) {
            disadvantage = true;
        }
        if (target.isProne()) {
            if (!weapon.isRanged() && squares <= 1) {
                advantage = true;
            } else {
                disadvantage = true;
            }
        }
        if (rules.isFlankingAdvantage() && !weapon.isRanged() && isFlanked(attacker, aPos, tPos)) {
            advantage = true;
        }
        boolean autoCrit = false;
        if (deathSaveOf(target).isDown()) {
            advantage = true;
            autoCrit = squares <= 1;
        }

        int attackBonus = attacker.getAttackBonus() + terrainEffects.getElevationAttackModifier(aPos, tPos);
        AttackOutcome outcome = calculator.resolveAttack(attackBonus, target.getCurrentArmorClass() + cover,
                weapon.getDamage(), attacker.getDamageModifier(), weapon.getDamageType(),
                advantage, disadvantage, attacker.getCritRange(), autoCrit, attacker.isPlayer());
        attacker.recordAttackOn(targetId);

        logEvent(CombatEvent.Type.ATTACK, attackerId, describeAttack(attacker, target, weapon, outcome));

        ReactionResult reaction = null;
        int damageTotal = outcome.getDamageTotal();
        if (defense != null && outcome.isHit()) {
            reaction = defendAgainstHit(target, weapon, outcome, defense);
            if (reaction != null && reaction.attackWouldMiss()) {
                outcome = AttackOutcome.miss(outcome.getAttackRoll(), reaction.getNewArmorClass());
            } else if (reaction != null && DAMAGE_REDUCING.contains(reaction.getType())) {
                damageTotal = reaction.getDamageTaken();
            }
        }

        DamageReport report = null;
        if (outcome.isHit()) {
            report = applyDamage(targetId, damageTotal, outcome.getDamageType().orElse(null),
                    outcome.isCriticalHit()).orElse(null);
        }

        DamageReport counterDamage = null;
        if (defense == ReactionType.RIPOSTE && reaction == null && !outcome.isHit() && !weapon.isRanged()
                && squares <= pathfinder.reachInSquares(target.getReach())
                && canReact(target, ReactionType.RIPOSTE, ReactionTrigger.BEING_MISSED)) {
            reaction = reactionResolver.riposte(target.getName(), attacker.getName(), target.getAttackBonus(),
                    attacker.getCurrentArmorClass(), target.getWeapon().getDamage(), target.getDamageModifier(),
                    target.getSuperiorityDie());
            spendReaction(target, reaction);
            if (reaction.getDamageDealt() > 0) {
                counterDamage = applyDamage(attackerId, reaction.getDamageDealt(),
                        target.getWeapon().getDamageType(), reaction.isCritical()).orElse(null);
            }
        }
        return AttackResult.resolved(outcome, report, advantage, disadvantage, cover, reaction, counterDamage);
    }

    /**
     * The target's defensive reaction against a hit, or null if it takes none.
     * Shield raises its AC until its next turn; Parry only works in melee.
     */
    private ReactionResult defendAgainstHit(Combatant target, WeaponProfile weapon, AttackOutcome outcome,
                                            ReactionType defense) {
        if (HIT_TRIGGERS.stream().noneMatch(trigger -> canReact(target, defense, trigger))) {
            return null;
        }
        int attackTotal = outcome.getAttackRoll().getTotal();
        ReactionResult result;
        switch (defense) {
            case SHIELD:
                result = reactionResolver.shield(target.getName(), attackTotal, outcome.getTargetAc(),
                        outcome.isCriticalHit());
                target.setArmorClassBonus(result.getArmorClassBonus());
                break;
            case PARRY:
                if (weapon.isRanged()) return null;
                result = reactionResolver.parry(target.getName(), target.getProficiencyBonus(), attackTotal,
                        outcome.getTargetAc(), outcome.isCriticalHit());
                break;
            case UNCANNY_DODGE:
                result = reactionResolver.uncannyDodge(target.getName(), outcome.getDamageTotal());
                break;
            case ABSORB_ELEMENTS:
                result = reactionResolver.absorbElements(target.getName(), outcome.getDamageType().orElse(null),
                        outcome.getDamageTotal(), 1);
                break;
            default:
                return null;
        }
        if (!result.wasTaken()) return null;
        spendReaction(target, result);
        return result;
    }

    /**
     * Spend a reactor's reaction on an opportunity attack reported by
     * {@link #moveCombatant}. The mover is attacked where it stood when it
     * provoked, not where it ended up. The reaction is only spent if the
     * attack could actually be made.
     *
     * @param moverId the combatant that provoked
     */
    public AttackResult resolveOpportunityAttack(String moverId, OpportunityAttack opportunity) {
        if (state == CombatState.ENDED) return AttackResult.failure("Combat has ended");
        String reactorId = opportunity.reactorId();
        if (!reactions.hasReaction(reactorId)) {
            return AttackResult.failure("No reaction available");
        }
        Combatant reactor = combatants.get(reactorId);
        Combatant mover = combatants.get(moverId);
        if (reactor == null || mover == null) return AttackResult.failure("Unknown combatant");
        if (reactor == mover) return AttackResult.failure("Cannot attack self");
        if (!canAct(reactor)) return AttackResult.failure(reactor.getName() + " cannot act");
        if (isDead(mover)) return AttackResult.failure(mover.getName() + " is already dead");
        Optional<GridPosition> from = grid.findCombatant(reactorId);
        if (from.isEmpty()) return AttackResult.failure("Not on the grid");

        AttackResult result = resolveAttack(reactor, mover, from.get(), opportunity.moverPosition(),
                false, false, null);
        if (result.wasAttempted()) {
            reactions.useReaction(reactorId);
            logEvent(CombatEvent.Type.REACTION, reactorId, nameOf(reactorId) + " uses their reaction.");
        }
        return result;
    }

    // ========== Reactions ==========

    /**
     * Reactions the combatant knows that answer {@code trigger} and that it
     * could take right now. Empty when its reaction is spent or it cannot act.
     */
    public List<ReactionType> getAvailableReactions(String combatantId, ReactionTrigger trigger) {
        Combatant c = combatants.get(combatantId);
        if (c == null || !canAct(c)) return List.of();
        return reactions.availableReactions(combatantId, trigger, c.getKnownReactions());
    }

    /**
     * Cast Hellish Rebuke at a creature that just damaged the caster. The
     * target saves against the caster's spell save DC; the fire damage is
     * applied here.
     */
    public ReactionResult hellishRebuke(String casterId, String targetId, int slotLevel) {
        Combatant caster = combatants.get(casterId);
        Combatant target = combatants.get(targetId);
        Optional<String> refusal = checkReactionSpell(caster, target, ReactionType.HELLISH_REBUKE,
                ReactionTrigger.TAKING_DAMAGE);
        if (refusal.isPresent()) return ReactionResult.notTaken(ReactionType.HELLISH_REBUKE, refusal.get());

        ReactionResult result = reactionResolver.hellishRebuke(caster.getName(), target.getName(),
                target.getDexterityModifier(), slotLevel, caster.getSpellSaveDc());
        spendReaction(caster, result);
        applyDamage(targetId, result.getDamageDealt(), DamageType.FIRE, false);
        return result;
    }

    /**
     * Try to counter a spell an enemy is casting. Spells above the slot level
     * need a spellcasting ability check.
     */
    public ReactionResult counterspell(String casterId, String spellcasterId, int spellLevel, int slotLevel,
                                       String spellName) {
        Combatant caster = combatants.get(casterId);
        Combatant spellcaster = combatants.get(spellcasterId);
        Optional<String> refusal = checkReactionSpell(caster, spellcaster, ReactionType.COUNTERSPELL,
                ReactionTrigger.ENEMY_CASTS_SPELL);
        if (refusal.isPresent()) return ReactionResult.notTaken(ReactionType.COUNTERSPELL, refusal.get());

        ReactionResult result = reactionResolver.counterspell(caster.getName(), spellLevel, slotLevel,
                caster.getSpellcastingModifier(), spellName);
        spendReaction(caster, result);
        return result;
    }

    private Optional<String> checkReactionSpell(Combatant caster, Combatant target, ReactionType type,
                                                ReactionTrigger trigger) {
        if (state == CombatState.ENDED) return Optional.of("Combat has ended");
        if (caster == null || target == null) return Optional.of("Unknown combatant");
        if (!caster.isHostileTo(target)) return Optional.of(target.getName() + " is not an enemy");
        if (isDead(target)) return Optional.of(target.getName() + " is already dead");
        if (!canReact(caster, type, trigger)) {
            return Optional.of(caster.getName() + " cannot use " + type.getDisplayName());
        }
        Optional<GridPosition> from = grid.findCombatant(caster.getId());
        Optional<GridPosition> to = grid.findCombatant(target.getId());
        if (from.isEmpty() || to.isEmpty()) return Optional.of("Not on the grid");
        if (from.get().chebyshevDistance(to.get()) * grid.getCellSize() > REACTION_SPELL_RANGE) {
            return Optional.of(target.getName() + " is out of range");
        }
        return Optional.empty();
    }

    /** Knows the reaction, still has its reaction, can act, and the reaction answers the trigger. */
    private boolean canReact(Combatant c, ReactionType type, ReactionTrigger trigger) {
        return canAct(c) && reactions.availableReactions(c.getId(), trigger, c.getKnownReactions()).contains(type);
    }

    private void spendReaction(Combatant reactor, ReactionResult result) {
        reactions.useReaction(reactor.getId());
        logEvent(CombatEvent.Type.REACTION, reactor.getId(), result.getDescription());
    }

    private boolean isFlanked(Combatant attacker, GridPosition aPos, GridPosition tPos) {
        if (!aPos.isAdjacentTo(tPos)) return false;
        GridPosition opposite = GridPosition.of(2 * tPos.x() - aPos.x(), 2 * tPos.y() - aPos.y());
        return grid.getOccupant(opposite.x(), opposite.y())
                .map(combatants::get)
                .filter(ally -> ally != attacker && ally.getAlliance() == attacker.getAlliance())
                .filter(this::canAct)
                .isPresent();
    }

    private boolean hostileAdjacent(Combatant attacker, GridPosition aPos) {
        for (GridCell cell : grid.getNeighbors(aPos)) {
            Combatant other = cell.isOccupied() ? combatants.get(cell.getOccupantId()) : null;
            if (other != null && other.isHostileTo(attacker) && canAct(other)) return true;
        }
        return false;
    }

    private String describeAttack(Combatant attacker, Combatant target, WeaponProfile weapon, AttackOutcome outcome) {
        String roll = " (" + outcome.getAttackRoll().getTotal() + " vs AC " + outcome.getTargetAc() + ")";
        if (outcome.isCriticalHit()) {
            return attacker.getName() + " critically hits " + target.getName() + " with " + weapon.getName() + roll;
        }
        if (outcome.isHit()) {
            return attacker.getName() + " hits " + target.getName() + " with " + weapon.getName() + roll;
        }
        if (outcome.isCriticalMiss()) {
            return attacker.getName() + " fumbles their attack against " + target.getName() + "!";
        }
        return attacker.getName() + " misses " + target.getName() + roll;
    }

    // ========== Checks ==========

    /**
     * Roll an ability or skill check for a combatant. Exhaustion gives
     * disadvantage from level 1. The caller compares the total with its DC.
     *
     * @return the roll, empty if no such combatant
     */
    public Optional<D20Outcome> abilityCheck(String combatantId, int modifier, boolean advantage,
                                             boolean disadvantage) {
        Combatant c = combatants.get(combatantId);
        if (c == null) return Optional.empty();
        boolean exhausted = exhaustionOf(c).hasDisadvantageOn(RollType.ABILITY_CHECK);
        D20Outcome roll = calculator.rollAbilityCheck(modifier, advantage, disadvantage || exhausted);
        logEvent(CombatEvent.Type.CHECK, combatantId, c.getName() + " rolls a check: " + roll.getTotal());
        return Optional.of(roll);
    }

    // ========== Hit Points ==========

    /**
     * Deal damage to a combatant, applying its resistances and the death-save rules.
     * <p>
     * A conscious player dropped to 0 HP starts dying; a non-player dies
     * outright. A combatant already at 0 HP takes death-save failures instead.
     * When massive damage is enabled, damage left over at 0 HP that reaches the
     * hit point maximum kills outright.
     *
     * @return the report, empty if no such combatant
     */
    public Optional<DamageReport> applyDamage(String targetId, int amount, DamageType type, boolean critical) {
        Combatant target = combatants.get(targetId);
        if (target == null) return Optional.empty();

        DeathSaveState before = deathSaveOf(target);
        int hpBefore = target.getCurrentHp();
        if (before.isDead()) {
            return Optional.of(new DamageReport(targetId, hpBefore, hpBefore, 0, type, before, null, false,
                    target.getName() + " is already dead"));
        }

        int effectiveMax = exhaustionOf(target).maxHpFor(target.getMaxHp());
        DamageApplication app = calculator.applyDamage(hpBefore, effectiveMax, amount,
                target.isResistantTo(type), target.isVulnerableTo(type), target.isImmuneTo(type));
        if (app.actualDamage() == 0) {
            String message = target.getName() + " takes no damage";
            logEvent(CombatEvent.Type.DAMAGE, targetId, message);
            return Optional.of(new DamageReport(targetId, hpBefore, hpBefore, 0, type, before, null, false, message));
        }

        target.setCurrentHp(app.newHp());
        boolean massive = rules.isMassiveDamageInstantDeath() && DeathSaves.isMassiveDamage(app.overflow(), effectiveMax);
        String typeName = type != null ? " " + type.getDisplayName().toLowerCase() : "";
        String taken = target.getName() + " takes " + app.actualDamage() + typeName + " damage";

        DeathSaveResult deathSave = null;
        DeathSaveState after;
        String message;
        if (before.isDown()) {
            if (massive) {
                after = DeathSaveState.of(DeathSavePhase.DEAD, before.getSuccesses(), DeathSaveState.MAX_MARKS);
                message = taken + " and is killed outright!";
            } else {
                DeathSaveTransition transition = DeathSaves.takeDamage(before, critical);
                after = transition.state();
                deathSave = transition.result();
                message = taken + " while down. " + deathSave.getDescription();
            }
        } else if (app.unconscious()) {
            if (massive) {
                after = DeathSaveState.of(DeathSavePhase.DEAD, 0, DeathSaveState.MAX_MARKS);
                message = taken + " and is killed outright!";
            } else if (!target.isPlayer()) {
                after = DeathSaveState.of(DeathSavePhase.DEAD, 0, DeathSaveState.MAX_MARKS);
                message = taken + " and is slain!";
            } else {
                after = DeathSaveState.dying();
                message = taken + " and falls unconscious!";
            }
        } else {
            after = before;
            message = taken + " (" + app.newHp() + "/" + effectiveMax + " HP)";
        }

        deathSaves.put(targetId, after);
        boolean killed = after.isDead();
        if (killed) {
            logger.debug("Combat {}: {} died", combatId, targetId);
        }
        logEvent(CombatEvent.Type.DAMAGE, targetId, message);
        return Optional.of(new DamageReport(targetId, hpBefore, app.newHp(), app.actualDamage(), type, after,
                deathSave, killed, message));
    }

    /**
     * Heal a combatant up to its hit point maximum after exhaustion. Any
     * healing brings a dying or stable combatant back to consciousness; the
     * dead cannot be healed.
     *
     * @return the healing applied, empty if no such combatant
     */
    public Optional<HealingApplication> applyHealing(String targetId, int amount) {
        Combatant target = combatants.get(targetId);
        if (target == null) return Optional.empty();

        DeathSaveState before = deathSaveOf(target);
        if (before.isDead()) {
            logEvent(CombatEvent.Type.HEALING, targetId, "Cannot heal " + target.getName() + " - they are dead");
            return Optional.of(new HealingApplication(target.getCurrentHp(), 0));
        }

        int effectiveMax = exhaustionOf(target).maxHpFor(target.getMaxHp());
        HealingApplication app = calculator.applyHealing(target.getCurrentHp(), effectiveMax, amount);
        target.setCurrentHp(app.newHp());

        String message = target.getName() + " regains " + app.actualHealing() + " HP";
        if (before.isDown() && app.actualHealing() > 0) {
            deathSaves.put(targetId, DeathSaves.heal(before).state());
            message += " and regains consciousness";
        }
        logEvent(CombatEvent.Type.HEALING, targetId, message);
        return Optional.of(app);
    }

    // ========== Death Saves ==========

    /**
     * Roll a death saving throw for a dying combatant. Exhaustion level 3 or
     * more gives disadvantage. A natural 20 restores 1 HP.
     *
     * @return the result, empty if no such combatant
     */
    public Optional<DeathSaveResult> rollDeathSave(String combatantId) {
        Combatant c = combatants.get(combatantId);
        if (c == null) return Optional.empty();

        boolean disadvantage = exhaustionOf(c).hasDisadvantageOn(RollType.SAVING_THROW);
        DeathSaveTransition transition = DeathSaves.roll(deathSaveOf(c), dice, 0, false, disadvantage);
        deathSaves.put(combatantId, transition.state());
        if (transition.outcome() == DeathSaveOutcome.REVIVED) {
            c.setCurrentHp(1);
        }
        logEvent(CombatEvent.Type.DEATH_SAVE, combatantId, c.getName() + ": " + transition.result().getDescription());
        return Optional.of(transition.result());
    }

    /**
     * Stabilize a dying combatant.
     *
     * @param check a rolled Medicine check, needed only for {@link StabilizationMethod#MEDICINE}
     * @return the result, empty if no such combatant
     */
    public Optional<StabilizationResult> stabilize(String combatantId, StabilizationMethod method, MedicineCheck check) {
        Combatant c = combatants.get(combatantId);
        if (c == null) return Optional.empty();

        StabilizationResult result = DeathSaves.stabilize(deathSaveOf(c), method, check);
        deathSaves.put(combatantId, result.getState());
        logEvent(CombatEvent.Type.STABILIZE, combatantId, c.getName() + ": " + result.getDescription());
        return Optional.of(result);
    }

    // ========== Exhaustion ==========

    public Optional<ExhaustionChange> gainExhaustion(String combatantId, int levels) {
        Combatant c = combatants.get(combatantId);
        if (c == null) return Optional.empty();
        return Optional.of(applyExhaustion(c, Exhaustion.gain(exhaustionOf(c), levels)));
    }

    public Optional<ExhaustionChange> reduceExhaustion(String combatantId, int levels) {
        Combatant c = combatants.get(combatantId);
        if (c == null) return Optional.empty();
        return Optional.of(applyExhaustion(c, Exhaustion.reduce(exhaustionOf(c), levels)));
    }

    private ExhaustionChange applyExhaustion(Combatant c, ExhaustionChange change) {
        exhaustion.put(c.getId(), change.state());
        if (change.died()) {
            c.setCurrentHp(0);
            deathSaves.put(c.getId(), DeathSaveState.of(DeathSavePhase.DEAD, 0, DeathSaveState.MAX_MARKS));
        } else {
            int effectiveMax = change.state().maxHpFor(c.getMaxHp());
            if (c.getCurrentHp() > effectiveMax) {
                c.setCurrentHp(effectiveMax);
            }
        }
        logEvent(CombatEvent.Type.EXHAUSTION, c.getId(), c.getName() + ": " + change.message());
        return change;
    }

    // ========== Readied Actions ==========

    public boolean readyAction(String combatantId, ReadiedAction action) {
        Combatant c = combatants.get(combatantId);
        if (c == null || !canAct(c)) return false;
        boolean set = reactions.setReadiedAction(combatantId, action);
        if (set) {
            logEvent(CombatEvent.Type.REACTION, combatantId, c.getName() + " readies: " + action.action());
        }
        return set;
    }

    /**
     * Release a readied action, spending the reaction.
     */
    public Optional<ReadiedAction> triggerReadiedAction(String combatantId) {
        Optional<ReadiedAction> action = reactions.triggerReadiedAction(combatantId);
        action.ifPresent(a -> logEvent(CombatEvent.Type.REACTION, combatantId,
                nameOf(combatantId) + " takes their readied action: " + a.action()));
        return action;
    }

    // ========== Combat Resolution ==========

    /**
     * Combat should end once at most one alliance still has a combatant able to act.
     */
    public boolean shouldEnd() {
        Set<Integer> standing = combatants.values().stream()
                .filter(this::canAct)
                .map(Combatant::getAlliance)
                .collect(Collectors.toSet());
        return standing.size() <= 1;
    }

    /**
     * End combat and release every combatant from the grid, the reaction registry and status tracking.
     */
    public void end() {
        if (state == CombatState.ENDED) return;

        List<String> survivors = combatants.values().stream()
                .filter(c -> !isDead(c))
                .map(Combatant::getName)
                .collect(Collectors.toList());
        if (survivors.isEmpty()) {
            logEvent(CombatEvent.Type.SESSION, null, "=== COMBAT ENDS - No survivors ===");
        } else {
            logEvent(CombatEvent.Type.SESSION, null, "=== COMBAT ENDS - Survivors: " + String.join(", ", survivors) + " ===");
        }

        for (String id : new ArrayList<>(combatants.keySet())) {
            grid.clearOccupant(id);
            reactions.unregister(id);
        }
        deathSaves.clear();
        exhaustion.clear();
        initiativeOrder.clear();
        currentTurnIndex = -1;
        state = CombatState.ENDED;
        logger.info("Combat {} ended after {} rounds", combatId, currentRound);
    }

    // ========== Helpers ==========

    /** Conscious and not dead from exhaustion. */
    private boolean canAct(Combatant c) {
        return deathSaveOf(c).isConscious() && !exhaustionOf(c).isDead();
    }

    private boolean isDead(Combatant c) {
        return deathSaveOf(c).isDead() || exhaustionOf(c).isDead();
    }

    private DeathSaveState deathSaveOf(Combatant c) {
        return deathSaves.getOrDefault(c.getId(), DeathSaveState.conscious());
    }

    private ExhaustionState exhaustionOf(Combatant c) {
        return exhaustion.getOrDefault(c.getId(), ExhaustionState.none());
    }

    private String nameOf(String combatantId) {
        Combatant c = combatants.get(combatantId);
        return c != null ? c.getName() : combatantId;
    }

    private void logEvent(CombatEvent.Type type, String combatantId, String message) {
        CombatEvent event = new CombatEvent(currentRound, type, combatantId, message);
        combatLog.add(event);
        logger.debug("Combat {}: {}", combatId, event);
    }

    @Override
    public String toString() {
        return "Combat[" + combatId + ", " + state.getDisplayName() + ", round " + currentRound
                + ", " + combatants.size() + " combatants]";
    }
}
