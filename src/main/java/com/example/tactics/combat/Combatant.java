package com.example.tactics.combat;

import com.example.tactics.reaction.ReactionResolver;
import com.example.tactics.reaction.ReactionType;
import com.example.tactics.rules.Ability;
import com.example.tactics.rules.DamageType;
import com.example.tactics.rules.MonsterProfile;
import com.example.tactics.rules.WeaponProfile;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * A participant in a combat encounter.
 * <p>
 * Holds the stat snapshot the session needs (hit points, armor class, speed,
 * weapon, feats, damage modifiers) and the per-turn bookkeeping used for
 * movement and opportunity attacks. Death saves, exhaustion and the reaction
 * budget are owned by the {@link Combat} session, not by the combatant.
 */
public class Combatant {

    public static final WeaponProfile UNARMED_STRIKE =
            new WeaponProfile("Unarmed Strike", "1", DamageType.BLUDGEONING, Set.of(), 0, 0);

    // ========== Identity ==========

    private final String id;
    private final String name;
    private final int alliance;
    private final boolean player;

    // ========== Stats ==========

    private final int maxHp;
    private int currentHp;
    private int armorClass;
    private int speed;
    private int dexterityModifier;
    private int attackBonus;
    private int damageModifier;
    private int critRange = CombatCalculator.DEFAULT_CRIT_RANGE;
    private int strengthScore = 10;
    private int proficiencyBonus = 2;
    private int spellcastingModifier;
    private String superiorityDie = ReactionResolver.DEFAULT_SUPERIORITY_DIE;
    private boolean flying;
    private boolean hovering;
    private WeaponProfile weapon = UNARMED_STRIKE;

    private final Set<Feat> feats = EnumSet.noneOf(Feat.class);
    private final Set<ReactionType> knownReactions = EnumSet.of(ReactionType.OPPORTUNITY_ATTACK);
    private final Set<DamageType> resistances = EnumSet.noneOf(DamageType.class);
    private final Set<DamageType> vulnerabilities = EnumSet.noneOf(DamageType.class);
    private final Set<DamageType> immunities = EnumSet.noneOf(DamageType.class);

    // ========== Turn state ==========

    private int initiative;
    private int movementUsed;
    private boolean disengaged;
    private boolean prone;
    // Until the start of this combatant's next turn, e.g. from Shield
    private int armorClassBonus;
    private final Set<String> attackedThisTurn = new HashSet<>();

    /**
     * Create a combatant at full hit points.
     *
     * @param id unique id within the combat, also used on the grid
     * @param alliance combatants sharing an alliance never threaten each other
     * @param player whether this combatant is player-controlled
     */
    public Combatant(String id, String name, int alliance, boolean player, int maxHp, int armorClass, int speed) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Combatant id is required");
        }
        this.id = id;
        this.name = name != null ? name : id;
        this.alliance = alliance;
        this.player = player;
        this.maxHp = Math.max(1, maxHp);
        this.currentHp = this.maxHp;
        this.armorClass = armorClass;
        this.speed = Math.max(0, speed);
    }

    /**
     * Build a non-player combatant from a monster stat block. The Dexterity
     * modifier and Strength score come from the stat block; the attack
     * defaults to an unarmed strike using Strength.
     */
    public static Combatant fromMonster(String id, MonsterProfile monster, int alliance) {
        Combatant c = new Combatant(id, monster.getName(), alliance, false,
                monster.getHitPoints(), monster.getArmorClass(), monster.getSpeed());
        c.setDexterityModifier(CombatCalculator.abilityModifier(monster.getAbilityScore(Ability.DEXTERITY)));
        c.setStrengthScore(monster.getAbilityScore(Ability.STRENGTH));
        c.setDamageModifier(CombatCalculator.abilityModifier(monster.getAbilityScore(Ability.STRENGTH)));
        c.resistances.addAll(monster.getResistances());
        c.vulnerabilities.addAll(monster.getVulnerabilities());
        c.immunities.addAll(monster.getImmunities());
        return c;
    }

    // ========== Getters ==========

    public String getId() { return id; }
    public String getName() { return name; }
    public int getAlliance() { return alliance; }
    public boolean isPlayer() { return player; }
    public int getMaxHp() { return maxHp; }
    public int getCurrentHp() { return currentHp; }
    public int getArmorClass() { return armorClass; }

    /** Armor class including temporary bonuses such as Shield. */
    public int getCurrentArmorClass() { return armorClass + armorClassBonus; }

    public int getSpeed() { return speed; }
    public int getDexterityModifier() { return dexterityModifier; }
    public int getAttackBonus() { return attackBonus; }
    public int getDamageModifier() { return damageModifier; }
    public int getCritRange() { return critRange; }
    public int getStrengthScore() { return strengthScore; }
    public int getStrengthModifier() { return CombatCalculator.abilityModifier(strengthScore); }
    public int getProficiencyBonus() { return proficiencyBonus; }
    public int getSpellcastingModifier() { return spellcastingModifier; }

    /** Spell save DC: 8 + proficiency bonus + spellcasting modifier. */
    public int getSpellSaveDc() { return CombatCalculator.spellSaveDc(spellcastingModifier, proficiencyBonus); }

    public String getSuperiorityDie() { return superiorityDie; }
    public boolean isFlying() { return flying; }
    public boolean isHovering() { return hovering; }
    public boolean isProne() { return prone; }
    public WeaponProfile getWeapon() { return weapon; }
    public int getInitiative() { return initiative; }
    public int getMovementUsed() { return movementUsed; }
    public boolean isDisengaged() { return disengaged; }

    /** Melee reach in feet, from the wielded weapon. */
    public int getReach() {
        return weapon.getReach();
    }

    public boolean hasFeat(Feat feat) {
        return feats.contains(feat);
    }

    public Set<Feat> getFeats() {
        return Collections.unmodifiableSet(feats);
    }

    public Set<ReactionType> getKnownReactions() {
        return Collections.unmodifiableSet(knownReactions);
    }

    public boolean isResistantTo(DamageType type) { return type != null && resistances.contains(type); }
    public boolean isVulnerableTo(DamageType type) { return type != null && vulnerabilities.contains(type); }
    public boolean isImmuneTo(DamageType type) { return type != null && immunities.contains(type); }

    public boolean isHostileTo(Combatant other) {
        return other != null && other != this && other.alliance != alliance;
    }

    public boolean hasAttackedThisTurn(String targetId) {
        return attackedThisTurn.contains(targetId);
    }

    // ========== Setters ==========

    public void setArmorClass(int armorClass) { this.armorClass = armorClass; }
    public void setSpeed(int speed) { this.speed = Math.max(0, speed); }
    public void setDexterityModifier(int dexterityModifier) { this.dexterityModifier = dexterityModifier; }
    public void setAttackBonus(int attackBonus) { this.attackBonus = attackBonus; }
    public void setDamageModifier(int damageModifier) { this.damageModifier = damageModifier; }

    public void setCritRange(int critRange) {
        this.critRange = critRange;
    }

    public void setStrengthScore(int strengthScore) { this.strengthScore = strengthScore; }
    public void setProficiencyBonus(int proficiencyBonus) { this.proficiencyBonus = proficiencyBonus; }
    public void setSpellcastingModifier(int spellcastingModifier) { this.spellcastingModifier = spellcastingModifier; }
    public void setFlying(boolean flying) { this.flying = flying; }
    public void setHovering(boolean hovering) { this.hovering = hovering; }

    /**
     * @param superiorityDie dice added to a riposte's damage, e.g. "1d10"
     */
    public void setSuperiorityDie(String superiorityDie) {
        this.superiorityDie = superiorityDie != null ? superiorityDie : ReactionResolver.DEFAULT_SUPERIORITY_DIE;
    }

    public void setWeapon(WeaponProfile weapon) {
        this.weapon = weapon != null ? weapon : UNARMED_STRIKE;
    }

    public void addFeat(Feat feat) {
        if (feat != null) feats.add(feat);
    }

    public void addKnownReaction(ReactionType type) {
        if (type != null) knownReactions.add(type);
    }

    public void addResistance(DamageType type) { if (type != null) resistances.add(type); }
    public void addVulnerability(DamageType type) { if (type != null) vulnerabilities.add(type); }
    public void addImmunity(DamageType type) { if (type != null) immunities.add(type); }

    // ========== Session bookkeeping ==========

    void setCurrentHp(int hp) {
        this.currentHp = Math.max(0, Math.min(maxHp, hp));
    }

    void setInitiative(int initiative) {
        this.initiative = initiative;
    }

    void addMovementUsed(int cost) {
        this.movementUsed += cost;
    }

    void setDisengaged(boolean disengaged) {
        this.disengaged = disengaged;
    }

    void setProne(boolean prone) {
        this.prone = prone;
    }

    void setArmorClassBonus(int bonus) {
        this.armorClassBonus = Math.max(armorClassBonus, bonus);
    }

    void recordAttackOn(String targetId) {
        attackedThisTurn.add(targetId);
    }

    /**
     * Clear movement, Disengage, temporary AC and the attacked-this-turn list
     * at the start of this combatant's turn. Being prone lasts until it stands up.
     */
    void resetForNewTurn() {
        movementUsed = 0;
        disengaged = false;
        armorClassBonus = 0;
        attackedThisTurn.clear();
    }

    @Override
    public String toString() {
        return "Combatant[" + id + " " + name + ", HP " + currentHp + "/" + maxHp + ", AC " + getCurrentArmorClass()
                + (prone ? ", prone" : "") + "]";
    }
}
