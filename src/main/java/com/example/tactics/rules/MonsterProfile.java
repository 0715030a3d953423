package com.example.tactics.rules;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Stat block of a monster from the rule tables.
 */
public class MonsterProfile {

    private final String name;
    private final int armorClass;
    private final int hitPoints;
    private final int speed;
    private final String challengeRating;
    private final Map<Ability, Integer> abilityScores;
    private final Set<DamageType> resistances;
    private final Set<DamageType> vulnerabilities;
    private final Set<DamageType> immunities;

    public MonsterProfile(String name, int armorClass, int hitPoints, int speed, String challengeRating,
                          Map<Ability, Integer> abilityScores, Set<DamageType> resistances,
                          Set<DamageType> vulnerabilities, Set<DamageType> immunities) {
        this.name = name;
        this.armorClass = armorClass;
        this.hitPoints = hitPoints;
        this.speed = speed;
        this.challengeRating = challengeRating;
        Map<Ability, Integer> scores = new EnumMap<>(Ability.class);
        scores.putAll(abilityScores);
        this.abilityScores = scores;
        this.resistances = Set.copyOf(resistances);
        this.vulnerabilities = Set.copyOf(vulnerabilities);
        this.immunities = Set.copyOf(immunities);
    }

    public String getName() { return name; }
    public int getArmorClass() { return armorClass; }
    public int getHitPoints() { return hitPoints; }
    public int getSpeed() { return speed; }
    public String getChallengeRating() { return challengeRating; }
    public Set<DamageType> getResistances() { return resistances; }
    public Set<DamageType> getVulnerabilities() { return vulnerabilities; }
    public Set<DamageType> getImmunities() { return immunities; }

    /** Ability score, 10 when the stat block leaves it out. */
    public int getAbilityScore(Ability ability) {
        return abilityScores.getOrDefault(ability, 10);
    }

    public Map<Ability, Integer> getAbilityScores() {
        return Map.copyOf(abilityScores);
    }

    @Override
    public String toString() {
        return name + " (CR " + challengeRating + ", AC " + armorClass + ", HP " + hitPoints + ")";
    }
}
