package com.example.tactics.rules;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of weapons, armor and monsters.
 * <p>
 * Built once by {@link RulesRegistryLoader} and passed by reference to whoever
 * needs it. Lookups are case-insensitive on the entry name.
 */
public final class RulesRegistry {

    private static final RulesRegistry EMPTY = new RulesRegistry(Map.of(), Map.of(), Map.of());

    private final Map<String, WeaponProfile> weapons;
    private final Map<String, ArmorDefinition> armor;
    private final Map<String, MonsterProfile> monsters;

    RulesRegistry(Map<String, WeaponProfile> weapons, Map<String, ArmorDefinition> armor,
                  Map<String, MonsterProfile> monsters) {
        this.weapons = copy(weapons);
        this.armor = copy(armor);
        this.monsters = copy(monsters);
    }

    public static RulesRegistry empty() {
        return EMPTY;
    }

    public Optional<WeaponProfile> getWeapon(String name) {
        return lookup(weapons, name);
    }

    public Optional<ArmorDefinition> getArmor(String name) {
        return lookup(armor, name);
    }

    public Optional<MonsterProfile> getMonster(String name) {
        return lookup(monsters, name);
    }

    public Collection<WeaponProfile> getWeapons() { return weapons.values(); }
    public Collection<ArmorDefinition> getArmorList() { return armor.values(); }
    public Collection<MonsterProfile> getMonsters() { return monsters.values(); }

    public int size() {
        return weapons.size() + armor.size() + monsters.size();
    }

    static String key(String name) {
        return name.trim().toLowerCase();
    }

    private static <T> Optional<T> lookup(Map<String, T> map, String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(map.get(key(name)));
    }

    private static <T> Map<String, T> copy(Map<String, T> source) {
        // LinkedHashMap keeps file order for listings
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
