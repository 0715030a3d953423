package com.example.tactics.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads weapon, armor and monster tables from YAML resources into a {@link RulesRegistry}.
 * <p>
 * Each file holds a single top-level list ({@code weapons:}, {@code armor:},
 * {@code monsters:}). Entries without a name are skipped with a warning;
 * a file that is not valid YAML, or whose list has the wrong shape, fails the load.
 */
public class RulesRegistryLoader {

    private static final Logger logger = LoggerFactory.getLogger(RulesRegistryLoader.class);

    public static final String WEAPONS_RESOURCE = "/data/weapons.yaml";
    public static final String ARMOR_RESOURCE = "/data/armor.yaml";
    public static final String MONSTERS_RESOURCE = "/data/monsters.yaml";

    private final Map<String, WeaponProfile> weapons = new LinkedHashMap<>();
    private final Map<String, ArmorDefinition> armor = new LinkedHashMap<>();
    private final Map<String, MonsterProfile> monsters = new LinkedHashMap<>();

    /**
     * Load the three default resources and build the registry.
     */
    public static RulesRegistry loadDefaults() {
        return new RulesRegistryLoader()
                .loadWeapons(WEAPONS_RESOURCE)
                .loadArmor(ARMOR_RESOURCE)
                .loadMonsters(MONSTERS_RESOURCE)
                .build();
    }

    public RulesRegistry build() {
        RulesRegistry registry = new RulesRegistry(weapons, armor, monsters);
        logger.info("Rules registry built: {} weapons, {} armor, {} monsters",
                weapons.size(), armor.size(), monsters.size());
        return registry;
    }

    // ========== Weapons ==========

    public RulesRegistryLoader loadWeapons(String resourcePath) {
        Map<String, Object> root = readResource(resourcePath);
        for (Map<String, Object> entry : YamlValues.getEntries(root, "weapons", resourcePath)) {
            String name = YamlValues.getString(entry, "name", null);
            if (name == null || name.isBlank()) {
                logger.warn("Skipping unnamed weapon in {}", resourcePath);
                continue;
            }
            String damage = YamlValues.getString(entry, "damage", "1d4");
            DamageType type = DamageType.fromString(YamlValues.getString(entry, "damage_type", null));
            if (type == null) {
                logger.warn("Weapon '{}' has unknown damage type, defaulting to bludgeoning", name);
                type = DamageType.BLUDGEONING;
            }

            Set<String> properties = new LinkedHashSet<>();
            for (String p : YamlValues.getStringList(entry, "properties")) {
                properties.add(p.toLowerCase());
            }

            Map<String, Object> range = YamlValues.getMap(entry, "range");
            int normal = YamlValues.getInt(range, "normal", 0);
            int longRange = YamlValues.getInt(range, "long", 0);

            weapons.put(RulesRegistry.key(name), new WeaponProfile(name, damage, type, properties, normal, longRange));
        }
        return this;
    }

    // ========== Armor ==========

    public RulesRegistryLoader loadArmor(String resourcePath) {
        Map<String, Object> root = readResource(resourcePath);
        for (Map<String, Object> entry : YamlValues.getEntries(root, "armor", resourcePath)) {
            String name = YamlValues.getString(entry, "name", null);
            if (name == null || name.isBlank()) {
                logger.warn("Skipping unnamed armor in {}", resourcePath);
                continue;
            }
            String acText = YamlValues.getString(entry, "armor_class", "10");
            ArmorProfile profile = ArmorClassFormula.parse(acText);
            String category = YamlValues.getString(entry, "category", profile.shield() ? "shield" : "light");

            armor.put(RulesRegistry.key(name), new ArmorDefinition(name, category.toLowerCase(), acText, profile,
                    YamlValues.getInt(entry, "strength", 0),
                    YamlValues.getBoolean(entry, "stealth_disadvantage", false)));
        }
        return this;
    }

    // ========== Monsters ==========

    public RulesRegistryLoader loadMonsters(String resourcePath) {
        Map<String, Object> root = readResource(resourcePath);
        for (Map<String, Object> entry : YamlValues.getEntries(root, "monsters", resourcePath)) {
            String name = YamlValues.getString(entry, "name", null);
            if (name == null || name.isBlank()) {
                logger.warn("Skipping unnamed monster in {}", resourcePath);
                continue;
            }

            Map<Ability, Integer> scores = new EnumMap<>(Ability.class);
            Map<String, Object> abilities = YamlValues.getMap(entry, "abilities");
            for (Map.Entry<String, Object> a : abilities.entrySet()) {
                Ability ability = Ability.fromString(a.getKey());
                if (ability == null) {
                    logger.warn("Monster '{}' has unknown ability '{}'", name, a.getKey());
                    continue;
                }
                scores.put(ability, YamlValues.getInt(abilities, a.getKey(), 10));
            }

            monsters.put(RulesRegistry.key(name), new MonsterProfile(
                    name,
                    YamlValues.getInt(entry, "armor_class", 10),
                    YamlValues.getInt(entry, "hit_points", 1),
                    YamlValues.getInt(entry, "speed", 30),
                    YamlValues.getString(entry, "challenge_rating", "0"),
                    scores,
                    damageTypes(entry, "resistances", name),
                    damageTypes(entry, "vulnerabilities", name),
                    damageTypes(entry, "immunities", name)));
        }
        return this;
    }

    // ========== Helpers ==========

    private Set<DamageType> damageTypes(Map<String, Object> entry, String key, String owner) {
        Set<DamageType> types = EnumSet.noneOf(DamageType.class);
        List<String> names = YamlValues.getStringList(entry, key);
        for (String n : names) {
            DamageType t = DamageType.fromString(n);
            if (t == null) {
                logger.warn("'{}' lists unknown damage type '{}' under {}", owner, n, key);
            } else {
                types.add(t);
            }
        }
        return types;
    }

    private Map<String, Object> readResource(String resourcePath) {
        try (InputStream is = RulesRegistryLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("Rules resource not found: {}", resourcePath);
                return Map.of();
            }
            Object doc = new Yaml().load(is);
            if (doc == null) return Map.of();
            if (!(doc instanceof Map)) {
                throw new RulesDataException(resourcePath + ": top level must be a mapping");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> root = (Map<String, Object>) doc;
            return root;
        } catch (YAMLException e) {
            throw new RulesDataException("Malformed YAML in " + resourcePath, e);
        } catch (IOException e) {
            throw new RulesDataException("Failed to read " + resourcePath, e);
        }
    }
}
