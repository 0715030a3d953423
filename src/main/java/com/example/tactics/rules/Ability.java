package com.example.tactics.rules;

public enum Ability {
    STRENGTH("str"),
    DEXTERITY("dex"),
    CONSTITUTION("con"),
    INTELLIGENCE("int"),
    WISDOM("wis"),
    CHARISMA("cha");

    private final String abbreviation;

    Ability(String abbreviation) {
        this.abbreviation = abbreviation;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    /** Accepts full names or three-letter abbreviations; null when unknown. */
    public static Ability fromString(String s) {
        if (s == null || s.isBlank()) return null;
        String trimmed = s.trim();
        for (Ability a : values()) {
            if (a.name().equalsIgnoreCase(trimmed) || a.abbreviation.equalsIgnoreCase(trimmed)) return a;
        }
        return null;
    }
}
