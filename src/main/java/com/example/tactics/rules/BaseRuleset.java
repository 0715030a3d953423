package com.example.tactics.rules;

/**
 * Edition of the core rules a configuration starts from.
 */
public enum BaseRuleset {
    RULES_2014("2014"),
    RULES_2024("2024");

    private final String year;

    BaseRuleset(String year) {
        this.year = year;
    }

    public String getYear() {
        return year;
    }

    /**
     * Parse "2014", "2024" or an enum name. Falls back to 2014 rules.
     */
    public static BaseRuleset fromString(String s) {
        if (s == null || s.isEmpty()) return RULES_2014;
        String trimmed = s.trim();
        for (BaseRuleset r : values()) {
            if (r.year.equals(trimmed) || r.name().equalsIgnoreCase(trimmed)) return r;
        }
        return RULES_2014;
    }
}
