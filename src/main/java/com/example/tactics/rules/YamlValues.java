package com.example.tactics.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers for values out of a SnakeYAML document tree.
 */
final class YamlValues {

    private YamlValues() {}

    static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try {
                return Integer.parseInt(((String) val).trim());
            } catch (NumberFormatException e) {
                return defaultVal;
            }
        }
        return defaultVal;
    }

    static boolean getBoolean(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean) return (Boolean) val;
        if (val instanceof String) {
            String s = ((String) val).trim();
            if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("yes")) return true;
            if (s.equalsIgnoreCase("false") || s.equalsIgnoreCase("no")) return false;
        }
        return defaultVal;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        return Collections.emptyMap();
    }

    static List<String> getStringList(Map<String, Object> map, String key) {
        Object val = map.get(key);
        List<String> result = new ArrayList<>();
        if (val instanceof List) {
            for (Object o : (List<?>) val) {
                if (o != null) result.add(o.toString().trim());
            }
        } else if (val instanceof String && !((String) val).isBlank()) {
            for (String s : ((String) val).split(",")) {
                if (!s.isBlank()) result.add(s.trim());
            }
        }
        return result;
    }

    /**
     * The entries of a top-level list of maps, e.g. {@code weapons:}.
     *
     * @throws RulesDataException if the key holds something other than a list of maps
     */
    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> getEntries(Map<String, Object> root, String key, String source) {
        Object val = root.get(key);
        if (val == null) return Collections.emptyList();
        if (!(val instanceof List)) {
            throw new RulesDataException(source + ": '" + key + "' must be a list");
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Object o : (List<?>) val) {
            if (!(o instanceof Map)) {
                throw new RulesDataException(source + ": every '" + key + "' entry must be a mapping");
            }
            entries.add((Map<String, Object>) o);
        }
        return entries;
    }
}
