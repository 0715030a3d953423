package com.example.tactics.dice;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for chained dice expressions.
 * <p>
 * Accepted forms: {@code d8}, {@code 2d6}, {@code 2d6+3}, {@code 3d4-1},
 * {@code 2d6+1d4+3}, {@code 1d10-1d4}, and flat values like {@code 5}.
 * Whitespace and case are ignored. Flat modifiers accumulate onto the last
 * dice term of the expression.
 */
public final class DiceNotation {

    private static final Pattern DICE_TERM = Pattern.compile("^([+-]?)(\\d*)d(\\d+)$");
    private static final Pattern FLAT_TERM = Pattern.compile("^[+-]?\\d+$");

    private DiceNotation() {}

    /**
     * Parse an expression into its dice terms.
     *
     * @param notation expression such as "2d6+1d4+3"
     * @return immutable list of terms, never empty
     * @throws DiceNotationException if the notation is empty or malformed, or
     *         a die has fewer than one face
     */
    public static List<DiceTerm> parse(String notation) {
        if (notation == null) {
            throw new DiceNotationException("null", "Dice notation is missing");
        }
        String cleaned = notation.toLowerCase().replaceAll("\\s+", "");
        if (cleaned.isEmpty()) {
            throw new DiceNotationException(notation, "Dice notation is empty");
        }

        List<int[]> dice = new ArrayList<>();
        int flat = 0;

        for (String part : cleaned.split("(?=[+-])")) {
            if (part.isEmpty()) continue;

            Matcher m = DICE_TERM.matcher(part);
            if (m.matches()) {
                int count = m.group(2).isEmpty() ? 1 : parseNumber(notation, m.group(2));
                int sides = parseNumber(notation, m.group(3));
                if (sides < 1) {
                    throw new DiceNotationException(notation, "Die must have at least one face");
                }
                if ("-".equals(m.group(1))) {
                    count = -count;
                }
                dice.add(new int[] {count, sides});
            } else if (FLAT_TERM.matcher(part).matches()) {
                flat += parseNumber(notation, part);
            } else {
                throw new DiceNotationException(notation, "Invalid dice term '" + part + "'");
            }
        }

        if (dice.isEmpty()) {
            return List.of(new DiceTerm(0, 0, flat));
        }

        List<DiceTerm> terms = new ArrayList<>(dice.size());
        for (int i = 0; i < dice.size(); i++) {
            int[] d = dice.get(i);
            int mod = (i == dice.size() - 1) ? flat : 0;
            terms.add(new DiceTerm(d[0], d[1], mod));
        }
        return Collections.unmodifiableList(terms);
    }

    /**
     * Check whether a string parses without throwing.
     */
    public static boolean isValid(String notation) {
        try {
            parse(notation);
            return true;
        } catch (DiceNotationException e) {
            return false;
        }
    }

    private static int parseNumber(String notation, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new DiceNotationException(notation, "Number out of range '" + digits + "'");
        }
    }
}
