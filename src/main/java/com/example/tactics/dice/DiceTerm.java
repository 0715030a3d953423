package com.example.tactics.dice;

/**
 * One parsed component of a dice expression.
 * <p>
 * {@code count} carries the sign of the term, so "-1d4" is count -1, sides 4.
 * Flat modifiers are folded into the last dice term of an expression; a
 * notation with no dice at all yields a single term with count 0 and sides 0.
 *
 * @param count number of dice (negative to subtract the dice)
 * @param sides faces per die, 0 for a flat-only term
 * @param modifier flat value added after the dice
 */
public record DiceTerm(int count, int sides, int modifier) {

    public boolean isFlat() {
        return sides == 0;
    }

    /** Copy of this term with the die count doubled, as for a critical hit. */
    public DiceTerm doubled() {
        return new DiceTerm(count * 2, sides, modifier);
    }

    @Override
    public String toString() {
        if (isFlat()) {
            return Integer.toString(modifier);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(count).append('d').append(sides);
        if (modifier > 0) {
            sb.append('+').append(modifier);
        } else if (modifier < 0) {
            sb.append(modifier);
        }
        return sb.toString();
    }
}
