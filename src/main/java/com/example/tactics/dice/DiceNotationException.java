package com.example.tactics.dice;

/**
 * Thrown when a dice expression such as "2d6+3" cannot be parsed.
 */
public class DiceNotationException extends IllegalArgumentException {

    private final String notation;

    public DiceNotationException(String notation, String message) {
        super(message + ": '" + notation + "'");
        this.notation = notation;
    }

    /** The offending notation exactly as it was supplied. */
    public String getNotation() {
        return notation;
    }
}
