package com.example.tactics.rules;

/**
 * Rule data (configuration or rule tables) could not be read or is structurally invalid.
 */
public class RulesDataException extends RuntimeException {

    public RulesDataException(String message) {
        super(message);
    }

    public RulesDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
