package com.example.tactics.status;

/**
 * What a death-save transition led to.
 */
public enum DeathSaveOutcome {
    /** Still dying; keep rolling. */
    CONTINUE,
    /** Third success: unconscious but stable. */
    STABILIZED,
    /** Natural 20 or healing: conscious again. */
    REVIVED,
    DEAD,
    /** The event does not apply in the current phase (e.g. a death save while conscious). */
    NO_EFFECT
}
