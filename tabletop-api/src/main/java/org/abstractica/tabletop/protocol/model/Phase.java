package org.abstractica.tabletop.protocol.model;

/**
 * Turn structure phases, in order.
 */
public enum Phase
{
    UNTAP,
    UPKEEP,
    DRAW,
    MAIN_1,
    COMBAT,
    MAIN_2,
    END,
    CLEANUP;

    /**
     * Returns the phase following this one within the same turn.
     *
     * @return the next phase, or null after {@link #CLEANUP}
     */
    public Phase next()
    {
        Phase[] phases = values();
        int next = ordinal() + 1;
        return next < phases.length ? phases[next] : null;
    }
}
