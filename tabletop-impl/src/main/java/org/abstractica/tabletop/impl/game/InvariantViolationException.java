package org.abstractica.tabletop.impl.game;

/**
 * Thrown when events cannot be folded into a game state, or when the folded
 * state is inconsistent. Always a server defect, never a client error.
 */
public class InvariantViolationException extends RuntimeException
{
    public InvariantViolationException(String message)
    {
        super(message);
    }
}
