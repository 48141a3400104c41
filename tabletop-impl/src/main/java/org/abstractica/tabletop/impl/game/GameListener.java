package org.abstractica.tabletop.impl.game;

/**
 * Observes changes to a game's public summary or membership.
 *
 * <p>Called from the game's mailbox; implementations must not block.</p>
 */
@FunctionalInterface
public interface GameListener
{
    void gameChanged(Game game);
}
