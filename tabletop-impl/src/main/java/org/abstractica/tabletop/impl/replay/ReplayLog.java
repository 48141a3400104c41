package org.abstractica.tabletop.impl.replay;

import org.abstractica.tabletop.protocol.SequencedEvent;

/**
 * Append-only event log of one game.
 *
 * <p>Sequences start at 1 and have no gaps. Appends come from the game's
 * mailbox; reads may come from any thread and see a consistent prefix.</p>
 */
public interface ReplayLog
{
    long gameId();

    /**
     * Appends one event.
     *
     * @param event the event, whose sequence must be {@code lastSequence() + 1}
     * @throws IllegalArgumentException     if the sequence is out of order
     * @throws java.io.UncheckedIOException if the event cannot be made durable
     */
    void append(SequencedEvent event);

    /**
     * Returns the sequence of the last appended event.
     *
     * @return last sequence, or 0 if the log is empty
     */
    long lastSequence();

    /**
     * Opens a cursor over the events after a sequence.
     *
     * <p>The cursor covers the events committed when it was opened.</p>
     *
     * @param afterSequence exclusive lower bound, 0 to read from the start
     * @return a lazy cursor
     */
    ReplayCursor read(long afterSequence);
}
