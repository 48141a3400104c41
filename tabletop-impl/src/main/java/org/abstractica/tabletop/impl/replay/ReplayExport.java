package org.abstractica.tabletop.impl.replay;

import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.Reply.ReplayChunk;
import org.abstractica.tabletop.protocol.SequencedEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads replay logs in pages for export.
 */
public final class ReplayExport
{
    public static final int MAX_PAGE_SIZE = 1000;

    private ReplayExport() {}

    /**
     * Reads one page of a log.
     *
     * @param log           the log
     * @param afterSequence exclusive lower bound
     * @param maxEvents     requested page size, capped at {@link #MAX_PAGE_SIZE}
     * @return the page
     * @throws ValidationException if the bounds are invalid
     */
    public static ReplayChunk page(ReplayLog log, long afterSequence, int maxEvents)
    {
        if (afterSequence < 0)
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "afterSequence must not be negative");
        }
        if (maxEvents < 1)
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "maxEvents must be positive");
        }
        int limit = Math.min(maxEvents, MAX_PAGE_SIZE);
        long last = log.lastSequence();

        List<SequencedEvent> events = new ArrayList<>(Math.min(limit, 64));
        try (ReplayCursor cursor = log.read(afterSequence))
        {
            while (events.size() < limit && cursor.hasNext())
            {
                SequencedEvent event = cursor.next();
                if (event.sequence() > last)
                {
                    break;
                }
                events.add(event);
            }
        }

        long reached = events.isEmpty() ? afterSequence : events.get(events.size() - 1).sequence();
        return new ReplayChunk(log.gameId(), events, last, reached >= last);
    }

    /**
     * Reads every event after a sequence.
     *
     * @param log           the log
     * @param afterSequence exclusive lower bound
     * @return the events in order
     */
    public static List<SequencedEvent> tail(ReplayLog log, long afterSequence)
    {
        List<SequencedEvent> events = new ArrayList<>();
        try (ReplayCursor cursor = log.read(afterSequence))
        {
            cursor.forEachRemaining(events::add);
        }
        return events;
    }
}
