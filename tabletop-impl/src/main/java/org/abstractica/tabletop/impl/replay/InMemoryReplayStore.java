package org.abstractica.tabletop.impl.replay;

import org.abstractica.tabletop.protocol.SequencedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Replay store kept on the heap. Used by tests and by servers that do not
 * need replays to survive a restart.
 */
public final class InMemoryReplayStore implements ReplayStore
{
    private final Map<Long, MemoryLog> logs = new ConcurrentHashMap<>();

    @Override
    public ReplayLog open(long gameId)
    {
        return logs.computeIfAbsent(gameId, MemoryLog::new);
    }

    @Override
    public boolean exists(long gameId)
    {
        MemoryLog log = logs.get(gameId);
        return log != null && log.lastSequence() > 0;
    }

    @Override
    public OptionalLong maxGameId()
    {
        long[] ids = gameIds();
        return ids.length == 0 ? OptionalLong.empty() : OptionalLong.of(ids[ids.length - 1]);
    }

    @Override
    public long[] gameIds()
    {
        return logs.values().stream()
                .filter(log -> log.lastSequence() > 0)
                .mapToLong(MemoryLog::gameId)
                .sorted()
                .toArray();
    }

    @Override
    public void close()
    {
        // nothing to release
    }

    private static final class MemoryLog implements ReplayLog
    {
        private final long gameId;
        private final List<SequencedEvent> events = new ArrayList<>();

        MemoryLog(long gameId)
        {
            this.gameId = gameId;
        }

        @Override
        public long gameId()
        {
            return gameId;
        }

        @Override
        public synchronized void append(SequencedEvent event)
        {
            Objects.requireNonNull(event, "event");
            long expected = events.size() + 1L;
            if (event.sequence() != expected)
            {
                throw new IllegalArgumentException(
                        "Game " + gameId + ": expected sequence " + expected + ", got " + event.sequence());
            }
            events.add(event);
        }

        @Override
        public synchronized long lastSequence()
        {
            return events.size();
        }

        @Override
        public ReplayCursor read(long afterSequence)
        {
            int limit;
            synchronized (this)
            {
                limit = events.size();
            }
            int start = (int) Math.max(0, Math.min(afterSequence, limit));
            return new MemoryCursor(start, limit);
        }

        private final class MemoryCursor implements ReplayCursor
        {
            private final int limit;
            private int next;

            MemoryCursor(int start, int limit)
            {
                this.next = start;
                this.limit = limit;
            }

            @Override
            public boolean hasNext()
            {
                return next < limit;
            }

            @Override
            public SequencedEvent next()
            {
                if (!hasNext())
                {
                    throw new NoSuchElementException();
                }
                synchronized (MemoryLog.this)
                {
                    return events.get(next++);
                }
            }

            @Override
            public void close()
            {
                next = limit;
            }
        }
    }
}
