package org.abstractica.tabletop.impl.dispatch;

import org.abstractica.tabletop.protocol.ErrorCode;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Commands of one session that have not been answered yet, by correlation id.
 */
public final class PendingCommands
{
    private final Map<Integer, DefaultCommandContext> pending = new ConcurrentHashMap<>();

    /**
     * Registers an accepted command.
     *
     * @param context the command
     * @return false if a command with the same correlation id is still outstanding
     */
    public boolean register(DefaultCommandContext context)
    {
        Objects.requireNonNull(context, "context");
        return pending.putIfAbsent(context.correlationId(), context) == null;
    }

    void remove(DefaultCommandContext context)
    {
        pending.remove(context.correlationId(), context);
    }

    public boolean isPending(int correlationId)
    {
        return pending.containsKey(correlationId);
    }

    public int size()
    {
        return pending.size();
    }

    /**
     * Answers every command outstanding for at least {@code timeout} with TIMEOUT.
     *
     * @param nowNanos current {@link System#nanoTime()}
     * @param timeout  the command idle limit
     * @return number of commands timed out
     */
    public int expire(long nowNanos, Duration timeout)
    {
        long limit = timeout.toNanos();
        int expired = 0;
        for (DefaultCommandContext context : pending.values())
        {
            if (nowNanos - context.getAcceptedNanos() >= limit
                    && context.fail(ErrorCode.TIMEOUT, "No answer within " + timeout.toMillis() + " ms"))
            {
                expired++;
            }
        }
        return expired;
    }
}
