package org.abstractica.tabletop.impl.dispatch;

import org.abstractica.tabletop.Session;
import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.protocol.CommandEnvelope;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.ResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Context of one accepted command.
 *
 * <p>The first completion wins: it removes the command from its session's
 * pending set and hands the response to the responder. Later completions,
 * including a handler answering after the command timed out, are dropped.</p>
 */
public final class DefaultCommandContext implements CommandContext
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultCommandContext.class);

    private final Session session;
    private final CommandEnvelope envelope;
    private final PendingCommands pending;
    private final Consumer<ResponseEnvelope> responder;
    private final long acceptedNanos;
    private final AtomicBoolean completed = new AtomicBoolean(false);

    /**
     * Creates a context.
     *
     * @param session       the issuing session
     * @param envelope      the decoded command
     * @param pending       the session's outstanding commands
     * @param responder     sends the response to the client
     * @param acceptedNanos {@link System#nanoTime()} when the command was accepted
     */
    public DefaultCommandContext(
            Session session,
            CommandEnvelope envelope,
            PendingCommands pending,
            Consumer<ResponseEnvelope> responder,
            long acceptedNanos)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.envelope = Objects.requireNonNull(envelope, "envelope");
        this.pending = Objects.requireNonNull(pending, "pending");
        this.responder = Objects.requireNonNull(responder, "responder");
        this.acceptedNanos = acceptedNanos;
    }

    @Override
    public Session session()
    {
        return session;
    }

    @Override
    public CommandEnvelope envelope()
    {
        return envelope;
    }

    @Override
    public long targetId()
    {
        return envelope.targetId().orElseThrow(
                () -> new IllegalStateException(envelope.scope() + " commands have no target id"));
    }

    @Override
    public boolean reply(Reply reply)
    {
        Objects.requireNonNull(reply, "reply");
        return complete(ResponseEnvelope.success(envelope.correlationId(), reply));
    }

    @Override
    public boolean fail(ErrorCode code, String message)
    {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        return complete(ResponseEnvelope.failure(envelope.correlationId(), code, message));
    }

    @Override
    public boolean isCompleted()
    {
        return completed.get();
    }

    public int correlationId()
    {
        return envelope.correlationId();
    }

    public long getAcceptedNanos()
    {
        return acceptedNanos;
    }

    private boolean complete(ResponseEnvelope response)
    {
        if (!completed.compareAndSet(false, true))
        {
            LOG.debug("Session {}: dropping late response to command {}", session.getId(), envelope.correlationId());
            return false;
        }
        pending.remove(this);
        responder.accept(response);
        return true;
    }

    @Override
    public String toString()
    {
        return "Command[" + envelope.correlationId() + " " + envelope.scope() + " "
                + envelope.payload().getClass().getSimpleName() + "]";
    }
}
