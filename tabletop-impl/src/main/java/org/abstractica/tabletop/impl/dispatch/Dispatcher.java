package org.abstractica.tabletop.impl.dispatch;

import org.abstractica.tabletop.Privilege;
import org.abstractica.tabletop.handlers.CommandHandler;
import org.abstractica.tabletop.handlers.ErrorHandler;
import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.impl.protocol.CommandFrame;
import org.abstractica.tabletop.impl.protocol.EnvelopeCodec;
import org.abstractica.tabletop.impl.protocol.FrameCodec;
import org.abstractica.tabletop.impl.protocol.MalformedCommandException;
import org.abstractica.tabletop.protocol.Command;
import org.abstractica.tabletop.protocol.CommandEnvelope;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.NoticeLevel;
import org.abstractica.tabletop.protocol.ResponseEnvelope;
import org.abstractica.tabletop.protocol.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decodes command frames, checks privileges and invokes handlers.
 *
 * <p>Every command that passes decoding is registered as pending and is
 * answered exactly once: by its handler, with an error when the handler
 * throws, or with TIMEOUT by the pending-command sweep. Malformed commands
 * never reach a handler and get no response; the client receives a warning
 * notice and is disconnected once it reaches the malformed-command limit.</p>
 */
public final class Dispatcher
{
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final DispatchTable table;
    private final EnvelopeCodec codec;
    private final int maxMalformedCommands;
    private final Runnable onAccepted;
    private volatile ErrorHandler errorHandler;

    /**
     * Creates a dispatcher.
     *
     * @param table                handlers by scope and command type
     * @param codec                envelope codec
     * @param maxMalformedCommands malformed commands tolerated per session
     * @param onAccepted           called once per accepted command
     */
    public Dispatcher(DispatchTable table, EnvelopeCodec codec, int maxMalformedCommands, Runnable onAccepted)
    {
        this.table = Objects.requireNonNull(table, "table");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.onAccepted = Objects.requireNonNull(onAccepted, "onAccepted");
        if (maxMalformedCommands <= 0)
        {
            throw new IllegalArgumentException("maxMalformedCommands must be positive: " + maxMalformedCommands);
        }
        this.maxMalformedCommands = maxMalformedCommands;
    }

    public void setErrorHandler(ErrorHandler errorHandler)
    {
        this.errorHandler = errorHandler;
    }

    // ========== Dispatch ==========

    /**
     * Dispatches one command frame.
     *
     * @param source the issuing session
     * @param frame  the command frame
     */
    public void dispatch(CommandSource source, CommandFrame frame)
    {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(frame, "frame");

        CommandEnvelope envelope;
        try
        {
            envelope = codec.decodeCommand(frame);
        }
        catch (MalformedCommandException e)
        {
            malformed(source, e);
            return;
        }

        Command command = envelope.payload();
        CommandHandler<?> handler = table.find(envelope.scope(), command.getClass());
        if (handler == null)
        {
            malformed(source, new MalformedCommandException(envelope.correlationId(),
                    "No handler for " + envelope.scope() + " " + command.getClass().getSimpleName()));
            return;
        }

        DefaultCommandContext context = new DefaultCommandContext(
                source.session(),
                envelope,
                source.pendingCommands(),
                response -> source.deliver(encodeResponse(response)),
                System.nanoTime());
        if (!source.pendingCommands().register(context))
        {
            malformed(source, new MalformedCommandException(envelope.correlationId(),
                    "Correlation id " + envelope.correlationId() + " is already outstanding"));
            return;
        }
        onAccepted.run();

        LOG.debug("Session {}: {}", source.session().getId(), context);

        Privilege required = requiredPrivilege(envelope.scope());
        Privilege actual = source.session().getIdentity().privilege();
        if (!actual.includes(required))
        {
            context.fail(ErrorCode.PERMISSION_DENIED, envelope.scope() + " commands require " + required);
            return;
        }

        invoke(handler, context, command);
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private void invoke(CommandHandler handler, DefaultCommandContext context, Command command)
    {
        try
        {
            handler.handle(context, command);
        }
        catch (ValidationException e)
        {
            context.fail(e.getCode(), e.getMessage());
        }
        catch (RuntimeException e)
        {
            context.fail(ErrorCode.INTERNAL_ERROR, "Internal error");
            ErrorHandler h = errorHandler;
            if (h != null)
            {
                try
                {
                    h.handle(context.session(), context.envelope(), e);
                }
                catch (Exception e2)
                {
                    LOG.error("Error handler threw exception", e2);
                }
            }
            else
            {
                LOG.error("Command handler exception: session={}, command={}",
                        context.session().getId(), context, e);
            }
        }
    }

    private void malformed(CommandSource source, MalformedCommandException e)
    {
        int count = source.recordMalformed();
        LOG.warn("Session {}: malformed command {} ({}/{}): {}",
                source.session().getId(), e.getCorrelationId(), count, maxMalformedCommands, e.getMessage());
        source.session().sendNotice(NoticeLevel.WARNING,
                "Malformed command " + e.getCorrelationId() + ": " + e.getMessage());
        if (count >= maxMalformedCommands)
        {
            source.protocolError("Too many malformed commands");
        }
    }

    // ========== Encoding ==========

    public byte[] encodeResponse(ResponseEnvelope response)
    {
        return FrameCodec.encode(codec.encodeResponse(response));
    }

    /**
     * Returns the privilege needed to issue commands of a scope.
     *
     * @param scope the scope
     * @return the minimum privilege
     */
    public static Privilege requiredPrivilege(Scope scope)
    {
        return switch (scope)
        {
            case SESSION, ROOM, GAME -> Privilege.USER;
            case MODERATION -> Privilege.MODERATOR;
            case ADMIN -> Privilege.ADMIN;
        };
    }
}
