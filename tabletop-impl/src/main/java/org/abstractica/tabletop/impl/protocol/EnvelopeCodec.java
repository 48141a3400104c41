package org.abstractica.tabletop.impl.protocol;

import org.abstractica.tabletop.impl.serialization.CodecException;
import org.abstractica.tabletop.impl.serialization.DefaultProtocol;
import org.abstractica.tabletop.protocol.AdminCommand;
import org.abstractica.tabletop.protocol.Command;
import org.abstractica.tabletop.protocol.CommandEnvelope;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.Event;
import org.abstractica.tabletop.protocol.EventEnvelope;
import org.abstractica.tabletop.protocol.GameCommand;
import org.abstractica.tabletop.protocol.ModerationCommand;
import org.abstractica.tabletop.protocol.OriginKind;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.ResponseEnvelope;
import org.abstractica.tabletop.protocol.RoomCommand;
import org.abstractica.tabletop.protocol.Scope;
import org.abstractica.tabletop.protocol.ServerMessage;
import org.abstractica.tabletop.protocol.SessionCommand;

import java.util.Objects;

/**
 * Converts between envelopes and their frames.
 *
 * <p>Command decoding is strict: anything that would make the command
 * unroutable raises {@link MalformedCommandException}. The reverse
 * directions (decoding responses and events) are used by clients and tests.</p>
 */
public final class EnvelopeCodec
{
    private final DefaultProtocol protocol;

    public EnvelopeCodec(DefaultProtocol protocol)
    {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
    }

    public DefaultProtocol getProtocol()
    {
        return protocol;
    }

    // ========== Commands ==========

    /**
     * Decodes a command frame.
     *
     * @param frame the frame
     * @return the envelope
     * @throws MalformedCommandException if the command is not routable
     */
    public CommandEnvelope decodeCommand(CommandFrame frame)
    {
        int correlationId = frame.correlationId();

        Scope scope;
        try
        {
            scope = Scope.fromCode(frame.scopeCode());
        }
        catch (IllegalArgumentException e)
        {
            throw new MalformedCommandException(correlationId, e.getMessage());
        }

        if (scope.isTargeted() && frame.targetId().isEmpty())
        {
            throw new MalformedCommandException(correlationId, "Missing target id for scope " + scope);
        }
        if (!scope.isTargeted() && frame.targetId().isPresent())
        {
            throw new MalformedCommandException(correlationId, "Unexpected target id for scope " + scope);
        }

        Command command;
        try
        {
            command = protocol.decodeCommand(frame.payload());
        }
        catch (CodecException e)
        {
            throw new MalformedCommandException(correlationId, "Undecodable payload: " + e.getMessage());
        }

        if (!scopeType(scope).isInstance(command))
        {
            throw new MalformedCommandException(correlationId,
                    command.getClass().getSimpleName() + " is not a " + scope + " command");
        }

        return new CommandEnvelope(correlationId, scope, frame.targetId(), command);
    }

    public CommandFrame encodeCommand(CommandEnvelope envelope)
    {
        return new CommandFrame(
                envelope.correlationId(),
                envelope.scope().getCode(),
                envelope.targetId(),
                protocol.encodeMessage((Record) envelope.payload()));
    }

    private static Class<? extends Command> scopeType(Scope scope)
    {
        return switch (scope)
        {
            case SESSION -> SessionCommand.class;
            case ROOM -> RoomCommand.class;
            case GAME -> GameCommand.class;
            case MODERATION -> ModerationCommand.class;
            case ADMIN -> AdminCommand.class;
        };
    }

    // ========== Responses ==========

    public ResponseFrame encodeResponse(ResponseEnvelope envelope)
    {
        if (envelope.result() instanceof ResponseEnvelope.Success success)
        {
            return ResponseFrame.ok(envelope.correlationId(), protocol.encodeMessage((Record) success.reply()));
        }
        ResponseEnvelope.Failure failure = (ResponseEnvelope.Failure) envelope.result();
        return ResponseFrame.error(envelope.correlationId(), failure.code().getCode(), failure.message());
    }

    /**
     * Decodes a response frame.
     *
     * @param frame the frame
     * @return the envelope
     * @throws CodecException if the payload is not a reply
     */
    public ResponseEnvelope decodeResponse(ResponseFrame frame)
    {
        if (!frame.success())
        {
            return ResponseEnvelope.failure(frame.correlationId(), ErrorCode.fromCode(frame.errorCode()), frame.message());
        }
        ServerMessage message = protocol.decodeServerMessage(frame.payload());
        if (!(message instanceof Reply reply))
        {
            throw new CodecException("Response payload is not a reply: " + message.getClass().getSimpleName());
        }
        return ResponseEnvelope.success(frame.correlationId(), reply);
    }

    // ========== Events ==========

    public EventFrame encodeEvent(EventEnvelope envelope)
    {
        return new EventFrame(
                envelope.originKind().getCode(),
                envelope.originId(),
                envelope.sequence(),
                protocol.encodeMessage((Record) envelope.payload()));
    }

    /**
     * Decodes an event frame.
     *
     * @param frame the frame
     * @return the envelope
     * @throws CodecException if the frame does not hold a valid event
     */
    public EventEnvelope decodeEvent(EventFrame frame)
    {
        OriginKind kind;
        try
        {
            kind = OriginKind.fromCode(frame.originKind());
        }
        catch (IllegalArgumentException e)
        {
            throw new CodecException(e.getMessage());
        }
        ServerMessage message = protocol.decodeServerMessage(frame.payload());
        if (!(message instanceof Event event))
        {
            throw new CodecException("Event payload is not an event: " + message.getClass().getSimpleName());
        }
        if (frame.sequence() < 1)
        {
            throw new CodecException("Invalid event sequence: " + frame.sequence());
        }
        return new EventEnvelope(kind, frame.originId(), frame.sequence(), event);
    }

    /**
     * Encodes an event envelope straight to frame bytes.
     *
     * @param envelope the envelope
     * @return encoded frame
     */
    public byte[] eventBytes(EventEnvelope envelope)
    {
        return FrameCodec.encode(encodeEvent(envelope));
    }
}
