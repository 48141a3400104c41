package org.abstractica.tabletop.impl.protocol;

import org.abstractica.tabletop.Privilege;
import org.abstractica.tabletop.protocol.NoticeLevel;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Encodes and decodes wire protocol frames.
 *
 * <p>All methods assume big-endian byte order (network order). The transport
 * adds its own framing (length prefix or web-socket message boundary); the
 * bytes handled here are exactly one frame.</p>
 */
public final class FrameCodec
{
    private FrameCodec() {}

    /**
     * Wire protocol version carried in {@link Hello}.
     */
    public static final int VERSION = 1;

    private static final int MAX_STRING_LENGTH = 0xFFFF;

    // ========== Encoding ==========

    /**
     * Encodes a frame.
     *
     * @param frame the frame to encode
     * @return encoded bytes, starting with the frame type
     */
    public static byte[] encode(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");

        if (frame instanceof Hello hello)
        {
            byte[] user = utf8(hello.user());
            byte[] secret = utf8(hello.secret());
            ByteBuffer buffer = ByteBuffer.allocate(1 + 1 + Hello.HASH_LENGTH + 2 + user.length + 2 + secret.length);
            buffer.put((byte) FrameType.HELLO.getId());
            buffer.put((byte) hello.version());
            buffer.put(hello.protocolHash());
            putString(buffer, user);
            putString(buffer, secret);
            return buffer.array();
        }
        if (frame instanceof Welcome welcome)
        {
            byte[] sessionId = utf8(welcome.sessionId());
            byte[] name = utf8(welcome.name());
            ByteBuffer buffer = ByteBuffer.allocate(1 + 2 + sessionId.length + 8 + 2 + name.length + 1 + 4 + 4);
            buffer.put((byte) FrameType.WELCOME.getId());
            putString(buffer, sessionId);
            buffer.putLong(welcome.identityId());
            putString(buffer, name);
            buffer.put((byte) welcome.privilege().getCode());
            buffer.putInt(welcome.heartbeatIntervalMs());
            buffer.putInt(welcome.livenessTimeoutMs());
            return buffer.array();
        }
        if (frame instanceof Reject reject)
        {
            return encodeCodeAndMessage(FrameType.REJECT, reject.reasonCode().getCode(), reject.message());
        }
        if (frame instanceof CommandFrame command)
        {
            int size = 1 + 4 + 1 + 1 + (command.targetId().isPresent() ? 8 : 0) + command.payload().length;
            ByteBuffer buffer = ByteBuffer.allocate(size);
            buffer.put((byte) FrameType.COMMAND.getId());
            buffer.putInt(command.correlationId());
            buffer.put((byte) command.scopeCode());
            if (command.targetId().isPresent())
            {
                buffer.put((byte) 1);
                buffer.putLong(command.targetId().get());
            }
            else
            {
                buffer.put((byte) 0);
            }
            buffer.put(command.payload());
            return buffer.array();
        }
        if (frame instanceof ResponseFrame response)
        {
            if (response.success())
            {
                ByteBuffer buffer = ByteBuffer.allocate(1 + 4 + 1 + response.payload().length);
                buffer.put((byte) FrameType.RESPONSE.getId());
                buffer.putInt(response.correlationId());
                buffer.put((byte) 0);
                buffer.put(response.payload());
                return buffer.array();
            }
            byte[] message = utf8(response.message());
            ByteBuffer buffer = ByteBuffer.allocate(1 + 4 + 1 + 2 + 2 + message.length);
            buffer.put((byte) FrameType.RESPONSE.getId());
            buffer.putInt(response.correlationId());
            buffer.put((byte) 1);
            buffer.putShort((short) response.errorCode());
            putString(buffer, message);
            return buffer.array();
        }
        if (frame instanceof EventFrame event)
        {
            ByteBuffer buffer = ByteBuffer.allocate(1 + 1 + 8 + 8 + event.payload().length);
            buffer.put((byte) FrameType.EVENT.getId());
            buffer.put((byte) event.originKind());
            buffer.putLong(event.originId());
            buffer.putLong(event.sequence());
            buffer.put(event.payload());
            return buffer.array();
        }
        if (frame instanceof Notice notice)
        {
            return encodeCodeAndMessage(FrameType.NOTICE, notice.level().getCode(), notice.message());
        }
        if (frame instanceof Heartbeat heartbeat)
        {
            ByteBuffer buffer = ByteBuffer.allocate(1 + 8);
            buffer.put((byte) FrameType.HEARTBEAT.getId());
            buffer.putLong(heartbeat.timestamp());
            return buffer.array();
        }
        if (frame instanceof HeartbeatAck ack)
        {
            ByteBuffer buffer = ByteBuffer.allocate(1 + 8 + 8);
            buffer.put((byte) FrameType.HEARTBEAT_ACK.getId());
            buffer.putLong(ack.echoTimestamp());
            buffer.putLong(ack.timestamp());
            return buffer.array();
        }
        if (frame instanceof Disconnect disconnect)
        {
            return encodeCodeAndMessage(FrameType.DISCONNECT, disconnect.reasonCode().getCode(), disconnect.message());
        }
        throw new IllegalArgumentException("Unsupported frame: " + frame.getClass().getName());
    }

    private static byte[] encodeCodeAndMessage(FrameType type, int code, String message)
    {
        byte[] messageBytes = utf8(message);
        ByteBuffer buffer = ByteBuffer.allocate(1 + 1 + 2 + messageBytes.length);
        buffer.put((byte) type.getId());
        buffer.put((byte) code);
        putString(buffer, messageBytes);
        return buffer.array();
    }

    private static byte[] utf8(String value)
    {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_LENGTH)
        {
            // frames carry human-readable text; clip rather than fail
            byte[] clipped = new byte[MAX_STRING_LENGTH];
            System.arraycopy(bytes, 0, clipped, 0, MAX_STRING_LENGTH);
            return clipped;
        }
        return bytes;
    }

    private static void putString(ByteBuffer buffer, byte[] bytes)
    {
        buffer.putShort((short) bytes.length);
        buffer.put(bytes);
    }

    // ========== Decoding ==========

    /**
     * Reads the frame type without decoding the body.
     *
     * @param data the encoded frame
     * @return the frame type
     * @throws FrameFormatException if the data is empty or the type unknown
     */
    public static FrameType peekType(byte[] data)
    {
        if (data.length == 0)
        {
            throw new FrameFormatException("Empty frame");
        }
        return FrameType.fromId(data[0] & 0xFF);
    }

    /**
     * Decodes one frame.
     *
     * @param data the encoded frame
     * @return the decoded frame
     * @throws FrameFormatException if the frame is corrupt
     */
    public static Frame decode(byte[] data)
    {
        Objects.requireNonNull(data, "data");

        FrameType type = peekType(data);
        ByteBuffer buffer = ByteBuffer.wrap(data, 1, data.length - 1);
        try
        {
            Frame frame = switch (type)
            {
                case HELLO -> decodeHello(buffer);
                case WELCOME -> decodeWelcome(buffer);
                case REJECT -> new Reject(Reject.RejectReason.fromCode(buffer.get() & 0xFF), getString(buffer));
                case COMMAND -> decodeCommand(buffer);
                case RESPONSE -> decodeResponse(buffer);
                case EVENT -> new EventFrame(buffer.get() & 0xFF, buffer.getLong(), buffer.getLong(), remaining(buffer));
                case NOTICE -> new Notice(NoticeLevel.fromCode(buffer.get() & 0xFF), getString(buffer));
                case HEARTBEAT -> new Heartbeat(buffer.getLong());
                case HEARTBEAT_ACK -> new HeartbeatAck(buffer.getLong(), buffer.getLong());
                case DISCONNECT -> new Disconnect(Disconnect.DisconnectCode.fromCode(buffer.get() & 0xFF), getString(buffer));
            };
            if (buffer.hasRemaining())
            {
                throw new FrameFormatException(buffer.remaining() + " trailing bytes after " + type);
            }
            return frame;
        }
        catch (BufferUnderflowException e)
        {
            throw new FrameFormatException("Truncated " + type + " frame");
        }
        catch (IllegalArgumentException e)
        {
            // unknown privilege or notice level code
            throw new FrameFormatException("Invalid " + type + " frame: " + e.getMessage());
        }
    }

    private static Hello decodeHello(ByteBuffer buffer)
    {
        int version = buffer.get() & 0xFF;
        byte[] hash = new byte[Hello.HASH_LENGTH];
        buffer.get(hash);
        String user = getString(buffer);
        String secret = getString(buffer);
        return new Hello(version, hash, user, secret);
    }

    private static Welcome decodeWelcome(ByteBuffer buffer)
    {
        String sessionId = getString(buffer);
        long identityId = buffer.getLong();
        String name = getString(buffer);
        Privilege privilege = Privilege.fromCode(buffer.get() & 0xFF);
        int heartbeatMs = buffer.getInt();
        int livenessMs = buffer.getInt();
        return new Welcome(sessionId, identityId, name, privilege, heartbeatMs, livenessMs);
    }

    private static CommandFrame decodeCommand(ByteBuffer buffer)
    {
        int correlationId = buffer.getInt();
        int scopeCode = buffer.get() & 0xFF;
        int hasTarget = buffer.get() & 0xFF;
        Optional<Long> targetId;
        if (hasTarget == 0)
        {
            targetId = Optional.empty();
        }
        else if (hasTarget == 1)
        {
            targetId = Optional.of(buffer.getLong());
        }
        else
        {
            throw new FrameFormatException("Invalid hasTarget flag: " + hasTarget);
        }
        return new CommandFrame(correlationId, scopeCode, targetId, remaining(buffer));
    }

    private static ResponseFrame decodeResponse(ByteBuffer buffer)
    {
        int correlationId = buffer.getInt();
        int status = buffer.get() & 0xFF;
        if (status == 0)
        {
            return ResponseFrame.ok(correlationId, remaining(buffer));
        }
        if (status == 1)
        {
            int errorCode = buffer.getShort() & 0xFFFF;
            return ResponseFrame.error(correlationId, errorCode, getString(buffer));
        }
        throw new FrameFormatException("Invalid response status: " + status);
    }

    private static String getString(ByteBuffer buffer)
    {
        int length = buffer.getShort() & 0xFFFF;
        if (length > buffer.remaining())
        {
            throw new FrameFormatException("String length " + length + " exceeds remaining " + buffer.remaining());
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static byte[] remaining(ByteBuffer buffer)
    {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }
}
