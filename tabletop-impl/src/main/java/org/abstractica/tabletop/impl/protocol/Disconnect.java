package org.abstractica.tabletop.impl.protocol;

import java.util.Objects;

/**
 * Graceful disconnect frame, sent by either side before closing.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x30]
 * [reasonCode: 1 byte]
 * [messageLength: 2 bytes]
 * [message: variable UTF-8]
 * </pre>
 *
 * @param reasonCode disconnect reason code
 * @param message    human-readable disconnect message
 */
public record Disconnect(
        DisconnectCode reasonCode,
        String message
) implements Frame
{
    public Disconnect
    {
        Objects.requireNonNull(reasonCode, "reasonCode");
        Objects.requireNonNull(message, "message");
    }

    public static Disconnect normal(String message)
    {
        return new Disconnect(DisconnectCode.NORMAL, message);
    }

    public static Disconnect kicked(String message)
    {
        return new Disconnect(DisconnectCode.KICKED, message);
    }

    public static Disconnect protocolError(String message)
    {
        return new Disconnect(DisconnectCode.PROTOCOL_ERROR, message);
    }

    public static Disconnect timeout()
    {
        return new Disconnect(DisconnectCode.TIMEOUT, "No traffic");
    }

    public static Disconnect replaced()
    {
        return new Disconnect(DisconnectCode.REPLACED, "Logged in from another connection");
    }

    public static Disconnect shutdown()
    {
        return new Disconnect(DisconnectCode.SHUTDOWN, "Server shutting down");
    }

    @Override
    public FrameType type()
    {
        return FrameType.DISCONNECT;
    }

    /**
     * Disconnect reason codes.
     */
    public enum DisconnectCode
    {
        NORMAL(0x00),
        KICKED(0x01),
        PROTOCOL_ERROR(0x02),
        TIMEOUT(0x03),
        OVERFLOW(0x04),
        REPLACED(0x05),
        SHUTDOWN(0x06);

        private final int code;

        DisconnectCode(int code)
        {
            this.code = code;
        }

        public int getCode()
        {
            return code;
        }

        public static DisconnectCode fromCode(int code)
        {
            for (DisconnectCode dc : values())
            {
                if (dc.code == code)
                {
                    return dc;
                }
            }
            throw new FrameFormatException("Unknown disconnect code: 0x" + Integer.toHexString(code));
        }
    }
}
