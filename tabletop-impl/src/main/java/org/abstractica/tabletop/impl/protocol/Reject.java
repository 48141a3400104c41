package org.abstractica.tabletop.impl.protocol;

import java.util.Objects;

/**
 * Server's handshake rejection.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x03]
 * [reasonCode: 1 byte]
 * [messageLength: 2 bytes]
 * [message: variable UTF-8]
 * </pre>
 *
 * @param reasonCode rejection reason code
 * @param message    human-readable rejection message
 */
public record Reject(
        RejectReason reasonCode,
        String message
) implements Frame
{
    public Reject
    {
        Objects.requireNonNull(reasonCode, "reasonCode");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public FrameType type()
    {
        return FrameType.REJECT;
    }

    /**
     * Rejection reason codes.
     */
    public enum RejectReason
    {
        VERSION_MISMATCH(0x01),
        PROTOCOL_MISMATCH(0x02),
        AUTHENTICATION_FAILED(0x03),
        SERVER_FULL(0x04),
        HANDSHAKE_TIMEOUT(0x05),
        PROTOCOL_ERROR(0x06),
        SHUTTING_DOWN(0x07);

        private final int code;

        RejectReason(int code)
        {
            this.code = code;
        }

        public int getCode()
        {
            return code;
        }

        public static RejectReason fromCode(int code)
        {
            for (RejectReason reason : values())
            {
                if (reason.code == code)
                {
                    return reason;
                }
            }
            throw new FrameFormatException("Unknown reject reason code: 0x" + Integer.toHexString(code));
        }
    }
}
