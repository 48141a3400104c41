package org.abstractica.tabletop.impl.protocol;

import java.util.Objects;

/**
 * The terminal response to one command.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x11]
 * [correlationId: 4 bytes]
 * [status: 1 byte (0 = ok, 1 = error)]
 * ok:    [payload: remaining bytes]
 * error: [errorCode: 2 bytes][messageLength: 2 bytes][message: UTF-8]
 * </pre>
 *
 * @param correlationId the command's correlation id
 * @param success       whether the command succeeded
 * @param payload       encoded reply (empty on error)
 * @param errorCode     error code (0 on success)
 * @param message       error message (empty on success)
 */
public record ResponseFrame(
        int correlationId,
        boolean success,
        byte[] payload,
        int errorCode,
        String message
) implements Frame
{
    public ResponseFrame
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(message, "message");
    }

    public static ResponseFrame ok(int correlationId, byte[] payload)
    {
        return new ResponseFrame(correlationId, true, payload, 0, "");
    }

    public static ResponseFrame error(int correlationId, int errorCode, String message)
    {
        return new ResponseFrame(correlationId, false, new byte[0], errorCode, message);
    }

    @Override
    public FrameType type()
    {
        return FrameType.RESPONSE;
    }
}
