package org.abstractica.tabletop.impl.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * A client command.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x10]
 * [correlationId: 4 bytes]
 * [scope: 1 byte]
 * [hasTarget: 1 byte]
 * [targetId: 8 bytes, if hasTarget]
 * [payload: remaining bytes (2-byte type id + record body)]
 * </pre>
 *
 * <p>The scope code is kept raw; it is resolved by the dispatcher so an
 * unknown scope is a malformed command rather than a corrupt frame.</p>
 */
public record CommandFrame(
        int correlationId,
        int scopeCode,
        Optional<Long> targetId,
        byte[] payload
) implements Frame
{
    public CommandFrame
    {
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public FrameType type()
    {
        return FrameType.COMMAND;
    }
}
