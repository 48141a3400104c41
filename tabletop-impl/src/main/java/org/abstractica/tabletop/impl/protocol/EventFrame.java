package org.abstractica.tabletop.impl.protocol;

import java.util.Objects;

/**
 * A sequenced event from a room or game.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x12]
 * [originKind: 1 byte]
 * [originId: 8 bytes]
 * [sequence: 8 bytes]
 * [payload: remaining bytes]
 * </pre>
 *
 * <p>The same bytes (without the type byte) are what the replay log stores.</p>
 */
public record EventFrame(
        int originKind,
        long originId,
        long sequence,
        byte[] payload
) implements Frame
{
    public EventFrame
    {
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public FrameType type()
    {
        return FrameType.EVENT;
    }
}
