package org.abstractica.tabletop.impl.protocol;

import org.abstractica.tabletop.protocol.NoticeLevel;

import java.util.Objects;

/**
 * Out-of-band message to one connection.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x13]
 * [level: 1 byte]
 * [messageLength: 2 bytes][message: UTF-8]
 * </pre>
 */
public record Notice(NoticeLevel level, String message) implements Frame
{
    public Notice
    {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public FrameType type()
    {
        return FrameType.NOTICE;
    }
}
