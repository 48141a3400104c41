package org.abstractica.tabletop.impl.protocol;

/**
 * Keep-alive probe.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x20]
 * [timestamp: 8 bytes]
 * </pre>
 *
 * @param timestamp sender's clock in milliseconds
 */
public record Heartbeat(long timestamp) implements Frame
{
    @Override
    public FrameType type()
    {
        return FrameType.HEARTBEAT;
    }
}
