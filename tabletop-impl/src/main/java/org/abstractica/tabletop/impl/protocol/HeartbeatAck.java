package org.abstractica.tabletop.impl.protocol;

/**
 * Keep-alive answer.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x21]
 * [echoTimestamp: 8 bytes]
 * [timestamp: 8 bytes]
 * </pre>
 *
 * @param echoTimestamp the timestamp of the heartbeat being answered
 * @param timestamp     responder's clock in milliseconds
 */
public record HeartbeatAck(long echoTimestamp, long timestamp) implements Frame
{
    @Override
    public FrameType type()
    {
        return FrameType.HEARTBEAT_ACK;
    }
}
