package org.abstractica.tabletop.impl.protocol;

/**
 * A wire protocol frame.
 *
 * <p>Frames are identical on every transport: {@code [frameType: 1 byte][body]}.</p>
 */
public sealed interface Frame permits
        Hello,
        Welcome,
        Reject,
        CommandFrame,
        ResponseFrame,
        EventFrame,
        Notice,
        Heartbeat,
        HeartbeatAck,
        Disconnect
{
    /**
     * Returns the type of this frame.
     *
     * @return the frame type
     */
    FrameType type();
}
