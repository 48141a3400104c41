package org.abstractica.tabletop.impl.transport;

import org.abstractica.tabletop.DisconnectReason;

/**
 * Receives inbound frames and the close notification of one channel.
 */
public interface ChannelHandler
{
    /**
     * Called for each inbound frame, in arrival order, from one thread at a time.
     *
     * @param frame the encoded frame
     */
    void onFrame(byte[] frame);

    /**
     * Called at most once when the channel closes for a reason other than a
     * local {@link MessageChannel#close()}.
     *
     * @param reason why the channel closed
     */
    void onClosed(DisconnectReason reason);
}
