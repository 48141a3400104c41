package org.abstractica.tabletop.impl.transport;

import org.abstractica.tabletop.TransportKind;

import java.net.SocketAddress;

/**
 * A bidirectional channel carrying whole frames.
 *
 * <p>{@link #send} may block while the peer applies backpressure; callers
 * that must not block hand frames to an outbound queue instead.</p>
 */
public interface MessageChannel
{
    TransportKind kind();

    /**
     * Returns the peer's address, for logging.
     *
     * @return remote address, or null for in-process channels
     */
    SocketAddress remoteAddress();

    /**
     * Installs the handler for inbound frames and close notification.
     *
     * @param handler the handler
     */
    void setHandler(ChannelHandler handler);

    /**
     * Writes one frame.
     *
     * @param frame the encoded frame
     * @throws java.io.UncheckedIOException if the channel is closed or the write fails
     */
    void send(byte[] frame);

    /**
     * Closes the channel. Idempotent. The local handler is not notified.
     */
    void close();

    boolean isOpen();
}
