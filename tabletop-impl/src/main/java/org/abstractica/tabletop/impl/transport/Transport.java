package org.abstractica.tabletop.impl.transport;

import org.abstractica.tabletop.TransportKind;

import java.net.SocketAddress;
import java.util.function.Consumer;

/**
 * Accepts client connections and exposes each as a {@link MessageChannel}.
 *
 * <p>Transport handles framing and the physical network without any
 * knowledge of frame contents. Everything above it is transport-agnostic.</p>
 */
public interface Transport extends AutoCloseable
{
    /**
     * Returns the kind of connections this transport accepts.
     *
     * @return the transport kind
     */
    TransportKind kind();

    /**
     * Starts accepting connections.
     *
     * <p>The acceptor is called once per new connection, before any inbound
     * frame is delivered. It must install a {@link ChannelHandler} on the
     * channel and must not block.</p>
     *
     * @param acceptor called with each accepted channel
     */
    void start(Consumer<MessageChannel> acceptor);

    /**
     * Stops accepting connections and closes every open channel.
     */
    @Override
    void close();

    /**
     * Returns the local address this transport is bound to.
     *
     * @return the local socket address, or null if not bound
     */
    SocketAddress getLocalAddress();
}
