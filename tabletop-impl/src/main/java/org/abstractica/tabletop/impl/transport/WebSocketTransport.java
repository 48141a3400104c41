package org.abstractica.tabletop.impl.transport;

import org.abstractica.tabletop.DisconnectReason;
import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.impl.protocol.Disconnect;
import org.abstractica.tabletop.impl.protocol.FrameCodec;
import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Web-socket transport: one binary web-socket message per frame.
 *
 * <p>I/O runs on the Java-WebSocket library's threads. A text message or an
 * oversized binary message is a protocol error and closes the connection.</p>
 */
public class WebSocketTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketTransport.class);
    private static final long START_TIMEOUT_SECONDS = 10;

    private final InetSocketAddress bindAddress;
    private final int maxFrameSize;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Server server;

    /**
     * Creates a web-socket transport.
     *
     * @param bindAddress  address and port to listen on (port 0 for ephemeral)
     * @param maxFrameSize largest accepted inbound frame in bytes
     */
    public WebSocketTransport(InetSocketAddress bindAddress, int maxFrameSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxFrameSize <= 0)
        {
            throw new IllegalArgumentException("maxFrameSize must be positive");
        }
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.WEB_SOCKET;
    }

    @Override
    public void start(Consumer<MessageChannel> acceptor)
    {
        Objects.requireNonNull(acceptor, "acceptor");
        if (!running.compareAndSet(false, true))
        {
            throw new IllegalStateException("Transport already started");
        }

        server = new Server(bindAddress, acceptor);
        server.setReuseAddr(true);
        // liveness is handled by protocol heartbeats
        server.setConnectionLostTimeout(0);
        server.start();

        try
        {
            if (!server.started.await(START_TIMEOUT_SECONDS, TimeUnit.SECONDS))
            {
                throw new IllegalStateException("Web-socket transport did not start within " + START_TIMEOUT_SECONDS + "s");
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting web-socket transport", e);
        }

        Exception failure = server.startFailure.get();
        if (failure != null)
        {
            running.set(false);
            throw new UncheckedIOException("Failed to bind web-socket transport to " + bindAddress,
                    failure instanceof IOException io ? io : new IOException(failure));
        }

        LOG.info("Web-socket transport started on {}", getLocalAddress());
    }

    @Override
    public void close()
    {
        if (!running.compareAndSet(true, false))
        {
            return;
        }

        LOG.info("Closing web-socket transport");
        try
        {
            server.stop(1000);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public SocketAddress getLocalAddress()
    {
        if (server == null)
        {
            return null;
        }
        return new InetSocketAddress(bindAddress.getAddress(), server.getPort());
    }

    // ========== Library callbacks ==========

    private final class Server extends WebSocketServer
    {
        private final Consumer<MessageChannel> acceptor;
        private final CountDownLatch started = new CountDownLatch(1);
        private final AtomicReference<Exception> startFailure = new AtomicReference<>();

        Server(InetSocketAddress address, Consumer<MessageChannel> acceptor)
        {
            super(address);
            this.acceptor = acceptor;
        }

        @Override
        public void onStart()
        {
            started.countDown();
        }

        @Override
        public void onOpen(WebSocket conn, ClientHandshake handshake)
        {
            WebSocketChannel channel = new WebSocketChannel(conn);
            conn.setAttachment(channel);
            try
            {
                acceptor.accept(channel);
            }
            catch (RuntimeException e)
            {
                LOG.error("Error accepting web-socket connection {}", conn.getRemoteSocketAddress(), e);
                channel.close();
            }
        }

        @Override
        public void onMessage(WebSocket conn, ByteBuffer message)
        {
            WebSocketChannel channel = conn.getAttachment();
            if (channel == null)
            {
                return;
            }
            if (message.remaining() < 1 || message.remaining() > maxFrameSize)
            {
                channel.protocolFault("Invalid frame length: " + message.remaining());
                return;
            }
            byte[] frame = new byte[message.remaining()];
            message.get(frame);
            channel.deliver(frame);
        }

        @Override
        public void onMessage(WebSocket conn, String message)
        {
            WebSocketChannel channel = conn.getAttachment();
            if (channel != null)
            {
                channel.protocolFault("Text messages are not supported");
            }
        }

        @Override
        public void onClose(WebSocket conn, int code, String reason, boolean remote)
        {
            WebSocketChannel channel = conn.getAttachment();
            if (channel != null)
            {
                channel.peerClosed(new DisconnectReason.ClosedByPeer(reason == null ? "" : reason));
            }
        }

        @Override
        public void onError(WebSocket conn, Exception ex)
        {
            if (conn == null)
            {
                // server-level failure, usually during bind
                LOG.error("Web-socket server error", ex);
                startFailure.compareAndSet(null, ex);
                started.countDown();
                return;
            }
            WebSocketChannel channel = conn.getAttachment();
            if (channel != null)
            {
                channel.peerClosed(new DisconnectReason.NetworkError(
                        ex instanceof IOException io ? io : new IOException(ex)));
            }
        }
    }

    /**
     * Channel over one web-socket connection.
     */
    private static final class WebSocketChannel implements MessageChannel
    {
        private final WebSocket conn;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile ChannelHandler handler;

        WebSocketChannel(WebSocket conn)
        {
            this.conn = conn;
        }

        @Override
        public TransportKind kind()
        {
            return TransportKind.WEB_SOCKET;
        }

        @Override
        public SocketAddress remoteAddress()
        {
            return conn.getRemoteSocketAddress();
        }

        @Override
        public void setHandler(ChannelHandler handler)
        {
            this.handler = Objects.requireNonNull(handler, "handler");
        }

        @Override
        public void send(byte[] frame)
        {
            if (closed.get())
            {
                throw new UncheckedIOException(new IOException("Channel closed"));
            }
            try
            {
                conn.send(frame);
            }
            catch (WebsocketNotConnectedException e)
            {
                throw new UncheckedIOException(new IOException("Web-socket not connected", e));
            }
        }

        @Override
        public void close()
        {
            if (closed.compareAndSet(false, true))
            {
                conn.close(CloseFrame.NORMAL, "");
            }
        }

        @Override
        public boolean isOpen()
        {
            return !closed.get() && conn.isOpen();
        }

        void deliver(byte[] frame)
        {
            ChannelHandler h = handler;
            if (h == null || closed.get())
            {
                return;
            }
            try
            {
                h.onFrame(frame);
            }
            catch (RuntimeException e)
            {
                LOG.error("Error in frame handler", e);
            }
        }

        void protocolFault(String details)
        {
            LOG.warn("Protocol error from {}: {}", remoteAddress(), details);
            try
            {
                send(FrameCodec.encode(Disconnect.protocolError(details)));
            }
            catch (UncheckedIOException e)
            {
                LOG.debug("Could not send disconnect to {}: {}", remoteAddress(), e.getMessage());
            }
            if (closed.compareAndSet(false, true))
            {
                conn.close(CloseFrame.PROTOCOL_ERROR, details);
                ChannelHandler h = handler;
                if (h != null)
                {
                    h.onClosed(new DisconnectReason.ProtocolError(details));
                }
            }
        }

        void peerClosed(DisconnectReason reason)
        {
            if (closed.compareAndSet(false, true))
            {
                conn.close();
                ChannelHandler h = handler;
                if (h != null)
                {
                    h.onClosed(reason);
                }
            }
        }
    }
}
