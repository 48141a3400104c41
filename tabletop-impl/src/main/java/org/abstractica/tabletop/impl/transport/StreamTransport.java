package org.abstractica.tabletop.impl.transport;

import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.impl.concurrent.DaemonThreadFactory;
import org.abstractica.tabletop.impl.protocol.FrameCodec;
import org.abstractica.tabletop.impl.protocol.Reject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * TCP transport with length-prefixed frames.
 *
 * <p>One accept thread hands each connection to a bounded worker pool that
 * runs the connection's read loop. When every worker is busy the new
 * connection is rejected with SERVER_FULL and closed.</p>
 */
public class StreamTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(StreamTransport.class);

    private final InetSocketAddress bindAddress;
    private final int maxConnections;
    private final int maxFrameSize;

    private final Set<StreamChannel> channels = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ServerSocket serverSocket;
    private ThreadPoolExecutor workers;
    private Thread acceptThread;

    /**
     * Creates a stream transport.
     *
     * @param bindAddress    address and port to listen on (port 0 for ephemeral)
     * @param maxConnections size of the connection worker pool
     * @param maxFrameSize   largest accepted inbound frame in bytes
     */
    public StreamTransport(InetSocketAddress bindAddress, int maxConnections, int maxFrameSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxConnections <= 0)
        {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        if (maxFrameSize <= 0)
        {
            throw new IllegalArgumentException("maxFrameSize must be positive");
        }
        this.maxConnections = maxConnections;
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.STREAM;
    }

    @Override
    public void start(Consumer<MessageChannel> acceptor)
    {
        Objects.requireNonNull(acceptor, "acceptor");
        if (!running.compareAndSet(false, true))
        {
            throw new IllegalStateException("Transport already started");
        }

        try
        {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(bindAddress);
        }
        catch (IOException e)
        {
            running.set(false);
            throw new UncheckedIOException("Failed to bind stream transport to " + bindAddress, e);
        }

        workers = new ThreadPoolExecutor(
                maxConnections, maxConnections,
                60, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new DaemonThreadFactory("stream-conn"));
        workers.allowCoreThreadTimeOut(true);

        acceptThread = new Thread(() -> acceptLoop(acceptor), "stream-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        LOG.info("Stream transport started on {}", serverSocket.getLocalSocketAddress());
    }

    @Override
    public void close()
    {
        if (!running.compareAndSet(true, false))
        {
            return;
        }

        LOG.info("Closing stream transport");

        try
        {
            serverSocket.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing server socket", e);
        }

        for (StreamChannel channel : channels)
        {
            channel.close();
        }
        channels.clear();

        workers.shutdownNow();
        try
        {
            acceptThread.join(1000);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public SocketAddress getLocalAddress()
    {
        return serverSocket == null ? null : serverSocket.getLocalSocketAddress();
    }

    private void acceptLoop(Consumer<MessageChannel> acceptor)
    {
        while (running.get())
        {
            Socket socket;
            try
            {
                socket = serverSocket.accept();
            }
            catch (IOException e)
            {
                if (running.get())
                {
                    LOG.error("Error accepting connection", e);
                }
                continue;
            }

            StreamChannel channel;
            try
            {
                channel = new StreamChannel(socket, maxFrameSize);
            }
            catch (IOException e)
            {
                LOG.warn("Failed to set up connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                closeQuietly(socket);
                continue;
            }

            try
            {
                workers.execute(() -> serve(channel, acceptor));
            }
            catch (RejectedExecutionException e)
            {
                LOG.warn("Connection worker pool saturated, rejecting {}", channel.remoteAddress());
                rejectFull(channel);
            }
        }

        LOG.debug("Accept loop exited");
    }

    private void serve(StreamChannel channel, Consumer<MessageChannel> acceptor)
    {
        channels.add(channel);
        try
        {
            acceptor.accept(channel);
            channel.readLoop();
        }
        catch (RuntimeException e)
        {
            LOG.error("Error serving connection {}", channel.remoteAddress(), e);
            channel.close();
        }
        finally
        {
            channels.remove(channel);
        }
    }

    private void rejectFull(StreamChannel channel)
    {
        try
        {
            channel.send(FrameCodec.encode(new Reject(Reject.RejectReason.SERVER_FULL, "Server full")));
        }
        catch (UncheckedIOException e)
        {
            LOG.debug("Could not send reject to {}: {}", channel.remoteAddress(), e.getMessage());
        }
        channel.close();
    }

    private static void closeQuietly(Socket socket)
    {
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
