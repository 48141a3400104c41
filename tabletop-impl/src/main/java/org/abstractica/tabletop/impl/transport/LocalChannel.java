package org.abstractica.tabletop.impl.transport;

import org.abstractica.tabletop.DisconnectReason;
import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.impl.concurrent.SerialExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One end of an in-process channel pair.
 *
 * <p>Frames sent on one end are delivered to the other end's handler in
 * order, on a serial executor. An end can be {@linkplain #pause() paused}:
 * while paused, the peer's {@link #send} blocks, the way a TCP write blocks
 * when the reader stops reading.</p>
 */
public final class LocalChannel implements MessageChannel
{
    private static final Logger LOG = LoggerFactory.getLogger(LocalChannel.class);

    private final String name;
    private final SerialExecutor inbox;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    // set only by close(); frames already queued when the peer closes are still delivered
    private volatile boolean closedLocally;
    private final Object pauseLock = new Object();
    private final List<byte[]> undelivered = new ArrayList<>();
    private LocalChannel peer;
    private ChannelHandler handler;
    private boolean paused;

    private LocalChannel(String name, Executor executor)
    {
        this.name = name;
        this.inbox = new SerialExecutor(executor, name);
    }

    /**
     * Creates a connected pair of channels.
     *
     * @param name     base name for logging
     * @param executor executor running inbound deliveries
     * @return two ends; index 0 is the client end, index 1 the server end
     */
    public static LocalChannel[] pair(String name, Executor executor)
    {
        Objects.requireNonNull(executor, "executor");
        LocalChannel client = new LocalChannel(name + "-client", executor);
        LocalChannel server = new LocalChannel(name + "-server", executor);
        client.peer = server;
        server.peer = client;
        return new LocalChannel[]{client, server};
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.LOCAL;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return null;
    }

    @Override
    public void setHandler(ChannelHandler handler)
    {
        Objects.requireNonNull(handler, "handler");
        List<byte[]> pending;
        synchronized (undelivered)
        {
            this.handler = handler;
            pending = new ArrayList<>(undelivered);
            undelivered.clear();
        }
        for (byte[] frame : pending)
        {
            inbox.execute(() -> deliver(handler, frame));
        }
    }

    @Override
    public void send(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (closed.get())
        {
            throw new UncheckedIOException(new IOException("Channel closed: " + name));
        }
        peer.receive(frame);
    }

    @Override
    public void close()
    {
        closedLocally = true;
        if (closed.compareAndSet(false, true))
        {
            wakeWriters();
            peer.peerClosed(new DisconnectReason.ClosedByPeer("Connection closed"));
        }
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get();
    }

    /**
     * Stops accepting inbound frames; the peer's writes block until resumed.
     */
    public void pause()
    {
        synchronized (pauseLock)
        {
            paused = true;
        }
    }

    /**
     * Resumes accepting inbound frames.
     */
    public void resume()
    {
        synchronized (pauseLock)
        {
            paused = false;
            pauseLock.notifyAll();
        }
    }

    private void receive(byte[] frame)
    {
        synchronized (pauseLock)
        {
            while (paused && !closed.get() && !peer.closed.get())
            {
                try
                {
                    pauseLock.wait();
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    throw new UncheckedIOException(new IOException("Interrupted while writing to " + name));
                }
            }
        }
        if (closed.get() || peer.closed.get())
        {
            throw new UncheckedIOException(new IOException("Channel closed: " + name));
        }

        ChannelHandler h;
        synchronized (undelivered)
        {
            h = handler;
            if (h == null)
            {
                undelivered.add(frame);
                return;
            }
        }
        inbox.execute(() -> deliver(h, frame));
    }

    private void deliver(ChannelHandler h, byte[] frame)
    {
        if (closedLocally)
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

    private void peerClosed(DisconnectReason reason)
    {
        if (closed.compareAndSet(false, true))
        {
            wakeWriters();
            inbox.execute(() ->
            {
                ChannelHandler h;
                synchronized (undelivered)
                {
                    h = handler;
                }
                if (h != null)
                {
                    h.onClosed(reason);
                }
            });
        }
    }

    private void wakeWriters()
    {
        synchronized (pauseLock)
        {
            pauseLock.notifyAll();
        }
        synchronized (peer.pauseLock)
        {
            peer.pauseLock.notifyAll();
        }
    }

    @Override
    public String toString()
    {
        return name;
    }
}
