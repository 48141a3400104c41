package org.abstractica.tabletop.impl.transport;

import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.impl.concurrent.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-process transport for tests and embedding.
 *
 * <p>{@link #connect()} creates a channel pair, hands the server end to the
 * acceptor and returns the client end.</p>
 */
public class LocalTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(LocalTransport.class);

    private final ExecutorService executor = Executors.newCachedThreadPool(new DaemonThreadFactory("local-transport"));
    private final Set<LocalChannel> serverEnds = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectionCounter = new AtomicInteger();
    private volatile Consumer<MessageChannel> acceptor;

    @Override
    public TransportKind kind()
    {
        return TransportKind.LOCAL;
    }

    @Override
    public void start(Consumer<MessageChannel> acceptor)
    {
        Objects.requireNonNull(acceptor, "acceptor");
        if (this.acceptor != null)
        {
            throw new IllegalStateException("Transport already started");
        }
        this.acceptor = acceptor;
        LOG.debug("Local transport started");
    }

    /**
     * Opens a new connection to the server.
     *
     * @return the client end of the connection
     * @throws IllegalStateException if the transport is not running
     */
    public LocalChannel connect()
    {
        Consumer<MessageChannel> a = acceptor;
        if (a == null || executor.isShutdown())
        {
            throw new IllegalStateException("Transport not running");
        }
        LocalChannel[] ends = LocalChannel.pair("local-" + connectionCounter.incrementAndGet(), executor);
        serverEnds.add(ends[1]);
        a.accept(ends[1]);
        return ends[0];
    }

    @Override
    public void close()
    {
        if (executor.isShutdown())
        {
            return;
        }
        for (LocalChannel channel : serverEnds)
        {
            channel.close();
        }
        serverEnds.clear();
        // queued deliveries, including close notifications, still run
        executor.shutdown();
    }

    @Override
    public SocketAddress getLocalAddress()
    {
        return null;
    }
}
