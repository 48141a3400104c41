package org.abstractica.tabletop.impl.session;

import org.abstractica.tabletop.DisconnectReason;
import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.impl.protocol.CommandFrame;
import org.abstractica.tabletop.impl.protocol.Disconnect;
import org.abstractica.tabletop.impl.protocol.Frame;
import org.abstractica.tabletop.impl.protocol.FrameCodec;
import org.abstractica.tabletop.impl.protocol.FrameFormatException;
import org.abstractica.tabletop.impl.protocol.Heartbeat;
import org.abstractica.tabletop.impl.protocol.HeartbeatAck;
import org.abstractica.tabletop.impl.protocol.Reject;
import org.abstractica.tabletop.impl.protocol.Welcome;
import org.abstractica.tabletop.impl.transport.ChannelHandler;
import org.abstractica.tabletop.impl.transport.MessageChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live channel, from accept until close.
 *
 * <p>Outbound frames go through a bounded queue drained on the outbound
 * pool, with at most one drain task in flight, so {@link #offer} never
 * blocks. A full queue ends the connection with {@link DisconnectReason.Overflow}.
 * The server is told about the end exactly once, whichever side closes.</p>
 */
public final class Connection implements ChannelHandler
{
    private static final Logger LOG = LoggerFactory.getLogger(Connection.class);

    /**
     * Connection lifecycle.
     */
    public enum State
    {
        HANDSHAKE,
        OPEN,
        CLOSED
    }

    private final MessageChannel channel;
    private final SessionCallback callback;
    private final Executor outbound;
    private final BlockingQueue<byte[]> queue;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private final long acceptedNanos;

    private volatile State state = State.HANDSHAKE;
    private volatile DefaultSession session;
    private volatile boolean closeWhenDrained;
    private volatile long closingSinceNanos;
    private volatile long lastInboundNanos;
    private volatile long lastHeartbeatNanos;

    /**
     * Creates a connection.
     *
     * @param channel          the accepted channel
     * @param callback         the server
     * @param outbound         pool draining outbound queues
     * @param maxOutboundQueue queued frames allowed before the connection is dropped
     */
    public Connection(MessageChannel channel, SessionCallback callback, Executor outbound, int maxOutboundQueue)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.outbound = Objects.requireNonNull(outbound, "outbound");
        this.queue = new ArrayBlockingQueue<>(maxOutboundQueue);
        this.acceptedNanos = System.nanoTime();
        this.lastInboundNanos = acceptedNanos;
        this.lastHeartbeatNanos = acceptedNanos;
    }

    // ========== Inbound ==========

    @Override
    public void onFrame(byte[] data)
    {
        if (state == State.CLOSED)
        {
            return;
        }
        lastInboundNanos = System.nanoTime();

        Frame frame;
        try
        {
            frame = FrameCodec.decode(data);
        }
        catch (FrameFormatException e)
        {
            LOG.warn("Corrupt frame from {}: {}", this, e.getMessage());
            if (state == State.HANDSHAKE)
            {
                reject(Reject.RejectReason.PROTOCOL_ERROR, e.getMessage());
            }
            else
            {
                closeAfter(Disconnect.protocolError(e.getMessage()), new DisconnectReason.ProtocolError(e.getMessage()));
            }
            return;
        }

        if (state == State.HANDSHAKE)
        {
            callback.onHandshake(this, frame);
            return;
        }

        if (frame instanceof CommandFrame command)
        {
            callback.onCommand(session, command);
        }
        else if (frame instanceof Heartbeat heartbeat)
        {
            send(new HeartbeatAck(heartbeat.timestamp(), System.currentTimeMillis()));
        }
        else if (frame instanceof HeartbeatAck)
        {
            LOG.trace("Heartbeat ack from {}", this);
        }
        else if (frame instanceof Disconnect disconnect)
        {
            LOG.debug("{} sent disconnect: {} - {}", this, disconnect.reasonCode(), disconnect.message());
            terminate(new DisconnectReason.ClosedByPeer(disconnect.message()));
        }
        else
        {
            String details = "Unexpected " + frame.type() + " frame";
            LOG.warn("{}: {}", this, details);
            closeAfter(Disconnect.protocolError(details), new DisconnectReason.ProtocolError(details));
        }
    }

    @Override
    public void onClosed(DisconnectReason reason)
    {
        terminate(reason);
    }

    // ========== Outbound ==========

    /**
     * Queues a frame.
     *
     * @param frame the frame
     * @return false if the connection is closing or its queue overflowed
     */
    public boolean send(Frame frame)
    {
        return offer(FrameCodec.encode(frame));
    }

    /**
     * Queues an encoded frame. Never blocks.
     *
     * @param frame encoded frame
     * @return false if the connection is closing or its queue overflowed
     */
    public boolean offer(byte[] frame)
    {
        if (state == State.CLOSED || closeWhenDrained)
        {
            return false;
        }
        if (!queue.offer(frame))
        {
            LOG.warn("Outbound queue of {} overflowed ({} frames), dropping connection", this, queue.size());
            terminate(new DisconnectReason.Overflow());
            return false;
        }
        scheduleDrain();
        return true;
    }

    private void scheduleDrain()
    {
        if (!draining.compareAndSet(false, true))
        {
            return;
        }
        try
        {
            outbound.execute(this::drain);
        }
        catch (RejectedExecutionException e)
        {
            draining.set(false);
            channel.close();
        }
    }

    private void drain()
    {
        try
        {
            byte[] frame;
            while ((frame = queue.poll()) != null)
            {
                if (!channel.isOpen())
                {
                    queue.clear();
                    break;
                }
                channel.send(frame);
            }
            if (closeWhenDrained)
            {
                channel.close();
            }
        }
        catch (UncheckedIOException e)
        {
            LOG.debug("Write to {} failed: {}", this, e.getMessage());
            terminate(new DisconnectReason.NetworkError(e.getCause()));
        }
        finally
        {
            draining.set(false);
        }
        if (!queue.isEmpty() && channel.isOpen())
        {
            scheduleDrain();
        }
    }

    // ========== Lifecycle ==========

    /**
     * Completes the handshake: binds the session and sends the welcome.
     *
     * @param session the new session
     * @param welcome the welcome frame
     */
    void open(DefaultSession session, Welcome welcome)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.state = State.OPEN;
        send(welcome);
    }

    /**
     * Rejects a connection during the handshake.
     *
     * @param reason  rejection reason
     * @param message text for the client
     */
    public void reject(Reject.RejectReason reason, String message)
    {
        LOG.warn("Rejecting {}: {} - {}", this, reason, message);
        closeAfter(new Reject(reason, message), new DisconnectReason.ProtocolError("Handshake rejected: " + reason));
    }

    /**
     * Sends a last frame, then closes the channel once the queue has drained.
     *
     * @param last   final frame, usually a disconnect or reject
     * @param reason reported to the server
     */
    public void closeAfter(Frame last, DisconnectReason reason)
    {
        if (state == State.CLOSED || closeWhenDrained)
        {
            return;
        }
        if (!queue.offer(FrameCodec.encode(last)))
        {
            terminate(reason);
            return;
        }
        closingSinceNanos = System.nanoTime();
        closeWhenDrained = true;
        scheduleDrain();
        end(reason);
    }

    /**
     * Closes the channel immediately, dropping queued frames.
     *
     * @param reason reported to the server
     */
    public void terminate(DisconnectReason reason)
    {
        // report first; closing a network channel can raise its own close event
        end(reason);
        channel.close();
        queue.clear();
    }

    /**
     * Closes a channel whose final frames could not be written within {@code limitNanos}.
     *
     * @param nowNanos   current time
     * @param limitNanos how long a closing connection may keep draining
     */
    void closeIfStuck(long nowNanos, long limitNanos)
    {
        if (closeWhenDrained && channel.isOpen() && nowNanos - closingSinceNanos > limitNanos)
        {
            LOG.debug("{} did not drain its final frames, closing", this);
            channel.close();
            queue.clear();
        }
    }

    private void end(DisconnectReason reason)
    {
        if (ended.compareAndSet(false, true))
        {
            state = State.CLOSED;
            callback.onConnectionClosed(this, reason);
        }
    }

    // ========== Liveness ==========

    void heartbeatSent(long nowNanos)
    {
        lastHeartbeatNanos = nowNanos;
    }

    long getLastHeartbeatNanos()
    {
        return lastHeartbeatNanos;
    }

    long getLastInboundNanos()
    {
        return lastInboundNanos;
    }

    long getAcceptedNanos()
    {
        return acceptedNanos;
    }

    // ========== Accessors ==========

    public State getState()
    {
        return state;
    }

    public boolean isOpen()
    {
        return state != State.CLOSED && channel.isOpen();
    }

    public TransportKind kind()
    {
        return channel.kind();
    }

    /**
     * Returns the session once the handshake has completed.
     *
     * @return the session, or null during the handshake or after a rejection
     */
    public DefaultSession getSession()
    {
        return session;
    }

    public int getQueuedFrames()
    {
        return queue.size();
    }

    @Override
    public String toString()
    {
        DefaultSession s = session;
        Object address = channel.remoteAddress();
        return "Connection[" + channel.kind() + (address != null ? " " + address : "")
                + (s != null ? " " + s.getIdentity().name() : "") + "]";
    }
}
