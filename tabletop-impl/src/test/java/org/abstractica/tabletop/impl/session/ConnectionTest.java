package org.abstractica.tabletop.impl.session;

import org.abstractica.tabletop.DisconnectReason;
import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.impl.protocol.CommandFrame;
import org.abstractica.tabletop.impl.protocol.Frame;
import org.abstractica.tabletop.impl.transport.ChannelHandler;
import org.abstractica.tabletop.impl.transport.MessageChannel;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Connection}.
 */
class ConnectionTest
{
    // holds drain tasks so the outbound queue fills up
    private static final Executor STALLED = task -> {};

    @Test
    void offer_queueFull_reportsOverflowOnce()
    {
        ReportingChannel channel = new ReportingChannel();
        RecordingCallback callback = new RecordingCallback();
        Connection connection = new Connection(channel, callback, STALLED, 2);
        channel.setHandler(connection);

        assertTrue(connection.offer(new byte[]{1}));
        assertTrue(connection.offer(new byte[]{2}));
        assertFalse(connection.offer(new byte[]{3}));

        assertEquals(List.of(new DisconnectReason.Overflow()), callback.reasons);
        assertFalse(channel.isOpen());
        assertEquals(Connection.State.CLOSED, connection.getState());
        assertEquals(0, connection.getQueuedFrames());
    }

    @Test
    void terminate_channelRaisesOwnCloseEvent_firstReasonWins()
    {
        ReportingChannel channel = new ReportingChannel();
        RecordingCallback callback = new RecordingCallback();
        Connection connection = new Connection(channel, callback, STALLED, 8);
        channel.setHandler(connection);

        connection.terminate(new DisconnectReason.KickedByServer("bye"));

        assertEquals(List.of(new DisconnectReason.KickedByServer("bye")), callback.reasons);
    }

    @Test
    void onClosed_afterTerminate_isIgnored()
    {
        ReportingChannel channel = new ReportingChannel();
        RecordingCallback callback = new RecordingCallback();
        Connection connection = new Connection(channel, callback, STALLED, 8);
        channel.setHandler(connection);

        connection.terminate(new DisconnectReason.Timeout());
        connection.onClosed(new DisconnectReason.ClosedByPeer("late"));

        assertEquals(1, callback.reasons.size());
        assertInstanceOf(DisconnectReason.Timeout.class, callback.reasons.get(0));
        assertFalse(connection.offer(new byte[]{1}));
    }

    /**
     * Channel that reports a network error to its handler while closing, the
     * way a socket reader does when its stream is shut under it.
     */
    private static final class ReportingChannel implements MessageChannel
    {
        private ChannelHandler handler;
        private boolean open = true;

        @Override
        public TransportKind kind()
        {
            return TransportKind.STREAM;
        }

        @Override
        public SocketAddress remoteAddress()
        {
            return null;
        }

        @Override
        public void setHandler(ChannelHandler handler)
        {
            this.handler = handler;
        }

        @Override
        public void send(byte[] frame)
        {
        }

        @Override
        public void close()
        {
            if (open)
            {
                open = false;
                handler.onClosed(new DisconnectReason.NetworkError(new IOException("Socket closed")));
            }
        }

        @Override
        public boolean isOpen()
        {
            return open;
        }
    }

    private static final class RecordingCallback implements SessionCallback
    {
        final List<DisconnectReason> reasons = new ArrayList<>();

        @Override
        public void onHandshake(Connection connection, Frame frame)
        {
        }

        @Override
        public void onCommand(DefaultSession session, CommandFrame frame)
        {
        }

        @Override
        public void onConnectionClosed(Connection connection, DisconnectReason reason)
        {
            reasons.add(reason);
        }
    }
}
