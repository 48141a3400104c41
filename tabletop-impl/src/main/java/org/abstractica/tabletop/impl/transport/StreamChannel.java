package org.abstractica.tabletop.impl.transport;

import org.abstractica.tabletop.DisconnectReason;
import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.impl.protocol.Disconnect;
import org.abstractica.tabletop.impl.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A TCP connection carrying length-prefixed frames.
 *
 * <p>Wire format per frame:</p>
 * <pre>
 * [length: 4 bytes, big-endian, 1..maxFrameSize]
 * [frame: length bytes]
 * </pre>
 *
 * <p>Reading happens in {@link #readLoop()}, which the owner runs on a
 * dedicated worker thread. Writes are synchronized and may block.</p>
 */
public final class StreamChannel implements MessageChannel
{
    private static final Logger LOG = LoggerFactory.getLogger(StreamChannel.class);

    private final Socket socket;
    private final int maxFrameSize;
    private final DataInputStream in;
    private final DataOutputStream out;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ChannelHandler handler;

    public StreamChannel(Socket socket, int maxFrameSize) throws IOException
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        if (maxFrameSize <= 0)
        {
            throw new IllegalArgumentException("maxFrameSize must be positive");
        }
        this.maxFrameSize = maxFrameSize;
        socket.setTcpNoDelay(true);
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
    }

    /**
     * Opens a client connection.
     *
     * @param address      server address
     * @param maxFrameSize largest accepted inbound frame
     * @return the connected channel; call {@link #readLoop()} to receive
     * @throws IOException if the connection fails
     */
    public static StreamChannel connect(InetSocketAddress address, int maxFrameSize) throws IOException
    {
        Socket socket = new Socket();
        try
        {
            socket.connect(address, 5000);
            return new StreamChannel(socket, maxFrameSize);
        }
        catch (IOException e)
        {
            socket.close();
            throw e;
        }
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.STREAM;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return socket.getRemoteSocketAddress();
    }

    @Override
    public void setHandler(ChannelHandler handler)
    {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public void send(byte[] frame)
    {
        synchronized (out)
        {
            if (closed.get())
            {
                throw new UncheckedIOException(new IOException("Channel closed"));
            }
            try
            {
                out.writeInt(frame.length);
                out.write(frame);
                out.flush();
            }
            catch (IOException e)
            {
                throw new UncheckedIOException(e);
            }
        }
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing socket {}: {}", remoteAddress(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get();
    }

    /**
     * Reads frames until the connection closes, delivering each to the handler.
     *
     * <p>Runs on the calling thread and returns when the channel is closed.</p>
     */
    public void readLoop()
    {
        ChannelHandler h = handler;
        if (h == null)
        {
            throw new IllegalStateException("Handler must be set before reading");
        }

        try
        {
            while (!closed.get())
            {
                int length = in.readInt();
                if (length < 1 || length > maxFrameSize)
                {
                    protocolFault(h, "Invalid frame length: " + length);
                    return;
                }
                byte[] frame = new byte[length];
                in.readFully(frame);
                try
                {
                    h.onFrame(frame);
                }
                catch (RuntimeException e)
                {
                    LOG.error("Error in frame handler", e);
                }
            }
        }
        catch (EOFException e)
        {
            peerClosed(h, new DisconnectReason.ClosedByPeer("Connection closed"));
        }
        catch (IOException e)
        {
            peerClosed(h, new DisconnectReason.NetworkError(e));
        }
    }

    private void protocolFault(ChannelHandler h, String details)
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
        peerClosed(h, new DisconnectReason.ProtocolError(details));
    }

    private void peerClosed(ChannelHandler h, DisconnectReason reason)
    {
        // a local close() also ends the read loop; only report remote closes
        if (closed.compareAndSet(false, true))
        {
            try
            {
                socket.close();
            }
            catch (IOException e)
            {
                LOG.debug("Error closing socket: {}", e.getMessage());
            }
            h.onClosed(reason);
        }
    }
}
