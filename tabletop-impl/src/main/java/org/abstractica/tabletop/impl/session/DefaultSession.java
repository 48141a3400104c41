package org.abstractica.tabletop.impl.session;

import org.abstractica.tabletop.DisconnectReason;
import org.abstractica.tabletop.Identity;
import org.abstractica.tabletop.Session;
import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.impl.broadcast.Member;
import org.abstractica.tabletop.impl.dispatch.CommandSource;
import org.abstractica.tabletop.impl.dispatch.PendingCommands;
import org.abstractica.tabletop.impl.protocol.Disconnect;
import org.abstractica.tabletop.impl.protocol.Frame;
import org.abstractica.tabletop.impl.protocol.Notice;
import org.abstractica.tabletop.protocol.NoticeLevel;
import org.abstractica.tabletop.protocol.OriginKind;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of Session.
 *
 * <p>A session is an authenticated identity on one {@link Connection}. It is
 * the subscriber rooms and games deliver events to, and it remembers which
 * rooms and games it belongs to so the server can clean up when the
 * connection ends.</p>
 */
public class DefaultSession implements Session, Member, CommandSource
{
    private final String id;
    private final Identity identity;
    private final Connection connection;
    private final PendingCommands pendingCommands = new PendingCommands();
    private final Set<Long> rooms = ConcurrentHashMap.newKeySet();
    private final Set<Long> games = ConcurrentHashMap.newKeySet();
    private final AtomicInteger malformedCommands = new AtomicInteger();

    private volatile Object attachment;

    /**
     * Creates a session.
     *
     * @param id         unique session id
     * @param identity   the authenticated identity
     * @param connection the connection carrying the session
     */
    public DefaultSession(String id, Identity identity, Connection connection)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    // ========== Session Interface ==========

    @Override
    public String getId()
    {
        return id;
    }

    @Override
    public Identity getIdentity()
    {
        return identity;
    }

    @Override
    public TransportKind getTransportKind()
    {
        return connection.kind();
    }

    @Override
    public boolean isConnected()
    {
        return connection.isOpen();
    }

    @Override
    public boolean sendNotice(NoticeLevel level, String message)
    {
        return send(new Notice(level, message));
    }

    @Override
    public void close()
    {
        connection.closeAfter(Disconnect.normal("Closed by server"),
                new DisconnectReason.KickedByServer("Closed by server"));
    }

    @Override
    public void close(String reason)
    {
        Objects.requireNonNull(reason, "reason");
        connection.closeAfter(Disconnect.kicked(reason), new DisconnectReason.KickedByServer(reason));
    }

    @Override
    public Optional<Object> getAttachment()
    {
        return Optional.ofNullable(attachment);
    }

    @Override
    public void setAttachment(Object attachment)
    {
        this.attachment = attachment;
    }

    // ========== Member ==========

    @Override
    public String subscriberId()
    {
        return id;
    }

    @Override
    public boolean offer(byte[] frame)
    {
        return connection.offer(frame);
    }

    @Override
    public long identityId()
    {
        return identity.id();
    }

    @Override
    public String displayName()
    {
        return identity.name();
    }

    @Override
    public void joined(OriginKind kind, long originId)
    {
        (kind == OriginKind.ROOM ? rooms : games).add(originId);
    }

    @Override
    public void left(OriginKind kind, long originId)
    {
        (kind == OriginKind.ROOM ? rooms : games).remove(originId);
    }

    public Set<Long> getRoomIds()
    {
        return Set.copyOf(rooms);
    }

    public Set<Long> getGameIds()
    {
        return Set.copyOf(games);
    }

    // ========== CommandSource ==========

    @Override
    public Session session()
    {
        return this;
    }

    @Override
    public PendingCommands pendingCommands()
    {
        return pendingCommands;
    }

    @Override
    public boolean deliver(byte[] frame)
    {
        return connection.offer(frame);
    }

    @Override
    public int recordMalformed()
    {
        return malformedCommands.incrementAndGet();
    }

    @Override
    public void protocolError(String details)
    {
        connection.closeAfter(Disconnect.protocolError(details), new DisconnectReason.ProtocolError(details));
    }

    // ========== Server side ==========

    /**
     * Queues a frame for the client.
     *
     * @param frame the frame
     * @return false if the connection is gone or overflowed
     */
    public boolean send(Frame frame)
    {
        return connection.send(frame);
    }

    /**
     * Disconnects the session because the same identity logged in elsewhere.
     */
    void replace()
    {
        connection.closeAfter(Disconnect.replaced(),
                new DisconnectReason.Replaced());
    }

    public Connection getConnection()
    {
        return connection;
    }

    @Override
    public String toString()
    {
        return "Session[" + id + " " + identity.name() + "]";
    }
}
