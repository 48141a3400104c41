package org.abstractica.tabletop.impl.session;

import org.abstractica.tabletop.AuthenticationException;
import org.abstractica.tabletop.Authenticator;
import org.abstractica.tabletop.Identity;
import org.abstractica.tabletop.impl.protocol.Frame;
import org.abstractica.tabletop.impl.protocol.FrameCodec;
import org.abstractica.tabletop.impl.protocol.Hello;
import org.abstractica.tabletop.impl.protocol.Reject;
import org.abstractica.tabletop.impl.protocol.Welcome;
import org.abstractica.tabletop.impl.serialization.DefaultProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Handles the connection handshake.
 *
 * <p>The first frame must be a {@link Hello}. Version, protocol hash,
 * credentials and capacity are checked in that order; the first failure
 * is answered with a {@link Reject} and the connection is closed without
 * a session. On success the session is registered, any older session of
 * the same identity is disconnected, and a {@link Welcome} is sent.</p>
 */
public class HandshakeHandler
{
    private static final Logger LOG = LoggerFactory.getLogger(HandshakeHandler.class);

    private final SessionRegistry registry;
    private final DefaultProtocol protocol;
    private final Authenticator authenticator;
    private final Duration heartbeatInterval;
    private final Duration livenessTimeout;
    private final BooleanSupplier accepting;
    private final Consumer<DefaultSession> onSessionCreated;

    /**
     * Creates a new handshake handler.
     *
     * @param registry          the session registry
     * @param protocol          the payload protocol clients must match
     * @param authenticator     verifies credentials
     * @param heartbeatInterval heartbeat interval announced to clients
     * @param livenessTimeout   liveness timeout announced to clients
     * @param accepting         false while the server is shutting down
     * @param onSessionCreated  callback when a new session is created
     */
    public HandshakeHandler(
            SessionRegistry registry,
            DefaultProtocol protocol,
            Authenticator authenticator,
            Duration heartbeatInterval,
            Duration livenessTimeout,
            BooleanSupplier accepting,
            Consumer<DefaultSession> onSessionCreated
    )
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        this.livenessTimeout = Objects.requireNonNull(livenessTimeout, "livenessTimeout");
        this.accepting = Objects.requireNonNull(accepting, "accepting");
        this.onSessionCreated = Objects.requireNonNull(onSessionCreated, "onSessionCreated");
    }

    /**
     * Handles the first frame of a connection.
     *
     * @param connection the connection
     * @param frame      the received frame
     */
    public void handle(Connection connection, Frame frame)
    {
        if (!(frame instanceof Hello hello))
        {
            connection.reject(Reject.RejectReason.PROTOCOL_ERROR, "Expected HELLO, got " + frame.type());
            return;
        }

        LOG.debug("Hello from {}: version={}, user={}", connection, hello.version(), hello.user());

        if (hello.version() != FrameCodec.VERSION)
        {
            connection.reject(Reject.RejectReason.VERSION_MISMATCH,
                    "Server speaks version " + FrameCodec.VERSION + ", client sent " + hello.version());
            return;
        }

        if (!Arrays.equals(hello.protocolHash(), protocol.getHashBytes()))
        {
            connection.reject(Reject.RejectReason.PROTOCOL_MISMATCH, "Protocol hash mismatch");
            return;
        }

        if (!accepting.getAsBoolean())
        {
            connection.reject(Reject.RejectReason.SHUTTING_DOWN, "Server is shutting down");
            return;
        }

        Identity identity;
        try
        {
            identity = authenticator.authenticate(hello.user(), hello.secret());
        }
        catch (AuthenticationException e)
        {
            connection.reject(Reject.RejectReason.AUTHENTICATION_FAILED, e.getMessage());
            return;
        }
        catch (RuntimeException e)
        {
            LOG.error("Authenticator failed for user {}", hello.user(), e);
            connection.reject(Reject.RejectReason.AUTHENTICATION_FAILED, "Authentication unavailable");
            return;
        }

        if (!registry.canAccept(identity.id()))
        {
            connection.reject(Reject.RejectReason.SERVER_FULL, "Server is full");
            return;
        }

        DefaultSession session = new DefaultSession(UUID.randomUUID().toString(), identity, connection);
        connection.open(session, new Welcome(
                session.getId(),
                identity.id(),
                identity.name(),
                identity.privilege(),
                (int) heartbeatInterval.toMillis(),
                (int) livenessTimeout.toMillis()));
        registry.register(session).ifPresent(DefaultSession::replace);

        LOG.info("Session created: id={}, user={}, privilege={}, transport={}",
                session.getId(), identity.name(), identity.privilege(), connection.kind());

        onSessionCreated.accept(session);
    }
}
