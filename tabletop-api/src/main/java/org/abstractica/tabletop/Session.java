package org.abstractica.tabletop;

import org.abstractica.tabletop.protocol.NoticeLevel;

import java.util.Optional;

/**
 * An authenticated identity bound to one live connection.
 *
 * <p>A session ends when its connection closes. Reconnecting creates a new
 * session for the same identity; games keep the player's seat across the gap.</p>
 */
public interface Session
{
    /**
     * Returns the unique session identifier.
     *
     * @return session ID
     */
    String getId();

    /**
     * Returns the authenticated identity.
     *
     * @return the identity
     */
    Identity getIdentity();

    /**
     * Returns the transport the session is connected through.
     *
     * @return transport kind
     */
    TransportKind getTransportKind();

    /**
     * Returns whether the connection is still open.
     *
     * @return true while connected
     */
    boolean isConnected();

    /**
     * Sends an out-of-band notice to the client.
     *
     * @param level   severity
     * @param message text to show
     * @return false if the session is closed or its outbound queue is full
     */
    boolean sendNotice(NoticeLevel level, String message);

    /**
     * Closes the session normally.
     */
    void close();

    /**
     * Disconnects the client with a reason message.
     *
     * <p>The reason is sent to the peer before closing.</p>
     *
     * @param reason the reason for closing
     */
    void close(String reason);

    /**
     * Returns the application attachment if set.
     *
     * @return the attachment, or empty if none set
     */
    Optional<Object> getAttachment();

    /**
     * Sets the application attachment.
     *
     * <p>The attachment is application-managed state associated with
     * this session. The server does not interpret or modify it.</p>
     *
     * @param attachment the attachment to set (may be null)
     */
    void setAttachment(Object attachment);
}
