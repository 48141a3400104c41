package org.abstractica.tabletop.impl.session;

import org.abstractica.tabletop.DisconnectReason;
import org.abstractica.tabletop.impl.protocol.CommandFrame;
import org.abstractica.tabletop.impl.protocol.Frame;

/**
 * Callback interface from connection to server.
 *
 * <p>Used by {@link Connection} to hand over the handshake, commands and the
 * end of the connection.</p>
 */
public interface SessionCallback
{
    /**
     * Handles the first frame of a connection that has not completed the handshake.
     *
     * @param connection the connection
     * @param frame      the decoded frame
     */
    void onHandshake(Connection connection, Frame frame);

    /**
     * Handles a command frame from an established session.
     *
     * @param session the session
     * @param frame   the command frame
     */
    void onCommand(DefaultSession session, CommandFrame frame);

    /**
     * Notifies that a connection has ended. Called exactly once per connection.
     *
     * @param connection the connection
     * @param reason     why it ended
     */
    void onConnectionClosed(Connection connection, DisconnectReason reason);
}
