package org.abstractica.tabletop.impl.dispatch;

import org.abstractica.tabletop.Session;

/**
 * The session side of dispatching: where commands come from and answers go.
 */
public interface CommandSource
{
    Session session();

    PendingCommands pendingCommands();

    /**
     * Queues an encoded frame for the client.
     *
     * @param frame encoded frame
     * @return false if the connection is gone
     */
    boolean deliver(byte[] frame);

    /**
     * Counts one malformed command.
     *
     * @return the number of malformed commands so far
     */
    int recordMalformed();

    /**
     * Disconnects the client for a protocol violation.
     *
     * @param details description sent to the client
     */
    void protocolError(String details);
}
