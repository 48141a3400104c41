package org.abstractica.tabletop.handlers;

import org.abstractica.tabletop.Session;
import org.abstractica.tabletop.protocol.CommandEnvelope;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.Reply;

/**
 * Context of one dispatched command.
 *
 * <p>Exactly one response is sent per command: the first call to
 * {@link #reply} or {@link #fail} wins and later calls return false.</p>
 */
public interface CommandContext
{
    /**
     * Returns the issuing session.
     *
     * @return the session
     */
    Session session();

    /**
     * Returns the decoded envelope.
     *
     * @return the envelope
     */
    CommandEnvelope envelope();

    /**
     * Returns the target room or game id.
     *
     * @return the target id
     * @throws IllegalStateException if the command is not targeted
     */
    long targetId();

    /**
     * Completes the command successfully.
     *
     * @param reply the reply payload
     * @return true if this call completed the command
     */
    boolean reply(Reply reply);

    /**
     * Completes the command with an error.
     *
     * @param code    reason code
     * @param message explanation for the client
     * @return true if this call completed the command
     */
    boolean fail(ErrorCode code, String message);

    /**
     * Returns whether a response has been sent.
     *
     * @return true once completed
     */
    boolean isCompleted();
}
