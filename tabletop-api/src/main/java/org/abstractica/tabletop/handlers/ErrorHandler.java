package org.abstractica.tabletop.handlers;

import org.abstractica.tabletop.Session;
import org.abstractica.tabletop.protocol.CommandEnvelope;

/**
 * Handles unexpected exceptions thrown by command handlers.
 *
 * <p>When a handler throws anything other than {@link ValidationException},
 * the dispatcher answers the command with INTERNAL_ERROR, logs the exception
 * and invokes this handler. The session continues processing other commands.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by a command handler.
     *
     * @param session   the session where the error occurred
     * @param command   the command that caused the error
     * @param exception the exception thrown by the handler
     */
    void handle(Session session, CommandEnvelope command, Exception exception);
}
