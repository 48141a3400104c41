package org.abstractica.tabletop.handlers;

import org.abstractica.tabletop.protocol.Command;

/**
 * Handles commands of a specific scope and type.
 *
 * <p>A handler completes the command through its context, either before
 * returning or later from another thread. Throwing {@link ValidationException}
 * completes it with an error response.</p>
 *
 * @param <T> the command type this handler processes
 */
@FunctionalInterface
public interface CommandHandler<T extends Command>
{
    /**
     * Handles a command.
     *
     * @param context the command's context
     * @param command the decoded command
     */
    void handle(CommandContext context, T command);
}
