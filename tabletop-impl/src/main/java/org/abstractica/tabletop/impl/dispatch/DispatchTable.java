package org.abstractica.tabletop.impl.dispatch;

import org.abstractica.tabletop.handlers.CommandHandler;
import org.abstractica.tabletop.protocol.Command;
import org.abstractica.tabletop.protocol.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flat table from {@code (scope, command class)} to handler.
 *
 * <p>Lookups use the exact runtime class of the command; there is no
 * inheritance search. Registration replaces an existing entry.</p>
 */
public final class DispatchTable
{
    private static final Logger LOG = LoggerFactory.getLogger(DispatchTable.class);

    private final Map<DispatchKey, CommandHandler<?>> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler.
     *
     * @param scope   the scope the command must arrive in
     * @param type    the command class
     * @param handler the handler
     * @param <T>     the command type
     */
    public <T extends Command> void register(Scope scope, Class<T> type, CommandHandler<T> handler)
    {
        Objects.requireNonNull(handler, "handler");
        CommandHandler<?> previous = handlers.put(new DispatchKey(scope, type), handler);
        if (previous != null)
        {
            LOG.debug("Replaced handler for {} {}", scope, type.getSimpleName());
        }
    }

    /**
     * Looks up the handler for a command.
     *
     * @param scope the scope the command arrived in
     * @param type  the command's runtime class
     * @return the handler, or null if none is registered
     */
    public CommandHandler<?> find(Scope scope, Class<?> type)
    {
        return handlers.get(new DispatchKey(scope, type));
    }

    public int size()
    {
        return handlers.size();
    }
}
