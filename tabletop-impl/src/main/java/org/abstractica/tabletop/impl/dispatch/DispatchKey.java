package org.abstractica.tabletop.impl.dispatch;

import org.abstractica.tabletop.protocol.Scope;

import java.util.Objects;

/**
 * Key of the dispatch table: a scope and an exact command class.
 */
record DispatchKey(Scope scope, Class<?> type)
{
    DispatchKey
    {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(type, "type");
    }
}
