package org.abstractica.tabletop.impl.replay;

import org.abstractica.tabletop.protocol.SequencedEvent;

import java.util.Iterator;

/**
 * Lazy, finite iteration over recorded events in sequence order.
 */
public interface ReplayCursor extends Iterator<SequencedEvent>, AutoCloseable
{
    @Override
    void close();
}
