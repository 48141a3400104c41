package org.abstractica.tabletop.impl.concurrent;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates named daemon threads: {@code <prefix>-1}, {@code <prefix>-2}, ...
 */
public final class DaemonThreadFactory implements ThreadFactory
{
    private final String namePrefix;
    private final AtomicInteger index = new AtomicInteger();

    public DaemonThreadFactory(String namePrefix)
    {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
    }

    @Override
    public Thread newThread(Runnable r)
    {
        Thread t = new Thread(r, namePrefix + "-" + index.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
