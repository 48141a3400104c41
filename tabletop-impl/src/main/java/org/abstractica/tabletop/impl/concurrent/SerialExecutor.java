package org.abstractica.tabletop.impl.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor.
 *
 * <p>At most one task of this executor is running or scheduled on the
 * underlying executor at any moment, so tasks never overlap and each task
 * sees the effects of the previous one.</p>
 */
public final class SerialExecutor implements Executor
{
    private static final Logger LOG = LoggerFactory.getLogger(SerialExecutor.class);

    private final Executor delegate;
    private final String name;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private boolean scheduled;

    public SerialExecutor(Executor delegate, String name)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        synchronized (tasks)
        {
            tasks.add(task);
            if (scheduled)
            {
                return;
            }
            scheduled = true;
        }
        schedule();
    }

    /**
     * Returns the number of tasks waiting to run.
     *
     * @return queued task count, excluding a running task
     */
    public int backlog()
    {
        synchronized (tasks)
        {
            return tasks.size();
        }
    }

    private void schedule()
    {
        try
        {
            delegate.execute(this::runNext);
        }
        catch (RejectedExecutionException e)
        {
            LOG.warn("{}: executor rejected task, dropping {} queued tasks", name, backlog());
            synchronized (tasks)
            {
                tasks.clear();
                scheduled = false;
            }
        }
    }

    private void runNext()
    {
        Runnable task;
        synchronized (tasks)
        {
            task = tasks.poll();
            if (task == null)
            {
                scheduled = false;
                return;
            }
        }

        try
        {
            task.run();
        }
        catch (RuntimeException e)
        {
            LOG.error("{}: task failed", name, e);
        }

        synchronized (tasks)
        {
            if (tasks.isEmpty())
            {
                scheduled = false;
                return;
            }
        }
        schedule();
    }
}
