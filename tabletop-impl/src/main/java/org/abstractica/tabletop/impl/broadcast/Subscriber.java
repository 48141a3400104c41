package org.abstractica.tabletop.impl.broadcast;

/**
 * A receiver of published event frames, typically one connection.
 */
public interface Subscriber
{
    /**
     * Returns a stable id used to de-duplicate subscriptions.
     *
     * @return subscriber id
     */
    String subscriberId();

    /**
     * Offers one encoded event frame. Must not block.
     *
     * <p>Returning false means the subscriber is gone or its queue
     * overflowed; the subscriber tears itself down and the topic drops it.</p>
     *
     * @param frame encoded event frame
     * @return true if queued for delivery
     */
    boolean offer(byte[] frame);
}
