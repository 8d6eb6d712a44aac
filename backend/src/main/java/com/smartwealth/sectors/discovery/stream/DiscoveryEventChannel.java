package com.smartwealth.sectors.discovery.stream;

import com.smartwealth.sectors.discovery.model.DiscoveryEvent;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded hand-off between one producer and one consumer. The producer blocks while the
 * channel is full. Nothing is accepted after the first terminal event.
 */
public class DiscoveryEventChannel {
    private final BlockingQueue<DiscoveryEvent> queue;
    private final AtomicBoolean terminalPublished = new AtomicBoolean(false);

    public DiscoveryEventChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    /** Returns false when the event was refused or the producer was interrupted. */
    public boolean publish(DiscoveryEvent event) {
        if (event.isTerminal()) {
            if (!terminalPublished.compareAndSet(false, true)) {
                return false;
            }
        } else if (terminalPublished.get()) {
            return false;
        }
        try {
            queue.put(event);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public DiscoveryEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Closes the channel without enqueueing anything and drops queued events so a producer
     * blocked on a full queue is released. Returns false if a terminal event was already published.
     */
    public boolean close() {
        if (!terminalPublished.compareAndSet(false, true)) {
            return false;
        }
        queue.clear();
        return true;
    }

    public boolean isClosed() {
        return terminalPublished.get();
    }
}
