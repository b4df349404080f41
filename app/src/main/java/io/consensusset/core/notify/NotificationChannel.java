package io.consensusset.core.notify;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Queue-backed subscriber for consumers on their own thread. Each delivery is
 * acknowledged as soon as it is enqueued.
 */
public final class NotificationChannel implements ConsensusSubscriber {

    private final BlockingQueue<ConsensusChange> queue = new LinkedBlockingQueue<>();

    @Override
    public void processConsensusChange(ConsensusChange change) {
        queue.add(change);
    }

    /** Waits for the next change. */
    public ConsensusChange take() throws InterruptedException {
        return queue.take();
    }

    /** Next change, or null if none arrives in time. */
    public ConsensusChange poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int pending() {
        return queue.size();
    }
}
