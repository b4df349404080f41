package io.consensusset.core.notify;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans ledger changes out to subscribers: tier by tier, registration order within a
 * tier, on the caller's thread. A subscriber that throws is logged and skipped; the
 * others still receive the change.
 */
public final class NotificationBus {
    private static final Logger LOG = Logger.getLogger(NotificationBus.class.getName());

    private final Map<SubscriberTier, List<ConsensusSubscriber>> tiers = new EnumMap<>(SubscriberTier.class);

    public NotificationBus() {
        for (SubscriberTier tier : SubscriberTier.values()) {
            tiers.put(tier, new CopyOnWriteArrayList<>());
        }
    }

    public Subscription subscribe(SubscriberTier tier, ConsensusSubscriber subscriber) {
        List<ConsensusSubscriber> list = tiers.get(tier);
        list.add(subscriber);
        AtomicBoolean active = new AtomicBoolean(true);
        return new Subscription() {
            @Override
            public boolean isActive() {
                return active.get();
            }

            @Override
            public void close() {
                if (active.compareAndSet(true, false)) {
                    list.remove(subscriber);
                }
            }
        };
    }

    public void deliver(ConsensusChange change) {
        for (SubscriberTier tier : SubscriberTier.values()) {
            for (ConsensusSubscriber s : tiers.get(tier)) {
                deliverTo(s, change);
            }
        }
    }

    /** Delivers to one subscriber only (used to bring a new subscriber up to date). */
    public void deliverTo(ConsensusSubscriber subscriber, ConsensusChange change) {
        try {
            subscriber.processConsensusChange(change);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Subscriber " + subscriber + " failed on change at height " + change.height(), e);
        }
    }

    public int subscriberCount() {
        int n = 0;
        for (List<ConsensusSubscriber> list : tiers.values()) n += list.size();
        return n;
    }
}
