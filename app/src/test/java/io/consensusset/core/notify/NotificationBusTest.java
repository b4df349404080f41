package io.consensusset.core.notify;

import io.consensusset.core.protocol.Hash;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NotificationBusTest {

    private static final ConsensusChange CHANGE =
            new ConsensusChange(List.of(), List.of(Hash.ofTag(1)), List.of(), 1L);

    @Test
    void deliversTierByTierInRegistrationOrder() {
        NotificationBus bus = new NotificationBus();
        List<String> seen = new ArrayList<>();
        bus.subscribe(SubscriberTier.POOL_DEPENDENT, c -> seen.add("wallet"));
        bus.subscribe(SubscriberTier.TRANSACTION_POOL, c -> seen.add("tpool"));
        bus.subscribe(SubscriberTier.CONSENSUS, c -> seen.add("explorer"));
        bus.subscribe(SubscriberTier.POOL_DEPENDENT, c -> seen.add("miner"));
        bus.subscribe(SubscriberTier.CONSENSUS, c -> seen.add("renter"));

        bus.deliver(CHANGE);

        assertEquals(List.of("explorer", "renter", "tpool", "wallet", "miner"), seen);
    }

    @Test
    void failingSubscriberDoesNotStopDelivery() {
        NotificationBus bus = new NotificationBus();
        List<Long> heights = new ArrayList<>();
        bus.subscribe(SubscriberTier.CONSENSUS, c -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(SubscriberTier.CONSENSUS, c -> heights.add(c.height()));

        bus.deliver(CHANGE);

        assertEquals(List.of(1L), heights);
    }

    @Test
    void closedSubscriptionReceivesNothing() {
        NotificationBus bus = new NotificationBus();
        List<ConsensusChange> seen = new ArrayList<>();
        Subscription sub = bus.subscribe(SubscriberTier.CONSENSUS, seen::add);
        assertEquals(1, bus.subscriberCount());

        sub.close();
        sub.close();
        bus.deliver(CHANGE);

        assertFalse(sub.isActive());
        assertTrue(seen.isEmpty());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void channelQueuesChanges() throws Exception {
        NotificationChannel channel = new NotificationChannel();
        NotificationBus bus = new NotificationBus();
        bus.subscribe(SubscriberTier.CONSENSUS, channel);

        bus.deliver(CHANGE);

        assertEquals(1, channel.pending());
        assertSame(CHANGE, channel.take());
        assertNull(channel.poll(10, TimeUnit.MILLISECONDS));
    }
}
