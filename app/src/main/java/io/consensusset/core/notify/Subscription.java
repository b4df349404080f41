package io.consensusset.core.notify;

/** Handle returned by subscribe; closing it stops further deliveries. */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
