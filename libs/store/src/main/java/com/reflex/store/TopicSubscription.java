package com.reflex.store;

/** A live topic subscription. Closing it is idempotent. */
@FunctionalInterface
public interface TopicSubscription extends AutoCloseable {

    @Override
    void close();
}
