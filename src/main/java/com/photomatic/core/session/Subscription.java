package com.photomatic.core.session;

/**
 * Handle returned by {@code subscribe}; closing it removes the listener. Closing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
