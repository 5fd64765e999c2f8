package com.photomatic.core.session;

/**
 * Notified synchronously after every store mutation. Read the new state through
 * {@link SessionStore#snapshot()}.
 */
@FunctionalInterface
public interface SessionListener {

    void sessionChanged();
}
