package com.photomatic.core.session;

import com.photomatic.logging.AppLogger;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * START → LOADING → EDITING, EDITING → LOADING on every further batch, and
 * EDITING → SAVING → EDITING around an export. There is no terminal state.
 */
public final class SessionStateMachine {

    private static final Logger LOGGER = AppLogger.get();

    private final CopyOnWriteArrayList<Consumer<SessionState>> listeners = new CopyOnWriteArrayList<>();
    private SessionState state = SessionState.START;

    public SessionState state() {
        return state;
    }

    public boolean canLoad() {
        return state == SessionState.START || state == SessionState.EDITING;
    }

    public boolean canEdit() {
        return state == SessionState.EDITING;
    }

    public boolean canExport() {
        return state == SessionState.EDITING;
    }

    public void beginLoading() {
        require(canLoad(), "start loading");
        moveTo(SessionState.LOADING);
    }

    /**
     * Ends a batch. The session goes back to START when the batch left it without photos.
     */
    public void finishLoading(boolean hasPhotos) {
        require(state == SessionState.LOADING, "finish loading");
        moveTo(hasPhotos ? SessionState.EDITING : SessionState.START);
    }

    public void beginSaving() {
        require(canExport(), "start saving");
        moveTo(SessionState.SAVING);
    }

    public void finishSaving() {
        require(state == SessionState.SAVING, "finish saving");
        moveTo(SessionState.EDITING);
    }

    public Subscription subscribe(Consumer<SessionState> listener) {
        Objects.requireNonNull(listener, "listener");
        Consumer<SessionState> wrapper = listener::accept;
        listeners.add(wrapper);
        return () -> listeners.remove(wrapper);
    }

    private void require(boolean allowed, String action) {
        if (!allowed) {
            throw new IllegalStateException("Cannot " + action + " while " + state);
        }
    }

    private void moveTo(SessionState next) {
        SessionState previous = state;
        state = next;
        LOGGER.fine(() -> "Session " + previous + " -> " + next);
        for (Consumer<SessionState> listener : listeners) {
            listener.accept(next);
        }
    }
}
