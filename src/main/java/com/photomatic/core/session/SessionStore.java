package com.photomatic.core.session;

import com.photomatic.core.model.PhotoRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered photos of a session plus the selected index. Owned by a single thread; every
 * mutation notifies all listeners before it returns.
 * <p>
 * Notification walks the listener list as it was when the mutation started: a listener added
 * meanwhile waits for the next mutation, one removed meanwhile is still called.
 */
public final class SessionStore {

    private final List<PhotoRecord> records = new ArrayList<>();
    private final CopyOnWriteArrayList<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private int selectedIndex;

    /**
     * Drops every photo, keeps {@code newRecords} and selects the first one.
     */
    public void replaceAll(Collection<PhotoRecord> newRecords) {
        List<PhotoRecord> copy = copyOf(newRecords);
        records.clear();
        records.addAll(copy);
        selectedIndex = 0;
        notifyListeners();
    }

    /**
     * Adds photos at the end; the selection stays where it is.
     */
    public void append(Collection<PhotoRecord> moreRecords) {
        records.addAll(copyOf(moreRecords));
        notifyListeners();
    }

    /**
     * Selects {@code index} clamped to the valid range. Listeners hear about it only when the
     * selection actually moves.
     */
    public void select(int index) {
        int clamped = records.isEmpty() ? 0 : Math.max(0, Math.min(index, records.size() - 1));
        if (clamped == selectedIndex) {
            return;
        }
        selectedIndex = clamped;
        notifyListeners();
    }

    public Subscription subscribe(SessionListener listener) {
        Objects.requireNonNull(listener, "listener");
        SessionListener wrapper = listener::sessionChanged;
        listeners.add(wrapper);
        return () -> listeners.remove(wrapper);
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(records, selectedIndex);
    }

    public Optional<PhotoRecord> selected() {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(records.get(selectedIndex));
    }

    public int selectedIndex() {
        return selectedIndex;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    private void notifyListeners() {
        for (SessionListener listener : listeners) {
            listener.sessionChanged();
        }
    }

    private static List<PhotoRecord> copyOf(Collection<PhotoRecord> incoming) {
        if (incoming == null) {
            return List.of();
        }
        List<PhotoRecord> copy = new ArrayList<>(incoming.size());
        for (PhotoRecord record : incoming) {
            copy.add(Objects.requireNonNull(record, "record"));
        }
        return copy;
    }
}
