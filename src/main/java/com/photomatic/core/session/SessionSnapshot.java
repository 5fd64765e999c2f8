package com.photomatic.core.session;

import com.photomatic.core.model.PhotoRecord;

import java.util.List;
import java.util.Optional;

/**
 * Immutable view of the store at one point in time.
 */
public record SessionSnapshot(List<PhotoRecord> records, int selectedIndex) {

    public SessionSnapshot {
        records = List.copyOf(records);
    }

    public Optional<PhotoRecord> selected() {
        if (selectedIndex < 0 || selectedIndex >= records.size()) {
            return Optional.empty();
        }
        return Optional.of(records.get(selectedIndex));
    }
}
