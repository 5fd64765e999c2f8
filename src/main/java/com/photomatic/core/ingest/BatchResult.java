package com.photomatic.core.ingest;

import com.photomatic.core.model.PhotoRecord;

import java.util.List;

/**
 * Outcome of one ingestion batch. {@code records} keeps the submission order.
 */
public record BatchResult(List<PhotoRecord> records, List<IngestFailure> failures) {

    public BatchResult {
        records = List.copyOf(records);
        failures = List.copyOf(failures);
    }

    public static BatchResult empty() {
        return new BatchResult(List.of(), List.of());
    }

    public int submitted() {
        return records.size() + failures.size();
    }

    public boolean isEmpty() {
        return submitted() == 0;
    }
}
