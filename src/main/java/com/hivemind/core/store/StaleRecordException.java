package com.hivemind.core.store;

/**
 * Optimistic-lock conflict: the record was changed by another writer after it was read.
 * Callers re-read the record and decide again.
 */
public class StaleRecordException extends RuntimeException {

    private final String recordId;

    public StaleRecordException(String recordType, String recordId, long expectedVersion, long actualVersion) {
        super(String.format("%s %s was modified concurrently (expected version %d, found %d)",
                recordType, recordId, expectedVersion, actualVersion));
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
