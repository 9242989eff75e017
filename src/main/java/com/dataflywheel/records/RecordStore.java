package com.dataflywheel.records;

import java.util.List;

public interface RecordStore {
    /**
     * Returns the records captured for a workload and client, oldest first.
     *
     * @throws com.dataflywheel.exception.RecordsNotFoundException when nothing matches
     * @throws com.dataflywheel.exception.RecordStoreUnavailableException when the backend cannot be read
     */
    List<InteractionRecord> fetch(String workloadId, String clientId, TimeRange range);

    /**
     * Stores records that are not already present. Returns how many were new.
     */
    int append(List<InteractionRecord> records);
}
