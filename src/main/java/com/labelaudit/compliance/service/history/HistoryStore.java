package com.labelaudit.compliance.service.history;

import com.labelaudit.compliance.exception.DuplicateEntryException;
import com.labelaudit.compliance.exception.HistoryPersistenceException;
import com.labelaudit.compliance.model.ManufacturerHistoryEntry;
import com.labelaudit.compliance.model.ManufacturerProfile;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for manufacturer history: one append-only entry log per manufacturer
 * key plus a derived profile snapshot. The log is the source of truth; the snapshot
 * may be missing or stale and is rebuilt from the log by the caller.
 *
 * <p>Implementations signal I/O failures with {@link HistoryPersistenceException}.
 */
public interface HistoryStore {

    /**
     * Appends an entry to its manufacturer's log.
     *
     * @throws DuplicateEntryException if an entry with the same composite key is already stored
     */
    void append(ManufacturerHistoryEntry entry);

    /** Entries in append order; empty for an unknown key. */
    List<ManufacturerHistoryEntry> readEntries(String manufacturerKey);

    Optional<ManufacturerProfile> readAggregate(String manufacturerKey);

    void writeAggregate(ManufacturerProfile profile);

    Set<String> manufacturerKeys();
}
