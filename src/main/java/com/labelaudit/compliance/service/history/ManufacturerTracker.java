package com.labelaudit.compliance.service.history;

import com.labelaudit.compliance.exception.DuplicateEntryException;
import com.labelaudit.compliance.exception.HistoryPersistenceException;
import com.labelaudit.compliance.model.ComplianceResult;
import com.labelaudit.compliance.model.ManufacturerHistoryEntry;
import com.labelaudit.compliance.model.ManufacturerProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Sole writer of manufacturer history. Each manufacturer key has its own lock, so the
 * read-dedupe-append-recompute sequence for one manufacturer never interleaves,
 * while different manufacturers proceed in parallel.
 *
 * <p>Store failures never escape {@link #record}; they come back as
 * {@link TrackingOutcome.Status#NOT_RECORDED}.
 */
@Service
public class ManufacturerTracker {
    private static final Logger log = LoggerFactory.getLogger(ManufacturerTracker.class);

    private final HistoryStore store;
    private final TrendCalculator trendCalculator;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public ManufacturerTracker(HistoryStore store, TrendCalculator trendCalculator) {
        this.store = store;
        this.trendCalculator = trendCalculator;
    }

    public TrackingOutcome record(String manufacturerName, ComplianceResult result, String productTitle) {
        Optional<String> normalized = ManufacturerKeyNormalizer.normalize(manufacturerName);
        if (normalized.isEmpty()) {
            log.debug("No manufacturer identity for {}; history not updated", result.getProductIdentifier());
            return TrackingOutcome.skipped("No manufacturer identity available");
        }
        String key = normalized.get();
        ManufacturerHistoryEntry entry = ManufacturerHistoryEntry.from(key, manufacturerName.trim(), result,
                productTitle, result.getEvaluatedAt());

        synchronized (lockFor(key)) {
            try {
                List<ManufacturerHistoryEntry> entries = new ArrayList<>(guard(() -> store.readEntries(key)));
                if (entries.contains(entry)) {
                    log.info("Duplicate history entry {} for {}; ignored", entry.getCompositeKey(), key);
                    return TrackingOutcome.duplicate(trendCalculator.profileOf(key, entries));
                }
                try {
                    guard(() -> {
                        store.append(entry);
                        return null;
                    });
                } catch (DuplicateEntryException e) {
                    log.info("Store already holds {} for {}; ignored", e.getCompositeKey(), key);
                    return TrackingOutcome.duplicate(trendCalculator.profileOf(key, guard(() -> store.readEntries(key))));
                }
                entries.add(entry);
                ManufacturerProfile profile = trendCalculator.profileOf(key, entries);
                writeSnapshot(profile);
                log.info("Recorded {} for {}: count={}, mean={}, trend={}", result.getProductIdentifier(), key,
                        profile.getCount(), String.format("%.3f", profile.getMeanScore()), profile.getTrend());
                return TrackingOutcome.recorded(profile);
            } catch (HistoryPersistenceException e) {
                log.warn("History not recorded for {} ({}): {}", key, result.getProductIdentifier(), e.getMessage());
                return TrackingOutcome.notRecorded(key, e.getMessage());
            }
        }
    }

    /**
     * Current profile for a manufacturer name or key. Uses the snapshot only when it
     * covers every logged entry and rebuilds it from the entry log otherwise.
     */
    public ManufacturerProfile profile(String manufacturerName) {
        Optional<String> normalized = ManufacturerKeyNormalizer.normalize(manufacturerName);
        if (normalized.isEmpty()) return ManufacturerProfile.unknown(null);
        String key = normalized.get();
        synchronized (lockFor(key)) {
            List<ManufacturerHistoryEntry> entries = guard(() -> store.readEntries(key));
            Optional<ManufacturerProfile> snapshot = guard(() -> store.readAggregate(key));
            if (snapshot.isPresent() && snapshot.get().getCount() == entries.size()) return snapshot.get();
            ManufacturerProfile rebuilt = trendCalculator.profileOf(key, entries);
            if (!entries.isEmpty()) {
                log.info("Rebuilt profile snapshot for {} from {} entries (snapshot count {})", key, entries.size(),
                        snapshot.map(ManufacturerProfile::getCount).map(String::valueOf).orElse("none"));
                writeSnapshot(rebuilt);
            }
            return rebuilt;
        }
    }

    public List<ManufacturerHistoryEntry> entries(String manufacturerName) {
        return ManufacturerKeyNormalizer.normalize(manufacturerName)
                .map(key -> guard(() -> store.readEntries(key)))
                .orElse(List.of());
    }

    public Set<String> manufacturerKeys() {
        return guard(store::manufacturerKeys);
    }

    /** The snapshot is a cache; a failed write leaves the log authoritative. */
    private void writeSnapshot(ManufacturerProfile profile) {
        try {
            guard(() -> {
                store.writeAggregate(profile);
                return null;
            });
        } catch (HistoryPersistenceException e) {
            log.warn("Profile snapshot for {} not written: {}", profile.getManufacturerKey(), e.getMessage());
        }
    }

    private Object lockFor(String key) {
        return locks.computeIfAbsent(key, k -> new Object());
    }

    /** Passes store errors through and wraps anything else a store throws. */
    private static <T> T guard(Supplier<T> call) {
        try {
            return call.get();
        } catch (HistoryPersistenceException | DuplicateEntryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HistoryPersistenceException("History store failure: " + e, e);
        }
    }
}
