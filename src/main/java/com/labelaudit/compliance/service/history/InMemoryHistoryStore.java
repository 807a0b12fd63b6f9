package com.labelaudit.compliance.service.history;

import com.labelaudit.compliance.exception.DuplicateEntryException;
import com.labelaudit.compliance.model.ManufacturerHistoryEntry;
import com.labelaudit.compliance.model.ManufacturerProfile;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "compliance.history", name = "store", havingValue = "memory")
public class InMemoryHistoryStore implements HistoryStore {

    private final Map<String, List<ManufacturerHistoryEntry>> entries = new ConcurrentHashMap<>();
    private final Map<String, ManufacturerProfile> aggregates = new ConcurrentHashMap<>();

    @Override
    public void append(ManufacturerHistoryEntry entry) {
        List<ManufacturerHistoryEntry> log = entries.computeIfAbsent(entry.getManufacturerKey(),
                k -> Collections.synchronizedList(new ArrayList<>()));
        synchronized (log) {
            for (ManufacturerHistoryEntry e : log) {
                if (e.getCompositeKey().equals(entry.getCompositeKey())) {
                    throw new DuplicateEntryException(entry.getManufacturerKey(), entry.getCompositeKey());
                }
            }
            log.add(entry);
        }
    }

    @Override
    public List<ManufacturerHistoryEntry> readEntries(String manufacturerKey) {
        List<ManufacturerHistoryEntry> log = entries.get(manufacturerKey);
        if (log == null) return List.of();
        synchronized (log) {
            return List.copyOf(log);
        }
    }

    @Override
    public Optional<ManufacturerProfile> readAggregate(String manufacturerKey) {
        return Optional.ofNullable(aggregates.get(manufacturerKey));
    }

    @Override
    public void writeAggregate(ManufacturerProfile profile) {
        aggregates.put(profile.getManufacturerKey(), profile);
    }

    @Override
    public Set<String> manufacturerKeys() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }
}
