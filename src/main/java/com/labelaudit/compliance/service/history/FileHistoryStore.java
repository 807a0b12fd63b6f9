package com.labelaudit.compliance.service.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labelaudit.compliance.config.ComplianceProperties;
import com.labelaudit.compliance.exception.DuplicateEntryException;
import com.labelaudit.compliance.exception.HistoryPersistenceException;
import com.labelaudit.compliance.model.ManufacturerHistoryEntry;
import com.labelaudit.compliance.model.ManufacturerProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File-backed history. Per manufacturer key:
 * <ul>
 *   <li>{@code <dir>/<key>.events.jsonl} - one JSON entry per line, append only</li>
 *   <li>{@code <dir>/<key>.profile.json} - profile snapshot, replaced atomically</li>
 * </ul>
 * Keys are URL-encoded into file names. Encodings longer than {@value #MAX_STEM} characters
 * are cut down to a prefix plus the SHA-256 of the key, so the key itself is read back
 * from the log rather than from the file name.
 */
@Component
@ConditionalOnProperty(prefix = "compliance.history", name = "store", havingValue = "file", matchIfMissing = true)
public class FileHistoryStore implements HistoryStore {
    private static final Logger log = LoggerFactory.getLogger(FileHistoryStore.class);

    static final String EVENTS_SUFFIX = ".events.jsonl";
    static final String PROFILE_SUFFIX = ".profile.json";
    static final int MAX_STEM = 120;
    private static final int HASHED_PREFIX = 40;

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    @Autowired
    public FileHistoryStore(ComplianceProperties properties, ObjectMapper objectMapper) {
        this(Path.of(resolveDirectory(properties)), objectMapper);
    }

    public FileHistoryStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        log.info("Manufacturer history stored under {}", directory.toAbsolutePath());
    }

    private static String resolveDirectory(ComplianceProperties properties) {
        String dir = properties.getHistory().getDirectory();
        if (dir == null || dir.isBlank()) dir = "tmp/manufacturer-history";
        return dir;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void append(ManufacturerHistoryEntry entry) {
        String key = entry.getManufacturerKey();
        synchronized (lockFor(key)) {
            for (ManufacturerHistoryEntry e : readEntriesLocked(key)) {
                if (e.getCompositeKey().equals(entry.getCompositeKey())) {
                    throw new DuplicateEntryException(key, entry.getCompositeKey());
                }
            }
            Path events = eventsPath(key);
            try {
                String line = objectMapper.writeValueAsString(entry) + "\n";
                Files.createDirectories(directory);
                Files.write(events, line.getBytes(StandardCharsets.UTF_8),
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            } catch (IOException e) {
                throw new HistoryPersistenceException("Cannot append to " + events + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public List<ManufacturerHistoryEntry> readEntries(String manufacturerKey) {
        synchronized (lockFor(manufacturerKey)) {
            return readEntriesLocked(manufacturerKey);
        }
    }

    private List<ManufacturerHistoryEntry> readEntriesLocked(String key) {
        Path events = eventsPath(key);
        if (!Files.exists(events)) return List.of();
        List<String> lines;
        try {
            lines = Files.readAllLines(events, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new HistoryPersistenceException("Cannot read " + events + ": " + e.getMessage(), e);
        }
        List<ManufacturerHistoryEntry> out = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) continue;
            try {
                out.add(objectMapper.readValue(line, ManufacturerHistoryEntry.class));
            } catch (JsonProcessingException e) {
                throw new HistoryPersistenceException("Corrupt entry at " + events + ":" + lineNo, e);
            }
        }
        return out;
    }

    /** Empty when the snapshot is missing or cannot be parsed; the log still holds the truth. */
    @Override
    public Optional<ManufacturerProfile> readAggregate(String manufacturerKey) {
        Path profile = profilePath(manufacturerKey);
        synchronized (lockFor(manufacturerKey)) {
            if (!Files.exists(profile)) return Optional.empty();
            try {
                return Optional.of(objectMapper.readValue(profile.toFile(), ManufacturerProfile.class));
            } catch (IOException e) {
                log.warn("Ignoring unreadable profile snapshot {}: {}", profile, e.toString());
                return Optional.empty();
            }
        }
    }

    @Override
    public void writeAggregate(ManufacturerProfile profile) {
        String key = profile.getManufacturerKey();
        Path target = profilePath(key);
        synchronized (lockFor(key)) {
            try {
                Files.createDirectories(directory);
                Path tmp = Files.createTempFile(directory, "profile-", ".tmp");
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), profile);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                throw new HistoryPersistenceException("Cannot write " + target + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public Set<String> manufacturerKeys() {
        if (!Files.isDirectory(directory)) return Set.of();
        Set<String> keys = new TreeSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EVENTS_SUFFIX)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                String stem = name.substring(0, name.length() - EVENTS_SUFFIX.length());
                Optional<String> logged = firstLoggedKey(p);
                if (logged.isPresent()) {
                    keys.add(logged.get());
                } else if (!stem.contains("~")) {
                    keys.add(decode(stem));
                }
            }
        } catch (IOException e) {
            throw new HistoryPersistenceException("Cannot list " + directory + ": " + e.getMessage(), e);
        }
        return Collections.unmodifiableSet(keys);
    }

    private Optional<String> firstLoggedKey(Path events) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(events, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    return Optional.ofNullable(objectMapper.readValue(line, ManufacturerHistoryEntry.class)
                            .getManufacturerKey());
                } catch (JsonProcessingException e) {
                    throw new HistoryPersistenceException("Corrupt entry at " + events + ":" + lineNo, e);
                }
            }
        }
        return Optional.empty();
    }

    Path eventsPath(String key) {
        return directory.resolve(stem(key) + EVENTS_SUFFIX);
    }

    Path profilePath(String key) {
        return directory.resolve(stem(key) + PROFILE_SUFFIX);
    }

    /** URL-encoded key, or a bounded prefix of it joined to the key's SHA-256 by {@code ~}. */
    static String stem(String key) {
        String encoded = encode(key);
        if (encoded.length() <= MAX_STEM) return encoded;
        int cut = HASHED_PREFIX;
        // never split a %XX escape
        int escape = encoded.lastIndexOf('%', cut - 1);
        if (escape >= 0 && escape > cut - 3) cut = escape;
        return encoded.substring(0, cut) + "~" + sha256Hex(key);
    }

    private Object lockFor(String key) {
        return locks.computeIfAbsent(key, k -> new Object());
    }

    private static String encode(String key) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8).replace("*", "%2A");
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] d = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : d) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String decode(String fileStem) {
        return URLDecoder.decode(fileStem, StandardCharsets.UTF_8);
    }
}
