package com.gamearr.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamearr.integration.CatalogStore;
import com.gamearr.model.CatalogEntry;
import com.gamearr.model.CatalogStatus;
import com.gamearr.model.PendingAcquisition;
import com.gamearr.model.ReleaseInfo;
import com.gamearr.model.UpdateCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Catalog kept in a single JSON document. Every mutation rewrites the file.
 */
public class JsonCatalogStore implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(JsonCatalogStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<Long, CatalogEntry> entries = new LinkedHashMap<>();
    private final Map<Long, PendingAcquisition> pending = new LinkedHashMap<>();
    private final Map<Long, List<UpdateCandidate>> updates = new LinkedHashMap<>();

    public record CatalogDocument(
            Instant updatedAt,
            List<CatalogEntry> entries,
            List<PendingAcquisition> pending,
            Map<Long, List<UpdateCandidate>> updates
    ) {}

    public JsonCatalogStore(Path file, ObjectMapper mapper) {
        this(file, mapper, Clock.systemUTC());
    }

    public JsonCatalogStore(Path file, ObjectMapper mapper, Clock clock) {
        this.file = file;
        this.mapper = mapper;
        this.clock = clock;
    }

    public void load() {
        lock.lock();
        try {
            entries.clear();
            pending.clear();
            updates.clear();
            if (!Files.exists(file)) {
                log.info("Catalog file {} not found, starting empty", file);
                return;
            }
            CatalogDocument doc = mapper.readValue(file.toFile(), CatalogDocument.class);
            if (doc.entries() != null) {
                doc.entries().forEach(e -> entries.put(e.id(), e));
            }
            if (doc.pending() != null) {
                doc.pending().forEach(p -> pending.put(p.entryId(), p));
            }
            if (doc.updates() != null) {
                doc.updates().forEach((id, list) -> updates.put(id, new ArrayList<>(list)));
            }
            log.info("Loaded {} catalog entries from {}", entries.size(), file);
        } catch (IOException e) {
            log.warn("Failed to load catalog {}: {}", file, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    public void save(CatalogEntry entry) {
        lock.lock();
        try {
            entries.put(entry.id(), entry);
            persist();
        } finally {
            lock.unlock();
        }
    }

    public List<CatalogEntry> listAll() {
        lock.lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<CatalogEntry> listMonitoredWanted() {
        return filter(e -> e.monitored() && e.status() == CatalogStatus.WANTED);
    }

    @Override
    public List<CatalogEntry> listAcquired() {
        return filter(e -> e.status() == CatalogStatus.ACQUIRED);
    }

    @Override
    public Optional<CatalogEntry> findById(long id) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PendingAcquisition> listPendingAcquisitions() {
        lock.lock();
        try {
            return List.copyOf(pending.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void markAcquiring(long id, ReleaseInfo release) {
        lock.lock();
        try {
            CatalogEntry entry = require(id);
            entries.put(id, entry.withStatus(CatalogStatus.ACQUIRING));
            pending.put(id, new PendingAcquisition(id, release, clock.instant()));
            persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void markAcquired(long id, ReleaseInfo release) {
        lock.lock();
        try {
            CatalogEntry entry = require(id);
            CatalogEntry updated = entry.withStatus(CatalogStatus.ACQUIRED);
            if (release != null) {
                updated = updated.withInstalled(
                        release.version() != null ? release.version() : entry.installedVersion(),
                        release.quality() != null ? release.quality() : entry.installedQuality());
            }
            entries.put(id, updated);
            pending.remove(id);
            persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void markFailed(long id) {
        lock.lock();
        try {
            CatalogEntry entry = require(id);
            pending.remove(id);
            if (entry.monitored() && entry.status() == CatalogStatus.ACQUIRING) {
                entries.put(id, entry.withStatus(CatalogStatus.WANTED));
            }
            persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<UpdateCandidate> listUpdates(long id) {
        lock.lock();
        try {
            return List.copyOf(updates.getOrDefault(id, List.of()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordUpdates(long id, List<UpdateCandidate> found) {
        if (found == null || found.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            require(id);
            updates.computeIfAbsent(id, k -> new ArrayList<>()).addAll(found);
            persist();
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    private List<CatalogEntry> filter(Predicate<CatalogEntry> predicate) {
        lock.lock();
        try {
            return entries.values().stream().filter(predicate).toList();
        } finally {
            lock.unlock();
        }
    }

    private CatalogEntry require(long id) {
        CatalogEntry entry = entries.get(id);
        if (entry == null) {
            throw new NoSuchElementException("Catalog entry " + id + " not found");
        }
        return entry;
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            CatalogDocument doc = new CatalogDocument(clock.instant(), List.copyOf(entries.values()),
                    List.copyOf(pending.values()), new LinkedHashMap<>(updates));
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), doc);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist catalog " + file, e);
        }
    }
}
