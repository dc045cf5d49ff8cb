package me.golemcore.council.domain.knowledge;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.model.KnowledgeEntry;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import me.golemcore.council.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the knowledge base and the reinforcement memory of its entries.
 *
 * <p>
 * Entries load lazily from {@code knowledge/**.json} (each file a JSON array)
 * with memory overrides from {@code knowledge/memory-stats.json}. Readers work
 * on an immutable snapshot; reinforcement and penalty updates build a new
 * snapshot under a single writer lock, persist it, and only then swap it in.
 */
@Service
@Slf4j
public class KnowledgeStoreService {

    private static final TypeReference<List<KnowledgeEntry>> ENTRY_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, KnowledgeEntry.MemoryStats>> STATS_MAP = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final CouncilProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Snapshot snapshot;

    public KnowledgeStoreService(StoragePort storagePort, CouncilProperties properties, ObjectMapper objectMapper,
            Clock clock) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public List<KnowledgeEntry> all() {
        return current().entries();
    }

    public List<KnowledgeEntry> byDomain(String domain) {
        if (domain == null) {
            return List.of();
        }
        String normalized = domain.toLowerCase(Locale.ROOT);
        return current().entries().stream()
                .filter(entry -> entry.getDomain() != null
                        && entry.getDomain().toLowerCase(Locale.ROOT).equals(normalized))
                .toList();
    }

    public Optional<KnowledgeEntry> findById(String id) {
        return Optional.ofNullable(current().byId().get(id));
    }

    public boolean isFallback() {
        return current().fallback();
    }

    /**
     * Count one successful reuse per occurrence of a known id.
     *
     * @return reinforcements applied, 0 if persisting failed
     */
    public int reinforce(Collection<String> ids) {
        return attribute(ids, List.of()).map(Attribution::reinforced).orElse(0);
    }

    /**
     * Attribute one failure per occurrence of a known id.
     *
     * @return penalties applied, 0 if persisting failed
     */
    public int penalize(Collection<String> ids) {
        return attribute(List.of(), ids).map(Attribution::penalized).orElse(0);
    }

    /**
     * Apply reinforcements and penalties as one snapshot update. An id listed
     * twice counts twice; unknown ids are ignored.
     *
     * @return the counts applied, or empty when the memory stats could not be
     *         persisted and nothing changed
     */
    public Optional<Attribution> attribute(Collection<String> reinforcedIds, Collection<String> penalizedIds) {
        Map<String, Integer> reinforcements = countUses(reinforcedIds);
        Map<String, Integer> penalties = countUses(penalizedIds);
        if (reinforcements.isEmpty() && penalties.isEmpty()) {
            return Optional.of(new Attribution(0, 0));
        }
        Instant now = clock.instant();
        writeLock.lock();
        try {
            Snapshot previous = current();
            List<KnowledgeEntry> updated = new ArrayList<>(previous.entries().size());
            int reinforced = 0;
            int penalized = 0;
            for (KnowledgeEntry entry : previous.entries()) {
                int successes = reinforcements.getOrDefault(entry.getId(), 0);
                int failures = penalties.getOrDefault(entry.getId(), 0);
                if (successes == 0 && failures == 0) {
                    updated.add(entry);
                    continue;
                }
                KnowledgeEntry.MemoryStats stats = entry.getMemory() != null
                        ? entry.getMemory()
                        : new KnowledgeEntry.MemoryStats();
                KnowledgeEntry.MemoryStats.MemoryStatsBuilder next = stats.toBuilder()
                        .reinforcementCount(stats.getReinforcementCount() + successes)
                        .penaltyCount(stats.getPenaltyCount() + failures);
                if (successes > 0) {
                    next.lastReinforcedAt(now);
                }
                updated.add(entry.toBuilder().memory(next.build()).build());
                reinforced += successes;
                penalized += failures;
            }
            if (reinforced == 0 && penalized == 0) {
                return Optional.of(new Attribution(0, 0));
            }

            Snapshot next = Snapshot.of(updated, previous.fallback());
            if (!persistStats(next)) {
                return Optional.empty();
            }
            snapshot = next;
            log.debug("[Knowledge] Applied {} reinforcements and {} penalties", reinforced, penalized);
            return Optional.of(new Attribution(reinforced, penalized));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drop the current snapshot so the next read loads from storage again.
     */
    public void reload() {
        writeLock.lock();
        try {
            snapshot = null;
        } finally {
            writeLock.unlock();
        }
    }

    private static Map<String, Integer> countUses(Collection<String> ids) {
        Map<String, Integer> uses = new LinkedHashMap<>();
        if (ids != null) {
            for (String id : ids) {
                if (id != null) {
                    uses.merge(id, 1, Integer::sum);
                }
            }
        }
        return uses;
    }

    private boolean persistStats(Snapshot next) {
        Map<String, KnowledgeEntry.MemoryStats> stats = new LinkedHashMap<>();
        for (KnowledgeEntry entry : next.entries()) {
            if (entry.getMemory() != null) {
                stats.put(entry.getId(), entry.getMemory());
            }
        }
        try {
            String json = objectMapper.writeValueAsString(stats);
            storagePort.putTextAtomic(directory(), properties.getKnowledge().getMemoryStatsFile(), json, true)
                    .join();
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Knowledge] Failed to persist memory stats, keeping previous state: {}", e.getMessage());
            return false;
        }
    }

    private Snapshot current() {
        Snapshot local = snapshot;
        if (local == null) {
            synchronized (this) {
                local = snapshot;
                if (local == null) {
                    local = load();
                    snapshot = local;
                }
            }
        }
        return local;
    }

    private Snapshot load() {
        List<KnowledgeEntry> entries = new ArrayList<>();
        String statsFile = properties.getKnowledge().getMemoryStatsFile();
        try {
            List<String> files = storagePort.listObjects(directory(), "").join();
            for (String file : files) {
                if (file.endsWith(".json") && !file.equals(statsFile)) {
                    entries.addAll(loadFile(file));
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Knowledge] Failed to list knowledge files: {}", e.getMessage());
        }

        boolean fallback = false;
        if (entries.isEmpty() && properties.getKnowledge().isBuiltinFallback()) {
            log.info("[Knowledge] Knowledge base empty, using builtin entries");
            entries.addAll(BuiltinKnowledge.entries());
            fallback = true;
        }

        applyStoredStats(entries);
        log.info("[Knowledge] Loaded {} entries{}", entries.size(), fallback ? " (builtin)" : "");
        return Snapshot.of(entries, fallback);
    }

    private List<KnowledgeEntry> loadFile(String file) {
        try {
            String json = storagePort.getText(directory(), file).join();
            if (json == null || json.isBlank()) {
                return List.of();
            }
            List<KnowledgeEntry> parsed = objectMapper.readValue(json, ENTRY_LIST);
            List<KnowledgeEntry> valid = new ArrayList<>();
            for (KnowledgeEntry entry : parsed) {
                if (isValid(entry)) {
                    valid.add(entry);
                } else {
                    log.trace("[Knowledge] Skipping incomplete entry in {}", file);
                }
            }
            return valid;
        } catch (IOException | RuntimeException e) {
            log.warn("[Knowledge] Skipping unreadable knowledge file {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private void applyStoredStats(List<KnowledgeEntry> entries) {
        try {
            String json = storagePort.getText(directory(), properties.getKnowledge().getMemoryStatsFile()).join();
            if (json == null || json.isBlank()) {
                return;
            }
            Map<String, KnowledgeEntry.MemoryStats> stats = objectMapper.readValue(json, STATS_MAP);
            entries.replaceAll(entry -> stats.containsKey(entry.getId())
                    ? entry.toBuilder().memory(stats.get(entry.getId())).build()
                    : entry);
        } catch (IOException | RuntimeException e) {
            log.warn("[Knowledge] Ignoring unreadable memory stats: {}", e.getMessage());
        }
    }

    private boolean isValid(KnowledgeEntry entry) {
        return entry != null
                && entry.getId() != null && !entry.getId().isBlank()
                && entry.getType() != null
                && entry.getContent() != null && !entry.getContent().isBlank();
    }

    private String directory() {
        return properties.getKnowledge().getDirectory();
    }

    /**
     * Counts applied by one {@link #attribute} call.
     */
    public record Attribution(int reinforced, int penalized) {
    }

    private record Snapshot(List<KnowledgeEntry> entries, Map<String, KnowledgeEntry> byId, boolean fallback) {

        static Snapshot of(List<KnowledgeEntry> entries, boolean fallback) {
            Map<String, KnowledgeEntry> byId = new LinkedHashMap<>();
            for (KnowledgeEntry entry : entries) {
                byId.putIfAbsent(entry.getId(), entry);
            }
            return new Snapshot(List.copyOf(entries), Collections.unmodifiableMap(byId), fallback);
        }
    }
}
