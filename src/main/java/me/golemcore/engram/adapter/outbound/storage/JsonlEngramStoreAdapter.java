package me.golemcore.engram.adapter.outbound.storage;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramSortField;
import me.golemcore.engram.domain.model.EngramUpdate;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.EngramStoreException;
import me.golemcore.engram.port.outbound.EngramStorePort;
import me.golemcore.engram.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Engram store backed by one JSONL file per thread on top of
 * {@link StoragePort}.
 *
 * <p>
 * Every write replaces the thread file through an atomic rename, so readers see
 * either the previous or the new population and never a partial engram.
 * Read-modify-write cycles (insert, update, soft delete) are serialized per
 * thread file, which gives per-record atomicity within a process.
 *
 * <p>
 * Lines that fail to parse are reported and written back verbatim on the next
 * rewrite, so a damaged row is never dropped by an unrelated update.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlEngramStoreAdapter implements EngramStorePort {

    private static final String FILE_SUFFIX = ".jsonl";
    private static final int LOCK_STRIPES = 64;

    private final StoragePort storagePort;
    private final EngramProperties properties;
    private final ObjectMapper objectMapper;

    private final Object[] threadLocks = createLocks();

    @Override
    public CompletableFuture<Engram> insert(Engram engram) {
        if (engram == null || engram.getThreadId() == null || engram.getId() == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Engram with id and threadId is required"));
        }
        return CompletableFuture.supplyAsync(() -> {
            String threadId = engram.getThreadId();
            synchronized (monitorFor(threadId)) {
                ThreadFile file = readThread(threadId);
                List<Engram> engrams = file.engrams();
                boolean duplicate = engrams.stream().anyMatch(existing -> engram.getId().equals(existing.getId()));
                if (duplicate) {
                    throw new EngramStoreException("Engram already exists: " + engram.getId());
                }
                engrams.add(engram);
                writeThread(threadId, file);
                log.debug("[EngramStore] Inserted engram {} for thread {}", engram.getId(), threadId);
                return engram;
            }
        });
    }

    @Override
    public CompletableFuture<List<Engram>> findActiveByThread(String threadId) {
        return CompletableFuture.supplyAsync(() -> readThread(threadId).engrams().stream()
                .filter(engram -> !engram.isDeleted())
                .toList());
    }

    @Override
    public CompletableFuture<List<Engram>> findAllByThread(String threadId) {
        return CompletableFuture.supplyAsync(() -> List.copyOf(readThread(threadId).engrams()));
    }

    @Override
    public CompletableFuture<List<Engram>> findActiveByThreadOrdered(String threadId, EngramSortField sortField,
            boolean descending, int limit) {
        Comparator<Engram> comparator = comparatorFor(sortField);
        Comparator<Engram> ordered = descending ? comparator.reversed() : comparator;
        return findActiveByThread(threadId).thenApply(engrams -> engrams.stream()
                .sorted(ordered)
                .limit(Math.max(0, limit))
                .toList());
    }

    @Override
    public CompletableFuture<Optional<Engram>> update(String threadId, String engramId, EngramUpdate update) {
        return CompletableFuture.supplyAsync(() -> {
            synchronized (monitorFor(threadId)) {
                ThreadFile file = readThread(threadId);
                for (Engram engram : file.engrams()) {
                    if (engramId.equals(engram.getId())) {
                        apply(engram, update);
                        writeThread(threadId, file);
                        return Optional.of(engram);
                    }
                }
                return Optional.<Engram>empty();
            }
        });
    }

    @Override
    public CompletableFuture<Integer> softDeleteMatching(Predicate<Engram> predicate) {
        return CompletableFuture.supplyAsync(() -> {
            int deleted = 0;
            for (String threadId : listThreadIds()) {
                deleted += softDeleteInThread(threadId, predicate);
            }
            return deleted;
        });
    }

    private int softDeleteInThread(String threadId, Predicate<Engram> predicate) {
        synchronized (monitorFor(threadId)) {
            ThreadFile file = readThread(threadId);
            int deleted = 0;
            for (Engram engram : file.engrams()) {
                if (!engram.isDeleted() && predicate.test(engram)) {
                    engram.setDeleted(true);
                    deleted++;
                }
            }
            if (deleted > 0) {
                writeThread(threadId, file);
                log.debug("[EngramStore] Soft-deleted {} engram(s) in thread {}", deleted, threadId);
            }
            return deleted;
        }
    }

    private void apply(Engram engram, EngramUpdate update) {
        if (update.getAccessIncrement() > 0) {
            engram.setAccessCount(engram.getAccessCount() + update.getAccessIncrement());
        }
        if (update.getRelevanceBoost() > 0) {
            double boosted = engram.getRelevanceScore() + update.getRelevanceBoost();
            if (update.getRelevanceCap() != null) {
                boosted = Math.min(boosted, update.getRelevanceCap());
            }
            engram.setRelevanceScore(Math.max(engram.getRelevanceScore(), boosted));
        }
        Instant lastAccessedAt = update.getLastAccessedAt();
        if (lastAccessedAt != null
                && (engram.getLastAccessedAt() == null || lastAccessedAt.isAfter(engram.getLastAccessedAt()))) {
            engram.setLastAccessedAt(lastAccessedAt);
        }
        if (update.isMarkDeleted()) {
            engram.setDeleted(true);
        }
    }

    private List<String> listThreadIds() {
        List<String> files = storagePort.listFiles(getDirectory()).join();
        List<String> threadIds = new ArrayList<>();
        for (String file : files) {
            if (file.endsWith(FILE_SUFFIX)) {
                String encoded = file.substring(0, file.length() - FILE_SUFFIX.length());
                threadIds.add(URLDecoder.decode(encoded, StandardCharsets.UTF_8));
            }
        }
        return threadIds;
    }

    private ThreadFile readThread(String threadId) {
        List<Engram> engrams = new ArrayList<>();
        List<String> unreadable = new ArrayList<>();
        String content = storagePort.getText(getDirectory(), fileName(threadId)).join();
        if (content == null || content.isBlank()) {
            return new ThreadFile(engrams, unreadable);
        }
        for (String line : content.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                engrams.add(objectMapper.readValue(line, Engram.class));
            } catch (IOException e) {
                log.warn("[EngramStore] Unreadable engram line in thread {}, keeping it as is: {}",
                        threadId, e.getMessage());
                unreadable.add(line);
            }
        }
        return new ThreadFile(engrams, unreadable);
    }

    private void writeThread(String threadId, ThreadFile file) {
        StringBuilder payload = new StringBuilder();
        for (Engram engram : file.engrams()) {
            try {
                payload.append(objectMapper.writeValueAsString(engram)).append('\n');
            } catch (JsonProcessingException e) {
                throw new EngramStoreException("Failed to serialize engram " + engram.getId(), e);
            }
        }
        for (String line : file.unreadable()) {
            payload.append(line).append('\n');
        }
        storagePort.replaceText(getDirectory(), fileName(threadId), payload.toString()).join();
    }

    private Comparator<Engram> comparatorFor(EngramSortField sortField) {
        return switch (sortField) {
        case CREATED_AT -> Comparator.comparing(Engram::getCreatedAt,
                Comparator.nullsFirst(Comparator.naturalOrder()));
        case LAST_ACCESSED_AT -> Comparator.comparing(Engram::getLastAccessedAt,
                Comparator.nullsFirst(Comparator.naturalOrder()));
        case RELEVANCE_SCORE -> Comparator.comparingDouble(Engram::getRelevanceScore);
        case ACCESS_COUNT -> Comparator.comparingInt(Engram::getAccessCount);
        };
    }

    private Object monitorFor(String threadId) {
        return threadLocks[Math.floorMod(threadId.hashCode(), LOCK_STRIPES)];
    }

    private static Object[] createLocks() {
        Object[] locks = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
        return locks;
    }

    private String fileName(String threadId) {
        return URLEncoder.encode(threadId, StandardCharsets.UTF_8) + FILE_SUFFIX;
    }

    private String getDirectory() {
        String configured = properties.getStorage().getDirectory();
        if (configured == null || configured.isBlank()) {
            return "engrams";
        }
        return configured;
    }

    private record ThreadFile(List<Engram> engrams, List<String> unreadable) {
    }
}
