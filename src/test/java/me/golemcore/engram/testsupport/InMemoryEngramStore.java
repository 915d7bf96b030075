package me.golemcore.engram.testsupport;

import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramSortField;
import me.golemcore.engram.domain.model.EngramUpdate;
import me.golemcore.engram.port.outbound.EngramStoreException;
import me.golemcore.engram.port.outbound.EngramStorePort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Engram store fake holding copies of the engrams in memory. Failures can be
 * switched on to exercise degraded paths.
 */
public class InMemoryEngramStore implements EngramStorePort {

    private final Map<String, Engram> engrams = new LinkedHashMap<>();
    private final AtomicBoolean failing = new AtomicBoolean(false);
    private final AtomicInteger insertCount = new AtomicInteger();

    public void setFailing(boolean failing) {
        this.failing.set(failing);
    }

    public int getInsertCount() {
        return insertCount.get();
    }

    public synchronized void put(Engram engram) {
        engrams.put(engram.getId(), copy(engram));
    }

    public synchronized Engram get(String id) {
        Engram engram = engrams.get(id);
        return engram != null ? copy(engram) : null;
    }

    public synchronized List<Engram> all() {
        return engrams.values().stream().map(InMemoryEngramStore::copy).toList();
    }

    @Override
    public CompletableFuture<Engram> insert(Engram engram) {
        if (failing.get()) {
            return failure();
        }
        synchronized (this) {
            if (engrams.containsKey(engram.getId())) {
                return CompletableFuture.failedFuture(new EngramStoreException("duplicate " + engram.getId()));
            }
            engrams.put(engram.getId(), copy(engram));
            insertCount.incrementAndGet();
        }
        return CompletableFuture.completedFuture(engram);
    }

    @Override
    public CompletableFuture<List<Engram>> findActiveByThread(String threadId) {
        if (failing.get()) {
            return failure();
        }
        return CompletableFuture.completedFuture(select(e -> threadId.equals(e.getThreadId()) && !e.isDeleted()));
    }

    @Override
    public CompletableFuture<List<Engram>> findAllByThread(String threadId) {
        if (failing.get()) {
            return failure();
        }
        return CompletableFuture.completedFuture(select(e -> threadId.equals(e.getThreadId())));
    }

    @Override
    public CompletableFuture<List<Engram>> findActiveByThreadOrdered(String threadId, EngramSortField sortField,
            boolean descending, int limit) {
        Comparator<Engram> comparator = switch (sortField) {
        case CREATED_AT -> Comparator.comparing(Engram::getCreatedAt);
        case LAST_ACCESSED_AT -> Comparator.comparing(Engram::getLastAccessedAt);
        case RELEVANCE_SCORE -> Comparator.comparingDouble(Engram::getRelevanceScore);
        case ACCESS_COUNT -> Comparator.comparingInt(Engram::getAccessCount);
        };
        Comparator<Engram> ordered = descending ? comparator.reversed() : comparator;
        return findActiveByThread(threadId)
                .thenApply(list -> list.stream().sorted(ordered).limit(limit).toList());
    }

    @Override
    public CompletableFuture<Optional<Engram>> update(String threadId, String engramId, EngramUpdate update) {
        if (failing.get()) {
            return failure();
        }
        synchronized (this) {
            Engram engram = engrams.get(engramId);
            if (engram == null || !threadId.equals(engram.getThreadId())) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            engram.setAccessCount(engram.getAccessCount() + update.getAccessIncrement());
            if (update.getRelevanceBoost() > 0) {
                double boosted = engram.getRelevanceScore() + update.getRelevanceBoost();
                if (update.getRelevanceCap() != null) {
                    boosted = Math.min(boosted, update.getRelevanceCap());
                }
                engram.setRelevanceScore(Math.max(engram.getRelevanceScore(), boosted));
            }
            if (update.getLastAccessedAt() != null) {
                engram.setLastAccessedAt(update.getLastAccessedAt());
            }
            if (update.isMarkDeleted()) {
                engram.setDeleted(true);
            }
            return CompletableFuture.completedFuture(Optional.of(copy(engram)));
        }
    }

    @Override
    public CompletableFuture<Integer> softDeleteMatching(Predicate<Engram> predicate) {
        if (failing.get()) {
            return failure();
        }
        int deleted = 0;
        synchronized (this) {
            for (Engram engram : engrams.values()) {
                if (!engram.isDeleted() && predicate.test(engram)) {
                    engram.setDeleted(true);
                    deleted++;
                }
            }
        }
        return CompletableFuture.completedFuture(deleted);
    }

    private synchronized List<Engram> select(Predicate<Engram> filter) {
        List<Engram> result = new ArrayList<>();
        for (Engram engram : engrams.values()) {
            if (filter.test(engram)) {
                result.add(copy(engram));
            }
        }
        return result;
    }

    private static <T> CompletableFuture<T> failure() {
        return CompletableFuture.failedFuture(new EngramStoreException("store unavailable"));
    }

    private static Engram copy(Engram engram) {
        return engram.toBuilder()
                .topics(engram.getTopics() != null ? new ArrayList<>(engram.getTopics()) : new ArrayList<>())
                .messageTypes(engram.getMessageTypes() != null
                        ? new LinkedHashMap<>(engram.getMessageTypes())
                        : new LinkedHashMap<>())
                .build();
    }
}
