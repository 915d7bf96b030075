package me.golemcore.engram.adapter.outbound.storage;

import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramSortField;
import me.golemcore.engram.domain.model.EngramTrigger;
import me.golemcore.engram.domain.model.EngramUpdate;
import me.golemcore.engram.domain.model.MessageRange;
import me.golemcore.engram.infrastructure.config.AutoConfiguration;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.EngramStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class JsonlEngramStoreAdapterTest {

    private static final String THREAD = "thread-1";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private JsonlEngramStoreAdapter store;

    @BeforeEach
    void setUp() {
        EngramProperties properties = new EngramProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = new JsonlEngramStoreAdapter(storage, properties, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldPersistAllFieldsAcrossReads() {
        Engram engram = engram("e1", THREAD, NOW);
        engram.setTopics(List.of("api", "debug"));
        engram.setHasError(true);
        engram.setMessageTypes(Map.of("ERROR", 2));
        engram.setSourceRange(new MessageRange("m1", "m5", 5));

        store.insert(engram).join();
        List<Engram> loaded = store.findActiveByThread(THREAD).join();

        assertEquals(1, loaded.size());
        Engram stored = loaded.get(0);
        assertEquals("summary e1", stored.getContent());
        assertEquals(List.of("api", "debug"), stored.getTopics());
        assertTrue(stored.isHasError());
        assertEquals(2, stored.getMessageTypes().get("ERROR"));
        assertEquals("m5", stored.getSourceRange().getEndMessageId());
        assertEquals(EngramTrigger.TOKEN_THRESHOLD, stored.getTrigger());
        assertEquals(NOW, stored.getCreatedAt());
    }

    @Test
    void shouldRejectDuplicateInsert() {
        store.insert(engram("e1", THREAD, NOW)).join();

        CompletionException thrown = assertThrows(CompletionException.class,
                () -> store.insert(engram("e1", THREAD, NOW)).join());

        assertInstanceOf(EngramStoreException.class, thrown.getCause());
        assertEquals(1, store.findAllByThread(THREAD).join().size());
    }

    @Test
    void shouldApplyAccessBookkeepingWithCap() {
        Engram engram = engram("e1", THREAD, NOW);
        engram.setRelevanceScore(4.9);
        store.insert(engram).join();
        Instant later = NOW.plusSeconds(60);

        Optional<Engram> updated = store.update(THREAD, "e1", EngramUpdate.builder()
                .accessIncrement(1)
                .relevanceBoost(0.2)
                .relevanceCap(5.0)
                .lastAccessedAt(later)
                .build()).join();

        assertTrue(updated.isPresent());
        Engram reloaded = store.findActiveByThread(THREAD).join().get(0);
        assertEquals(1, reloaded.getAccessCount());
        assertEquals(5.0, reloaded.getRelevanceScore(), 1e-9);
        assertEquals(later, reloaded.getLastAccessedAt());
    }

    @Test
    void shouldNotLowerRelevanceAlreadyAboveCap() {
        Engram engram = engram("e1", THREAD, NOW);
        engram.setRelevanceScore(6.0);
        store.insert(engram).join();

        store.update(THREAD, "e1", EngramUpdate.builder()
                .relevanceBoost(0.2)
                .relevanceCap(5.0)
                .build()).join();

        assertEquals(6.0, store.findActiveByThread(THREAD).join().get(0).getRelevanceScore(), 1e-9);
    }

    @Test
    void shouldNotMoveLastAccessedBackwards() {
        store.insert(engram("e1", THREAD, NOW)).join();

        store.update(THREAD, "e1", EngramUpdate.builder().lastAccessedAt(NOW.minusSeconds(3600)).build()).join();

        assertEquals(NOW, store.findActiveByThread(THREAD).join().get(0).getLastAccessedAt());
    }

    @Test
    void shouldReturnEmptyWhenUpdatingUnknownEngram() {
        assertTrue(store.update(THREAD, "missing", EngramUpdate.builder().accessIncrement(1).build())
                .join().isEmpty());
    }

    @Test
    void shouldSoftDeleteAcrossThreadsAndHideFromActiveQueries() {
        Engram stale = engram("old", THREAD, NOW.minusSeconds(86_400 * 40L));
        stale.setRelevanceScore(0.01);
        store.insert(stale).join();
        store.insert(engram("fresh", THREAD, NOW)).join();
        Engram otherStale = engram("other-old", "thread-2", NOW.minusSeconds(86_400 * 40L));
        otherStale.setRelevanceScore(0.01);
        store.insert(otherStale).join();

        int deleted = store.softDeleteMatching(e -> e.getRelevanceScore() < 0.1).join();

        assertEquals(2, deleted);
        assertEquals(List.of("fresh"), ids(store.findActiveByThread(THREAD).join()));
        assertTrue(store.findActiveByThread("thread-2").join().isEmpty());
        assertEquals(2, store.findAllByThread(THREAD).join().size());
        assertEquals(0, store.softDeleteMatching(e -> e.getRelevanceScore() < 0.1).join());
    }

    @Test
    void shouldOrderActiveEngramsAndApplyLimit() {
        store.insert(engram("a", THREAD, NOW.minusSeconds(300))).join();
        store.insert(engram("b", THREAD, NOW)).join();
        store.insert(engram("c", THREAD, NOW.minusSeconds(100))).join();

        List<Engram> newest = store.findActiveByThreadOrdered(THREAD, EngramSortField.CREATED_AT, true, 2).join();

        assertEquals(List.of("b", "c"), ids(newest));
    }

    @Test
    void shouldKeepThreadsWithSpecialCharactersSeparate() {
        String odd = "team/alpha:42 ü";
        store.insert(engram("x", odd, NOW)).join();
        store.insert(engram("y", THREAD, NOW)).join();

        assertEquals(List.of("x"), ids(store.findActiveByThread(odd).join()));
        assertEquals(1, store.softDeleteMatching(e -> odd.equals(e.getThreadId())).join());
        assertTrue(store.findActiveByThread(odd).join().isEmpty());
    }

    @Test
    void shouldKeepUnreadableLinesAcrossRewrites() throws Exception {
        store.insert(engram("e1", THREAD, NOW)).join();
        Path file = tempDir.resolve("engrams").resolve(THREAD + ".jsonl");
        Files.writeString(file, Files.readString(file) + "{not json\n");

        assertEquals(List.of("e1"), ids(store.findActiveByThread(THREAD).join()));

        store.insert(engram("e2", THREAD, NOW)).join();
        store.update(THREAD, "e1", EngramUpdate.builder().accessIncrement(1).build()).join();

        assertTrue(Files.readAllLines(file).contains("{not json"));
        assertEquals(List.of("e1", "e2"), ids(store.findActiveByThread(THREAD).join()));
    }

    @Test
    void shouldReturnEmptyForUnknownThread() {
        assertTrue(store.findActiveByThread("nobody").join().isEmpty());
    }

    private static List<String> ids(List<Engram> engrams) {
        return engrams.stream().map(Engram::getId).toList();
    }

    private static Engram engram(String id, String threadId, Instant createdAt) {
        return Engram.builder()
                .id(id)
                .threadId(threadId)
                .content("summary " + id)
                .tokenCount(100)
                .summaryTokenCount(10)
                .relevanceScore(1.0)
                .surpriseScore(0.2)
                .createdAt(createdAt)
                .lastAccessedAt(createdAt)
                .trigger(EngramTrigger.TOKEN_THRESHOLD)
                .build();
    }
}
