package me.golemcore.engram.domain.service;

import me.golemcore.engram.domain.model.CognitiveLoadStatus;
import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramMetricsSnapshot;
import me.golemcore.engram.domain.model.EngramTrigger;
import me.golemcore.engram.domain.model.TemporalDistribution;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.testsupport.InMemoryEngramStore;
import me.golemcore.engram.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngramMetricsServiceTest {

    private static final String THREAD = "thread-1";
    private static final Instant NOW = Instant.parse("2026-07-01T00:00:00Z");

    private InMemoryEngramStore store;
    private EngramMetricsService service;

    @BeforeEach
    void setUp() {
        EngramProperties properties = new EngramProperties();
        store = new InMemoryEngramStore();
        service = new EngramMetricsService(store, new RelevanceDecayModel(properties), properties,
                new MutableClock(NOW));
    }

    @Test
    void emptyPopulationUsesDefaults() {
        EngramMetricsSnapshot snapshot = service.getMetricsSnapshot(THREAD);

        assertEquals(0, snapshot.getTotalEngrams());
        assertEquals(0.0, snapshot.getCompressionRatio());
        assertEquals(0.0, snapshot.getTopicDiversity());
        assertEquals(1.0, snapshot.getCoherence());
        assertNull(snapshot.getForgettingCurveR2());
        assertNull(snapshot.getSurpriseAccessCorrelation());
        assertEquals(TemporalDistribution.Pattern.INSUFFICIENT_DATA, snapshot.getTemporalDistribution().getPattern());
        assertEquals(0.0, snapshot.getCognitiveLoad());
        assertEquals(CognitiveLoadStatus.IDLE, snapshot.getCognitiveLoadStatus());
        assertEquals(0.0, snapshot.getHebbianStrength());
    }

    @Test
    void singletonPopulationIsWellDefined() {
        store.put(engram("e1", NOW.minus(Duration.ofDays(1)), 400, 80, List.of("api")));

        EngramMetricsSnapshot snapshot = service.getMetricsSnapshot(THREAD);

        assertEquals(1, snapshot.getActiveEngrams());
        assertEquals(5.0, snapshot.getCompressionRatio(), 1e-9);
        assertEquals(0.0, snapshot.getTopicDiversity());
        assertEquals(1.0, snapshot.getCoherence());
        assertNull(snapshot.getForgettingCurveR2());
        assertNull(snapshot.getHalfLifeDays());
        assertEquals(0.0, snapshot.getHebbianStrength());
        assertEquals(CognitiveLoadStatus.IDLE, snapshot.getCognitiveLoadStatus());
    }

    @Test
    void storeFailureYieldsEmptySnapshot() {
        store.put(engram("e1", NOW, 100, 10, List.of()));
        store.setFailing(true);

        EngramMetricsSnapshot snapshot = service.getMetricsSnapshot(THREAD);

        assertEquals(THREAD, snapshot.getThreadId());
        assertEquals(0, snapshot.getTotalEngrams());
        assertEquals(1.0, snapshot.getCoherence());
    }

    @Test
    void deletedEngramsCountOnlyInTotal() {
        Engram deleted = engram("gone", NOW.minus(Duration.ofDays(2)), 1000, 10, List.of("bug"));
        deleted.setDeleted(true);
        store.put(deleted);
        store.put(engram("live", NOW.minus(Duration.ofDays(1)), 300, 100, List.of("api")));

        EngramMetricsSnapshot snapshot = service.getMetricsSnapshot(THREAD);

        assertEquals(2, snapshot.getTotalEngrams());
        assertEquals(1, snapshot.getActiveEngrams());
        assertEquals(300, snapshot.getTotalSourceTokens());
        assertEquals(3.0, snapshot.getCompressionRatio(), 1e-9);
        assertEquals(1, snapshot.getTriggerCounts().get(EngramTrigger.FORCED));
        assertEquals(0, snapshot.getTriggerCounts().get(EngramTrigger.SURPRISE));
    }

    @Test
    void pureDecayFitsPerfectly() {
        List<Engram> engrams = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            engrams.add(engram("e" + i, NOW.minus(Duration.ofDays(i * 3L)), 100, 20, List.of()));
        }

        EngramMetricsSnapshot snapshot = service.computeSnapshot(THREAD, engrams, NOW);

        assertEquals(1.0, snapshot.getForgettingCurveR2(), 1e-9);
        assertEquals(-Math.log(0.95), snapshot.getDecayConstant(), 1e-9);
        assertEquals(Math.log(2) / -Math.log(0.95), snapshot.getHalfLifeDays(), 1e-6);
    }

    @Test
    void forgettingCurveNeedsFivePoints() {
        List<Engram> engrams = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            engrams.add(engram("e" + i, NOW.minus(Duration.ofDays(i)), 100, 20, List.of()));
        }

        assertNull(service.computeSnapshot(THREAD, engrams, NOW).getForgettingCurveR2());
    }

    @Test
    void fitIsUndefinedWithoutAgeSpread() {
        List<double[]> points = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            points.add(new double[] { 2.0, i });
        }

        assertNull(EngramMetricsService.fitLine(points));
    }

    @Test
    void topicDiversityIsNormalizedEntropy() {
        List<Engram> balanced = List.of(
                engram("e1", NOW, 1, 1, List.of("api", "bug")),
                engram("e2", NOW, 1, 1, List.of("api", "bug")));
        List<Engram> skewed = List.of(
                engram("e1", NOW, 1, 1, List.of("api")),
                engram("e2", NOW, 1, 1, List.of("api")),
                engram("e3", NOW, 1, 1, List.of("api", "bug")));

        assertEquals(1.0, EngramMetricsService.topicDiversity(balanced), 1e-9);
        double skewedDiversity = EngramMetricsService.topicDiversity(skewed);
        assertTrue(skewedDiversity > 0.0 && skewedDiversity < 1.0);
    }

    @Test
    void coherenceAveragesConsecutivePairs() {
        Engram first = engram("e1", NOW.minus(Duration.ofHours(3)), 1, 1, List.of());
        first.setContent("database migration failed");
        Engram second = engram("e2", NOW.minus(Duration.ofHours(2)), 1, 1, List.of());
        second.setContent("database migration failed");
        Engram third = engram("e3", NOW.minus(Duration.ofHours(1)), 1, 1, List.of());
        third.setContent("holiday plans");

        assertEquals(0.5, EngramMetricsService.coherence(List.of(third, first, second)), 1e-9);
    }

    @Test
    void surpriseAccessCorrelation() {
        double[] surprise = { 0.1, 0.2, 0.3, 0.4, 0.5 };

        assertEquals(1.0, EngramMetricsService.correlation(surprise, new double[] { 1, 2, 3, 4, 5 }), 1e-9);
        assertEquals(-1.0, EngramMetricsService.correlation(surprise, new double[] { 5, 4, 3, 2, 1 }), 1e-9);
        assertNull(EngramMetricsService.correlation(surprise, new double[] { 2, 2, 2, 2, 2 }));
        assertNull(EngramMetricsService.correlation(new double[] { 0.1, 0.2 }, new double[] { 1, 2 }));
    }

    @Test
    void regularCreationIsUniform() {
        List<Engram> engrams = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            engrams.add(engram("e" + i, NOW.minus(Duration.ofHours(i)), 1, 1, List.of()));
        }

        TemporalDistribution distribution = EngramMetricsService.temporalDistribution(engrams);

        assertEquals(TemporalDistribution.Pattern.UNIFORM, distribution.getPattern());
        assertEquals(3600.0, distribution.getMeanGapSeconds(), 1e-9);
        assertEquals(3.0, distribution.getTotalSpanHours(), 1e-9);
    }

    @Test
    void clusteredCreationIsBursty() {
        List<Engram> engrams = List.of(
                engram("e1", NOW, 1, 1, List.of()),
                engram("e2", NOW.plusSeconds(1), 1, 1, List.of()),
                engram("e3", NOW.plusSeconds(2), 1, 1, List.of()),
                engram("e4", NOW.plusSeconds(10_000), 1, 1, List.of()));

        assertEquals(TemporalDistribution.Pattern.BURSTY,
                EngramMetricsService.temporalDistribution(engrams).getPattern());
    }

    @Test
    void cognitiveLoadCountsOnlyTheLastHour() {
        Engram recent = engram("recent", NOW.minus(Duration.ofMinutes(30)), 4000, 100, List.of());
        recent.setSurpriseScore(0.5);
        Engram old = engram("old", NOW.minus(Duration.ofHours(2)), 100_000, 100, List.of());
        old.setSurpriseScore(1.0);

        EngramMetricsSnapshot snapshot = service.computeSnapshot(THREAD, List.of(recent, old), NOW);

        assertEquals(6.0, snapshot.getCognitiveLoad(), 1e-9);
        assertEquals(CognitiveLoadStatus.MEDIUM, snapshot.getCognitiveLoadStatus());
    }

    @Test
    void cognitiveLoadIsIdleWithoutRecentEngrams() {
        EngramMetricsSnapshot snapshot = service.computeSnapshot(THREAD,
                List.of(engram("old", NOW.minus(Duration.ofDays(1)), 5000, 100, List.of())), NOW);

        assertEquals(0.0, snapshot.getCognitiveLoad());
        assertEquals(CognitiveLoadStatus.IDLE, snapshot.getCognitiveLoadStatus());
    }

    @Test
    void loadStatusBands() {
        assertEquals(CognitiveLoadStatus.LOW, EngramMetricsService.loadStatus(4.99));
        assertEquals(CognitiveLoadStatus.MEDIUM, EngramMetricsService.loadStatus(5.0));
        assertEquals(CognitiveLoadStatus.MEDIUM, EngramMetricsService.loadStatus(19.9));
        assertEquals(CognitiveLoadStatus.HIGH, EngramMetricsService.loadStatus(20.0));
    }

    @Test
    void hebbianStrengthDampsByAccessGapAndSkipsUnaccessed() {
        Engram first = engram("e1", NOW, 1, 1, List.of());
        first.setAccessCount(2);
        Engram second = engram("e2", NOW.minus(Duration.ofHours(1)), 1, 1, List.of());
        second.setAccessCount(3);
        Engram never = engram("e3", NOW, 1, 1, List.of());
        never.setAccessCount(0);
        never.setLastAccessedAt(null);

        assertEquals(6.0 * Math.exp(-1), EngramMetricsService.hebbianStrength(List.of(first, second, never)), 1e-9);
        assertEquals(0.0, EngramMetricsService.hebbianStrength(List.of(first)));
    }

    @Test
    void hebbianStrengthUsesTwentyMostRecentlyAccessed() {
        List<Engram> engrams = new ArrayList<>();
        for (int i = 0; i < EngramMetricsService.HEBBIAN_WINDOW; i++) {
            Engram engram = engram("e" + i, NOW, 1, 1, List.of());
            engram.setAccessCount(1);
            engrams.add(engram);
        }
        Engram stale = engram("stale", NOW.minus(Duration.ofDays(1)), 1, 1, List.of());
        stale.setAccessCount(1000);
        engrams.add(0, stale);

        assertEquals(1.0, EngramMetricsService.hebbianStrength(engrams), 1e-9);
    }

    private static Engram engram(String id, Instant createdAt, int tokens, int summaryTokens, List<String> topics) {
        return Engram.builder()
                .id(id)
                .threadId(THREAD)
                .content("content of " + id)
                .tokenCount(tokens)
                .summaryTokenCount(summaryTokens)
                .relevanceScore(1.0)
                .createdAt(createdAt)
                .lastAccessedAt(createdAt)
                .topics(new ArrayList<>(topics))
                .trigger(EngramTrigger.FORCED)
                .build();
    }
}
