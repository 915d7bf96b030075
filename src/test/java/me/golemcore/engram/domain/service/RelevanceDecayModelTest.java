package me.golemcore.engram.domain.service;

import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramUpdate;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RelevanceDecayModelTest {

    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    private RelevanceDecayModel model;

    @BeforeEach
    void setUp() {
        model = new RelevanceDecayModel(new EngramProperties());
    }

    @Test
    void decaysExponentiallyPerDay() {
        Engram engram = engram(1.0, T0, T0);

        assertEquals(1.0, model.currentRelevance(engram, T0), 1e-12);
        assertEquals(Math.pow(0.95, 10), model.currentRelevance(engram, T0.plus(Duration.ofDays(10))), 1e-12);
        assertEquals(Math.pow(0.95, 0.5), model.currentRelevance(engram, T0.plus(Duration.ofHours(12))), 1e-12);
    }

    @Test
    void decayIsMeasuredFromLastAccess() {
        Engram engram = engram(2.0, T0, T0.plus(Duration.ofDays(9)));

        assertEquals(2.0 * 0.95, model.currentRelevance(engram, T0.plus(Duration.ofDays(10))), 1e-12);
    }

    @Test
    void fallsBackToCreationWhenNeverAccessed() {
        Engram engram = engram(1.0, T0, null);

        assertEquals(0.95, model.currentRelevance(engram, T0.plus(Duration.ofDays(1))), 1e-12);
    }

    @Test
    void neverIncreasesWithoutAccess() {
        Engram engram = engram(3.0, T0, T0);
        double previous = model.currentRelevance(engram, T0);
        for (int hours = 1; hours <= 24 * 120; hours += 7) {
            double current = model.currentRelevance(engram, T0.plus(Duration.ofHours(hours)));
            assertTrue(current <= previous, "relevance grew at hour " + hours);
            assertTrue(current >= 0.0);
            previous = current;
        }
    }

    @Test
    void clockSkewCountsAsZeroAge() {
        Engram engram = engram(1.5, T0, T0);

        assertEquals(1.5, model.currentRelevance(engram, T0.minus(Duration.ofDays(3))), 1e-12);
        assertEquals(0.0, RelevanceDecayModel.ageInDays(T0, T0.minusSeconds(60)));
    }

    @Test
    void negativeBaseNeverYieldsNegativeRelevance() {
        assertEquals(0.0, model.currentRelevance(engram(-1.0, T0, T0), T0.plus(Duration.ofDays(1))));
    }

    @Test
    void reinforcementIsCapped() {
        assertEquals(1.2, model.reinforce(1.0), 1e-12);
        assertEquals(5.0, model.reinforce(4.9), 1e-12);

        double base = 1.0;
        for (int i = 0; i < 100; i++) {
            base = model.reinforce(base);
            assertTrue(base <= 5.0);
        }
        assertEquals(5.0, base, 1e-12);
    }

    @Test
    void reinforcementNeverLowersBaseAboveCap() {
        assertEquals(7.0, model.reinforce(7.0));
    }

    @Test
    void reinforcementUpdateRecordsOneAccess() {
        Instant now = T0.plus(Duration.ofDays(2));
        EngramUpdate update = model.reinforcementUpdate(now);

        assertEquals(1, update.getAccessIncrement());
        assertEquals(0.2, update.getRelevanceBoost(), 1e-12);
        assertEquals(5.0, update.getRelevanceCap());
        assertEquals(now, update.getLastAccessedAt());
        assertFalse(update.isMarkDeleted());
    }

    private static Engram engram(double base, Instant createdAt, Instant lastAccessedAt) {
        return Engram.builder()
                .id("e1")
                .threadId("t1")
                .relevanceScore(base)
                .createdAt(createdAt)
                .lastAccessedAt(lastAccessedAt)
                .build();
    }
}
