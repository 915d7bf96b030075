package me.golemcore.engram.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engram.domain.model.CognitiveLoadStatus;
import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramMetricsSnapshot;
import me.golemcore.engram.domain.model.EngramTrigger;
import me.golemcore.engram.domain.model.TemporalDistribution;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.EngramStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Read-only diagnostics over a thread's engram population. Each statistic is
 * computed by its own method and falls back to a documented default on empty
 * or tiny populations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngramMetricsService {

    static final int MIN_FIT_POINTS = 5;
    static final int HEBBIAN_WINDOW = 20;
    private static final Duration LOAD_WINDOW = Duration.ofHours(1);

    private final EngramStorePort storePort;
    private final RelevanceDecayModel decayModel;
    private final EngramProperties properties;
    private final Clock clock;

    public EngramMetricsSnapshot getMetricsSnapshot(String threadId) {
        Instant now = clock.instant();
        long timeoutMs = properties.getRetrieval().getStoreTimeout().toMillis();

        List<Engram> all;
        try {
            all = storePort.findAllByThread(threadId).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[EngramMetrics] Loading engrams for thread {} interrupted", threadId);
            return EngramMetricsSnapshot.empty(threadId, now);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[EngramMetrics] Failed to load engrams for thread {}: {}", threadId, e.getMessage());
            return EngramMetricsSnapshot.empty(threadId, now);
        }

        EngramMetricsSnapshot snapshot = computeSnapshot(threadId, all != null ? all : List.of(), now);
        logMetrics(snapshot);
        return snapshot;
    }

    EngramMetricsSnapshot computeSnapshot(String threadId, List<Engram> all, Instant now) {
        List<Engram> active = all.stream().filter(engram -> !engram.isDeleted()).toList();

        EngramMetricsSnapshot snapshot = EngramMetricsSnapshot.empty(threadId, now);
        snapshot.setTotalEngrams(all.size());
        snapshot.setActiveEngrams(active.size());
        if (active.isEmpty()) {
            return snapshot;
        }

        snapshot.setTotalSourceTokens(active.stream().mapToLong(Engram::getTokenCount).sum());
        snapshot.setAverageSurprise(active.stream().mapToDouble(Engram::getSurpriseScore).average().orElse(0.0));
        snapshot.setAverageAccessCount(active.stream().mapToInt(Engram::getAccessCount).average().orElse(0.0));
        snapshot.setTriggerCounts(triggerCounts(active));

        snapshot.setCompressionRatio(compressionRatio(active));
        snapshot.setTopicDiversity(topicDiversity(active));
        snapshot.setCoherence(coherence(active));

        List<double[]> curve = new ArrayList<>();
        for (Engram engram : active) {
            double relevance = decayModel.currentRelevance(engram, now);
            if (relevance > 0) {
                curve.add(new double[] { RelevanceDecayModel.ageInDays(engram.getCreatedAt(), now),
                        Math.log(relevance) });
            }
        }
        LinearFit fit = fitLine(curve);
        if (fit != null) {
            snapshot.setForgettingCurveR2(fit.rSquared());
            double decayConstant = -fit.slope();
            snapshot.setDecayConstant(decayConstant);
            snapshot.setHalfLifeDays(decayConstant > 0 ? Math.log(2) / decayConstant : null);
        }

        snapshot.setSurpriseAccessCorrelation(correlation(
                active.stream().mapToDouble(Engram::getSurpriseScore).toArray(),
                active.stream().mapToDouble(Engram::getAccessCount).toArray()));
        snapshot.setTemporalDistribution(temporalDistribution(active));

        List<Engram> recent = active.stream()
                .filter(engram -> engram.getCreatedAt() != null
                        && !engram.getCreatedAt().isBefore(now.minus(LOAD_WINDOW)))
                .toList();
        double load = cognitiveLoad(recent);
        snapshot.setCognitiveLoad(load);
        snapshot.setCognitiveLoadStatus(recent.isEmpty() ? CognitiveLoadStatus.IDLE : loadStatus(load));
        snapshot.setHebbianStrength(hebbianStrength(active));
        return snapshot;
    }

    /**
     * Σ source tokens / Σ summary tokens; 0.0 when nothing was summarized.
     */
    static double compressionRatio(List<Engram> engrams) {
        long source = 0;
        long summary = 0;
        for (Engram engram : engrams) {
            source += engram.getTokenCount();
            summary += engram.getSummaryTokenCount();
        }
        return summary > 0 ? (double) source / summary : 0.0;
    }

    /**
     * Shannon entropy of the topic tag multiset, normalized by its maximum
     * {@code ln(distinct)}; 0.0 with fewer than two distinct tags.
     */
    static double topicDiversity(List<Engram> engrams) {
        Map<String, Integer> counts = new HashMap<>();
        int total = 0;
        for (Engram engram : engrams) {
            if (engram.getTopics() == null) {
                continue;
            }
            for (String topic : engram.getTopics()) {
                counts.merge(topic, 1, Integer::sum);
                total++;
            }
        }
        if (counts.size() < 2) {
            return 0.0;
        }
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = (double) count / total;
            entropy -= p * Math.log(p);
        }
        return entropy / Math.log(counts.size());
    }

    /**
     * Mean Jaccard similarity of consecutive engrams ordered by creation; 1.0
     * with fewer than two engrams.
     */
    static double coherence(List<Engram> engrams) {
        if (engrams.size() < 2) {
            return 1.0;
        }
        List<Engram> ordered = byCreation(engrams);
        double sum = 0.0;
        for (int i = 1; i < ordered.size(); i++) {
            sum += LexicalSimilarity.jaccard(ordered.get(i - 1).getContent(), ordered.get(i).getContent());
        }
        return sum / (ordered.size() - 1);
    }

    /**
     * Least-squares line through (x, y) points. Null with fewer than
     * {@value #MIN_FIT_POINTS} points or when all x are equal. A perfect fit of
     * constant y reports R² = 1.
     */
    static LinearFit fitLine(List<double[]> points) {
        int n = points.size();
        if (n < MIN_FIT_POINTS) {
            return null;
        }
        double meanX = points.stream().mapToDouble(p -> p[0]).average().orElse(0.0);
        double meanY = points.stream().mapToDouble(p -> p[1]).average().orElse(0.0);

        double sxx = 0.0;
        double sxy = 0.0;
        double syy = 0.0;
        for (double[] p : points) {
            double dx = p[0] - meanX;
            double dy = p[1] - meanY;
            sxx += dx * dx;
            sxy += dx * dy;
            syy += dy * dy;
        }
        if (sxx == 0.0) {
            return null;
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;

        double ssRes = 0.0;
        for (double[] p : points) {
            double residual = p[1] - (intercept + slope * p[0]);
            ssRes += residual * residual;
        }
        double rSquared = syy == 0.0 ? 1.0 : 1.0 - ssRes / syy;
        return new LinearFit(slope, intercept, rSquared);
    }

    /**
     * Pearson correlation; null with fewer than {@value #MIN_FIT_POINTS} pairs
     * or zero variance on either side.
     */
    static Double correlation(double[] xs, double[] ys) {
        int n = Math.min(xs.length, ys.length);
        if (n < MIN_FIT_POINTS) {
            return null;
        }
        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += xs[i];
            meanY += ys[i];
        }
        meanX /= n;
        meanY /= n;

        double sxx = 0.0;
        double syy = 0.0;
        double sxy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = xs[i] - meanX;
            double dy = ys[i] - meanY;
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
        }
        if (sxx == 0.0 || syy == 0.0) {
            return null;
        }
        return sxy / Math.sqrt(sxx * syy);
    }

    /**
     * Thousands of source tokens consolidated in the window, scaled by
     * {@code 1 + mean surprise}; 0.0 for an empty window.
     */
    static double cognitiveLoad(List<Engram> recent) {
        if (recent.isEmpty()) {
            return 0.0;
        }
        long tokens = recent.stream().mapToLong(Engram::getTokenCount).sum();
        double surprise = recent.stream().mapToDouble(Engram::getSurpriseScore).average().orElse(0.0);
        return tokens / 1000.0 * (1 + surprise);
    }

    static CognitiveLoadStatus loadStatus(double load) {
        if (load < 5) {
            return CognitiveLoadStatus.LOW;
        }
        return load < 20 ? CognitiveLoadStatus.MEDIUM : CognitiveLoadStatus.HIGH;
    }

    /**
     * Co-access strength over the {@value #HEBBIAN_WINDOW} most recently
     * accessed engrams: mean over pairs of access-count product damped by
     * {@code exp(-|Δ last access| / 1h)}. Pairs missing an access time are
     * skipped. 0.0 with fewer than two engrams or no countable pair.
     */
    static double hebbianStrength(List<Engram> engrams) {
        List<Engram> window = engrams.stream()
                .sorted(Comparator.comparing(Engram::getLastAccessedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(HEBBIAN_WINDOW)
                .toList();
        if (window.size() < 2) {
            return 0.0;
        }
        double total = 0.0;
        int pairs = 0;
        for (int i = 0; i < window.size() - 1; i++) {
            Engram first = window.get(i);
            for (int j = i + 1; j < window.size(); j++) {
                Engram second = window.get(j);
                if (first.getLastAccessedAt() == null || second.getLastAccessedAt() == null) {
                    continue;
                }
                double gapSeconds = Math.abs(
                        Duration.between(first.getLastAccessedAt(), second.getLastAccessedAt()).toMillis() / 1000.0);
                total += (double) first.getAccessCount() * second.getAccessCount() * Math.exp(-gapSeconds / 3600.0);
                pairs++;
            }
        }
        return pairs > 0 ? total / pairs : 0.0;
    }

    static TemporalDistribution temporalDistribution(List<Engram> engrams) {
        List<Instant> times = byCreation(engrams).stream()
                .map(Engram::getCreatedAt)
                .filter(Objects::nonNull)
                .toList();
        if (times.size() < 2) {
            return TemporalDistribution.insufficientData();
        }

        double[] gaps = new double[times.size() - 1];
        for (int i = 1; i < times.size(); i++) {
            gaps[i - 1] = Duration.between(times.get(i - 1), times.get(i)).toMillis() / 1000.0;
        }
        double mean = 0.0;
        for (double gap : gaps) {
            mean += gap;
        }
        mean /= gaps.length;
        double variance = 0.0;
        for (double gap : gaps) {
            variance += (gap - mean) * (gap - mean);
        }
        double stdDev = Math.sqrt(variance / gaps.length);

        TemporalDistribution.Pattern pattern = stdDev < 0.5 * mean
                ? TemporalDistribution.Pattern.UNIFORM
                : TemporalDistribution.Pattern.BURSTY;
        double spanHours = Duration.between(times.get(0), times.get(times.size() - 1)).toMillis() / 3_600_000.0;
        return new TemporalDistribution(pattern, mean, stdDev, spanHours);
    }

    private static Map<EngramTrigger, Integer> triggerCounts(List<Engram> engrams) {
        Map<EngramTrigger, Integer> counts = new LinkedHashMap<>();
        for (EngramTrigger trigger : EngramTrigger.values()) {
            counts.put(trigger, 0);
        }
        for (Engram engram : engrams) {
            if (engram.getTrigger() != null) {
                counts.merge(engram.getTrigger(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static List<Engram> byCreation(List<Engram> engrams) {
        return engrams.stream()
                .sorted(Comparator.comparing(Engram::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    private void logMetrics(EngramMetricsSnapshot snapshot) {
        String threadId = snapshot.getThreadId();
        log.info("[EngramMetrics] metric=engram.active.count value={} threadId={}",
                snapshot.getActiveEngrams(), threadId);
        log.info("[EngramMetrics] metric=engram.compression.ratio value={} threadId={}",
                String.format("%.2f", snapshot.getCompressionRatio()), threadId);
        log.debug("[EngramMetrics] metric=engram.topic.diversity value={} threadId={}",
                String.format("%.3f", snapshot.getTopicDiversity()), threadId);
        log.debug("[EngramMetrics] metric=engram.coherence value={} threadId={}",
                String.format("%.3f", snapshot.getCoherence()), threadId);
        log.debug("[EngramMetrics] metric=engram.cognitive.load value={} status={} threadId={}",
                String.format("%.2f", snapshot.getCognitiveLoad()), snapshot.getCognitiveLoadStatus(), threadId);
        log.debug("[EngramMetrics] metric=engram.hebbian.strength value={} threadId={}",
                String.format("%.3f", snapshot.getHebbianStrength()), threadId);
        if (snapshot.getForgettingCurveR2() != null) {
            log.debug("[EngramMetrics] metric=engram.forgetting.r2 value={} threadId={}",
                    String.format("%.3f", snapshot.getForgettingCurveR2()), threadId);
        }
    }

    record LinearFit(double slope, double intercept, double rSquared) {
    }
}
