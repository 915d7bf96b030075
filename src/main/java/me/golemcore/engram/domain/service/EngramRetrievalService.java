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
import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramsRetrievedEvent;
import me.golemcore.engram.domain.model.ScoredEngram;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.EngramEventPort;
import me.golemcore.engram.port.outbound.EngramStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ranks a thread's live engrams for context injection.
 *
 * <p>
 * Composite score, with configurable weights that sum to 1:
 *
 * <pre>
 * w.relevance  * clamp(currentRelevance / maxRelevance)
 * + w.surprise   * surpriseScore
 * + w.access     * min(log1p(accessCount) / accessSaturation, 1)
 * + w.recency    * 0.5^(ageDays / recencyHalfLifeDays)
 * + w.similarity * jaccard(content, query)
 * </pre>
 *
 * Ties go to the more recently created engram, then to the smaller id.
 *
 * <p>
 * Retrieval is not read-only: every returned engram gets its access count
 * incremented, its relevance reinforced and its last-access time set. Store
 * failures degrade to an empty result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngramRetrievalService {

    private static final Comparator<ScoredEngram> RANKING = Comparator
            .comparingDouble(ScoredEngram::getScore).reversed()
            .thenComparing(scored -> scored.getEngram().getCreatedAt(),
                    Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(scored -> scored.getEngram().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final EngramStorePort storePort;
    private final RelevanceDecayModel decayModel;
    private final EngramEventPort eventPort;
    private final EngramProperties properties;
    private final Clock clock;

    public List<Engram> retrieve(String threadId, String queryText) {
        return retrieve(threadId, queryText, properties.getRetrieval().getMaxEngramsInContext());
    }

    public List<Engram> retrieve(String threadId, String queryText, int limit) {
        if (!properties.isEnabled() || threadId == null || limit <= 0) {
            return List.of();
        }

        long start = clock.millis();
        Instant now = clock.instant();
        long timeoutMs = properties.getRetrieval().getStoreTimeout().toMillis();

        List<Engram> candidates;
        try {
            candidates = storePort.findActiveByThread(threadId).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[EngramRetrieval] Loading engrams for thread {} interrupted", threadId);
            return List.of();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[EngramRetrieval] Failed to load engrams for thread {}: {}", threadId, e.getMessage());
            return List.of();
        }
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        List<ScoredEngram> selected = rank(candidates, queryText, now).stream()
                .limit(limit)
                .toList();

        List<Engram> result = recordAccess(threadId, selected, now, timeoutMs);

        long elapsed = clock.millis() - start;
        eventPort.publish(new EngramsRetrievedEvent(threadId, result.stream().map(Engram::getId).toList(),
                candidates.size(), elapsed));
        log.info("[EngramMetrics] metric=engram.retrieval.selected.count value={} threadId={} available={}",
                result.size(), threadId, candidates.size());
        return result;
    }

    /**
     * Score and order engrams without side effects. Soft-deleted engrams are
     * skipped.
     */
    public List<ScoredEngram> rank(List<Engram> engrams, String queryText, Instant now) {
        List<ScoredEngram> scored = new ArrayList<>();
        for (Engram engram : engrams) {
            if (engram.isDeleted()) {
                continue;
            }
            double current = decayModel.currentRelevance(engram, now);
            scored.add(new ScoredEngram(engram, score(engram, current, queryText, now), current));
        }
        scored.sort(RANKING);
        return scored;
    }

    double score(Engram engram, double currentRelevance, String queryText, Instant now) {
        EngramProperties.RetrievalProperties retrieval = properties.getRetrieval();
        EngramProperties.WeightsProperties weights = retrieval.getWeights();

        double relevance = clamp(currentRelevance / properties.getDecay().getMaxRelevance());
        double surprise = clamp(engram.getSurpriseScore());
        double access = Math.min(Math.log1p(Math.max(0, engram.getAccessCount()))
                / retrieval.getAccessSaturation(), 1.0);
        double ageDays = RelevanceDecayModel.ageInDays(engram.getCreatedAt(), now);
        double recency = Math.pow(0.5, ageDays / retrieval.getRecencyHalfLifeDays());
        double similarity = queryText == null || queryText.isBlank()
                ? 0.0
                : LexicalSimilarity.jaccard(engram.getContent(), queryText);

        return weights.getRelevance() * relevance
                + weights.getSurprise() * surprise
                + weights.getAccess() * access
                + weights.getRecency() * recency
                + weights.getSimilarity() * similarity;
    }

    private List<Engram> recordAccess(String threadId, List<ScoredEngram> selected, Instant now, long timeoutMs) {
        List<CompletableFuture<Optional<Engram>>> updates = new ArrayList<>();
        for (ScoredEngram scored : selected) {
            updates.add(storePort.update(threadId, scored.getEngram().getId(), decayModel.reinforcementUpdate(now)));
        }

        List<Engram> result = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            Engram original = selected.get(i).getEngram();
            result.add(awaitUpdate(updates.get(i), original, timeoutMs));
        }
        return result;
    }

    private Engram awaitUpdate(CompletableFuture<Optional<Engram>> update, Engram original, long timeoutMs) {
        try {
            return update.get(timeoutMs, TimeUnit.MILLISECONDS).orElse(original);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[EngramRetrieval] Access bookkeeping for engram {} interrupted", original.getId());
            return original;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[EngramRetrieval] Access bookkeeping failed for engram {}: {}", original.getId(),
                    e.getMessage());
            return original;
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
