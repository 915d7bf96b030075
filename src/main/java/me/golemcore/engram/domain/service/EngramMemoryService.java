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
import me.golemcore.engram.domain.model.ConsolidationResult;
import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramMetricsSnapshot;
import me.golemcore.engram.domain.model.Message;
import me.golemcore.engram.port.inbound.EngramMemoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for the request-handling layer. Delegates to the domain services
 * and turns any unexpected failure into "no memory available", so a memory
 * problem never aborts a conversation turn.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngramMemoryService implements EngramMemoryPort {

    private final EngramConsolidationService consolidationService;
    private final EngramRetrievalService retrievalService;
    private final EngramContextService contextService;
    private final EngramCleanupService cleanupService;
    private final EngramMetricsService metricsService;
    private final Clock clock;

    @Override
    public Optional<Engram> onMessage(String threadId, Message message) {
        return onMessage(threadId, message, false);
    }

    @Override
    public Optional<Engram> onMessage(String threadId, Message message, boolean force) {
        try {
            ConsolidationResult result = consolidationService.processMessage(threadId, message, force);
            return result.asOptional();
        } catch (IllegalArgumentException e) {
            log.warn("[Engram] Rejected message for thread {}: {}", threadId, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("[Engram] Unexpected failure handling message for thread {}", threadId, e);
            return Optional.empty();
        }
    }

    @Override
    public List<Engram> retrieve(String threadId, String queryText, int limit) {
        try {
            return retrievalService.retrieve(threadId, queryText, limit);
        } catch (RuntimeException e) {
            log.error("[EngramRetrieval] Unexpected failure retrieving engrams for thread {}", threadId, e);
            return List.of();
        }
    }

    @Override
    public List<Engram> retrieve(String threadId, String queryText) {
        try {
            return retrievalService.retrieve(threadId, queryText);
        } catch (RuntimeException e) {
            log.error("[EngramRetrieval] Unexpected failure retrieving engrams for thread {}", threadId, e);
            return List.of();
        }
    }

    @Override
    public String getContextSummary(String threadId, String queryText) {
        try {
            return contextService.buildContextSummary(threadId, queryText);
        } catch (RuntimeException e) {
            log.error("[EngramRetrieval] Unexpected failure building context for thread {}", threadId, e);
            return "";
        }
    }

    @Override
    public int cleanup(int maxAgeDays, double minRelevance) {
        try {
            return cleanupService.cleanup(maxAgeDays, minRelevance);
        } catch (IllegalArgumentException e) {
            log.warn("[EngramCleanup] Rejected cleanup request: {}", e.getMessage());
            return 0;
        } catch (RuntimeException e) {
            log.error("[EngramCleanup] Unexpected cleanup failure", e);
            return 0;
        }
    }

    @Override
    public int cleanup() {
        try {
            return cleanupService.cleanup();
        } catch (RuntimeException e) {
            log.error("[EngramCleanup] Unexpected cleanup failure", e);
            return 0;
        }
    }

    @Override
    public EngramMetricsSnapshot getMetricsSnapshot(String threadId) {
        try {
            return metricsService.getMetricsSnapshot(threadId);
        } catch (RuntimeException e) {
            log.error("[EngramMetrics] Unexpected failure computing metrics for thread {}", threadId, e);
            return EngramMetricsSnapshot.empty(threadId, clock.instant());
        }
    }
}
