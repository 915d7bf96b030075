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
import me.golemcore.engram.domain.model.ConsolidationLease;
import me.golemcore.engram.domain.model.ConsolidationResult;
import me.golemcore.engram.domain.model.ConsolidationStatus;
import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramCreatedEvent;
import me.golemcore.engram.domain.model.EngramTrigger;
import me.golemcore.engram.domain.model.Message;
import me.golemcore.engram.domain.model.MessageRange;
import me.golemcore.engram.domain.model.ThreadBuffer;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.ConsolidationLockPort;
import me.golemcore.engram.port.outbound.EngramEventPort;
import me.golemcore.engram.port.outbound.EngramStorePort;
import me.golemcore.engram.port.outbound.ThreadBufferPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Buffers conversation messages per thread and consolidates them into engrams.
 *
 * <p>
 * Three independent triggers, any one sufficient:
 * <ol>
 * <li>token threshold - the buffered estimate reached
 * {@code chunk-size-tokens}</li>
 * <li>surprise - at least {@code min-messages-for-engram} messages whose
 * surprise score reached {@code surprise-threshold}</li>
 * <li>forced - requested by the caller, no minimum applies</li>
 * </ol>
 *
 * <p>
 * A consolidation holds the thread's lease for the decide-and-persist section
 * only. Contention is not waited on: the loser reports
 * {@link ConsolidationStatus#IN_PROGRESS}. Messages arriving while a
 * consolidation runs stay buffered for the next engram. When summarization or
 * persistence fails the buffer is left as it was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngramConsolidationService {

    private final ThreadBufferPort bufferPort;
    private final ConsolidationLockPort lockPort;
    private final EngramStorePort storePort;
    private final SurpriseScorer surpriseScorer;
    private final TopicExtractor topicExtractor;
    private final EngramSummarizer summarizer;
    private final TokenEstimator tokenEstimator;
    private final EngramEventPort eventPort;
    private final EngramProperties properties;
    private final Clock clock;

    /**
     * Buffer a message, then consolidate if a trigger fires.
     */
    public ConsolidationResult processMessage(String threadId, Message message, boolean force) {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("threadId is required");
        }
        if (message == null) {
            throw new IllegalArgumentException("message is required");
        }
        if (!properties.isEnabled()) {
            return ConsolidationResult.skipped(ConsolidationStatus.DISABLED);
        }

        int tokens = tokenEstimator.estimate(message.getContent());
        ThreadBuffer buffer = bufferPort.append(threadId, message, tokens);
        log.trace("[Engram] Buffered message for thread {}: {} messages, ~{} tokens",
                threadId, buffer.size(), buffer.getTokenEstimate());

        return consolidate(threadId, force);
    }

    /**
     * Consolidate the thread's current buffer if a trigger fires (or if forced).
     */
    public ConsolidationResult consolidate(String threadId, boolean force) {
        if (!properties.isEnabled()) {
            return ConsolidationResult.skipped(ConsolidationStatus.DISABLED);
        }

        TriggerDecision decision = evaluate(bufferPort.snapshot(threadId), force);
        if (decision.trigger() == null) {
            log.trace("[Engram] No consolidation for thread {}: {}", threadId, decision.status());
            return ConsolidationResult.skipped(decision.status());
        }

        Optional<ConsolidationLease> lease = lockPort.tryAcquire(threadId,
                properties.getConsolidation().getLockLease());
        if (lease.isEmpty()) {
            log.debug("[Engram] Consolidation already in progress for thread {}, skipping", threadId);
            return ConsolidationResult.skipped(ConsolidationStatus.IN_PROGRESS);
        }

        try {
            // The buffer may have been drained between the check and the lock
            ThreadBuffer buffer = bufferPort.snapshot(threadId);
            TriggerDecision confirmed = evaluate(buffer, force);
            if (confirmed.trigger() == null) {
                log.debug("[Engram] Trigger no longer holds for thread {}: {}", threadId, confirmed.status());
                return ConsolidationResult.skipped(confirmed.status());
            }
            return createEngram(threadId, buffer, confirmed.trigger());
        } finally {
            lockPort.release(lease.get());
        }
    }

    TriggerDecision evaluate(ThreadBuffer buffer, boolean force) {
        if (buffer.isEmpty()) {
            return TriggerDecision.none(ConsolidationStatus.EMPTY_BUFFER);
        }
        if (force) {
            return TriggerDecision.fired(EngramTrigger.FORCED);
        }

        EngramProperties.ConsolidationProperties config = properties.getConsolidation();
        boolean enoughMessages = buffer.size() >= config.getMinMessagesForEngram();

        if (config.isAutoConsolidation() && buffer.getTokenEstimate() >= config.getChunkSizeTokens()) {
            return enoughMessages
                    ? TriggerDecision.fired(EngramTrigger.TOKEN_THRESHOLD)
                    : TriggerDecision.none(ConsolidationStatus.NOT_ENOUGH_MESSAGES);
        }

        if (config.isSurpriseDetection() && enoughMessages
                && surpriseScorer.score(buffer.getMessages()) >= config.getSurpriseThreshold()) {
            return TriggerDecision.fired(EngramTrigger.SURPRISE);
        }
        return TriggerDecision.none(ConsolidationStatus.BELOW_THRESHOLD);
    }

    private ConsolidationResult createEngram(String threadId, ThreadBuffer buffer, EngramTrigger trigger) {
        List<Message> messages = buffer.getMessages();
        double surprise = surpriseScorer.score(messages);

        String summary = summarizer.summarize(messages);
        if (summary == null) {
            log.warn("[Engram] Summarization failed for thread {} ({} messages kept in buffer)",
                    threadId, messages.size());
            return ConsolidationResult.failed(ConsolidationStatus.SUMMARY_FAILED, trigger);
        }

        Instant now = clock.instant();
        Engram engram = Engram.builder()
                .id(UUID.randomUUID().toString())
                .threadId(threadId)
                .content(summary)
                .sourceRange(new MessageRange(messages.get(0).getId(),
                        messages.get(messages.size() - 1).getId(), messages.size()))
                .tokenCount(buffer.getTokenEstimate())
                .summaryTokenCount(tokenEstimator.estimate(summary))
                .relevanceScore(1.0)
                .surpriseScore(surprise)
                .accessCount(0)
                .lastAccessedAt(now)
                .createdAt(now)
                .topics(new ArrayList<>(topicExtractor.extractTopics(summary)))
                .trigger(trigger)
                .hasCode(messages.stream().anyMatch(m -> MessageSignals.containsCode(m.getContent())))
                .hasError(messages.stream().anyMatch(m -> MessageSignals.containsErrorLanguage(m.getContent())))
                .messageTypes(countRoles(messages))
                .build();

        if (!persist(engram)) {
            return ConsolidationResult.failed(ConsolidationStatus.STORE_FAILED, trigger);
        }

        ThreadBuffer remaining = bufferPort.drain(threadId, messages);
        if (!remaining.isEmpty()) {
            log.debug("[Engram] {} message(s) arrived during consolidation of thread {}, kept for next engram",
                    remaining.size(), threadId);
        }

        double compressionRatio = engram.getSummaryTokenCount() > 0
                ? (double) engram.getTokenCount() / engram.getSummaryTokenCount()
                : 0.0;
        eventPort.publish(new EngramCreatedEvent(engram, messages.size(), compressionRatio));
        return ConsolidationResult.created(engram);
    }

    private boolean persist(Engram engram) {
        long timeoutMs = properties.getConsolidation().getStoreTimeout().toMillis();
        try {
            storePort.insert(engram).get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Engram] Persisting engram for thread {} interrupted", engram.getThreadId());
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Engram] Failed to persist engram for thread {}: {}", engram.getThreadId(), e.getMessage());
            return false;
        }
    }

    private Map<String, Integer> countRoles(List<Message> messages) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Message message : messages) {
            String role = message.getRole() != null ? message.getRole() : "unknown";
            counts.merge(role, 1, Integer::sum);
        }
        return counts;
    }

    record TriggerDecision(EngramTrigger trigger, ConsolidationStatus status) {

        static TriggerDecision fired(EngramTrigger trigger) {
            return new TriggerDecision(trigger, null);
        }

        static TriggerDecision none(ConsolidationStatus status) {
            return new TriggerDecision(null, status);
        }
    }
}
