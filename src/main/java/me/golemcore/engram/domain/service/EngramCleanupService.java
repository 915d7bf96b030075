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
import me.golemcore.engram.domain.model.EngramsCleanedUpEvent;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.EngramEventPort;
import me.golemcore.engram.port.outbound.EngramStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Maintenance sweep: soft-deletes engrams that are both older than
 * {@code maxAgeDays} and below {@code minRelevance} after decay. Re-running on
 * a swept population deletes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngramCleanupService {

    private final EngramStorePort storePort;
    private final RelevanceDecayModel decayModel;
    private final EngramEventPort eventPort;
    private final EngramProperties properties;
    private final Clock clock;

    public int cleanup() {
        EngramProperties.CleanupProperties cleanup = properties.getCleanup();
        return cleanup(cleanup.getMaxAgeDays(), cleanup.getMinRelevance());
    }

    /**
     * @return number of engrams soft-deleted, 0 when the store fails
     * @throws IllegalArgumentException
     *             for a negative age or relevance bound
     */
    public int cleanup(int maxAgeDays, double minRelevance) {
        if (maxAgeDays < 0) {
            throw new IllegalArgumentException("maxAgeDays must not be negative: " + maxAgeDays);
        }
        if (minRelevance < 0 || Double.isNaN(minRelevance)) {
            throw new IllegalArgumentException("minRelevance must not be negative: " + minRelevance);
        }

        Instant now = clock.instant();
        Predicate<Engram> expired = expiredPredicate(maxAgeDays, minRelevance, now);
        long timeoutMs = properties.getCleanup().getStoreTimeout().toMillis();

        int deleted;
        try {
            Integer count = storePort.softDeleteMatching(expired).get(timeoutMs, TimeUnit.MILLISECONDS);
            deleted = count != null ? count : 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[EngramCleanup] Cleanup interrupted");
            return 0;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[EngramCleanup] Cleanup failed: {}", e.getMessage());
            return 0;
        }

        if (deleted > 0) {
            eventPort.publish(new EngramsCleanedUpEvent(deleted, maxAgeDays, minRelevance));
        } else {
            log.debug("[EngramCleanup] Nothing to clean up (maxAgeDays={}, minRelevance={})",
                    maxAgeDays, minRelevance);
        }
        return deleted;
    }

    Predicate<Engram> expiredPredicate(int maxAgeDays, double minRelevance, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(maxAgeDays));
        return engram -> !engram.isDeleted()
                && engram.getCreatedAt() != null
                && engram.getCreatedAt().isBefore(cutoff)
                && decayModel.currentRelevance(engram, now) < minRelevance;
    }
}
