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
import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramUpdate;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential decay and usage reinforcement of engram relevance.
 *
 * <p>
 * {@code current = base * decayRate^ageDays}, where age is measured from the
 * last access (or creation, if never accessed). Decay is computed at read
 * time and never stored. Negative ages from clock skew count as zero.
 */
@Component
@RequiredArgsConstructor
public class RelevanceDecayModel {

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final EngramProperties properties;

    public double currentRelevance(Engram engram, Instant now) {
        double base = Math.max(0.0, engram.getRelevanceScore());
        Instant anchor = engram.getLastAccessedAt() != null ? engram.getLastAccessedAt() : engram.getCreatedAt();
        if (anchor == null) {
            return base;
        }
        double ageDays = ageInDays(anchor, now);
        return base * Math.pow(properties.getDecay().getDecayRate(), ageDays);
    }

    /**
     * Base relevance after one retrieval. Never lowers a base that already sits
     * above the cap.
     */
    public double reinforce(double baseRelevance) {
        EngramProperties.DecayProperties decay = properties.getDecay();
        double boosted = Math.min(baseRelevance + decay.getReinforcementBoost(), decay.getMaxRelevance());
        return Math.max(baseRelevance, boosted);
    }

    /**
     * Store update recording one retrieval at {@code now}.
     */
    public EngramUpdate reinforcementUpdate(Instant now) {
        EngramProperties.DecayProperties decay = properties.getDecay();
        return EngramUpdate.builder()
                .accessIncrement(1)
                .relevanceBoost(decay.getReinforcementBoost())
                .relevanceCap(decay.getMaxRelevance())
                .lastAccessedAt(now)
                .build();
    }

    public static double ageInDays(Instant from, Instant now) {
        if (from == null || now == null) {
            return 0.0;
        }
        long millis = Duration.between(from, now).toMillis();
        return Math.max(0.0, millis / MILLIS_PER_DAY);
    }
}
