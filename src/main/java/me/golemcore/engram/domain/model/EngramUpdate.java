package me.golemcore.engram.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Partial, declarative update applied atomically to a single stored engram.
 * Unset fields are left untouched.
 *
 * <p>
 * Access bookkeeping is expressed as increments so that concurrent retrievals
 * do not lose updates. Relevance only grows by {@code relevanceBoost} up to
 * {@code relevanceCap}; a soft delete cannot be reverted.
 */
@Value
@Builder
public class EngramUpdate {

    @Builder.Default
    int accessIncrement = 0;

    @Builder.Default
    double relevanceBoost = 0.0;

    Double relevanceCap;
    Instant lastAccessedAt;

    @Builder.Default
    boolean markDeleted = false;
}
