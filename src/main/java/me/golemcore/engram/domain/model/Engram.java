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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consolidated memory unit: a compressed, scored summary of a contiguous
 * segment of one conversation thread.
 *
 * <p>
 * Created only by the consolidation service. Afterwards only access
 * bookkeeping ({@code accessCount}, {@code relevanceScore},
 * {@code lastAccessedAt}) and the soft-delete flag change. {@code
 * relevanceScore} is the stored base relevance; decay is applied at read time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Engram {

    private String id;
    private String threadId;
    private String content;
    private MessageRange sourceRange;

    /** Estimated tokens of the compressed source segment. */
    private int tokenCount;

    /** Estimated tokens of {@link #content}. */
    private int summaryTokenCount;

    @Builder.Default
    private double relevanceScore = 1.0;

    private double surpriseScore;
    private int accessCount;
    private Instant lastAccessedAt;
    private Instant createdAt;

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    private EngramTrigger trigger;
    private boolean deleted;

    private boolean hasCode;
    private boolean hasError;

    @Builder.Default
    private Map<String, Integer> messageTypes = new LinkedHashMap<>();
}
