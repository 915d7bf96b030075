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
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Renders retrieved engrams as a markdown block for prompt injection.
 */
@Service
@RequiredArgsConstructor
public class EngramContextService {

    static final String HEADER = "# Previous Context";
    static final String ERROR_NOTE = "*Note: This memory contains error handling context*";
    static final String CODE_NOTE = "*Note: This memory contains code examples*";

    private final EngramRetrievalService retrievalService;
    private final Clock clock;

    /**
     * Retrieve (with the usual access bookkeeping) and render the thread's most
     * relevant engrams.
     *
     * @return the rendered block, or an empty string when nothing is retrievable
     */
    public String buildContextSummary(String threadId, String queryText) {
        List<Engram> engrams = retrievalService.retrieve(threadId, queryText);
        if (engrams.isEmpty()) {
            return "";
        }

        Instant now = clock.instant();
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append("\n\n");
        int index = 1;
        for (Engram engram : engrams) {
            sb.append("## Memory ").append(index++)
                    .append(" (").append(daysAgo(engram, now)).append(" days ago)\n");
            sb.append(engram.getContent()).append('\n');
            if (engram.isHasError()) {
                sb.append(ERROR_NOTE).append('\n');
            }
            if (engram.isHasCode()) {
                sb.append(CODE_NOTE).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private long daysAgo(Engram engram, Instant now) {
        if (engram.getCreatedAt() == null) {
            return 0;
        }
        return Math.max(0, Duration.between(engram.getCreatedAt(), now).toDays());
    }
}
