package me.golemcore.engram.infrastructure.event;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engram.domain.model.EngramCreatedEvent;
import me.golemcore.engram.domain.model.EngramsCleanedUpEvent;
import me.golemcore.engram.domain.model.EngramsRetrievedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes engram lifecycle events to the log.
 */
@Component
@Slf4j
public class EngramEventLogListener {

    @EventListener
    public void onEngramCreated(EngramCreatedEvent event) {
        log.info("[Engram] Created engram {} for thread {}: trigger={}, messages={}, compression={}x, topics={}",
                event.engram().getId(), event.engram().getThreadId(), event.engram().getTrigger().getValue(),
                event.messageCount(), String.format("%.1f", event.compressionRatio()),
                event.engram().getTopics());
    }

    @EventListener
    public void onEngramsRetrieved(EngramsRetrievedEvent event) {
        log.debug("[EngramRetrieval] Thread {}: selected {} of {} engram(s) in {}ms",
                event.threadId(), event.engramIds().size(), event.totalAvailable(), event.retrievalTimeMs());
    }

    @EventListener
    public void onEngramsCleanedUp(EngramsCleanedUpEvent event) {
        log.info("[EngramCleanup] Soft-deleted {} engram(s) older than {} days with relevance below {}",
                event.deletedCount(), event.maxAgeDays(), event.minRelevance());
    }
}
