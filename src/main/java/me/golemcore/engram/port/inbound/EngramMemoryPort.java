package me.golemcore.engram.port.inbound;

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

import me.golemcore.engram.domain.model.Engram;
import me.golemcore.engram.domain.model.EngramMetricsSnapshot;
import me.golemcore.engram.domain.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * The contracts a request-handling layer depends on. None of these methods
 * throws: memory augmentation is an enhancement of the conversation, so every
 * failure degrades to "no memory available".
 */
public interface EngramMemoryPort {

    /**
     * Buffer a message and consolidate when a trigger fires.
     *
     * @return the created engram, or empty when nothing was consolidated
     */
    Optional<Engram> onMessage(String threadId, Message message);

    /**
     * Buffer a message and optionally force consolidation of the whole buffer.
     */
    Optional<Engram> onMessage(String threadId, Message message, boolean force);

    /**
     * Rank the thread's live engrams and return the top {@code limit}. Updates
     * access bookkeeping of the returned engrams.
     *
     * @param queryText
     *            optional text to match lexically, may be null
     */
    List<Engram> retrieve(String threadId, String queryText, int limit);

    /**
     * Retrieve with the configured default limit.
     */
    List<Engram> retrieve(String threadId, String queryText);

    /**
     * Render the retrieved engrams as a prompt block, empty when none.
     */
    String getContextSummary(String threadId, String queryText);

    /**
     * Soft-delete engrams that are both older than {@code maxAgeDays} and less
     * relevant than {@code minRelevance}.
     *
     * @return number of engrams deleted
     */
    int cleanup(int maxAgeDays, double minRelevance);

    /**
     * Cleanup with the configured defaults.
     */
    int cleanup();

    EngramMetricsSnapshot getMetricsSnapshot(String threadId);
}
