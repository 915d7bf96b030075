package me.golemcore.engram.port.outbound;

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
import me.golemcore.engram.domain.model.EngramSortField;
import me.golemcore.engram.domain.model.EngramUpdate;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Record store for engrams. Only the logical operations the engine needs are
 * exposed; implementations guarantee per-record atomicity and that readers
 * never observe a partially written engram. No multi-record transaction is
 * assumed.
 *
 * <p>
 * Failures complete the returned future exceptionally, usually with
 * {@link EngramStoreException}.
 */
public interface EngramStorePort {

    /**
     * Insert a new engram.
     */
    CompletableFuture<Engram> insert(Engram engram);

    /**
     * All engrams of a thread that are not soft-deleted, read as one snapshot.
     */
    CompletableFuture<List<Engram>> findActiveByThread(String threadId);

    /**
     * All engrams of a thread, soft-deleted ones included.
     */
    CompletableFuture<List<Engram>> findAllByThread(String threadId);

    /**
     * Active engrams of a thread ordered by a field, limited to {@code limit}
     * rows.
     */
    CompletableFuture<List<Engram>> findActiveByThreadOrdered(String threadId, EngramSortField sortField,
            boolean descending, int limit);

    /**
     * Apply a partial update to one engram. Completes with empty when the engram
     * does not exist.
     *
     * @param threadId
     *            owning thread, the partition the engram lives in
     * @param engramId
     *            engram identifier
     */
    CompletableFuture<Optional<Engram>> update(String threadId, String engramId, EngramUpdate update);

    /**
     * Soft-delete every active engram matching the predicate, across all threads.
     *
     * @return number of engrams newly marked deleted
     */
    CompletableFuture<Integer> softDeleteMatching(Predicate<Engram> predicate);
}
