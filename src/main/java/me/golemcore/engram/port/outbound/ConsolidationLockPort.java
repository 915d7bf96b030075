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

import me.golemcore.engram.domain.model.ConsolidationLease;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-thread consolidation lock with lease semantics. Acquisition never waits:
 * a held, unexpired lock means "consolidation already in progress". An expired
 * lease may be taken over so that a stalled consolidation cannot block a thread
 * forever.
 */
public interface ConsolidationLockPort {

    Optional<ConsolidationLease> tryAcquire(String threadId, Duration leaseDuration);

    /**
     * Release the lock if it is still held by this lease. Releasing a lease that
     * expired and was taken over is a no-op.
     */
    void release(ConsolidationLease lease);
}
