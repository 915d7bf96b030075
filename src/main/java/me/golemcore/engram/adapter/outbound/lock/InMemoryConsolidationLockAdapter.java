package me.golemcore.engram.adapter.outbound.lock;

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
import me.golemcore.engram.port.outbound.ConsolidationLockPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local consolidation locks, one lease per thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryConsolidationLockAdapter implements ConsolidationLockPort {

    private final Clock clock;
    private final Map<String, ConsolidationLease> leases = new ConcurrentHashMap<>();

    @Override
    public Optional<ConsolidationLease> tryAcquire(String threadId, Duration leaseDuration) {
        Instant now = clock.instant();
        ConsolidationLease candidate = new ConsolidationLease(threadId, UUID.randomUUID().toString(),
                now.plus(leaseDuration));

        ConsolidationLease holder = leases.compute(threadId, (key, current) -> {
            if (current == null) {
                return candidate;
            }
            if (current.isExpired(now)) {
                log.warn("[Engram] Consolidation lease for thread {} expired at {}, taking over",
                        threadId, current.getExpiresAt());
                return candidate;
            }
            return current;
        });

        if (holder == candidate) {
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    @Override
    public void release(ConsolidationLease lease) {
        if (lease == null) {
            return;
        }
        boolean released = leases.remove(lease.getThreadId(), lease);
        if (!released) {
            log.debug("[Engram] Lease {} for thread {} no longer held, release ignored",
                    lease.getToken(), lease.getThreadId());
        }
    }
}
