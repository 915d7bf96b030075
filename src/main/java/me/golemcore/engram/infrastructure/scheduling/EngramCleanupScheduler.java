package me.golemcore.engram.infrastructure.scheduling;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.inbound.EngramMemoryPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the maintenance sweep periodically on a single daemon thread with the
 * configured {@code engram.cleanup.*} bounds. A tick that finds the previous
 * sweep still running is skipped.
 */
@Component
@Slf4j
public class EngramCleanupScheduler {

    private final EngramMemoryPort memoryPort;
    private final EngramProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public EngramCleanupScheduler(EngramMemoryPort memoryPort, EngramProperties properties) {
        this.memoryPort = memoryPort;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.isEnabled() || !properties.getCleanup().isEnabled()) {
            log.info("[EngramCleanup] Periodic cleanup disabled");
            return;
        }

        long intervalMs = properties.getCleanup().getInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "engram-cleanup-scheduler");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[EngramCleanup] Periodic cleanup every {}", properties.getCleanup().getInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.debug("[EngramCleanup] Scheduler shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[EngramCleanup] Tick skipped: previous sweep still in progress");
            return;
        }
        try {
            EngramProperties.CleanupProperties cleanup = properties.getCleanup();
            int deleted = memoryPort.cleanup(cleanup.getMaxAgeDays(), cleanup.getMinRelevance());
            log.debug("[EngramCleanup] Periodic sweep deleted {} engram(s)", deleted);
        } catch (RuntimeException e) {
            log.error("[EngramCleanup] Periodic sweep failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    boolean isRunning() {
        return tickTask != null && !tickTask.isCancelled();
    }
}
