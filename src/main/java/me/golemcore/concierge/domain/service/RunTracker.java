package me.golemcore.concierge.domain.service;

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
import me.golemcore.concierge.domain.model.EngineRun;
import me.golemcore.concierge.domain.model.EngineRunStatus;
import me.golemcore.concierge.port.outbound.EngineRunStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records one {@link EngineRun} per pipeline invocation and the audit events
 * that go with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunTracker {

    private final EngineRunStorePort runStore;
    private final SessionService sessionService;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Persists the run. A run without a session is attached to a fresh closed
     * placeholder session so that every run has one.
     */
    public EngineRun createEngineRun(EngineRun run) {
        if (run.getSessionId() == null) {
            run.setSessionId(sessionService.createOrphanSession().getId());
        }
        if (run.getId() == null) {
            run.setId(UUID.randomUUID().toString());
        }
        if (run.getCreatedAt() == null) {
            run.setCreatedAt(clock.instant());
        }
        EngineRun saved = runStore.save(run);
        log.debug("[Engine] Recorded run {} ({}) for tenant {}", saved.getId(), saved.getStatus().getValue(),
                saved.getTenantId());
        return saved;
    }

    public void audit(String tenantId, String action, Map<String, Object> details) {
        auditService.record(tenantId, action, details);
    }

    public RunStats getTenantRunStats(String tenantId, Instant since) {
        List<EngineRun> runs = runStore.findByTenantSince(tenantId, since);
        Map<EngineRunStatus, Integer> byStatus = new EnumMap<>(EngineRunStatus.class);
        for (EngineRunStatus status : EngineRunStatus.values()) {
            byStatus.put(status, 0);
        }
        double totalCost = 0;
        long totalDuration = 0;
        for (EngineRun run : runs) {
            byStatus.merge(run.getStatus(), 1, Integer::sum);
            totalCost += run.getCostUsd();
            totalDuration += run.getDurationMs();
        }
        long averageDuration = runs.isEmpty() ? 0 : Math.round((double) totalDuration / runs.size());
        return new RunStats(runs.size(), Map.copyOf(byStatus), totalCost, averageDuration);
    }

    public record RunStats(int total, Map<EngineRunStatus, Integer> byStatus, double totalCostUsd,
            long avgDurationMs) {

        public int count(EngineRunStatus status) {
            return byStatus.getOrDefault(status, 0);
        }
    }
}
