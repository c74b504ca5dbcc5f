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
import me.golemcore.concierge.domain.model.AuditEvent;
import me.golemcore.concierge.port.outbound.AuditLogPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes append-only audit events. A failed write is logged and never fails
 * the operation being audited.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final AuditLogPort auditLog;
    private final Clock clock;

    public void record(String tenantId, String action, Map<String, Object> details) {
        try {
            auditLog.append(AuditEvent.builder()
                    .id(UUID.randomUUID().toString())
                    .tenantId(tenantId)
                    .action(action)
                    .details(details != null ? new LinkedHashMap<>(details) : Map.of())
                    .createdAt(clock.instant())
                    .build());
        } catch (RuntimeException e) { // NOSONAR - audit failures are local-log only
            log.warn("[Audit] Failed to write {} for tenant {}: {}", action, tenantId, e.getMessage());
        }
    }
}
