package me.golemcore.concierge.adapter.outbound.memory;

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

import me.golemcore.concierge.domain.model.AuditEvent;
import me.golemcore.concierge.port.outbound.AuditLogPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit trail kept in process memory.
 */
@Component
public class InMemoryAuditLog implements AuditLogPort {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void append(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> findByTenant(String tenantId) {
        return events.stream()
                .filter(event -> Objects.equals(event.getTenantId(), tenantId))
                .toList();
    }

    public List<AuditEvent> findByAction(String action) {
        return events.stream()
                .filter(event -> Objects.equals(event.getAction(), action))
                .toList();
    }
}
