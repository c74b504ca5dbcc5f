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

import me.golemcore.concierge.domain.model.EngineRun;
import me.golemcore.concierge.port.outbound.EngineRunStorePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Engine runs kept in process memory.
 */
@Component
public class InMemoryEngineRunStore implements EngineRunStorePort {

    private final Map<String, EngineRun> runs = new ConcurrentHashMap<>();

    @Override
    public EngineRun save(EngineRun run) {
        runs.put(run.getId(), run);
        return run;
    }

    @Override
    public List<EngineRun> findByTenantSince(String tenantId, Instant since) {
        return runs.values().stream()
                .filter(run -> Objects.equals(run.getTenantId(), tenantId))
                .filter(run -> since == null || run.getCreatedAt() == null || !run.getCreatedAt().isBefore(since))
                .toList();
    }

    public List<EngineRun> findAll() {
        return List.copyOf(runs.values());
    }
}
