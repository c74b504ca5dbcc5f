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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.port.outbound.TenantSettingsPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tenant settings kept in process memory, optionally seeded at startup from
 * the JSON array at {@code concierge.tenants.seed-file}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryTenantSettingsStore implements TenantSettingsPort {

    private static final TypeReference<List<TenantSettings>> TENANT_LIST = new TypeReference<>() {
    };

    private final ConciergeProperties properties;
    private final ObjectMapper objectMapper;

    private final Map<String, TenantSettings> tenants = new ConcurrentHashMap<>();

    @PostConstruct
    void loadSeed() {
        String seedFile = properties.getTenants().getSeedFile();
        if (seedFile == null || seedFile.isBlank()) {
            return;
        }
        Path path = Path.of(seedFile);
        if (!Files.isRegularFile(path)) {
            log.warn("[Engine] Tenant seed file not found: {}", path);
            return;
        }
        try {
            List<TenantSettings> seeded = objectMapper.readValue(path.toFile(), TENANT_LIST);
            seeded.forEach(this::save);
            log.info("[Engine] Loaded {} tenant(s) from {}", seeded.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tenant seed file " + path, e);
        }
    }

    @Override
    public Optional<TenantSettings> findByTenantId(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tenants.get(tenantId));
    }

    public TenantSettings save(TenantSettings settings) {
        tenants.put(settings.getTenantId(), settings);
        return settings;
    }

    public void remove(String tenantId) {
        tenants.remove(tenantId);
    }
}
