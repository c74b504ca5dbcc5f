package me.golemcore.concierge.module;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to handler map, seeded at startup from every {@link ModuleHandler}
 * bean. Aliases point to the same handler instance.
 */
@Component
@Slf4j
public class ModuleRegistry {

    private final Map<String, ModuleHandler> handlers = new ConcurrentHashMap<>();

    public ModuleRegistry(List<ModuleHandler> moduleHandlers) {
        if (moduleHandlers == null) {
            return;
        }
        for (ModuleHandler handler : moduleHandlers) {
            register(handler.getName(), handler);
            for (String alias : handler.getAliases()) {
                register(alias, handler);
            }
        }
        log.info("[Modules] Registered modules: {}", getRegisteredNames());
    }

    public final void register(String name, ModuleHandler handler) {
        if (name == null || name.isBlank() || handler == null) {
            return;
        }
        ModuleHandler previous = handlers.put(name, handler);
        if (previous != null && previous != handler) {
            log.warn("[Modules] Module '{}' re-registered: {} replaces {}", name,
                    handler.getClass().getSimpleName(), previous.getClass().getSimpleName());
        }
    }

    public Optional<ModuleHandler> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(handlers.get(name));
    }

    public boolean contains(String name) {
        return name != null && handlers.containsKey(name);
    }

    public Set<String> getRegisteredNames() {
        return new TreeSet<>(handlers.keySet());
    }
}
