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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Runs candidate modules in order until one produces a reply.
 *
 * <p>
 * Unknown module names are logged and skipped. A handler that throws is
 * logged and treated as having no reply. When no candidate replies, a fixed
 * fallback that hands off to a person is returned.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModuleRunner {

    static final String NO_MODULE_REPLY = "I'll have someone from our team get back to you shortly.";
    static final String NO_MODULE_REASON = "No module could handle the request";

    private final ModuleRegistry registry;

    public ModuleResult run(List<String> moduleNames, ModuleContext context) {
        if (moduleNames != null) {
            for (String moduleName : moduleNames) {
                Optional<ModuleHandler> handler = registry.find(moduleName);
                if (handler.isEmpty()) {
                    log.warn("[Modules] Unknown module: {}", moduleName);
                    continue;
                }

                try {
                    ModuleResult result = handler.get().handle(context);
                    if (result != null && result.hasReply()) {
                        log.debug("[Modules] Module '{}' replied (handoff={}, blockedBy={})", moduleName,
                                result.isHandoffTriggered(), result.getBlockedBy());
                        return result;
                    }
                    log.debug("[Modules] Module '{}' produced no reply", moduleName);
                } catch (Exception e) { // NOSONAR - a failing module must not stop the chain
                    log.error("[Modules] Error in module {}: {}", moduleName, e.getMessage(), e);
                }
            }
        }

        log.info("[Modules] No module handled the request for session {}", context.getSessionId());
        return ModuleResult.handoff(NO_MODULE_REPLY, NO_MODULE_REASON);
    }
}
