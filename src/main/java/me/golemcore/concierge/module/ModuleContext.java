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

import lombok.Builder;
import lombok.Value;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.ConversationTurn;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.security.RuleSet;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Read-only input handed to a {@link ModuleHandler}.
 *
 * <p>
 * The session metadata is a snapshot taken before the run; modules read it
 * here and return their changes in {@link ModuleResult}. Capability checks go
 * through {@link #canUse(String)}, which is bound to the current tenant.
 *
 * @since 1.0
 */
@Value
@Builder
public class ModuleContext {

    String tenantId;
    String sessionId;
    Channel channel;
    /**
     * Normalized contact key of the customer, usually an E.164 phone number.
     */
    String contactKey;
    String userText;
    @Builder.Default
    List<ConversationTurn> history = List.of();
    String systemPrompt;
    RuleSet rules;
    TenantSettings tenant;
    @Builder.Default
    Map<String, Object> sessionMetadata = Map.of();
    Function<String, FeatureGateResult> capabilityCheck;
    String intent;

    public FeatureGateResult canUse(String capability) {
        if (capabilityCheck == null) {
            return FeatureGateResult.allow("No capability check bound");
        }
        return capabilityCheck.apply(capability);
    }

    public Map<String, Object> getSessionMetadata() {
        return Collections.unmodifiableMap(sessionMetadata);
    }

    public Object metadata(String key) {
        return sessionMetadata.get(key);
    }

    public String metadataString(String key) {
        Object value = sessionMetadata.get(key);
        return value != null ? value.toString() : null;
    }

    public boolean metadataFlag(String key) {
        Object value = sessionMetadata.get(key);
        return value instanceof Boolean flag ? flag : "true".equals(value);
    }

    public int metadataInt(String key, int defaultValue) {
        Object value = sessionMetadata.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
