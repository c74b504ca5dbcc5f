package me.golemcore.concierge.domain.model;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of everything the engine needs to know about a tenant:
 * entitlement state, kill switches, contact fallbacks, template and the raw
 * JSON configuration blobs of individual modules. Provisioned externally.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantSettings {

    public static final String DEFAULT_TIMEZONE = "Australia/Sydney";

    private String tenantId;
    private String name;
    private String industry;

    @Builder.Default
    private String timezone = DEFAULT_TIMEZONE;

    // Entitlement
    private String sandboxStatus;
    private String billingStatus;
    private int onboardingStepsCompleted;
    private int onboardingStepsTotal;
    private boolean sandboxTestMode;

    // Kill switches
    private boolean smsDisabled;
    private boolean voiceDisabled;
    private boolean bookingDisabled;
    private boolean takeawayDisabled;
    private boolean paymentDisabled;

    /**
     * Industry profile module map. A capability mapped to {@code false} is
     * excluded for the tenant's vertical.
     */
    @Builder.Default
    private Map<String, Boolean> industryModules = new HashMap<>();

    /**
     * Industry rules blob, may carry a {@code defaultFaq} text.
     */
    private JsonNode industryRules;

    // Template
    private String systemPrompt;
    private JsonNode templateRules;

    @Builder.Default
    private List<String> intentsAllowed = new ArrayList<>();

    @Builder.Default
    private Map<String, IntentDefinition> intentDefinitions = new HashMap<>();

    // Contact and handoff
    private String faqText;
    private String handoffPhone;
    private String handoffEmail;
    private String handoffSmsTo;
    private String handoffReplyText;

    // Limits
    private Integer maxEngineRunsPerMinute;
    private Double monthlyAiBudget;
    private Boolean hardBudgetLimit;
    private String aiModelOverride;

    // Module configuration blobs
    private JsonNode bookingConfig;
    private JsonNode takeawayConfig;
    private JsonNode takeawayPaymentConfig;
    private JsonNode menuConfig;
    private boolean useConversationalMode;

    /**
     * Tenant time zone, {@code Australia/Sydney} when unset or invalid.
     */
    public ZoneId zone() {
        try {
            return timezone != null ? ZoneId.of(timezone) : ZoneId.of(DEFAULT_TIMEZONE);
        } catch (DateTimeException e) {
            return ZoneId.of(DEFAULT_TIMEZONE);
        }
    }

    /**
     * Human-readable description and examples for an intent offered to the
     * classifier.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IntentDefinition {
        private String description;

        @Builder.Default
        private List<String> examples = new ArrayList<>();
    }
}
