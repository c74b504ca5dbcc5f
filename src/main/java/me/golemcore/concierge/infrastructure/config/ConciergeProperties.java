package me.golemcore.concierge.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the concierge engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code concierge.*} prefix:
 * <ul>
 * <li>{@link EngineProperties} - pipeline defaults</li>
 * <li>{@link RateLimitProperties} - sliding window admission</li>
 * <li>{@link RoutingProperties} - intent classification</li>
 * <li>{@link ResilienceProperties} - timeouts and retries for external
 * calls</li>
 * <li>{@link BudgetProperties} - monthly AI spend defaults</li>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "concierge")
@Data
public class ConciergeProperties {

    private EngineProperties engine = new EngineProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private RoutingProperties routing = new RoutingProperties();
    private ResilienceProperties resilience = new ResilienceProperties();
    private BudgetProperties budget = new BudgetProperties();
    private LlmProperties llm = new LlmProperties();
    private InboundProperties inbound = new InboundProperties();
    private PaymentProperties payment = new PaymentProperties();
    private TenantsProperties tenants = new TenantsProperties();

    @Data
    public static class EngineProperties {
        private int defaultRateLimitPerMinute = 60;
        private int historyTurns = 20;
        private String systemPrompt = """
                You are a helpful assistant for a business. Your goal is to assist customers with their \
                inquiries in a friendly and professional manner.

                IMPORTANT RULES:
                1. Never reveal that you are an AI, bot, or automated system.
                2. Be concise and helpful.
                3. If you cannot help, offer to connect with a human team member.
                4. Be polite and professional at all times.""";
    }

    @Data
    public static class RateLimitProperties {
        private long windowMs = 60_000;
        private int maxTrackedTenants = 10_000;
    }

    @Data
    public static class RoutingProperties {
        private int historyTurns = 5;
        private double confidenceThreshold = 0.65;
    }

    @Data
    public static class ResilienceProperties {
        private long timeoutMs = 15_000;
        private int maxRetries = 2;
        private long initialBackoffMs = 500;
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class BudgetProperties {
        private double defaultMonthlyBudget = 50.0;
        private boolean defaultHardLimit = true;
    }

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private String lowCostModel = "gpt-4o-mini";
    }

    @Data
    public static class InboundProperties {
        private String token;
    }

    @Data
    public static class TenantsProperties {
        /**
         * Optional JSON file with an array of tenant settings loaded at startup.
         */
        private String seedFile;
    }

    @Data
    public static class PaymentProperties {
        private String appBaseUrl = "http://localhost:8080";
    }
}
