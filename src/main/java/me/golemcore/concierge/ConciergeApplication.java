package me.golemcore.concierge;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Concierge.
 *
 * <p>
 * Concierge answers inbound customer messages (SMS, WhatsApp, voice
 * transcripts) on behalf of many independent business tenants. Every message
 * flows through one guarded pipeline that never lets a tenant overrun its rate,
 * cost or entitlement limits.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Per-tenant admission</b> - sliding window rate limiting with bounded
 * memory</li>
 * <li><b>Feature gating</b> - kill switches, industry profiles, sandbox
 * lifecycle and billing state</li>
 * <li><b>Policies</b> - input screening, confidence handoff and output
 * scrubbing</li>
 * <li><b>Modules</b> - FAQ, handoff, contact capture, booking and takeaway
 * ordering</li>
 * <li><b>Idempotent orders</b> - duplicate webhook deliveries never create a
 * second order</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → InboundMessageController
 * Domain Layer       → Engine, Modules, Services
 * Infrastructure     → LLM/Storage/Payment/Notification Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * Static configuration via {@code application.properties} under the
 * {@code concierge.*} prefix. Tenant configuration comes from the tenant
 * settings port.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ConciergeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConciergeApplication.class, args);
    }

}
