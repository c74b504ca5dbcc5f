package me.golemcore.concierge.module.builtin;

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

import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleHandler;
import me.golemcore.concierge.module.ModuleResult;
import org.springframework.stereotype.Component;

/**
 * Hands the conversation to a person with the tenant's configured reply.
 */
@Component
public class HandoffModule implements ModuleHandler {

    static final String HANDOFF_REPLY = "Let me connect you with a team member who can better assist you.";
    static final String HANDOFF_NO_CONTACT_REPLY = "I'll have someone from our team get back to you shortly.";

    @Override
    public String getName() {
        return "handoff";
    }

    @Override
    public ModuleResult handle(ModuleContext context) {
        return ModuleResult.handoff(replyFor(context.getTenant()), "User requested handoff or policy triggered");
    }

    static String replyFor(TenantSettings tenant) {
        if (tenant == null) {
            return HANDOFF_NO_CONTACT_REPLY;
        }
        if (hasText(tenant.getHandoffReplyText())) {
            return tenant.getHandoffReplyText();
        }
        return hasText(tenant.getHandoffPhone()) || hasText(tenant.getHandoffEmail())
                ? HANDOFF_REPLY
                : HANDOFF_NO_CONTACT_REPLY;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
