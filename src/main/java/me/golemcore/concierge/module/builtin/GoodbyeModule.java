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

import lombok.RequiredArgsConstructor;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleHandler;
import me.golemcore.concierge.module.ModuleResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Closes the conversation politely and marks the session as ended.
 */
@Component
@RequiredArgsConstructor
public class GoodbyeModule implements ModuleHandler {

    static final String GOODBYE_REPLY = "Thank you for reaching out. Have a great day!";

    private final Clock clock;

    @Override
    public String getName() {
        return "goodbye";
    }

    @Override
    public ModuleResult handle(ModuleContext context) {
        Map<String, Object> updates = ModuleResult.updates();
        updates.put("sessionEnded", true);
        updates.put("endedAt", clock.instant().toString());
        return ModuleResult.reply(GOODBYE_REPLY, updates);
    }
}
