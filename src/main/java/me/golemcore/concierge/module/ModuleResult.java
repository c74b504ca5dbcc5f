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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a {@link ModuleHandler}.
 *
 * <p>
 * {@code sessionMetadataUpdates} is shallow-merged into the session by the
 * engine after the run; a {@code null} value removes the key. Usage counters
 * describe billable LLM calls the module made.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
public class ModuleResult {

    String replyText;
    boolean handoffTriggered;
    String handoffReason;
    String blockedBy;
    Map<String, Object> sessionMetadataUpdates;
    int inputTokens;
    int outputTokens;
    double costUsd;
    String model;

    public boolean hasReply() {
        return replyText != null && !replyText.isBlank();
    }

    public static ModuleResult reply(String text) {
        return ModuleResult.builder().replyText(text).build();
    }

    public static ModuleResult reply(String text, Map<String, Object> updates) {
        return ModuleResult.builder().replyText(text).sessionMetadataUpdates(updates).build();
    }

    public static ModuleResult handoff(String text, String reason) {
        return ModuleResult.builder()
                .replyText(text)
                .handoffTriggered(true)
                .handoffReason(reason)
                .build();
    }

    public static ModuleResult blocked(String text, String reason, String blockedBy) {
        return ModuleResult.builder()
                .replyText(text)
                .handoffTriggered(true)
                .handoffReason(reason)
                .blockedBy(blockedBy)
                .build();
    }

    public static ModuleResult empty() {
        return ModuleResult.builder().build();
    }

    /**
     * Mutable update map that accepts {@code null} values as removals.
     */
    public static Map<String, Object> updates() {
        return new LinkedHashMap<>();
    }
}
