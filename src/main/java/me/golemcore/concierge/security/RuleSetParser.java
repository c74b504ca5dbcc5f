package me.golemcore.concierge.security;

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

/**
 * Parses the template rules blob into a {@link RuleSet}.
 *
 * <p>
 * Never throws: absent or mistyped fields fall back to
 * {@link RuleSet#defaults()}.
 */
public final class RuleSetParser {

    private RuleSetParser() {
    }

    public static RuleSet parse(JsonNode node) {
        RuleSet defaults = RuleSet.defaults();
        if (node == null || !node.isObject()) {
            return defaults;
        }

        JsonNode style = node.path("style");
        return new RuleSet(
                booleanOr(node.get("neverSayAI"), defaults.neverSayAI()),
                booleanOr(node.get("handoffOnLowConfidence"), defaults.handoffOnLowConfidence()),
                thresholdOr(node.get("confidenceThreshold"), defaults.confidenceThreshold()),
                node.hasNonNull("maxTurns") && node.get("maxTurns").isNumber() && node.get("maxTurns").asInt() > 0
                        ? node.get("maxTurns").asInt()
                        : defaults.maxTurns(),
                style.isObject() ? textOrNull(style.get("tone")) : null,
                style.isObject() ? textOrNull(style.get("persona")) : null);
    }

    private static boolean booleanOr(JsonNode value, boolean fallback) {
        return value != null && value.isBoolean() ? value.asBoolean() : fallback;
    }

    private static double thresholdOr(JsonNode value, double fallback) {
        if (value == null || !value.isNumber()) {
            return fallback;
        }
        double threshold = value.asDouble();
        return threshold >= 0.0 && threshold <= 1.0 ? threshold : fallback;
    }

    private static String textOrNull(JsonNode value) {
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
