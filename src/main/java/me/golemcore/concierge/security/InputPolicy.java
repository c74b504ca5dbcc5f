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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Screens inbound customer text before it reaches classification.
 *
 * <p>
 * Checks run in a fixed order and the first hit short-circuits:
 * <ol>
 * <li>abuse and profanity</li>
 * <li>high-risk topics (emergency, self-harm, legal threats, fraud)</li>
 * <li>conversation turn ceiling</li>
 * </ol>
 * Every hit asks for a handoff. The component is stateless and thread-safe.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class InputPolicy {

    private static final List<Pattern> ABUSE_PATTERNS = List.of(
            Pattern.compile("\\b(?:fuck|fucking|shit|damn|bitch|asshole|bastard)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:kill|hurt|harm) (?:yourself|myself|me)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:threat|threaten|attack)\\b", Pattern.CASE_INSENSITIVE));

    private static final Map<String, Pattern> HIGH_RISK_PATTERNS = new LinkedHashMap<>();

    static {
        HIGH_RISK_PATTERNS.put("emergency", Pattern.compile(
                "\\b(?:emergency|urgent|danger|police|ambulance|fire department)\\b", Pattern.CASE_INSENSITIVE));
        HIGH_RISK_PATTERNS.put("self_harm", Pattern.compile(
                "\\b(?:suicide|self.?harm|kill myself|end my life)\\b", Pattern.CASE_INSENSITIVE));
        HIGH_RISK_PATTERNS.put("legal", Pattern.compile(
                "\\b(?:legal|lawsuit|lawyer|attorney|sue|court)\\b", Pattern.CASE_INSENSITIVE));
        HIGH_RISK_PATTERNS.put("fraud", Pattern.compile(
                "\\b(?:refund|chargeback|fraud|scam|steal|stolen)\\b", Pattern.CASE_INSENSITIVE));
    }

    public PolicyResult check(String text, RuleSet rules, int turnCount) {
        PolicyResult abuse = checkForAbuse(text);
        if (!abuse.passed()) {
            return abuse;
        }

        PolicyResult risk = checkForHighRisk(text);
        if (!risk.passed()) {
            return risk;
        }

        return checkTurnLimit(turnCount, rules.maxTurns());
    }

    public PolicyResult checkForAbuse(String text) {
        if (text == null || text.isBlank()) {
            return PolicyResult.pass();
        }
        for (Pattern pattern : ABUSE_PATTERNS) {
            if (pattern.matcher(text).find()) {
                log.warn("[Policy] Abusive content detected: pattern={}", pattern.pattern());
                return PolicyResult.handoff(PolicyResult.CATEGORY_ABUSE,
                        "Abusive or inappropriate content detected");
            }
        }
        return PolicyResult.pass();
    }

    public PolicyResult checkForHighRisk(String text) {
        if (text == null || text.isBlank()) {
            return PolicyResult.pass();
        }
        for (Map.Entry<String, Pattern> entry : HIGH_RISK_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                log.warn("[Policy] High-risk topic detected: {}", entry.getKey());
                return PolicyResult.handoff(PolicyResult.CATEGORY_HIGH_RISK,
                        "high-risk topic detected (" + entry.getKey() + "), requires human attention");
            }
        }
        return PolicyResult.pass();
    }

    public PolicyResult checkTurnLimit(int turnCount, int maxTurns) {
        if (maxTurns > 0 && turnCount >= maxTurns) {
            log.info("[Policy] Turn limit reached: {}/{}", turnCount, maxTurns);
            return PolicyResult.handoff(PolicyResult.CATEGORY_TURN_LIMIT, "Turn limit " + maxTurns + " exceeded");
        }
        return PolicyResult.pass();
    }
}
