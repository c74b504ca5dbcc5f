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

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Entry point for text policies in both directions.
 *
 * <p>
 * Inbound text is screened by {@link InputPolicy}; generated replies are
 * rewritten by {@link OutputScrubber} unless the tenant disabled it;
 * classification confidence is judged by {@link ConfidencePolicy}.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class PolicyEngine {

    private final InputPolicy inputPolicy;
    private final OutputScrubber outputScrubber;
    private final ConfidencePolicy confidencePolicy;

    public PolicyResult applyInputPolicies(String userText, RuleSet rules, int turnCount) {
        return inputPolicy.check(userText, rules, turnCount);
    }

    /**
     * Returns the reply to send. Never blocks.
     */
    public String applyOutputPolicies(String replyText, RuleSet rules) {
        if (!rules.neverSayAI()) {
            return replyText;
        }
        return outputScrubber.scrub(replyText);
    }

    public PolicyResult checkConfidence(double confidence, RuleSet rules) {
        return confidencePolicy.check(confidence, rules);
    }
}
