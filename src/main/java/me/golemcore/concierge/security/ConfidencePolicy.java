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

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Hands off when a classification is not confident enough.
 */
@Component
public class ConfidencePolicy {

    public PolicyResult check(double confidence, double threshold) {
        if (confidence < threshold) {
            return PolicyResult.handoff(PolicyResult.CATEGORY_LOW_CONFIDENCE,
                    String.format(Locale.ROOT, "Confidence %.2f below threshold %.2f", confidence, threshold));
        }
        return PolicyResult.pass();
    }

    /**
     * Applies the tenant rules: no handoff at all when low-confidence handoff is
     * switched off.
     */
    public PolicyResult check(double confidence, RuleSet rules) {
        if (!rules.handoffOnLowConfidence()) {
            return PolicyResult.pass();
        }
        return check(confidence, rules.confidenceThreshold());
    }
}
