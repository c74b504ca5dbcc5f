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

/**
 * Outcome of an input or confidence policy check.
 *
 * @param passed
 *            whether the text may continue through the pipeline
 * @param action
 *            what the caller must do when the check failed ({@code handoff})
 * @param category
 *            machine-readable policy tag such as {@code high_risk} or
 *            {@code low_confidence}
 * @param reason
 *            human-readable explanation, used as the handoff reason
 */
public record PolicyResult(boolean passed, String action, String category, String reason) {

    public static final String ACTION_HANDOFF = "handoff";

    public static final String CATEGORY_ABUSE = "abuse";
    public static final String CATEGORY_HIGH_RISK = "high_risk";
    public static final String CATEGORY_TURN_LIMIT = "turn_limit";
    public static final String CATEGORY_LOW_CONFIDENCE = "low_confidence";

    public static PolicyResult pass() {
        return new PolicyResult(true, null, null, null);
    }

    public static PolicyResult handoff(String category, String reason) {
        return new PolicyResult(false, ACTION_HANDOFF, category, reason);
    }

    public boolean requiresHandoff() {
        return !passed && ACTION_HANDOFF.equals(action);
    }
}
