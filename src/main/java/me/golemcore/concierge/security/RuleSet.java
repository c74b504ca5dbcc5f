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
 * Per-tenant conversation rules parsed from the template rules blob.
 *
 * @param neverSayAI
 *            scrub self-identification as an automated system from replies
 * @param handoffOnLowConfidence
 *            hand off when classification confidence is under the threshold
 * @param confidenceThreshold
 *            minimum accepted classification confidence
 * @param maxTurns
 *            turn count at which the conversation is handed to a person
 * @param tone
 *            optional style hint for generation prompts
 * @param persona
 *            optional persona hint for generation prompts
 */
public record RuleSet(boolean neverSayAI, boolean handoffOnLowConfidence, double confidenceThreshold,
        int maxTurns, String tone, String persona) {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.65;
    public static final int DEFAULT_MAX_TURNS = 20;

    public static RuleSet defaults() {
        return new RuleSet(true, true, DEFAULT_CONFIDENCE_THRESHOLD, DEFAULT_MAX_TURNS, null, null);
    }
}
