package me.golemcore.concierge.routing;

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

import java.util.List;

/**
 * Classified intent of an inbound message and where to route it.
 *
 * <p>
 * {@code blockedBy} is set only when classification could not run because of
 * a tenant limit (currently {@code budget}). Token and cost counters are zero
 * when no billable call happened.
 *
 * @since 1.0
 */
@Value
@Builder
public class RouteResult {

    String intent;
    double confidence;
    String rationale;
    @Builder.Default
    List<String> suggestedModules = List.of();
    boolean requiresHandoff;
    String handoffReason;
    String blockedBy;
    int inputTokens;
    int outputTokens;
    double costUsd;
    String model;

    public boolean isBlocked() {
        return blockedBy != null;
    }
}
