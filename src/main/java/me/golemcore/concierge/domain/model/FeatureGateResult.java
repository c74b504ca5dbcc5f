package me.golemcore.concierge.domain.model;

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
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a capability check. Never persisted.
 */
@Data
@Builder
public class FeatureGateResult {

    public static final String BLOCKED_BY_KILL_SWITCH = "kill_switch";
    public static final String BLOCKED_BY_INDUSTRY = "industry";
    public static final String BLOCKED_BY_SANDBOX = "sandbox";
    public static final String BLOCKED_BY_BILLING = "billing";
    public static final String BLOCKED_BY_UNKNOWN = "unknown";

    private boolean allowed;
    private String reason;

    /**
     * Machine-readable deny tag, {@code null} when allowed.
     */
    private String blockedBy;

    /**
     * Lifecycle or billing stage behind a sandbox or billing denial (e.g.
     * {@code in_progress}, {@code past_due}).
     */
    private String subReason;

    /**
     * Next actions that would lift the denial.
     */
    @Builder.Default
    private List<String> requires = new ArrayList<>();

    public static FeatureGateResult allow(String reason) {
        return FeatureGateResult.builder()
                .allowed(true)
                .reason(reason)
                .build();
    }

    public static FeatureGateResult deny(String blockedBy, String subReason, String reason, List<String> requires) {
        return FeatureGateResult.builder()
                .allowed(false)
                .blockedBy(blockedBy)
                .subReason(subReason)
                .reason(reason)
                .requires(new ArrayList<>(requires))
                .build();
    }
}
