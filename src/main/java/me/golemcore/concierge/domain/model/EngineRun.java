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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only audit record of one pipeline invocation.
 */
@Data
@Builder
public class EngineRun {

    private String id;
    private String tenantId;
    private String sessionId;
    private EngineRunStatus status;
    private Decision decision;
    private int inputTokens;
    private int outputTokens;
    private double costUsd;
    private long durationMs;
    private String modelUsed;
    private Instant createdAt;

    /**
     * Routing and policy decisions taken during the run.
     */
    @Data
    @Builder
    public static class Decision {
        private String intent;
        private Double confidence;

        @Builder.Default
        private List<String> modules = new ArrayList<>();

        private String blockedBy;
        private String handoffReason;
        private String error;
    }
}
