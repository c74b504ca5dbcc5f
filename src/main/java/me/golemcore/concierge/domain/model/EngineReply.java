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

/**
 * Result of one pipeline invocation returned to the channel adapter.
 *
 * <p>
 * {@code blocked} is set only for admission, configuration and capability
 * denials. Policy handoffs keep {@code blocked=false} and set
 * {@code handoffTriggered=true} instead.
 */
@Data
@Builder
public class EngineReply {

    private String replyText;
    private String sessionId;
    private boolean handoffTriggered;
    private String handoffReason;
    private boolean blocked;
    private String blockedBy;
    private String engineRunId;
    private Integer inputTokens;
    private Integer outputTokens;
}
