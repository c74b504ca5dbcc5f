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
import java.util.HashMap;
import java.util.Map;

/**
 * One ongoing exchange with one external contact on one channel of a tenant.
 * Sessions are never deleted, only closed. The metadata map holds
 * session-scoped scratch state owned by individual modules.
 */
@Data
@Builder
public class ConversationSession {

    private String id;
    private String tenantId;
    private Channel channel;
    private String contactKey;
    private String externalThreadKey;

    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;
    private Instant lastActiveAt;

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    /**
     * Session lifecycle states.
     */
    public enum SessionStatus {
        ACTIVE, CLOSED
    }
}
