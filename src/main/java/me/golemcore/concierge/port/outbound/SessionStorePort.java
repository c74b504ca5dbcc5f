package me.golemcore.concierge.port.outbound;

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

import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.ConversationSession;
import me.golemcore.concierge.domain.model.ConversationTurn;

import java.util.List;
import java.util.Optional;

/**
 * Storage for conversation sessions and their turns.
 */
public interface SessionStorePort {

    /**
     * Most recently active session of the contact that is still open.
     */
    Optional<ConversationSession> findActive(String tenantId, Channel channel, String contactKey);

    Optional<ConversationSession> findById(String sessionId);

    ConversationSession save(ConversationSession session);

    void appendTurn(ConversationTurn turn);

    /**
     * Last {@code limit} turns of the session, oldest first.
     */
    List<ConversationTurn> findRecentTurns(String sessionId, int limit);
}
