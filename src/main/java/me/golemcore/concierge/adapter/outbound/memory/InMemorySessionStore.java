package me.golemcore.concierge.adapter.outbound.memory;

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
import me.golemcore.concierge.port.outbound.SessionStorePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions and turns kept in process memory.
 */
@Component
public class InMemorySessionStore implements SessionStorePort {

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<ConversationTurn>> turns = new ConcurrentHashMap<>();

    @Override
    public Optional<ConversationSession> findActive(String tenantId, Channel channel, String contactKey) {
        return sessions.values().stream()
                .filter(ConversationSession::isActive)
                .filter(session -> Objects.equals(session.getTenantId(), tenantId)
                        && session.getChannel() == channel
                        && Objects.equals(session.getContactKey(), contactKey))
                .max(Comparator.comparing(ConversationSession::getLastActiveAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())));
    }

    @Override
    public Optional<ConversationSession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public ConversationSession save(ConversationSession session) {
        sessions.put(session.getId(), session);
        return session;
    }

    @Override
    public void appendTurn(ConversationTurn turn) {
        turns.computeIfAbsent(turn.getSessionId(), id -> Collections.synchronizedList(new ArrayList<>()))
                .add(turn);
    }

    @Override
    public List<ConversationTurn> findRecentTurns(String sessionId, int limit) {
        List<ConversationTurn> all = turns.get(sessionId);
        if (all == null || limit <= 0) {
            return List.of();
        }
        synchronized (all) {
            int from = Math.max(0, all.size() - limit);
            return List.copyOf(all.subList(from, all.size()));
        }
    }
}
