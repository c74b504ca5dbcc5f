package me.golemcore.concierge.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.ConversationSession;
import me.golemcore.concierge.domain.model.ConversationTurn;
import me.golemcore.concierge.port.outbound.SessionStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Resolves conversation sessions and records their turns.
 *
 * <p>
 * A session is keyed by tenant, channel and normalized contact key. The first
 * inbound message without an active session opens a new one. Sessions are
 * never deleted, only closed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    public static final String ORPHAN_TENANT = "system";
    public static final String ORPHAN_RUN = "orphanRun";

    private final SessionStorePort sessionStore;
    private final Clock clock;

    public ConversationSession getOrCreate(String tenantId, Channel channel, String contactKey,
            String externalThreadKey) {
        String normalized = normalizePhone(contactKey);
        Instant now = clock.instant();
        return sessionStore.findActive(tenantId, channel, normalized)
                .map(existing -> {
                    existing.setLastActiveAt(now);
                    return sessionStore.save(existing);
                })
                .orElseGet(() -> {
                    ConversationSession created = sessionStore.save(ConversationSession.builder()
                            .id(UUID.randomUUID().toString())
                            .tenantId(tenantId)
                            .channel(channel)
                            .contactKey(normalized)
                            .externalThreadKey(externalThreadKey)
                            .createdAt(now)
                            .lastActiveAt(now)
                            .build());
                    log.info("[Engine] Opened session {} for tenant {} on {}", created.getId(), tenantId,
                            channel.getValue());
                    return created;
                });
    }

    /**
     * Closed placeholder session used to record runs that failed before a real
     * session existed.
     */
    public ConversationSession createOrphanSession() {
        Instant now = clock.instant();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(ORPHAN_RUN, true);
        return sessionStore.save(ConversationSession.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(ORPHAN_TENANT)
                .channel(Channel.SMS)
                .contactKey("unknown")
                .status(ConversationSession.SessionStatus.CLOSED)
                .metadata(metadata)
                .createdAt(now)
                .lastActiveAt(now)
                .build());
    }

    public void saveTurn(ConversationSession session, String role, String text, Map<String, Object> raw) {
        sessionStore.appendTurn(ConversationTurn.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getId())
                .role(role)
                .channel(session.getChannel())
                .text(text)
                .raw(raw != null ? raw : Map.of())
                .createdAt(clock.instant())
                .build());
    }

    /**
     * Last {@code maxTurns} turns in chronological order.
     */
    public List<ConversationTurn> getConversationHistory(String sessionId, int maxTurns) {
        if (maxTurns <= 0) {
            return List.of();
        }
        return sessionStore.findRecentTurns(sessionId, maxTurns);
    }

    public Map<String, Object> getSessionMetadata(String sessionId) {
        return sessionStore.findById(sessionId)
                .map(session -> Collections.unmodifiableMap(new HashMap<>(session.getMetadata())))
                .orElse(Map.of());
    }

    /**
     * Shallow merge into the session metadata. A {@code null} value removes the
     * key.
     */
    public void updateSessionMetadata(String sessionId, Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) {
            return;
        }
        sessionStore.findById(sessionId).ifPresentOrElse(session -> {
            Map<String, Object> merged = new HashMap<>(session.getMetadata());
            updates.forEach((key, value) -> {
                if (value == null) {
                    merged.remove(key);
                } else {
                    merged.put(key, value);
                }
            });
            session.setMetadata(merged);
            sessionStore.save(session);
        }, () -> log.warn("[Engine] Metadata update for unknown session {}", sessionId));
    }

    public void closeSession(String sessionId) {
        sessionStore.findById(sessionId).ifPresent(session -> {
            session.setStatus(ConversationSession.SessionStatus.CLOSED);
            sessionStore.save(session);
            log.info("[Engine] Closed session {}", sessionId);
        });
    }

    /**
     * Normalizes a phone number to E.164. Australian local numbers
     * ({@code 0} plus nine digits) get the {@code +61} prefix.
     */
    public static String normalizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        String normalized = phone.replaceAll("[^\\d+]", "");
        if (normalized.isEmpty()) {
            // not a phone number, keep the key as given
            return phone.trim();
        }
        if (normalized.startsWith("0") && normalized.length() == 10) {
            normalized = "+61" + normalized.substring(1);
        }
        if (!normalized.startsWith("+") && normalized.length() > 10) {
            normalized = "+" + normalized;
        }
        return normalized;
    }
}
