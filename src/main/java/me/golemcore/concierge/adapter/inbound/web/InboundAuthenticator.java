package me.golemcore.concierge.adapter.inbound.web;

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
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authenticates inbound channel requests with the shared bearer token from
 * {@code concierge.inbound.token}.
 *
 * <p>
 * The token is accepted from {@code Authorization: Bearer <token>} or the
 * {@code X-Concierge-Token} header. Comparison is constant-time. Without a
 * configured token every request is rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String CUSTOM_HEADER = "X-Concierge-Token";

    private final ConciergeProperties properties;

    public boolean authenticate(HttpHeaders headers) {
        String expected = properties.getInbound().getToken();
        if (expected == null || expected.isBlank()) {
            log.warn("[Inbound] No token configured, rejecting request");
            return false;
        }

        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return constantTimeEquals(expected, authHeader.substring(BEARER_PREFIX.length()));
        }

        String customToken = headers.getFirst(CUSTOM_HEADER);
        if (customToken != null) {
            return constantTimeEquals(expected, customToken);
        }

        log.debug("[Inbound] No authentication token found in request headers");
        return false;
    }

    private static boolean constantTimeEquals(String expected, String provided) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
