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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans inbound message text and raw webhook payloads.
 *
 * <p>
 * Text is normalized to NFC and stripped of zero-width, BiDi and control
 * characters (newline and tab survive). Raw payloads are stored with turns, so
 * tokens and secrets are redacted from them first.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class InputSanitizer {

    static final String REDACTED = "[REDACTED]";
    private static final int MAX_DEPTH = 10;

    private static final Set<String> SENSITIVE_KEYS = Set.of(
            "access_token", "accesstoken", "refresh_token", "refreshtoken", "id_token", "idtoken",
            "token", "bearer", "api_key", "apikey", "secret", "secretkey", "secret_key", "client_secret",
            "clientsecret", "password", "passwd", "authorization", "x-api-key");

    private static final List<Pattern> SENSITIVE_VALUE_PATTERNS = List.of(
            Pattern.compile("^ya29\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+$"),
            Pattern.compile("^sk[-_]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^pk[-_]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Bearer\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Basic\\s+", Pattern.CASE_INSENSITIVE));

    public String normalizeUnicode(String input) {
        if (input == null) {
            return "";
        }

        String normalized = Normalizer.normalize(input, Normalizer.Form.NFC);

        // Zero-width and BiDi control characters
        normalized = normalized.replaceAll(
                "[\\u200B-\\u200F\\uFEFF\\u2060\\u00AD\\u061C\\u180E\\u202A-\\u202E\\u2066-\\u2069]", "");

        // Control characters except newline/tab
        normalized = normalized.replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "");

        return normalized;
    }

    public String sanitize(String input) {
        if (input == null) {
            return "";
        }

        int originalLength = input.length();
        String sanitized = normalizeUnicode(input).strip();
        if (sanitized.length() != originalLength) {
            log.debug("[Inbound] Input sanitized: {} -> {} chars", originalLength, sanitized.length());
        }
        return sanitized;
    }

    /**
     * Returns a copy of the payload with sensitive keys and token-like values
     * replaced by {@value #REDACTED}.
     */
    public JsonNode redactSensitive(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        return redact(payload.deepCopy(), MAX_DEPTH);
    }

    private JsonNode redact(JsonNode node, int depth) {
        if (depth <= 0) {
            return TextNode.valueOf("[MAX_DEPTH]");
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (SENSITIVE_KEYS.contains(name.toLowerCase(Locale.ROOT))) {
                    object.put(name, REDACTED);
                } else {
                    object.set(name, redact(object.get(name), depth - 1));
                }
            }
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, redact(array.get(i), depth - 1));
            }
            return array;
        }
        if (node.isTextual() && isSensitiveValue(node.asText())) {
            return TextNode.valueOf(REDACTED);
        }
        return node;
    }

    private boolean isSensitiveValue(String value) {
        for (Pattern pattern : SENSITIVE_VALUE_PATTERNS) {
            if (pattern.matcher(value).find()) {
                return true;
            }
        }
        return false;
    }
}
