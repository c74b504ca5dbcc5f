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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic SHA-256 keys used to collapse duplicate order and booking
 * attempts.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    /**
     * Joins the components with {@code :} and returns the first
     * {@code hexLength} hex characters of their SHA-256.
     */
    public static String of(int hexLength, String... components) {
        return sha256Hex(String.join(":", components), hexLength);
    }

    public static String sha256Hex(String content, int hexLength) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((content != null ? content : "").getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < hash.length && sb.length() < hexLength; i++) {
                sb.append(String.format("%02x", hash[i]));
            }
            return sb.substring(0, Math.min(hexLength, sb.length()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
