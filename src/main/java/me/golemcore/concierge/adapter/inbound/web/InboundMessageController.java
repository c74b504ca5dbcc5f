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
import me.golemcore.concierge.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.concierge.adapter.inbound.web.dto.CallGreetingRequest;
import me.golemcore.concierge.adapter.inbound.web.dto.InboundMessageRequest;
import me.golemcore.concierge.adapter.inbound.web.dto.RateLimitStatusResponse;
import me.golemcore.concierge.domain.loop.Engine;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.InboundMessage;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.Locale;

/**
 * HTTP entry point for channel webhooks.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>{@code POST /api/inbound/message} - runs one message through the
 * engine and returns its reply</li>
 * <li>{@code POST /api/inbound/voice/greeting} - welcome text for an
 * inbound call</li>
 * <li>{@code GET /api/inbound/rate-limit/{tenantId}} - read-only admission
 * window of a tenant</li>
 * </ul>
 *
 * <p>
 * All endpoints require the inbound bearer token. The engine blocks on
 * external calls, so it runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/inbound")
@RequiredArgsConstructor
@Slf4j
public class InboundMessageController {

    private final Engine engine;
    private final InboundAuthenticator authenticator;

    @PostMapping("/message")
    public Mono<ResponseEntity<Object>> message(
            @RequestBody InboundMessageRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!authenticator.authenticate(headers)) {
                return unauthorized();
            }
            if (isBlank(request.getTenantId())) {
                return badRequest("'tenantId' is required");
            }
            if (isBlank(request.getContactKey())) {
                return badRequest("'contactKey' is required");
            }
            if (isBlank(request.getText())) {
                return badRequest("'text' is required");
            }
            if (!isBlank(request.getChannel()) && !isKnownChannel(request.getChannel())) {
                return badRequest("Unknown channel: " + request.getChannel());
            }

            InboundMessage message = InboundMessage.builder()
                    .tenantId(request.getTenantId())
                    .channel(Channel.fromValue(request.getChannel()))
                    .contactKey(request.getContactKey())
                    .userText(request.getText())
                    .externalThreadKey(request.getExternalThreadKey())
                    .raw(request.getRaw())
                    .build();
            return ResponseEntity.ok((Object) engine.handle(message));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/voice/greeting")
    public Mono<ResponseEntity<Object>> voiceGreeting(
            @RequestBody CallGreetingRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!authenticator.authenticate(headers)) {
                return unauthorized();
            }
            if (isBlank(request.tenantId()) || isBlank(request.from())) {
                return badRequest("'tenantId' and 'from' are required");
            }
            return ResponseEntity.ok((Object) engine.greetCaller(request.tenantId(), request.from()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/rate-limit/{tenantId}")
    public Mono<ResponseEntity<Object>> rateLimit(
            @PathVariable String tenantId,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!authenticator.authenticate(headers)) {
                return unauthorized();
            }
            return ResponseEntity.ok((Object) RateLimitStatusResponse.of(tenantId,
                    engine.rateLimitStatus(tenantId)));
        });
    }

    private static boolean isKnownChannel(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(Channel.values()).anyMatch(channel -> channel.getValue().equals(normalized));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ResponseEntity<Object> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ApiErrorResponse("Unauthorized"));
    }

    private static ResponseEntity<Object> badRequest(String message) {
        log.debug("[Inbound] Rejected request: {}", message);
        return ResponseEntity.badRequest().body(new ApiErrorResponse(message));
    }
}
