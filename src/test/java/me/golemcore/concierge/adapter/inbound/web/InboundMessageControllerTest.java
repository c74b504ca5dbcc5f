package me.golemcore.concierge.adapter.inbound.web;

import me.golemcore.concierge.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.concierge.adapter.inbound.web.dto.CallGreetingRequest;
import me.golemcore.concierge.adapter.inbound.web.dto.InboundMessageRequest;
import me.golemcore.concierge.adapter.inbound.web.dto.RateLimitStatusResponse;
import me.golemcore.concierge.domain.loop.Engine;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.EngineReply;
import me.golemcore.concierge.domain.model.InboundMessage;
import me.golemcore.concierge.domain.model.RateLimitResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class InboundMessageControllerTest {

    private Engine engine;
    private InboundAuthenticator authenticator;
    private InboundMessageController controller;
    private HttpHeaders headers;

    @BeforeEach
    void setUp() {
        engine = mock(Engine.class);
        authenticator = mock(InboundAuthenticator.class);
        controller = new InboundMessageController(engine, authenticator);
        headers = new HttpHeaders();
        when(authenticator.authenticate(headers)).thenReturn(true);
    }

    private static InboundMessageRequest request(String channel, String text) {
        return InboundMessageRequest.builder()
                .tenantId("tenant-1")
                .channel(channel)
                .contactKey("+61412345678")
                .text(text)
                .externalThreadKey("CA123")
                .raw(Map.of("provider", "test"))
                .build();
    }

    // ==================== Message ====================

    @Test
    void shouldRunMessageThroughEngine() {
        EngineReply reply = EngineReply.builder().replyText("We open at 9.").sessionId("session-1").build();
        when(engine.handle(any())).thenReturn(reply);

        StepVerifier.create(controller.message(request("WhatsApp", "hours?"), headers))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertSame(reply, response.getBody());
                })
                .verifyComplete();

        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(engine).handle(captor.capture());
        assertEquals(Channel.WHATSAPP, captor.getValue().getChannel());
        assertEquals("hours?", captor.getValue().getUserText());
        assertEquals("CA123", captor.getValue().getExternalThreadKey());
    }

    @Test
    void shouldRejectUnauthenticatedRequest() {
        when(authenticator.authenticate(headers)).thenReturn(false);

        StepVerifier.create(controller.message(request("sms", "hi"), headers))
                .assertNext(response -> {
                    assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
                    assertEquals(new ApiErrorResponse("Unauthorized"), response.getBody());
                })
                .verifyComplete();
        verify(engine, never()).handle(any());
    }

    @Test
    void shouldRejectMissingTextAndUnknownChannel() {
        StepVerifier.create(controller.message(request("sms", " "), headers))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals(new ApiErrorResponse("'text' is required"), response.getBody());
                })
                .verifyComplete();

        StepVerifier.create(controller.message(request("fax", "hi"), headers))
                .assertNext(response -> assertEquals(new ApiErrorResponse("Unknown channel: fax"),
                        response.getBody()))
                .verifyComplete();
        verify(engine, never()).handle(any());
    }

    // ==================== Voice greeting and rate limit ====================

    @Test
    void shouldGreetCaller() {
        Engine.CallGreeting greeting = new Engine.CallGreeting("Welcome to Luigi's!", "session-9");
        when(engine.greetCaller("tenant-1", "+61412345678")).thenReturn(greeting);

        StepVerifier.create(controller.voiceGreeting(new CallGreetingRequest("tenant-1", "+61412345678"), headers))
                .assertNext(response -> assertEquals(greeting, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldRequireCallerNumber() {
        StepVerifier.create(controller.voiceGreeting(new CallGreetingRequest("tenant-1", null), headers))
                .assertNext(response -> assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldReportRateLimitWindow() {
        when(engine.rateLimitStatus("tenant-1")).thenReturn(RateLimitResult.allowed(42, 15_000));

        StepVerifier.create(controller.rateLimit("tenant-1", headers))
                .assertNext(response -> assertEquals(new RateLimitStatusResponse("tenant-1", true, 42, 15_000),
                        response.getBody()))
                .verifyComplete();
    }
}
