package me.golemcore.concierge.adapter.inbound.web;

import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.*;

class InboundAuthenticatorTest {

    private ConciergeProperties properties;
    private InboundAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        properties = new ConciergeProperties();
        properties.getInbound().setToken("s3cret");
        authenticator = new InboundAuthenticator(properties);
    }

    private static HttpHeaders headers(String name, String value) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(name, value);
        return headers;
    }

    @Test
    void shouldAcceptBearerToken() {
        assertTrue(authenticator.authenticate(headers(HttpHeaders.AUTHORIZATION, "Bearer s3cret")));
    }

    @Test
    void shouldAcceptCustomHeader() {
        assertTrue(authenticator.authenticate(headers("X-Concierge-Token", "s3cret")));
    }

    @Test
    void shouldRejectWrongOrMissingToken() {
        assertFalse(authenticator.authenticate(headers(HttpHeaders.AUTHORIZATION, "Bearer nope")));
        assertFalse(authenticator.authenticate(headers(HttpHeaders.AUTHORIZATION, "Basic s3cret")));
        assertFalse(authenticator.authenticate(new HttpHeaders()));
    }

    @Test
    void shouldRejectEverythingWithoutConfiguredToken() {
        properties.getInbound().setToken(" ");

        assertFalse(authenticator.authenticate(headers(HttpHeaders.AUTHORIZATION, "Bearer  ")));
        assertFalse(authenticator.authenticate(headers("X-Concierge-Token", "s3cret")));
    }
}
