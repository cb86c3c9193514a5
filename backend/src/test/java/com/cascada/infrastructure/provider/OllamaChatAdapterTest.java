/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OllamaChatAdapterTest {
    private static final String OK_BODY = """
            {"model":"gemma2:2b","message":{"role":"assistant","content":"Paris."},
             "done":true,"prompt_eval_count":12,"eval_count":3}
            """;

    @Test
    void parsesMessageAndTokenCounts() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        OllamaChatAdapter adapter = adapter("secret", req -> {
            seen.set(req);
            return json(HttpStatus.OK, OK_BODY);
        });

        CompletionResult result = adapter.complete(request(Duration.ofSeconds(2)));

        assertEquals("Paris.", result.text());
        assertEquals(12, result.usage().promptTokens());
        assertEquals(3, result.usage().completionTokens());
        assertEquals("http://ollama:11434/api/chat", seen.get().url().toString());
        assertEquals("Bearer secret", seen.get().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void missingCountsMeanNoUsage() {
        OllamaChatAdapter adapter = adapter(null, req -> json(HttpStatus.OK, "{\"message\":{\"content\":\"hi\"}}"));

        CompletionResult result = adapter.complete(request(Duration.ofSeconds(2)));

        assertEquals("hi", result.text());
        assertNull(result.usage());
    }

    @Test
    void statusCodesMapToErrorTypes() {
        assertEquals(ProviderErrorType.AUTH, failure(HttpStatus.UNAUTHORIZED).getType());
        assertEquals(ProviderErrorType.RATE_LIMIT, failure(HttpStatus.TOO_MANY_REQUESTS).getType());
        assertEquals(ProviderErrorType.TIMEOUT, failure(HttpStatus.GATEWAY_TIMEOUT).getType());
        assertEquals(ProviderErrorType.TRANSPORT, failure(HttpStatus.INTERNAL_SERVER_ERROR).getType());
    }

    @Test
    void emptyMessageIsMalformed() {
        OllamaChatAdapter adapter = adapter(null, req -> json(HttpStatus.OK, "{\"done\":true}"));

        ProviderException e = assertThrows(ProviderException.class, () -> adapter.complete(request(Duration.ofSeconds(2))));
        assertEquals(ProviderErrorType.MALFORMED_RESPONSE, e.getType());
        assertEquals("gemma", e.getProviderId());
    }

    @Test
    void undecodableBodyIsMalformed() {
        OllamaChatAdapter adapter = adapter(null, req -> json(HttpStatus.OK, "<html>oops</html>"));

        ProviderException e = assertThrows(ProviderException.class, () -> adapter.complete(request(Duration.ofSeconds(2))));
        assertEquals(ProviderErrorType.MALFORMED_RESPONSE, e.getType());
    }

    @Test
    void slowServerTimesOut() {
        OllamaChatAdapter adapter = adapter(null, req -> Mono.never());

        ProviderException e = assertThrows(ProviderException.class, () -> adapter.complete(request(Duration.ofMillis(100))));
        assertEquals(ProviderErrorType.TIMEOUT, e.getType());
    }

    private static ProviderException failure(HttpStatus status) {
        OllamaChatAdapter adapter = adapter(null, req -> json(status, "{\"error\":\"nope\"}"));
        return assertThrows(ProviderException.class, () -> adapter.complete(request(Duration.ofSeconds(2))));
    }

    private static OllamaChatAdapter adapter(String apiKey, ExchangeFunction exchange) {
        WebClient client = WebClient.builder().exchangeFunction(exchange).build();
        return new OllamaChatAdapter("gemma", "gemma2:2b", "http://ollama:11434/", apiKey, client);
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    private static CompletionRequest request(Duration timeout) {
        return new CompletionRequest("be brief", "capital of France?", CompletionParameters.defaults(), timeout);
    }
}
