/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Ollama {@code /api/chat} adapter (non-streaming).
 */
public class OllamaChatAdapter implements ModelAdapter {
    private static final Logger log = LoggerFactory.getLogger(OllamaChatAdapter.class);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String providerId;
    private final String model;
    private final String chatEndpoint;
    private final String apiKey;
    private final WebClient webClient;

    public OllamaChatAdapter(String providerId, String model, String baseUrl, String apiKey, WebClient webClient) {
        this.providerId = providerId;
        this.model = model;
        this.chatEndpoint = normalizeEndpoint(baseUrl) + "/api/chat";
        this.apiKey = apiKey;
        this.webClient = webClient;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public CompletionResult complete(CompletionRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("stream", Boolean.FALSE);
        body.put("messages", messages(request));

        CompletionParameters params = request.parameters() == null ? CompletionParameters.defaults() : request.parameters();
        body.put("options", Map.of(
                "temperature", params.temperature(),
                "top_p", params.topP(),
                "num_predict", params.maxTokens()
        ));

        Duration timeout = request.timeout() == null ? DEFAULT_TIMEOUT : request.timeout();
        try {
            OllamaChatResponse resp = webClient.post()
                    .uri(chatEndpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (apiKey != null && !apiKey.isBlank()) {
                            h.setBearerAuth(apiKey);
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(OllamaChatResponse.class)
                    .timeout(timeout)
                    .block();

            if (resp == null || resp.message == null || resp.message.content == null) {
                throw new ProviderException(providerId, ProviderErrorType.MALFORMED_RESPONSE, "Ollama response has no message content");
            }

            TokenUsage usage = (resp.promptEvalCount == null && resp.evalCount == null)
                    ? null
                    : new TokenUsage(
                            resp.promptEvalCount == null ? 0 : resp.promptEvalCount,
                            resp.evalCount == null ? 0 : resp.evalCount
                    );
            return new CompletionResult(resp.message.content, usage);
        } catch (ProviderException e) {
            throw e;
        } catch (WebClientResponseException e) {
            throw mapWebClientException(e);
        } catch (WebClientRequestException e) {
            if (hasCause(e, ReadTimeoutException.class) || hasCause(e, TimeoutException.class)) {
                throw new ProviderException(providerId, ProviderErrorType.TIMEOUT, "Ollama request timed out", e);
            }
            throw new ProviderException(providerId, ProviderErrorType.TRANSPORT, "Ollama request failed", e);
        } catch (DecodingException e) {
            throw new ProviderException(providerId, ProviderErrorType.MALFORMED_RESPONSE, "Ollama response could not be decoded", e);
        } catch (RuntimeException e) {
            if (hasCause(e, TimeoutException.class)) {
                throw new ProviderException(providerId, ProviderErrorType.TIMEOUT, "Ollama request timed out", e);
            }
            if (hasCause(e, DecodingException.class)) {
                throw new ProviderException(providerId, ProviderErrorType.MALFORMED_RESPONSE, "Ollama response could not be decoded", e);
            }
            throw new ProviderException(providerId, ProviderErrorType.TRANSPORT, "Ollama request failed", e);
        }
    }

    private List<Map<String, Object>> messages(CompletionRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.prompt() == null ? "" : request.prompt()));
        return messages;
    }

    private ProviderException mapWebClientException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        ProviderErrorType type;
        if (status == 401 || status == 403) type = ProviderErrorType.AUTH;
        else if (status == 429) type = ProviderErrorType.RATE_LIMIT;
        else if (status == 408 || status == 504) type = ProviderErrorType.TIMEOUT;
        else type = ProviderErrorType.TRANSPORT;

        log.warn("Ollama error provider={} model={} type={} status={}", providerId, model, type, status);
        return new ProviderException(providerId, type, "Ollama request failed with status " + status);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable t = error;
        while (t != null) {
            if (type.isInstance(t)) return true;
            t = t.getCause();
        }
        return false;
    }

    private static String normalizeEndpoint(String value) {
        if (value == null || value.isBlank()) {
            return "http://localhost:11434";
        }
        return value.trim().replaceAll("/+$", "");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class OllamaChatResponse {
        public OllamaMessage message;

        @JsonProperty("prompt_eval_count")
        public Long promptEvalCount;

        @JsonProperty("eval_count")
        public Long evalCount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class OllamaMessage {
        public String role;
        public String content;
    }
}
