/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.execution;

import com.cascada.application.metrics.AttemptMetric;
import com.cascada.application.metrics.MetricsRecorder;
import com.cascada.application.registry.ProviderDescriptor;
import com.cascada.domain.model.AttemptOutcome;
import com.cascada.domain.model.CallKind;
import com.cascada.infrastructure.provider.CompletionRequest;
import com.cascada.infrastructure.provider.CompletionResult;
import com.cascada.infrastructure.provider.ModelAdapter;
import com.cascada.infrastructure.provider.ModelAdapterRegistry;
import com.cascada.infrastructure.provider.ProviderException;
import com.cascada.infrastructure.provider.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs exactly one adapter call with a hard timeout and classifies the result. Never retries.
 *
 * <p>Probe calls run on their own executor so that user request timeouts and cancellation never
 * reach them. A call that cannot get a worker in time is reported as {@link AttemptOutcome#REJECTED}
 * and a call abandoned by its caller as {@link AttemptOutcome#CANCELLED}; neither touches health.
 */
public class ExecutionClient {
    private static final Logger log = LoggerFactory.getLogger(ExecutionClient.class);

    private final ModelAdapterRegistry adapters;
    private final ExecutorService trafficExecutor;
    private final ExecutorService probeExecutor;
    private final MetricsRecorder metricsRecorder;
    private final Clock clock;

    public ExecutionClient(
            ModelAdapterRegistry adapters,
            ExecutorService trafficExecutor,
            ExecutorService probeExecutor,
            MetricsRecorder metricsRecorder,
            Clock clock
    ) {
        this.adapters = adapters;
        this.trafficExecutor = trafficExecutor;
        this.probeExecutor = probeExecutor;
        this.metricsRecorder = metricsRecorder;
        this.clock = clock;
    }

    public ExecutionAttempt execute(ProviderDescriptor provider, CompletionRequest request, Duration timeout, CallKind kind, int sequence) {
        ExecutorService executor = kind == CallKind.PROBE ? probeExecutor : trafficExecutor;
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        Optional<ModelAdapter> adapter = adapters.find(provider.id());
        if (adapter.isEmpty()) {
            log.error("No adapter registered provider={} kind={}", provider.id(), kind);
            return finish(provider, kind, sequence, startedAt, startNanos, AttemptOutcome.TRANSPORT_ERROR, null, "No adapter registered for provider");
        }

        CompletionRequest bounded = request.withTimeout(timeout);
        CountDownLatch running = new CountDownLatch(1);
        Future<CompletionResult> future;
        try {
            future = executor.submit(() -> {
                running.countDown();
                return adapter.get().complete(bounded);
            });
        } catch (RejectedExecutionException e) {
            log.warn("Worker queue full, call rejected provider={} kind={}", provider.id(), kind);
            return finish(provider, kind, sequence, startedAt, startNanos, AttemptOutcome.REJECTED, null, "Local worker queue is full");
        }

        CompletionResult result = null;
        AttemptOutcome outcome;
        String error = null;
        try {
            // the call timeout starts once a worker picks the task up
            if (!running.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                future.cancel(true);
                outcome = AttemptOutcome.REJECTED;
                error = "No free worker within " + timeout.toMillis() + "ms";
                log.warn("Call never started, workers saturated provider={} kind={}", provider.id(), kind);
            } else {
                result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (result == null || result.text() == null) {
                    outcome = AttemptOutcome.MALFORMED_RESPONSE;
                    error = "Provider returned no text";
                    result = null;
                } else {
                    outcome = AttemptOutcome.SUCCESS;
                }
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            outcome = AttemptOutcome.TIMEOUT;
            error = "Provider call exceeded " + timeout.toMillis() + "ms";
        } catch (InterruptedException e) {
            future.cancel(true);
            emit(provider, kind, AttemptOutcome.CANCELLED, elapsedMs(startNanos), null);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(provider.id(), e);
        } catch (CancellationException e) {
            outcome = AttemptOutcome.TRANSPORT_ERROR;
            error = "Provider call was cancelled";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            outcome = classify(cause);
            error = cause instanceof ProviderException pe ? pe.getSafeMessage() : cause.getClass().getSimpleName();
            if (!(cause instanceof ProviderException)) {
                log.warn("Unexpected adapter failure provider={} kind={}", provider.id(), kind, cause);
            }
        }

        return finish(provider, kind, sequence, startedAt, startNanos, outcome, result, error);
    }

    private ExecutionAttempt finish(
            ProviderDescriptor provider,
            CallKind kind,
            int sequence,
            Instant startedAt,
            long startNanos,
            AttemptOutcome outcome,
            CompletionResult result,
            String error
    ) {
        long latencyMs = elapsedMs(startNanos);
        TokenUsage usage = result == null ? null : result.usage();
        double cost = usage == null ? 0.0 : usage.totalTokens() * provider.costPerUnit();

        emit(provider, kind, outcome, latencyMs, usage);
        if (outcome != AttemptOutcome.SUCCESS) {
            log.debug("Attempt failed provider={} kind={} seq={} outcome={} latencyMs={}",
                    provider.id(), kind, sequence, outcome, latencyMs);
        }

        return new ExecutionAttempt(
                sequence,
                provider.id(),
                kind,
                startedAt,
                clock.instant(),
                latencyMs,
                outcome,
                result == null ? null : result.text(),
                usage,
                cost,
                error
        );
    }

    static AttemptOutcome classify(Throwable error) {
        if (error instanceof ProviderException pe) {
            return switch (pe.getType()) {
                case AUTH -> AttemptOutcome.AUTH_ERROR;
                case RATE_LIMIT -> AttemptOutcome.RATE_LIMITED;
                case TIMEOUT -> AttemptOutcome.TIMEOUT;
                case MALFORMED_RESPONSE -> AttemptOutcome.MALFORMED_RESPONSE;
                case TRANSPORT -> AttemptOutcome.TRANSPORT_ERROR;
            };
        }
        return AttemptOutcome.TRANSPORT_ERROR;
    }

    private void emit(ProviderDescriptor provider, CallKind kind, AttemptOutcome outcome, long latencyMs, TokenUsage usage) {
        long promptTokens = usage == null ? 0 : usage.promptTokens();
        long completionTokens = usage == null ? 0 : usage.completionTokens();
        double cost = usage == null ? 0.0 : usage.totalTokens() * provider.costPerUnit();
        try {
            metricsRecorder.record(new AttemptMetric(
                    provider.id(), kind, outcome, latencyMs, promptTokens, completionTokens, cost, clock.instant()
            ));
        } catch (RuntimeException e) {
            log.warn("Metrics recorder failed provider={} kind={}", provider.id(), kind, e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
