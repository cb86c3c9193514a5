/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.escalation;

import com.cascada.application.execution.ExecutionAttempt;
import com.cascada.application.execution.ExecutionClient;
import com.cascada.application.execution.RequestCancelledException;
import com.cascada.application.intent.IntentDetector;
import com.cascada.application.intent.PromptProfiles;
import com.cascada.application.registry.ProviderDescriptor;
import com.cascada.application.registry.RoutingConstraints;
import com.cascada.application.routing.ProviderRouter;
import com.cascada.application.verification.Verdict;
import com.cascada.application.verification.VerificationPipeline;
import com.cascada.domain.model.CallKind;
import com.cascada.domain.model.Intent;
import com.cascada.domain.model.RequestState;
import com.cascada.infrastructure.provider.CompletionParameters;
import com.cascada.infrastructure.provider.CompletionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one request up the escalation ladder until it is accepted, rejected or exhausted.
 *
 * <p>Attempts are strictly sequential: an answer and both of its judge calls finish before the
 * next rung is considered. At most {@code maxEscalations + 1} answer calls are made.
 */
public class EscalationController {
    private static final Logger log = LoggerFactory.getLogger(EscalationController.class);

    private final ProviderRouter router;
    private final ExecutionClient executionClient;
    private final VerificationPipeline pipeline;
    private final IntentDetector intentDetector;
    private final RoutingRequestLogService requestLog;
    private final EscalationSettings settings;

    public EscalationController(
            ProviderRouter router,
            ExecutionClient executionClient,
            VerificationPipeline pipeline,
            IntentDetector intentDetector,
            RoutingRequestLogService requestLog,
            EscalationSettings settings
    ) {
        this.router = router;
        this.executionClient = executionClient;
        this.pipeline = pipeline;
        this.intentDetector = intentDetector;
        this.requestLog = requestLog;
        this.settings = settings;
    }

    /**
     * @throws com.cascada.application.routing.NoProviderAvailableException when no provider can take the first attempt
     * @throws RequestCancelledException when the calling thread is interrupted mid-request
     */
    public RoutingOutcome route(RoutingRequest request) {
        Intent intent = request.intent() != null ? request.intent() : intentDetector.detect(request.prompt());
        ProviderDescriptor current = router.selectInitial(new RoutingConstraints(request.modelOverride(), intent));
        String systemPrompt = PromptProfiles.systemPromptFor(intent);
        RoutingOptions options = request.options();

        Progress progress = new Progress(request, intent, current.id());
        log.info("Routing request={} intent={} initial={}", request.requestId(), intent.code(), current.id());

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RequestCancelledException(current.id(), null);
            }

            int sequence = progress.attempts.size();
            CompletionRequest completion = new CompletionRequest(
                    systemPrompt, request.prompt(), CompletionParameters.defaults(), settings.answerTimeout());
            ExecutionAttempt answer = executionClient.execute(
                    current, completion, settings.answerTimeout(), CallKind.ANSWER, sequence);

            String escalateReason;
            if (!answer.isSuccess()) {
                progress.attempts.add(AttemptReport.failed(answer));
                escalateReason = "ATTEMPT_" + answer.outcome().name();
            } else {
                Verdict verdict = pipeline.evaluate(request.prompt(), answer.output(), current.id(), sequence,
                        options.enableVerification(), options.enableConfidenceScoring());
                progress.attempts.add(AttemptReport.judged(answer, verdict));

                if (!verdict.safe()) {
                    return finish(request, progress.rejected("UNSAFE", current.id(), verdict));
                }
                RequestState next = switch (verdict.confidence().action()) {
                    case REJECT -> RequestState.REJECTED;
                    case ACCEPT -> RequestState.ACCEPTED;
                    case ESCALATE -> RequestState.RUNNING;
                };
                if (next == RequestState.REJECTED) {
                    return finish(request, progress.rejected("CRITICAL_CONFIDENCE", current.id(), verdict));
                }
                if (next == RequestState.ACCEPTED) {
                    return finish(request, progress.accepted(current.id(), answer.output(), verdict));
                }
                progress.offer(current.id(), answer.output(), verdict);
                escalateReason = "CONFIDENCE_" + verdict.confidence().score();
            }

            if (!options.autoEscalate()) {
                return finish(request, progress.exhausted("AUTO_ESCALATE_DISABLED", current.id()));
            }
            if (progress.escalations >= settings.maxEscalations()) {
                return finish(request, progress.exhausted("MAX_ESCALATIONS", current.id()));
            }
            Optional<ProviderDescriptor> next = router.selectNext(current.id());
            if (next.isEmpty()) {
                return finish(request, progress.exhausted("ESCALATION_EXHAUSTED", current.id()));
            }

            log.info("Escalating request={} from={} to={} reason={}",
                    request.requestId(), current.id(), next.get().id(), escalateReason);
            progress.escalations++;
            current = next.get();
        }
    }

    private RoutingOutcome finish(RoutingRequest request, RoutingOutcome outcome) {
        log.info("Routing finished request={} state={} reason={} attempts={} final={} bestEffort={}",
                outcome.requestId(), outcome.terminalState(), outcome.reasonCode(), outcome.attempts().size(),
                outcome.finalProvider(), outcome.bestEffort());
        requestLog.record(request, outcome);
        return outcome;
    }

    /**
     * Mutable state of one request while it is RUNNING. Every terminal method builds the final
     * outcome exactly once.
     */
    private static final class Progress {
        private final RoutingRequest request;
        private final Intent intent;
        private final String originalProvider;
        private final List<AttemptReport> attempts = new ArrayList<>();
        private int escalations;

        private String bestProvider;
        private String bestAnswer;
        private Verdict bestVerdict;

        Progress(RoutingRequest request, Intent intent, String originalProvider) {
            this.request = request;
            this.intent = intent;
            this.originalProvider = originalProvider;
        }

        // ties go to the later attempt
        void offer(String providerId, String answer, Verdict verdict) {
            if (bestVerdict == null || verdict.confidence().score() >= bestVerdict.confidence().score()) {
                bestProvider = providerId;
                bestAnswer = answer;
                bestVerdict = verdict;
            }
        }

        RoutingOutcome accepted(String providerId, String answer, Verdict verdict) {
            return build(RequestState.ACCEPTED, "ACCEPTED", answer, providerId, verdict, false);
        }

        RoutingOutcome rejected(String reason, String providerId, Verdict verdict) {
            return build(RequestState.REJECTED, reason, null, providerId, verdict, false);
        }

        RoutingOutcome exhausted(String reason, String lastProviderId) {
            if (bestVerdict == null) {
                return build(RequestState.EXHAUSTED, reason, null, lastProviderId, null, true);
            }
            return build(RequestState.EXHAUSTED, reason, bestAnswer, bestProvider, bestVerdict, true);
        }

        private RoutingOutcome build(RequestState state, String reason, String answer, String finalProvider, Verdict verdict, boolean bestEffort) {
            long latency = attempts.stream().mapToLong(AttemptReport::latencyMs).sum();
            double cost = attempts.stream().mapToDouble(AttemptReport::cost).sum();
            return new RoutingOutcome(
                    request.requestId(),
                    state,
                    reason,
                    answer,
                    intent,
                    attempts,
                    escalations > 0,
                    originalProvider,
                    finalProvider,
                    verdict == null ? null : verdict.verification(),
                    verdict == null ? null : verdict.confidence(),
                    bestEffort,
                    latency,
                    cost
            );
        }
    }
}
