package com.linlay.assistantrunner.run;

import com.linlay.assistantrunner.client.CallResult;
import com.linlay.assistantrunner.client.RemoteAssistantClient;
import com.linlay.assistantrunner.config.RunPollingProperties;
import com.linlay.assistantrunner.model.TurnErrorCategory;
import com.linlay.assistantrunner.model.TurnFailedException;
import com.linlay.assistantrunner.model.TurnSideEffect;
import com.linlay.assistantrunner.run.policy.BackoffPolicy;
import com.linlay.assistantrunner.run.policy.PollingBudget;
import com.linlay.assistantrunner.run.policy.RetryDecision;
import com.linlay.assistantrunner.run.policy.RetryPolicy;
import com.linlay.assistantrunner.tool.ToolDispatchException;
import com.linlay.assistantrunner.tool.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Drives one run from creation to a terminal state.
 * <p>
 * Polls with exponential backoff (reset on every observed state change and after each tool-output
 * submission), resolves required tool calls through the {@link ToolDispatcher}, retries transient
 * client failures within the budget and enforces a wall-clock ceiling per run. Waiting is done with
 * Reactor timers only.
 */
@Component
public class RunPoller {

    private static final Logger log = LoggerFactory.getLogger(RunPoller.class);

    private final RemoteAssistantClient client;
    private final ToolDispatcher toolDispatcher;
    private final PollingBudget budget;
    private final BackoffPolicy backoffPolicy;
    private final RetryPolicy retryPolicy;
    private final RemoteCallExecutor callExecutor;
    private final List<RunEventListener> listeners;

    @Autowired
    public RunPoller(
            RemoteAssistantClient client,
            ToolDispatcher toolDispatcher,
            RunPollingProperties properties,
            List<RunEventListener> listeners
    ) {
        this(client, toolDispatcher, properties.toBudget(), listeners);
    }

    public RunPoller(
            RemoteAssistantClient client,
            ToolDispatcher toolDispatcher,
            PollingBudget budget,
            List<RunEventListener> listeners
    ) {
        this.client = client;
        this.toolDispatcher = toolDispatcher;
        this.budget = budget == null ? PollingBudget.DEFAULT : budget;
        this.backoffPolicy = this.budget.backoff();
        this.retryPolicy = this.budget.retry();
        this.callExecutor = new RemoteCallExecutor(this.budget);
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public PollingBudget budget() {
        return budget;
    }

    /**
     * Polls {@code run} until it is terminal. The returned {@link Mono} always completes with an
     * outcome; failures are reported as {@link RunOutcome.Failed}.
     */
    public Mono<RunOutcome> drive(String userId, RunHandle run) {
        return Mono.defer(() -> {
            PollState state = new PollState(userId, run);
            return pollOnce(state)
                    .timeout(budget.runTimeout(), Mono.fromSupplier(() -> failed(
                            state,
                            TurnErrorCategory.TIMEOUT,
                            "Run did not finish within " + budget.runTimeoutMs() + " ms"
                    )))
                    .onErrorResume(TurnFailedException.class,
                            ex -> Mono.just(failed(state, ex.category(), ex.getMessage())))
                    .doOnNext(outcome -> emit(RunEvent.terminal(userId, run, state.status, describe(outcome))));
        });
    }

    /**
     * Brings a run left behind by an abandoned turn to a terminal state: a run that is already
     * terminal is left alone, otherwise it is cancelled and polled until the service confirms it.
     *
     * @return the terminal status observed, or a {@link TurnFailedException} when the run did not settle
     *         within the orphan reconcile timeout
     */
    public Mono<RunStatus> settleOrphan(String userId, RunHandle run) {
        return callExecutor.call("getRunStatus", () -> client.getRunStatus(run))
                .flatMap(snapshot -> {
                    if (snapshot.status().isTerminal()) {
                        log.info("orphaned run already finished user={}, run={}, status={}",
                                userId, run.runId(), snapshot.status());
                        return Mono.just(snapshot.status());
                    }
                    log.info("cancel orphaned run user={}, run={}, status={}", userId, run.runId(), snapshot.status());
                    return callExecutor.call("cancelRun", () -> client.cancelRun(run))
                            .map(RunSnapshot::status)
                            .onErrorResume(TurnFailedException.class, ex -> {
                                log.warn("cancel of orphaned run {} rejected, waiting for it instead: {}",
                                        run.runId(), ex.getMessage());
                                return Mono.just(RunStatus.CANCELLING);
                            })
                            .flatMap(status -> status.isTerminal() ? Mono.just(status) : awaitTerminal(run, 0));
                })
                .timeout(budget.orphanReconcileTimeout(), Mono.error(() -> new TurnFailedException(
                        TurnErrorCategory.TIMEOUT,
                        "Orphaned run " + run.runId() + " did not settle within " + budget.orphanReconcileTimeoutMs() + " ms"
                )));
    }

    private Mono<RunStatus> awaitTerminal(RunHandle run, int step) {
        return Mono.delay(backoffPolicy.delayFor(step))
                .then(Mono.defer(() -> callExecutor.call("getRunStatus", () -> client.getRunStatus(run))))
                .flatMap(snapshot -> snapshot.status().isTerminal()
                        ? Mono.just(snapshot.status())
                        : awaitTerminal(run, step + 1));
    }

    private Mono<RunOutcome> pollOnce(PollState state) {
        Duration delay = backoffPolicy.delayFor(state.backoffStep);
        emit(RunEvent.pollScheduled(state.userId, state.run, state.status, delay));
        return Mono.delay(delay)
                .then(Mono.defer(() -> client.getRunStatus(state.run)))
                .flatMap(result -> onPollResult(state, result));
    }

    private Mono<RunOutcome> onPollResult(PollState state, CallResult<RunSnapshot> result) {
        RetryDecision decision = retryPolicy.decide(result, state.consecutiveTransientFailures);
        if (decision == RetryDecision.RETRY) {
            state.consecutiveTransientFailures++;
            state.backoffStep++;
            emit(RunEvent.transientFailure(state.userId, state.run, state.status, result.describe()));
            return pollOnce(state);
        }
        if (decision == RetryDecision.GIVE_UP) {
            return Mono.just(failed(state, TurnErrorCategory.TIMEOUT,
                    "Transient retry budget exhausted: " + result.describe()));
        }
        if (decision == RetryDecision.FAIL_FATAL) {
            return Mono.just(failed(state, TurnErrorCategory.REMOTE_FATAL, result.describe()));
        }

        RunSnapshot snapshot = ((CallResult.Ok<RunSnapshot>) result).value();
        state.consecutiveTransientFailures = 0;
        observe(state, snapshot.status());

        return switch (snapshot.status()) {
            case COMPLETED -> fetchReply(state);
            case FAILED, CANCELLED -> Mono.just(failed(state, TurnErrorCategory.REMOTE_FATAL,
                    "Run ended with status " + snapshot.status().wireValue() + lastErrorSuffix(snapshot)));
            case EXPIRED -> Mono.just(failed(state, TurnErrorCategory.TIMEOUT,
                    "Run expired on the remote service" + lastErrorSuffix(snapshot)));
            case REQUIRES_ACTION -> onRequiresAction(state, snapshot);
            default -> pollOnce(state);
        };
    }

    private Mono<RunOutcome> onRequiresAction(PollState state, RunSnapshot snapshot) {
        if (snapshot.toolCalls().isEmpty()) {
            return Mono.just(failed(state, TurnErrorCategory.REMOTE_FATAL,
                    "Run requires action but lists no tool calls"));
        }
        List<ToolCallRequest> pending = snapshot.toolCalls().stream()
                .filter(call -> !state.submittedToolCallIds.contains(call.id()))
                .toList();
        if (pending.isEmpty()) {
            // outputs already submitted, the service has not caught up yet
            return pollOnce(state);
        }
        return toolDispatcher.dispatchAsync(state.userId, state.run.threadId(), pending)
                .flatMap(batch -> {
                    state.sideEffects.addAll(batch.sideEffects());
                    return callExecutor.call(
                                    "submitToolOutputs",
                                    () -> client.submitToolOutputs(state.run, batch.results())
                            )
                            .flatMap(submitted -> {
                                pending.forEach(call -> state.submittedToolCallIds.add(call.id()));
                                state.toolRounds++;
                                state.status = submitted.status();
                                state.backoffStep = 0;
                                emit(RunEvent.toolOutputsSubmitted(
                                        state.userId, state.run, state.status, batch.results().size()));
                                return pollOnce(state);
                            });
                })
                .onErrorResume(ToolDispatchException.class, ex -> {
                    state.sideEffects.addAll(ex.sideEffects());
                    return Mono.just(failed(state, TurnErrorCategory.TOOL_FAILURE, ex.getMessage()));
                });
    }

    private Mono<RunOutcome> fetchReply(PollState state) {
        return callExecutor.call("getLatestMessage", () -> client.getLatestMessage(state.run.threadId()))
                .map(reply -> new RunOutcome.Completed(
                        state.run,
                        reply.orElse(null),
                        state.sideEffects,
                        state.toolRounds
                ));
    }

    private void observe(PollState state, RunStatus observed) {
        if (observed != state.status) {
            RunStatus previous = state.status;
            state.status = observed;
            state.backoffStep = 0;
            emit(RunEvent.statusChanged(state.userId, state.run, previous, observed));
            return;
        }
        state.backoffStep++;
    }

    private RunOutcome failed(PollState state, TurnErrorCategory category, String detail) {
        return new RunOutcome.Failed(state.run, category, detail, state.status, state.sideEffects, state.toolRounds);
    }

    private void emit(RunEvent event) {
        for (RunEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException ex) {
                log.warn("run event listener {} failed on {}", listener.getClass().getSimpleName(), event.type(), ex);
            }
        }
    }

    private static String describe(RunOutcome outcome) {
        if (outcome instanceof RunOutcome.Failed failed) {
            return "failed category=" + failed.category() + ", detail=" + failed.detail();
        }
        return "completed toolRounds=" + outcome.toolRounds();
    }

    private static String lastErrorSuffix(RunSnapshot snapshot) {
        return snapshot.lastError() == null || snapshot.lastError().isBlank() ? "" : ": " + snapshot.lastError();
    }

    private static final class PollState {

        private final String userId;
        private final RunHandle run;
        private final Set<String> submittedToolCallIds = new HashSet<>();
        private final List<TurnSideEffect> sideEffects = new CopyOnWriteArrayList<>();
        private volatile RunStatus status = RunStatus.QUEUED;
        private int backoffStep;
        private int consecutiveTransientFailures;
        private int toolRounds;

        private PollState(String userId, RunHandle run) {
            this.userId = userId;
            this.run = run;
        }
    }
}
