package com.linlay.assistantrunner.run;

import com.linlay.assistantrunner.client.CallResult;
import com.linlay.assistantrunner.model.TurnErrorCategory;
import com.linlay.assistantrunner.model.TurnFailedException;
import com.linlay.assistantrunner.run.policy.BackoffPolicy;
import com.linlay.assistantrunner.run.policy.PollingBudget;
import com.linlay.assistantrunner.run.policy.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a single remote call, retrying transient failures on the polling backoff schedule.
 * Exhausted retries fail with {@link TurnErrorCategory#TIMEOUT}, fatal results with
 * {@link TurnErrorCategory#REMOTE_FATAL}.
 */
public class RemoteCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(RemoteCallExecutor.class);

    private final BackoffPolicy backoffPolicy;
    private final RetryPolicy retryPolicy;

    public RemoteCallExecutor(PollingBudget budget) {
        PollingBudget safeBudget = budget == null ? PollingBudget.DEFAULT : budget;
        this.backoffPolicy = safeBudget.backoff();
        this.retryPolicy = safeBudget.retry();
    }

    public <T> Mono<T> call(String operation, Supplier<Mono<CallResult<T>>> request) {
        return attempt(operation, request, 0);
    }

    private <T> Mono<T> attempt(String operation, Supplier<Mono<CallResult<T>>> request, int priorFailures) {
        return Mono.defer(request).flatMap(result -> handle(operation, request, result, priorFailures));
    }

    private <T> Mono<T> handle(
            String operation,
            Supplier<Mono<CallResult<T>>> request,
            CallResult<T> result,
            int priorFailures
    ) {
        return switch (retryPolicy.decide(result, priorFailures)) {
            case PROCEED -> Mono.just(((CallResult.Ok<T>) result).value());
            case RETRY -> {
                Duration delay = backoffPolicy.delayFor(priorFailures);
                log.debug("retry {} in {} ms after transient failure #{}: {}",
                        operation, delay.toMillis(), priorFailures + 1, result.describe());
                yield Mono.delay(delay).then(Mono.defer(() -> attempt(operation, request, priorFailures + 1)));
            }
            case GIVE_UP -> Mono.error(new TurnFailedException(
                    TurnErrorCategory.TIMEOUT,
                    "Transient retry budget exhausted: " + result.describe()
            ));
            case FAIL_FATAL -> Mono.error(new TurnFailedException(TurnErrorCategory.REMOTE_FATAL, result.describe()));
        };
    }
}
