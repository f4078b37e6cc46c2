package com.linlay.assistantrunner.client;

import com.linlay.assistantrunner.run.RunHandle;
import com.linlay.assistantrunner.run.RunSnapshot;
import com.linlay.assistantrunner.run.ToolCallResult;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Typed view of the hosted assistant's thread/message/run primitives.
 * <p>
 * Every returned {@link Mono} emits exactly one {@link CallResult} and never errors; transport and
 * protocol failures are classified by {@link FailureClassifier}.
 */
public interface RemoteAssistantClient {

    Mono<CallResult<String>> createThread();

    /**
     * @return id of the created message
     */
    Mono<CallResult<String>> postMessage(String threadId, String text);

    Mono<CallResult<RunHandle>> createRun(String threadId);

    /**
     * Most recently created run on the thread, whatever its status; empty if the thread has none.
     */
    Mono<CallResult<Optional<RunHandle>>> getLatestRun(String threadId);

    Mono<CallResult<RunSnapshot>> getRunStatus(RunHandle run);

    Mono<CallResult<RunSnapshot>> submitToolOutputs(RunHandle run, List<ToolCallResult> outputs);

    Mono<CallResult<RunSnapshot>> cancelRun(RunHandle run);

    /**
     * Text of the most recent assistant message on the thread, empty if there is none.
     */
    Mono<CallResult<Optional<String>>> getLatestMessage(String threadId);
}
