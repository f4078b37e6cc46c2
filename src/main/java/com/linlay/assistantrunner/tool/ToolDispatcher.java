package com.linlay.assistantrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.assistantrunner.model.TurnSideEffect;
import com.linlay.assistantrunner.run.ToolCallRequest;
import com.linlay.assistantrunner.run.ToolCallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves one batch of required tool calls into submission payloads.
 * <p>
 * A failing tool yields an error output ({@code {"tool":..,"ok":false,"error":..}}) so the other
 * calls of the batch still run. Unknown tools and failing critical tools abort the batch with
 * {@link ToolDispatchException}.
 */
@Component
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    public ToolDispatcher(ToolRegistry toolRegistry, ObjectMapper objectMapper) {
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
    }

    public Mono<DispatchBatch> dispatchAsync(String userId, String threadId, List<ToolCallRequest> calls) {
        return Mono.fromCallable(() -> dispatch(userId, threadId, calls))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public DispatchBatch dispatch(String userId, String threadId, List<ToolCallRequest> calls) {
        if (calls == null || calls.isEmpty()) {
            return new DispatchBatch(List.of(), List.of());
        }
        List<ResolvedCall> resolved = resolve(calls);
        List<ToolCallResult> results = new ArrayList<>();
        List<TurnSideEffect> sideEffects = new ArrayList<>();
        for (ResolvedCall call : resolved) {
            ToolName toolName = call.tool().name();
            JsonNode output;
            try {
                ToolInvocation invocation = call.tool().invoke(
                        new ToolCallContext(userId, threadId, call.request().id()),
                        call.request().arguments()
                );
                output = invocation == null ? null : invocation.output();
                if (invocation != null) {
                    sideEffects.addAll(invocation.sideEffects());
                }
            } catch (RuntimeException ex) {
                if (toolRegistry.isCritical(toolName)) {
                    throw new ToolDispatchException(
                            toolName.wireName(),
                            "Critical tool failed: " + toolName.wireName() + ": " + resolveErrorMessage(ex),
                            ex,
                            sideEffects
                    );
                }
                log.warn("Tool '{}' failed for user={}, callId={}: {}",
                        toolName.wireName(), userId, call.request().id(), resolveErrorMessage(ex));
                output = errorResult(toolName.wireName(), resolveErrorMessage(ex));
            }
            results.add(new ToolCallResult(call.request().id(), toResultText(output)));
        }
        return new DispatchBatch(results, sideEffects);
    }

    private List<ResolvedCall> resolve(List<ToolCallRequest> calls) {
        // every name is checked before any tool runs
        List<ResolvedCall> resolved = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (ToolCallRequest call : calls) {
            if (call == null || !StringUtils.hasText(call.id()) || !seenIds.add(call.id())) {
                continue;
            }
            ToolName toolName = ToolName.fromWire(call.name())
                    .orElseThrow(() -> new ToolDispatchException(call.name(), "Unknown tool: " + call.name()));
            AssistantTool tool = toolRegistry.find(toolName)
                    .orElseThrow(() -> new ToolDispatchException(call.name(), "Tool is not registered: " + call.name()));
            resolved.add(new ResolvedCall(call, tool));
        }
        return resolved;
    }

    private ObjectNode errorResult(String toolName, String message) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("tool", toolName);
        error.put("ok", false);
        error.put("error", message == null ? "unknown error" : message);
        return error;
    }

    private String toResultText(JsonNode result) {
        if (result == null || result.isNull()) {
            return "null";
        }
        if (result.isTextual()) {
            return result.asText();
        }
        return result.toString();
    }

    private String resolveErrorMessage(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (StringUtils.hasText(cursor.getMessage())) {
                return cursor.getMessage();
            }
            cursor = cursor.getCause();
        }
        return "unknown error";
    }

    private record ResolvedCall(ToolCallRequest request, AssistantTool tool) {
    }
}
