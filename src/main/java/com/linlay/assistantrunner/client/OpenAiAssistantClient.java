package com.linlay.assistantrunner.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantrunner.config.AssistantProviderProperties;
import com.linlay.assistantrunner.run.RunHandle;
import com.linlay.assistantrunner.run.RunSnapshot;
import com.linlay.assistantrunner.run.RunStatus;
import com.linlay.assistantrunner.run.ToolCallRequest;
import com.linlay.assistantrunner.run.ToolCallResult;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link RemoteAssistantClient} for the OpenAI Assistants v2 REST API.
 */
@Component
public class OpenAiAssistantClient implements RemoteAssistantClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiAssistantClient.class);
    private static final String BETA_HEADER = "OpenAI-Beta";
    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final AssistantProviderProperties properties;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public OpenAiAssistantClient(
            AssistantProviderProperties properties,
            ObjectMapper objectMapper,
            ConnectionProvider assistantConnectionProvider
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.webClient = buildWebClient(properties, assistantConnectionProvider);
    }

    @Override
    public Mono<CallResult<String>> createThread() {
        return execute(
                "createThread",
                () -> webClient.post()
                        .uri("/threads")
                        .bodyValue(Map.of())
                        .retrieve()
                        .bodyToMono(JsonNode.class),
                node -> requireText(node, "id")
        );
    }

    @Override
    public Mono<CallResult<String>> postMessage(String threadId, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("role", "user");
        body.put("content", text == null ? "" : text);
        return execute(
                "postMessage",
                () -> webClient.post()
                        .uri("/threads/{threadId}/messages", threadId)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(JsonNode.class),
                node -> requireText(node, "id")
        );
    }

    @Override
    public Mono<CallResult<RunHandle>> createRun(String threadId) {
        if (!StringUtils.hasText(properties.getAssistantId())) {
            return Mono.just(CallResult.fatal("createRun", CallResult.NO_STATUS, "Missing assistant-id"));
        }
        return execute(
                "createRun",
                () -> webClient.post()
                        .uri("/threads/{threadId}/runs", threadId)
                        .bodyValue(Map.of("assistant_id", properties.getAssistantId().trim()))
                        .retrieve()
                        .bodyToMono(JsonNode.class),
                node -> new RunHandle(threadId, requireText(node, "id"))
        );
    }

    @Override
    public Mono<CallResult<Optional<RunHandle>>> getLatestRun(String threadId) {
        return execute(
                "getLatestRun",
                () -> webClient.get()
                        .uri(builder -> builder.path("/threads/{threadId}/runs")
                                .queryParam("order", "desc")
                                .queryParam("limit", 1)
                                .build(threadId))
                        .retrieve()
                        .bodyToMono(JsonNode.class),
                page -> latestRun(threadId, page)
        );
    }

    @Override
    public Mono<CallResult<RunSnapshot>> getRunStatus(RunHandle run) {
        return execute(
                "getRunStatus",
                () -> webClient.get()
                        .uri("/threads/{threadId}/runs/{runId}", run.threadId(), run.runId())
                        .retrieve()
                        .bodyToMono(JsonNode.class),
                node -> parseRun(run, node)
        );
    }

    @Override
    public Mono<CallResult<RunSnapshot>> submitToolOutputs(RunHandle run, List<ToolCallResult> outputs) {
        List<Map<String, Object>> toolOutputs = new ArrayList<>();
        for (ToolCallResult output : outputs == null ? List.<ToolCallResult>of() : outputs) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("tool_call_id", output.toolCallId());
            item.put("output", output.output() == null ? "" : output.output());
            toolOutputs.add(item);
        }
        return execute(
                "submitToolOutputs",
                () -> webClient.post()
                        .uri("/threads/{threadId}/runs/{runId}/submit_tool_outputs", run.threadId(), run.runId())
                        .bodyValue(Map.of("tool_outputs", toolOutputs))
                        .retrieve()
                        .bodyToMono(JsonNode.class),
                node -> parseRun(run, node)
        );
    }

    @Override
    public Mono<CallResult<RunSnapshot>> cancelRun(RunHandle run) {
        return execute(
                "cancelRun",
                () -> webClient.post()
                        .uri("/threads/{threadId}/runs/{runId}/cancel", run.threadId(), run.runId())
                        .retrieve()
                        .bodyToMono(JsonNode.class),
                node -> parseRun(run, node)
        );
    }

    @Override
    public Mono<CallResult<Optional<String>>> getLatestMessage(String threadId) {
        int pageSize = Math.max(1, Math.min(100, properties.getMessagePageSize()));
        return execute(
                "getLatestMessage",
                () -> webClient.get()
                        .uri(builder -> builder.path("/threads/{threadId}/messages")
                                .queryParam("order", "desc")
                                .queryParam("limit", pageSize)
                                .build(threadId))
                        .retrieve()
                        .bodyToMono(JsonNode.class),
                this::latestAssistantText
        );
    }

    private <T> Mono<CallResult<T>> execute(
            String operation,
            Supplier<Mono<JsonNode>> request,
            Function<JsonNode, T> mapper
    ) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            return Mono.just(CallResult.fatal(operation, CallResult.NO_STATUS, "Missing api-key"));
        }
        long startNanos = System.nanoTime();
        return Mono.defer(request)
                .timeout(Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs())))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Empty response body")))
                .map(node -> CallResult.<T>ok(mapper.apply(node)))
                .onErrorResume(ex -> Mono.just(FailureClassifier.<T>classify(operation, ex)))
                .doOnNext(result -> logResult(operation, result, startNanos));
    }

    private void logResult(String operation, CallResult<?> result, long startNanos) {
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
        if (result.isOk()) {
            log.debug("assistant call {} succeeded in {} ms", operation, elapsedMs);
            return;
        }
        log.warn("assistant call failed in {} ms: {}", elapsedMs, result.describe());
    }

    RunSnapshot parseRun(RunHandle run, JsonNode node) {
        RunStatus status = RunStatus.fromWire(requireText(node, "status"));
        List<ToolCallRequest> toolCalls = new ArrayList<>();
        if (status == RunStatus.REQUIRES_ACTION) {
            JsonNode calls = node.path("required_action").path("submit_tool_outputs").path("tool_calls");
            for (JsonNode call : calls) {
                JsonNode function = call.path("function");
                String rawArguments = function.path("arguments").asText("");
                toolCalls.add(new ToolCallRequest(
                        requireText(call, "id"),
                        function.path("name").asText(""),
                        parseArguments(rawArguments),
                        rawArguments
                ));
            }
        }
        return new RunSnapshot(run, status, toolCalls, lastError(node.path("last_error")));
    }

    Optional<RunHandle> latestRun(String threadId, JsonNode page) {
        JsonNode newest = page.path("data").path(0);
        if (newest.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(new RunHandle(threadId, requireText(newest, "id")));
    }

    Optional<String> latestAssistantText(JsonNode page) {
        // page is newest first; collect assistant messages written after the newest user message
        List<String> texts = new ArrayList<>();
        for (JsonNode message : page.path("data")) {
            if (!"assistant".equals(message.path("role").asText())) {
                break;
            }
            List<String> parts = new ArrayList<>();
            for (JsonNode content : message.path("content")) {
                if ("text".equals(content.path("type").asText())) {
                    parts.add(content.path("text").path("value").asText(""));
                }
            }
            String text = String.join("\n", parts).trim();
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        if (texts.isEmpty()) {
            return Optional.empty();
        }
        Collections.reverse(texts);
        return Optional.of(String.join("\n\n", texts));
    }

    private Map<String, Object> parseArguments(String rawArguments) {
        if (!StringUtils.hasText(rawArguments)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(rawArguments, ARGUMENTS_TYPE);
        } catch (JsonProcessingException ex) {
            log.warn("Tool call arguments are not a JSON object: {}", ex.getOriginalMessage());
            return Map.of();
        }
    }

    private String lastError(JsonNode error) {
        if (error == null || !error.isObject()) {
            return null;
        }
        String code = error.path("code").asText("");
        String message = error.path("message").asText("");
        if (!StringUtils.hasText(code)) {
            return message;
        }
        return StringUtils.hasText(message) ? code + ": " + message : code;
    }

    private String requireText(JsonNode node, String field) {
        String value = node == null ? null : node.path(field).asText(null);
        if (!StringUtils.hasText(value)) {
            throw new IllegalStateException("Response is missing field '" + field + "'");
        }
        return value;
    }

    private static WebClient buildWebClient(AssistantProviderProperties properties, ConnectionProvider connectionProvider) {
        HttpClient httpClient = (connectionProvider != null ? HttpClient.create(connectionProvider) : HttpClient.create())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(100L, properties.getConnectTimeoutMs()));
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(trimTrailingSlash(properties.getBaseUrl()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(properties.getBetaHeader())) {
            builder.defaultHeader(BETA_HEADER, properties.getBetaHeader().trim());
        }
        if (StringUtils.hasText(properties.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey().trim());
        }
        return builder.build();
    }

    private static String trimTrailingSlash(String baseUrl) {
        String value = baseUrl == null ? "" : baseUrl.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
