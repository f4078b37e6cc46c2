package com.linlay.assistantrunner.controller;

import com.linlay.assistantrunner.model.AssistantReply;
import com.linlay.assistantrunner.model.TurnError;
import com.linlay.assistantrunner.model.TurnResult;
import com.linlay.assistantrunner.model.api.ApiResponse;
import com.linlay.assistantrunner.model.api.ToolListResponse;
import com.linlay.assistantrunner.model.api.TurnRequest;
import com.linlay.assistantrunner.session.SessionRegistry;
import com.linlay.assistantrunner.session.SessionStats;
import com.linlay.assistantrunner.session.TurnRecord;
import com.linlay.assistantrunner.tool.AssistantTool;
import com.linlay.assistantrunner.tool.ToolRegistry;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/assistant")
public class AssistantController {

    private static final int MAX_TURNS_LIMIT = 1000;

    private final SessionRegistry sessionRegistry;
    private final ToolRegistry toolRegistry;

    public AssistantController(SessionRegistry sessionRegistry, ToolRegistry toolRegistry) {
        this.sessionRegistry = sessionRegistry;
        this.toolRegistry = toolRegistry;
    }

    @PostMapping("/turn")
    public Mono<ResponseEntity<ApiResponse<TurnResult>>> turn(@Valid @RequestBody TurnRequest request) {
        return sessionRegistry.handleTurn(request.userId(), request.text())
                .map(this::toResponse);
    }

    @GetMapping("/turns")
    public ApiResponse<List<TurnRecord>> turns(@RequestParam(defaultValue = "50") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ApiResponse.success(sessionRegistry.recentTurns(Math.min(limit, MAX_TURNS_LIMIT)));
    }

    @GetMapping("/sessions")
    public ApiResponse<SessionStats> sessions() {
        return ApiResponse.success(sessionRegistry.stats());
    }

    @PostMapping("/sessions/evict")
    public ApiResponse<Map<String, Object>> evict(@RequestParam String userId) {
        boolean evicted = sessionRegistry.evict(userId);
        return ApiResponse.success(Map.of("userId", userId, "evicted", evicted));
    }

    @GetMapping("/tools")
    public ApiResponse<ToolListResponse> tools() {
        List<ToolListResponse.ToolSummary> tools = toolRegistry.list().stream()
                .sorted(Comparator.comparing(tool -> tool.name().wireName()))
                .map(this::toSummary)
                .toList();
        return ApiResponse.success(new ToolListResponse(tools));
    }

    private ResponseEntity<ApiResponse<TurnResult>> toResponse(TurnResult result) {
        if (result instanceof AssistantReply reply) {
            return ResponseEntity.ok(ApiResponse.<TurnResult>success(reply));
        }
        TurnError error = (TurnError) result;
        HttpStatus status = switch (error.category()) {
            case BUSY -> HttpStatus.CONFLICT;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case REMOTE_FATAL, TOOL_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status)
                .body(ApiResponse.<TurnResult>failure(status, error.detail(), error));
    }

    private ToolListResponse.ToolSummary toSummary(AssistantTool tool) {
        return new ToolListResponse.ToolSummary(
                tool.name().wireName(),
                tool.description(),
                toolRegistry.isCritical(tool.name()),
                tool.parametersSchema()
        );
    }
}
