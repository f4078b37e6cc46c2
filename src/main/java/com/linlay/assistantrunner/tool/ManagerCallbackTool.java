package com.linlay.assistantrunner.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.assistantrunner.model.EscalationRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

@Component
public class ManagerCallbackTool implements AssistantTool {

    static final String DEFAULT_REASON = "Client asked to talk to a manager";

    private final ObjectMapper objectMapper;

    public ManagerCallbackTool(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolName name() {
        return ToolName.MANAGER_CALLBACK;
    }

    @Override
    public String description() {
        return "Ask a human manager to take over the conversation.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "reason", Map.of("type", "string", "description", "Why the client needs a manager")
                )
        );
    }

    @Override
    public ToolInvocation invoke(ToolCallContext context, Map<String, Object> args) {
        Object rawReason = args == null ? null : args.get("reason");
        String reason = rawReason != null && StringUtils.hasText(String.valueOf(rawReason))
                ? String.valueOf(rawReason).trim()
                : DEFAULT_REASON;

        ObjectNode output = objectMapper.createObjectNode();
        output.put("status", "success");
        output.put("message", "A manager has been asked to contact the client");
        return new ToolInvocation(output, List.of(new EscalationRequest(context.userId(), context.threadId(), reason)));
    }
}
