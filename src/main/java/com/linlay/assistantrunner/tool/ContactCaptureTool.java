package com.linlay.assistantrunner.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.assistantrunner.model.ExtractedContact;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * Receives the client's contact details collected by the assistant and hands them on as an
 * {@link ExtractedContact}.
 */
@Component
public class ContactCaptureTool implements AssistantTool {

    static final String SUCCESS_MESSAGE = "Contact information saved and notification sent";

    private final ObjectMapper objectMapper;

    public ContactCaptureTool(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolName name() {
        return ToolName.CONTACT_CAPTURE;
    }

    @Override
    public String description() {
        return "Save the client's name and phone number (or e-mail) so that a manager can contact them.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "name", Map.of("type", "string", "description", "Client name"),
                        "phone_number", Map.of("type", "string", "description", "Client phone number"),
                        "email", Map.of("type", "string", "description", "Client e-mail"),
                        "comment", Map.of("type", "string", "description", "What the client is interested in")
                ),
                "required", List.of("name", "phone_number")
        );
    }

    @Override
    public ToolInvocation invoke(ToolCallContext context, Map<String, Object> args) {
        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        String name = firstText(safeArgs, "name");
        String phone = normalizePhone(firstText(safeArgs, "phone_number", "phone"));
        String email = firstText(safeArgs, "email");
        String comment = firstText(safeArgs, "comment", "notes");
        if (phone == null && email == null) {
            throw new IllegalArgumentException("phone_number or email is required");
        }

        ExtractedContact contact = new ExtractedContact(
                context.userId(),
                context.threadId(),
                name,
                phone,
                email,
                comment,
                safeArgs
        );
        ObjectNode output = objectMapper.createObjectNode();
        output.put("status", "success");
        output.put("message", SUCCESS_MESSAGE);
        return new ToolInvocation(output, List.of(contact));
    }

    static String normalizePhone(String raw) {
        if (raw == null) {
            return null;
        }
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (Character.isDigit(ch)) {
                digits.append(ch);
            } else if (ch == '+' && digits.length() == 0) {
                digits.append(ch);
            }
        }
        String normalized = digits.toString();
        if (normalized.isEmpty() || "+".equals(normalized)) {
            return raw.trim();
        }
        return normalized;
    }

    private static String firstText(Map<String, Object> args, String... keys) {
        for (String key : keys) {
            Object value = args.get(key);
            if (value != null && StringUtils.hasText(String.valueOf(value))) {
                return String.valueOf(value).trim();
            }
        }
        return null;
    }
}
