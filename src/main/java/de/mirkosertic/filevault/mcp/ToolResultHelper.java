package de.mirkosertic.filevault.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps response DTOs into MCP tool results.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    /**
     * Serialize the DTO into a text content. A record with {@code success == false} is
     * flagged as an error result.
     */
    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(isErrorResponse(response))
                .build();
    }

    public static McpSchema.CallToolResult createErrorResult(final String code, final String message) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("errorCode", code);
        body.put("error", message);
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(body))))
                .isError(true)
                .build();
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            return "{\"success\":false,\"error\":\"JSON serialization error\"}";
        }
    }

    private static boolean isErrorResponse(final Object response) {
        if (response instanceof Record record) {
            for (final var component : record.getClass().getRecordComponents()) {
                if ("success".equals(component.getName())) {
                    try {
                        final Object value = component.getAccessor().invoke(record);
                        return value instanceof Boolean success && !success;
                    } catch (final ReflectiveOperationException e) {
                        return false;
                    }
                }
            }
        }
        return false;
    }
}
