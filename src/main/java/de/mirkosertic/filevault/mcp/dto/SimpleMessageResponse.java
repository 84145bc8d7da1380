package de.mirkosertic.filevault.mcp.dto;

/**
 * Response DTO for tools that only report success or failure.
 */
public record SimpleMessageResponse(
        boolean success,
        String message,
        String error
) {
    public static SimpleMessageResponse success(final String message) {
        return new SimpleMessageResponse(true, message, null);
    }

    public static SimpleMessageResponse error(final String errorMessage) {
        return new SimpleMessageResponse(false, null, errorMessage);
    }
}
