package de.mirkosertic.filevault.http;

import java.util.List;

/**
 * Error envelope: {@code {"error": {"code", "message", "allowed"}}}.
 */
public record ApiError(Body error) {

    public record Body(String code, String message, List<String> allowed) {
    }

    public static ApiError of(final String code, final String message) {
        return new ApiError(new Body(code, message, null));
    }

    public static ApiError of(final String code, final String message, final List<String> allowed) {
        return new ApiError(new Body(code, message, allowed.isEmpty() ? null : allowed));
    }
}
