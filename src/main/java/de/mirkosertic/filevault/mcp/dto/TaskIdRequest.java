package de.mirkosertic.filevault.mcp.dto;

import de.mirkosertic.filevault.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the tools addressing one rebuild task.
 */
public record TaskIdRequest(
        @Nullable
        @Description("Task id returned by rebuildIndex. Omit for the most recent task.")
        String taskId
) {
    public static TaskIdRequest fromMap(final Map<String, Object> args) {
        return new TaskIdRequest((String) args.get("taskId"));
    }
}
