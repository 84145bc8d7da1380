package de.mirkosertic.filevault.mcp.dto;

import de.mirkosertic.filevault.indexsync.IndexSyncException;
import de.mirkosertic.filevault.indexsync.SyncMode;
import de.mirkosertic.filevault.indexsync.SyncRequest;
import de.mirkosertic.filevault.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the rebuildIndex tool.
 */
public record RebuildIndexRequest(
        @Nullable
        @Description("audit (report only), sync (add missing, update stale), clean (remove orphans), full (sync + clean). Default is audit.")
        String mode,

        @Nullable
        @Description("Only reconcile this user. Omit for all users.")
        Long userId,

        @Nullable
        @Description("Only reconcile this organization's shared storage. Implies shared storage.")
        Long orgId,

        @Nullable
        @Description("Reconcile organization shared storage instead of user storage. Default is false.")
        Boolean shared,

        @Nullable
        @Description("Compute and count all actions without changing the index. Default is false.")
        Boolean dryRun,

        @Nullable
        @Description("Must be true for the destructive modes clean and full. Default is false.")
        Boolean force
) {
    public static RebuildIndexRequest fromMap(final Map<String, Object> args) {
        return new RebuildIndexRequest(
                (String) args.get("mode"),
                toLong(args.get("userId")),
                toLong(args.get("orgId")),
                (Boolean) args.get("shared"),
                (Boolean) args.get("dryRun"),
                (Boolean) args.get("force"));
    }

    // JSON numbers arrive as Integer, Long or Double depending on their size
    private static Long toLong(final Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Long.parseLong(text.trim());
        }
        return null;
    }

    public SyncRequest toSyncRequest() throws IndexSyncException {
        final boolean sharedStorage = Boolean.TRUE.equals(shared) || orgId != null;
        return new SyncRequest(
                SyncMode.parse(mode == null ? SyncMode.AUDIT.value() : mode),
                sharedStorage ? orgId : userId,
                sharedStorage,
                Boolean.TRUE.equals(dryRun),
                Boolean.TRUE.equals(force));
    }
}
