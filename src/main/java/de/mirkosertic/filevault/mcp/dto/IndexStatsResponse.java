package de.mirkosertic.filevault.mcp.dto;

/**
 * Response DTO for the getIndexStats tool.
 */
public record IndexStatsResponse(
        boolean success,
        long documentCount,
        long storedFileCount,
        long shareLinkCount,
        int accountCount,
        int organizationCount,
        String indexPath,
        int schemaVersion,
        boolean schemaUpgradeRequired,
        String softwareVersion,
        String buildTimestamp,
        String lastRebuildStatus,
        String error
) {
    public static IndexStatsResponse error(final String errorMessage) {
        return new IndexStatsResponse(false, 0, 0, 0, 0, 0, null, 0, false, null, null, null, errorMessage);
    }
}
