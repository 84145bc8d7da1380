package de.mirkosertic.filevault.indexsync;

import java.util.List;

/**
 * Structural failure of a reconciliation request, detected before any I/O.
 */
public class IndexSyncException extends Exception {

    private final SyncErrorCode code;
    private final List<String> allowed;

    public IndexSyncException(final SyncErrorCode code, final String message) {
        this(code, message, List.of());
    }

    public IndexSyncException(final SyncErrorCode code, final String message, final List<String> allowed) {
        super(message);
        this.code = code;
        this.allowed = List.copyOf(allowed);
    }

    public SyncErrorCode getCode() {
        return code;
    }

    /**
     * Accepted values, for errors caused by an unknown value. Empty otherwise.
     */
    public List<String> getAllowed() {
        return allowed;
    }
}
