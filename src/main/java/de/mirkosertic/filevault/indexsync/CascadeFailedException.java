package de.mirkosertic.filevault.indexsync;

import java.io.IOException;

/**
 * Dependents of a record could not be removed. The record itself is left in place.
 */
public class CascadeFailedException extends IOException {

    public CascadeFailedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
