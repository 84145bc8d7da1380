package de.mirkosertic.filevault.model;

/**
 * An organization with a shared storage area.
 */
public record Organization(long orgId, String name) {

    public OwnerRef owner() {
        return OwnerRef.organization(orgId);
    }
}
