package com.provenant.core.model;

/**
 * Position of a key in the hierarchy. Each role names the only role its parent may have.
 */
public enum KeyRole {
    ROOT(null),
    REPOSITORY_SIGNING(ROOT),
    APP_SIGNING(REPOSITORY_SIGNING);

    private final KeyRole parentRole;

    KeyRole(KeyRole parentRole) {
        this.parentRole = parentRole;
    }

    /** The role the parent key must have, or null for {@link #ROOT}. */
    public KeyRole parentRole() {
        return parentRole;
    }
}
