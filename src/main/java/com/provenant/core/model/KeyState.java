package com.provenant.core.model;

/**
 * Key lifecycle. Revocation is one-way.
 */
public enum KeyState {
    ACTIVE,
    REVOKED
}
