package com.provenant.core.error;

/**
 * The key, or one of its ancestors, has been revoked.
 */
public class KeyRevokedException extends ProvenantException {
    public KeyRevokedException(String keyId, String revokedKeyId) {
        super(ErrorCode.KEY_REVOKED, keyId.equals(revokedKeyId)
                ? "Key " + keyId + " is revoked"
                : "Key " + keyId + " is revoked through ancestor " + revokedKeyId);
    }
}
