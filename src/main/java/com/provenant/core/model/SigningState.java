package com.provenant.core.model;

/**
 * Lifecycle of a signing request.
 * <pre>
 *   AWAITING_QUORUM → AUTHORIZED → SIGNED
 *         ↓               ↓
 *      DENIED          EXPIRED
 * </pre>
 * AWAITING_QUORUM may also expire. SIGNED, DENIED and EXPIRED are terminal.
 */
public enum SigningState {
    AWAITING_QUORUM,
    AUTHORIZED,
    SIGNED,
    DENIED,
    EXPIRED;

    public boolean isTerminal() {
        return this == SIGNED || this == DENIED || this == EXPIRED;
    }

    public QuorumState quorumState() {
        return switch (this) {
            case AWAITING_QUORUM -> QuorumState.PENDING;
            case AUTHORIZED, SIGNED -> QuorumState.REACHED;
            case DENIED, EXPIRED -> QuorumState.FAILED;
        };
    }
}
