package com.provenant.sandbox;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;

/**
 * A sandbox did not finish within its wall-clock limit.
 */
public class SandboxTimeoutException extends ProvenantException {
    public SandboxTimeoutException(String sandboxId, int timeoutSeconds) {
        super(ErrorCode.BUILDER_TIMEOUT, "Sandbox " + sandboxId + " did not finish within " + timeoutSeconds + "s");
    }
}
