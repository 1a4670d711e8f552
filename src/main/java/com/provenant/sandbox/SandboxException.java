package com.provenant.sandbox;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;

/**
 * A sandbox could not be created, run or inspected.
 */
public class SandboxException extends ProvenantException {
    public SandboxException(String message) {
        super(ErrorCode.CONTAINER_ERROR, message);
    }

    public SandboxException(String message, Throwable cause) {
        super(ErrorCode.CONTAINER_ERROR, message, cause);
    }
}
