package com.provenant.core.build;

import com.provenant.core.error.SourceVerificationException;
import com.provenant.core.model.SourceReference;

/**
 * Checks a source reference before any builder is touched.
 */
public interface SourceVerifier {

    /**
     * @throws SourceVerificationException if the reference is not trusted
     */
    void verify(SourceReference source);
}
