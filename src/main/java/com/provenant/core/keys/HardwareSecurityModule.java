package com.provenant.core.keys;

import com.provenant.core.error.HsmUnavailableException;

import java.security.PublicKey;

/**
 * Boundary to the hardware that holds private keys. Callers work with opaque handles;
 * private key material never crosses this interface.
 * Implementations: {@link SimulatedHsm} (development, tests), {@link Pkcs11Hsm} (production).
 */
public interface HardwareSecurityModule {

    /** Short provider name used in logs and health output. */
    String name();

    /**
     * Generates a key pair inside the module.
     *
     * @param label human-readable label stored alongside the key where the module supports it
     * @return the handle and public half of the new key
     */
    GeneratedKey generateKeyPair(String label);

    /**
     * Signs {@code data} with the private key behind {@code handle}.
     *
     * @throws HsmUnavailableException if the module cannot be reached or refuses the operation
     */
    byte[] sign(String handle, byte[] data);

    /** Cheap liveness probe; never throws. */
    boolean isAvailable();

    /**
     * Result of a key generation.
     *
     * @param handle             opaque reference to the private key inside the module
     * @param publicKey          public half, safe to publish
     * @param signatureAlgorithm JCA signature algorithm the key signs with
     */
    record GeneratedKey(String handle, PublicKey publicKey, String signatureAlgorithm) {}
}
