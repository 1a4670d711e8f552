package com.provenant.core.keys;

import com.provenant.core.error.HsmUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stand-in for an HSM. Ed25519 private keys live in a private map and are
 * never returned. Can be taken offline to exercise fail-closed signing.
 */
public class SimulatedHsm implements HardwareSecurityModule {

    private static final Logger log = LoggerFactory.getLogger(SimulatedHsm.class);

    static final String ALGORITHM = "Ed25519";

    private final Map<String, PrivateKey> privateKeys = new ConcurrentHashMap<>();
    private volatile boolean online = true;

    @Override
    public String name() {
        return "simulated";
    }

    @Override
    public GeneratedKey generateKeyPair(String label) {
        requireOnline();
        try {
            KeyPair pair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            String handle = "sim-" + UUID.randomUUID();
            privateKeys.put(handle, pair.getPrivate());
            log.info("Generated {} key {} ({})", ALGORITHM, handle, label);
            return new GeneratedKey(handle, pair.getPublic(), ALGORITHM);
        } catch (GeneralSecurityException e) {
            throw new HsmUnavailableException("Key generation failed", e);
        }
    }

    @Override
    public byte[] sign(String handle, byte[] data) {
        requireOnline();
        PrivateKey key = privateKeys.get(handle);
        if (key == null) {
            throw new HsmUnavailableException("No key behind handle " + handle);
        }
        try {
            Signature signer = Signature.getInstance(ALGORITHM);
            signer.initSign(key);
            signer.update(data);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new HsmUnavailableException("Signing failed for handle " + handle, e);
        }
    }

    @Override
    public boolean isAvailable() {
        return online;
    }

    /** Simulates the module going offline or coming back. */
    public void setOnline(boolean online) {
        log.warn("Simulated HSM is now {}", online ? "online" : "OFFLINE");
        this.online = online;
    }

    private void requireOnline() {
        if (!online) {
            throw new HsmUnavailableException("Simulated HSM is offline");
        }
    }
}
