package com.provenant.core.keys;

import com.provenant.core.error.HsmUnavailableException;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.Security;
import java.security.Signature;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.UUID;

/**
 * HSM access through the JDK's SunPKCS11 provider.
 * <p>
 * Every handle is the alias of a private key stored on the token. A generated key is
 * written to the token's key store under a fresh alias together with a self-signed
 * certificate, because the PKCS#11 key store only lists private keys that have one.
 * Keys therefore outlive the process and are found again by alias after a restart.
 * The JVM only ever holds token object references, never key bytes.
 */
public class Pkcs11Hsm implements HardwareSecurityModule {

    private static final Logger log = LoggerFactory.getLogger(Pkcs11Hsm.class);

    static final String ALIAS_PREFIX = "provenant-";
    private static final int MAX_LABEL_LENGTH = 40;
    private static final Duration CERTIFICATE_VALIDITY = Duration.ofDays(30 * 365);

    private final Provider provider;
    private final char[] pin;
    private final String signatureAlgorithm;
    private final String curve;
    private volatile KeyStore keyStore;

    public Pkcs11Hsm(HsmProperties.Pkcs11 config) {
        this.pin = config.getPin() != null ? config.getPin().toCharArray() : new char[0];
        this.signatureAlgorithm = config.getSignatureAlgorithm();
        this.curve = config.getCurve();
        this.provider = loadProvider(config.getConfigFile());
    }

    @Override
    public String name() {
        return "pkcs11";
    }

    @Override
    public GeneratedKey generateKeyPair(String label) {
        requireProvider();
        KeyStore store = loadKeyStore();
        String alias = aliasFor(label);
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC", provider);
            generator.initialize(new ECGenParameterSpec(curve));
            KeyPair pair = generator.generateKeyPair();
            X509Certificate certificate = selfSignedCertificate(pair, alias, signatureAlgorithm, provider,
                    Instant.now());
            synchronized (this) {
                store.setKeyEntry(alias, pair.getPrivate(), pin, new Certificate[] {certificate});
            }
            log.info("Generated {} key on token under alias {} ({})", curve, alias, label);
            return new GeneratedKey(alias, pair.getPublic(), signatureAlgorithm);
        } catch (GeneralSecurityException | OperatorCreationException e) {
            throw new HsmUnavailableException("Token key generation failed", e);
        }
    }

    @Override
    public byte[] sign(String handle, byte[] data) {
        requireProvider();
        PrivateKey key = resolve(handle);
        try {
            Signature signer = Signature.getInstance(signatureAlgorithm, provider);
            signer.initSign(key);
            signer.update(data);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new HsmUnavailableException("Token signing failed for " + handle, e);
        }
    }

    @Override
    public boolean isAvailable() {
        if (provider == null) {
            return false;
        }
        try {
            loadKeyStore();
            return true;
        } catch (HsmUnavailableException e) {
            log.debug("PKCS#11 token not available: {}", e.getMessage());
            return false;
        }
    }

    private PrivateKey resolve(String handle) {
        try {
            Key key = loadKeyStore().getKey(handle, pin);
            if (key instanceof PrivateKey privateKey) {
                return privateKey;
            }
        } catch (GeneralSecurityException e) {
            throw new HsmUnavailableException("Cannot resolve token key " + handle, e);
        }
        throw new HsmUnavailableException("No private key on token under alias " + handle);
    }

    /** A token alias derived from {@code label}, unique per call. */
    static String aliasFor(String label) {
        String slug = label == null ? "" : label.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_LABEL_LENGTH) {
            slug = slug.substring(0, MAX_LABEL_LENGTH);
        }
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return ALIAS_PREFIX + (slug.isEmpty() ? "" : slug + "-") + suffix;
    }

    /**
     * Self-signs a certificate for {@code pair} with subject {@code CN=alias}. The private
     * key signs through {@code signer} when given, so a token key never leaves the token.
     */
    static X509Certificate selfSignedCertificate(KeyPair pair, String alias, String signatureAlgorithm,
                                                 Provider signer, Instant notBefore)
            throws GeneralSecurityException, OperatorCreationException {
        X500Name subject = new X500Name("CN=" + alias);
        X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(subject,
                BigInteger.valueOf(notBefore.toEpochMilli()),
                Date.from(notBefore),
                Date.from(notBefore.plus(CERTIFICATE_VALIDITY)),
                subject,
                pair.getPublic());
        JcaContentSignerBuilder contentSigner = new JcaContentSignerBuilder(signatureAlgorithm);
        if (signer != null) {
            contentSigner.setProvider(signer);
        }
        return new JcaX509CertificateConverter()
                .getCertificate(builder.build(contentSigner.build(pair.getPrivate())));
    }

    private KeyStore loadKeyStore() {
        KeyStore current = keyStore;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (keyStore == null) {
                try {
                    KeyStore ks = KeyStore.getInstance("PKCS11", provider);
                    ks.load(null, pin);
                    keyStore = ks;
                } catch (Exception e) {
                    throw new HsmUnavailableException("Cannot open PKCS#11 token", e);
                }
            }
            return keyStore;
        }
    }

    private void requireProvider() {
        if (provider == null) {
            throw new HsmUnavailableException("PKCS#11 provider is not configured");
        }
    }

    private static Provider loadProvider(String configFile) {
        if (configFile == null || configFile.isBlank()) {
            log.error("provenant.hsm.pkcs11.config-file is not set; HSM unavailable");
            return null;
        }
        Provider base = Security.getProvider("SunPKCS11");
        if (base == null) {
            log.error("SunPKCS11 provider is not present in this JDK; HSM unavailable");
            return null;
        }
        try {
            Provider configured = base.configure(configFile);
            Security.addProvider(configured);
            log.info("PKCS#11 provider {} configured from {}", configured.getName(), configFile);
            return configured;
        } catch (RuntimeException e) {
            log.error("Failed to configure PKCS#11 provider from {}: {}", configFile, e.getMessage());
            return null;
        }
    }
}
