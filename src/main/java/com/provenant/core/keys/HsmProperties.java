package com.provenant.core.keys;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "provenant.hsm")
public class HsmProperties {

    /** {@code simulated} or {@code pkcs11}. */
    private String provider = "simulated";
    private Pkcs11 pkcs11 = new Pkcs11();

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public Pkcs11 getPkcs11() { return pkcs11; }
    public void setPkcs11(Pkcs11 pkcs11) { this.pkcs11 = pkcs11; }

    public static class Pkcs11 {
        private String configFile;
        private String pin;
        private String signatureAlgorithm = "SHA256withECDSA";
        private String curve = "secp256r1";

        public String getConfigFile() { return configFile; }
        public void setConfigFile(String configFile) { this.configFile = configFile; }
        public String getPin() { return pin; }
        public void setPin(String pin) { this.pin = pin; }
        public String getSignatureAlgorithm() { return signatureAlgorithm; }
        public void setSignatureAlgorithm(String signatureAlgorithm) { this.signatureAlgorithm = signatureAlgorithm; }
        public String getCurve() { return curve; }
        public void setCurve(String curve) { this.curve = curve; }
    }
}
