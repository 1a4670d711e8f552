package com.provenant.core.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the HSM provider. Exactly one is active; there is no fallback between them.
 */
@Configuration
public class HsmConfig {

    private static final Logger log = LoggerFactory.getLogger(HsmConfig.class);

    @Bean
    @ConditionalOnProperty(name = "provenant.hsm.provider", havingValue = "simulated", matchIfMissing = true)
    public HardwareSecurityModule simulatedHsm() {
        log.warn("Using the SIMULATED HSM; private keys are held in process memory");
        return new SimulatedHsm();
    }

    @Bean
    @ConditionalOnProperty(name = "provenant.hsm.provider", havingValue = "pkcs11")
    public HardwareSecurityModule pkcs11Hsm(HsmProperties properties) {
        return new Pkcs11Hsm(properties.getPkcs11());
    }
}
