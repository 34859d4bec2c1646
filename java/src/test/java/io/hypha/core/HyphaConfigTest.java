package io.hypha.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HyphaConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        HyphaConfig config = HyphaConfig.builder().build().withDefaults();

        assertNull(config.getJwtSecret());
        assertEquals(HyphaConfig.DEFAULT_SERVICE_TIMEOUT, config.getServiceTimeout());
        assertEquals(Duration.ofSeconds(86400), config.getTokenTtl());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(400), Duration.ofMillis(1600)),
            config.getSetupRetryDelays());
        assertEquals(Duration.ofSeconds(60), config.getClientReadyTimeout());
        assertEquals(Duration.ofSeconds(60), config.getConnectionReadyTimeout());
        assertEquals("hypha-core", config.getIssuer());
        assertEquals("hypha-api", config.getAudience());
        assertEquals("workspace-manager", config.getManagerClientId());
        assertEquals(Clock.systemUTC(), config.getClock());
    }

    @Test
    void nonPositiveDurationsFallBackToDefaults() {
        HyphaConfig config = HyphaConfig.builder()
            .serviceTimeout(Duration.ZERO)
            .tokenTtl(Duration.ofSeconds(-1))
            .build()
            .withDefaults();

        assertEquals(HyphaConfig.DEFAULT_SERVICE_TIMEOUT, config.getServiceTimeout());
        assertEquals(HyphaConfig.DEFAULT_TOKEN_TTL, config.getTokenTtl());
    }

    @Test
    void honoursCustomValues() {
        HyphaConfig config = HyphaConfig.builder()
            .jwtSecret("s")
            .serviceTimeout(Duration.ofSeconds(2))
            .managerClientId(" manager ")
            .issuer("issuer-x")
            .build()
            .withDefaults();

        assertEquals("s", config.getJwtSecret());
        assertEquals(Duration.ofSeconds(2), config.getServiceTimeout());
        assertEquals("manager", config.getManagerClientId());
        assertEquals("issuer-x", config.getIssuer());
    }

    @Test
    void rejectsInvalidValues() {
        HyphaConfig negativeDelay = HyphaConfig.builder().setupRetryDelays(List.of(Duration.ofMillis(-1))).build();
        HyphaConfig badManager = HyphaConfig.builder().managerClientId("a/b").build();

        assertThrows(IllegalArgumentException.class, negativeDelay::withDefaults);
        assertThrows(IllegalArgumentException.class, badManager::withDefaults);
    }
}
