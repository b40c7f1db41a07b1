package com.reqsafe.token;

import com.reqsafe.token.key.PemKeyLoader;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class TokenServiceConfigTest {

    @Test
    void defaults() {
        TokenServiceConfig config = new TokenServiceConfig();

        assertThat(config.getAlgorithm()).isEqualTo(TokenAlgorithm.HS256);
        assertThat(config.defaultLifetime()).isNull();
        assertThat(config.getClockSkewSeconds()).isZero();
        assertThat(config.isRefreshExpired()).isFalse();
    }

    @Test
    void fromProperties_readsRecognizedKeys() {
        Properties props = new Properties();
        props.setProperty("reqsafe.token.algorithm", "hs512");
        props.setProperty("reqsafe.token.secret", "x".repeat(64));
        props.setProperty("reqsafe.token.default-lifetime-minutes", "60");
        props.setProperty("reqsafe.token.clock-skew-seconds", "5");
        props.setProperty("reqsafe.token.refresh-expired", "true");

        TokenServiceConfig config = TokenServiceConfig.fromProperties(props);

        assertThat(config.getAlgorithm()).isEqualTo(TokenAlgorithm.HS512);
        assertThat(config.defaultLifetime()).isEqualTo(Duration.ofSeconds(3600));
        assertThat(config.getClockSkewSeconds()).isEqualTo(5);
        assertThat(config.isRefreshExpired()).isTrue();
        assertThat(config.toString()).doesNotContain("xxxx");
    }

    @Test
    void fromProperties_unknownAlgorithm_shouldFail() {
        Properties props = new Properties();
        props.setProperty("reqsafe.token.algorithm", "PS999");

        assertThatThrownBy(() -> TokenServiceConfig.fromProperties(props))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("PS999");
    }

    @Test
    void signingKeys_missingSecret_shouldFail() {
        assertThatThrownBy(() -> new TokenServiceConfig().signingKeys())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("secret");
    }

    @Test
    void pemConfig_buildsSignerAndVerifier() {
        KeyPair pair = PemKeyLoader.generateKeyPair(TokenAlgorithm.RS256);
        TokenServiceConfig signerConfig = new TokenServiceConfig();
        signerConfig.setAlgorithm(TokenAlgorithm.RS256);
        signerConfig.setPublicKeyPem(PemKeyLoader.toPem(pair.getPublic()));
        signerConfig.setPrivateKeyPem(PemKeyLoader.toPem(pair.getPrivate()));
        TokenServiceConfig verifierConfig = new TokenServiceConfig();
        verifierConfig.setAlgorithm(TokenAlgorithm.RS256);
        verifierConfig.setPublicKeyPem(PemKeyLoader.toPem(pair.getPublic()));

        String token = JwtTokenService.fromConfig(signerConfig).encode(Map.of("sub", "svc"), Duration.ofMinutes(1));

        assertThat(verifierConfig.signingKeys().canSign()).isFalse();
        assertThat(JwtTokenService.fromConfig(verifierConfig).decode(token).subject()).isEqualTo("svc");
    }
}
