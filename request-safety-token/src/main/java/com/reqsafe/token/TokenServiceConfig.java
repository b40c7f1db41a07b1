package com.reqsafe.token;

import java.time.Duration;
import java.util.Properties;

import com.reqsafe.token.key.PemKeyLoader;
import lombok.Getter;
import lombok.Setter;

/**
 * Settings for {@link JwtTokenService#fromConfig(TokenServiceConfig)}.
 *
 * <p>HMAC algorithms read {@code secret}; RSA/EC algorithms read the PEM keys, where a missing private key
 * gives a verify-only service. {@code defaultLifetimeMinutes} is in minutes: 60 means {@code exp = iat + 3600}.
 * Left unset, tokens encoded without an explicit lifetime do not expire.
 */
@Getter
@Setter
public class TokenServiceConfig {

    public static final String PREFIX = "reqsafe.token.";

    private TokenAlgorithm algorithm = TokenAlgorithm.HS256;
    private String secret;
    private String publicKeyPem;
    private String privateKeyPem;
    private Long defaultLifetimeMinutes;
    private long clockSkewSeconds = 0;
    private boolean refreshExpired = false;

    public Duration defaultLifetime() {
        return defaultLifetimeMinutes == null ? null : Duration.ofMinutes(defaultLifetimeMinutes);
    }

    public SigningKeys signingKeys() {
        if (algorithm.isSymmetric()) {
            if (secret == null || secret.isBlank()) {
                throw new IllegalStateException(PREFIX + "secret is required for " + algorithm);
            }
            return SigningKeys.hmac(secret);
        }
        if (publicKeyPem == null || publicKeyPem.isBlank()) {
            throw new IllegalStateException(PREFIX + "public-key is required for " + algorithm);
        }
        if (privateKeyPem == null || privateKeyPem.isBlank()) {
            return SigningKeys.verifyOnly(PemKeyLoader.loadPublicKey(algorithm, publicKeyPem));
        }
        return SigningKeys.keyPair(PemKeyLoader.loadKeyPair(algorithm, publicKeyPem, privateKeyPem));
    }

    /**
     * Reads {@code reqsafe.token.*} keys; absent keys keep their defaults.
     */
    public static TokenServiceConfig fromProperties(Properties props) {
        TokenServiceConfig config = new TokenServiceConfig();
        String algorithm = props.getProperty(PREFIX + "algorithm");
        if (algorithm != null) {
            config.setAlgorithm(TokenAlgorithm.fromName(algorithm));
        }
        config.setSecret(props.getProperty(PREFIX + "secret"));
        config.setPublicKeyPem(props.getProperty(PREFIX + "public-key"));
        config.setPrivateKeyPem(props.getProperty(PREFIX + "private-key"));
        String lifetime = props.getProperty(PREFIX + "default-lifetime-minutes");
        if (lifetime != null && !lifetime.isBlank()) {
            config.setDefaultLifetimeMinutes(Long.parseLong(lifetime.trim()));
        }
        config.setClockSkewSeconds(Long.parseLong(props.getProperty(PREFIX + "clock-skew-seconds", "0").trim()));
        config.setRefreshExpired(Boolean.parseBoolean(props.getProperty(PREFIX + "refresh-expired", "false").trim()));
        return config;
    }

    @Override
    public String toString() {
        return "TokenServiceConfig[algorithm=" + algorithm
            + ", defaultLifetimeMinutes=" + defaultLifetimeMinutes
            + ", clockSkewSeconds=" + clockSkewSeconds
            + ", refreshExpired=" + refreshExpired + "]";
    }
}
