package com.reqsafe.token;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.jsonwebtoken.*;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.security.Key;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JJWT-backed {@link TokenService} producing compact JWS tokens.
 *
 * <p>The signing algorithm is fixed at construction. Before the signature is looked at, the token's
 * {@code alg} header has to name exactly that algorithm, so a token can never pick its own verification
 * key type. Timestamps are whole seconds.
 */
@Slf4j
public final class JwtTokenService implements TokenService {

    private static final String AUDIENCE = "aud";

    private final TokenAlgorithm algorithm;
    private final SigningKeys keys;
    private final Duration defaultLifetime;
    private final Duration clockSkew;
    private final boolean refreshExpired;
    private final Clock clock;
    private final ObjectMapper mapper;

    public JwtTokenService(TokenAlgorithm algorithm, SigningKeys keys) {
        this(algorithm, keys, null, Duration.ZERO, false, Clock.systemUTC());
    }

    public JwtTokenService(TokenAlgorithm algorithm,
                           SigningKeys keys,
                           Duration defaultLifetime,
                           Duration clockSkew,
                           boolean refreshExpired,
                           Clock clock) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.defaultLifetime = defaultLifetime;
        this.clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
        this.refreshExpired = refreshExpired;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        if (this.clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be negative");
        }
        // fail fast on a secret/key pair that does not fit the algorithm family
        keys.verificationKey(algorithm);
    }

    public static JwtTokenService fromConfig(TokenServiceConfig config) {
        return fromConfig(config, Clock.systemUTC());
    }

    public static JwtTokenService fromConfig(TokenServiceConfig config, Clock clock) {
        return new JwtTokenService(
            config.getAlgorithm(),
            config.signingKeys(),
            config.defaultLifetime(),
            Duration.ofSeconds(config.getClockSkewSeconds()),
            config.isRefreshExpired(),
            clock);
    }

    public TokenAlgorithm algorithm() {
        return algorithm;
    }

    @Override
    public IssuedToken issue(ClaimsBundle claims) {
        return issue(claims, defaultLifetime);
    }

    @Override
    public IssuedToken issue(ClaimsBundle claims, Duration expiresIn) {
        Objects.requireNonNull(claims, "claims");
        claims.validate();

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant exp = expiresIn == null ? null : now.plus(expiresIn);

        Key signingKey = keys.signingKey(algorithm);
        try {
            Map<String, Object> custom = new LinkedHashMap<>(claims.custom());
            Object audience = custom.remove(AUDIENCE);
            JwtBuilder builder = Jwts.builder()
                .header().type("JWT").and()
                .claims(custom)
                .issuedAt(Date.from(now));
            if (audience != null) {
                audience(builder, audience);
            }
            if (claims.subject() != null) {
                builder.subject(claims.subject());
            }
            if (exp != null) {
                builder.expiration(Date.from(exp));
            }
            if (algorithm.isSymmetric()) {
                builder.signWith((SecretKey) signingKey, algorithm.macAlgorithm());
            } else {
                builder.signWith((PrivateKey) signingKey, algorithm.signatureAlgorithm());
            }
            return new IssuedToken(builder.compact(), now, exp);
        } catch (JwtException | IllegalArgumentException e) {
            throw new EncodeException("Failed to encode token with " + algorithm + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ClaimsBundle decode(String token, DecodeOptions options) {
        Map<String, Object> payload = verifiedPayload(token, options);
        try {
            return ClaimsBundle.of(payload);
        } catch (EncodeException e) {
            throw new MalformedTokenException("Token payload has invalid registered claims: " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T decode(String token, DecodeOptions options, Class<T> payloadType) {
        Objects.requireNonNull(payloadType, "payloadType");
        Map<String, Object> payload = verifiedPayload(token, options);
        try {
            return mapper.convertValue(payload, payloadType);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Token payload does not fit " + payloadType.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public IssuedToken refresh(String token) {
        return refresh(token, defaultLifetime, refreshExpired);
    }

    @Override
    public IssuedToken refresh(String token, Duration expiresIn, boolean allowExpired) {
        ClaimsBundle claims = decode(token, allowExpired ? DecodeOptions.IGNORE_EXPIRATION : DecodeOptions.STRICT);
        IssuedToken refreshed = issue(claims.withoutTimestamps(), expiresIn);
        log.debug("Refreshed token for subject={}, new exp={}", claims.subject(), refreshed.expiresAt());
        return refreshed;
    }

    @Override
    public TokenValidation validate(String token) {
        try {
            return new TokenValidation.Valid(decode(token, DecodeOptions.STRICT));
        } catch (TokenException e) {
            log.debug("Token rejected: kind={}, reason={}", e.kind(), e.getMessage());
            return new TokenValidation.Rejected(e.kind(), e.getMessage());
        }
    }

    /**
     * Runs every requested check and hands back the payload exactly as it was serialized,
     * so values come back with their JSON types rather than JJWT's registered-claim conversions.
     */
    private Map<String, Object> verifiedPayload(String token, DecodeOptions options) {
        Objects.requireNonNull(options, "options");
        TokenSegments segments = TokenSegments.parse(token, mapper);

        String declared = segments.algorithm();
        if (!algorithm.headerName().equals(declared)) {
            throw new InvalidSignatureException(
                "Token declares algorithm '" + declared + "', expected '" + algorithm.headerName() + "'");
        }

        if (!options.verifySignature()) {
            if (options.verifyExpiration()) {
                checkExpiration(segments.payload());
            }
            return segments.payload();
        }

        try {
            parser().parseSignedClaims(token.trim());
            return segments.payload();
        } catch (ExpiredJwtException e) {
            // JJWT checks the signature before exp, so the payload is authentic
            if (!options.verifyExpiration()) {
                return segments.payload();
            }
            throw new ExpiredTokenException(e.getClaims().getExpiration().toInstant(), e);
        } catch (SignatureException e) {
            throw new InvalidSignatureException("Token signature does not match", e);
        } catch (MalformedJwtException e) {
            throw new MalformedTokenException("Token is malformed: " + e.getMessage(), e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new DecodeException("Token could not be decoded: " + e.getMessage(), e);
        }
    }

    private JwtParser parser() {
        JwtParserBuilder builder = Jwts.parser()
            .clock(() -> Date.from(clock.instant()))
            .clockSkewSeconds(clockSkew.getSeconds());
        Key key = keys.verificationKey(algorithm);
        if (algorithm.isSymmetric()) {
            builder.verifyWith((SecretKey) key);
        } else {
            builder.verifyWith((PublicKey) key);
        }
        return builder.build();
    }

    private void checkExpiration(Map<String, Object> payload) {
        Object exp = payload.get(ClaimsBundle.EXPIRES_AT);
        if (exp == null) {
            return;
        }
        if (!(exp instanceof Number seconds)) {
            throw new MalformedTokenException("Token 'exp' is not a number");
        }
        Instant expiresAt = Instant.ofEpochSecond(seconds.longValue());
        if (clock.instant().minus(clockSkew).isAfter(expiresAt)) {
            throw new ExpiredTokenException(expiresAt);
        }
    }

    // a single string audience is written as a string, not a one-element array
    private static void audience(JwtBuilder builder, Object audience) {
        if (audience instanceof String single) {
            builder.audience().single(single);
        } else if (audience instanceof Collection<?> values) {
            List<String> names = new ArrayList<>();
            for (Object value : values) {
                if (!(value instanceof String name)) {
                    throw new EncodeException("Claim 'aud' must hold strings, got " + value);
                }
                names.add(name);
            }
            builder.audience().add(names).and();
        } else {
            throw new EncodeException("Claim 'aud' must be a string or a list of strings");
        }
    }
}
