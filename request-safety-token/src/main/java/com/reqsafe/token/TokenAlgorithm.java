package com.reqsafe.token;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import io.jsonwebtoken.security.SecureDigestAlgorithm;
import io.jsonwebtoken.security.SignatureAlgorithm;

import java.util.Locale;

/**
 * Signing algorithms a {@link TokenService} can be bound to.
 * The binding happens at construction; the {@code alg} header of an incoming token is only ever compared against it.
 */
public enum TokenAlgorithm {
    HS256(KeyFamily.HMAC, "HmacSHA256", Jwts.SIG.HS256),
    HS384(KeyFamily.HMAC, "HmacSHA384", Jwts.SIG.HS384),
    HS512(KeyFamily.HMAC, "HmacSHA512", Jwts.SIG.HS512),
    RS256(KeyFamily.RSA, "RSA", Jwts.SIG.RS256),
    RS384(KeyFamily.RSA, "RSA", Jwts.SIG.RS384),
    RS512(KeyFamily.RSA, "RSA", Jwts.SIG.RS512),
    ES256(KeyFamily.EC, "EC", Jwts.SIG.ES256),
    ES384(KeyFamily.EC, "EC", Jwts.SIG.ES384),
    ES512(KeyFamily.EC, "EC", Jwts.SIG.ES512);

    private enum KeyFamily { HMAC, RSA, EC }

    private final KeyFamily family;
    private final String jcaName;
    private final SecureDigestAlgorithm<?, ?> jwa;

    TokenAlgorithm(KeyFamily family, String jcaName, SecureDigestAlgorithm<?, ?> jwa) {
        this.family = family;
        this.jcaName = jcaName;
        this.jwa = jwa;
    }

    public boolean isSymmetric() {
        return family == KeyFamily.HMAC;
    }

    /** JCA name of the key: the Mac algorithm for HMAC, the KeyFactory algorithm otherwise. */
    public String jcaName() {
        return jcaName;
    }

    /** Value written to and expected in the {@code alg} header. */
    public String headerName() {
        return jwa.getId();
    }

    /** The JJWT algorithm instance; signing and verification never pick one from token input. */
    public SecureDigestAlgorithm<?, ?> jwa() {
        return jwa;
    }

    /**
     * @throws IllegalStateException for RSA/EC algorithms
     */
    public MacAlgorithm macAlgorithm() {
        if (!(jwa instanceof MacAlgorithm mac)) {
            throw new IllegalStateException(this + " is not an HMAC algorithm");
        }
        return mac;
    }

    /**
     * @throws IllegalStateException for HMAC algorithms
     */
    public SignatureAlgorithm signatureAlgorithm() {
        if (!(jwa instanceof SignatureAlgorithm sig)) {
            throw new IllegalStateException(this + " is not a key-pair algorithm");
        }
        return sig;
    }

    public static TokenAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Signing algorithm must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported signing algorithm: " + name, e);
        }
    }
}
