package com.reqsafe.token;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;

/**
 * Key material of one {@link TokenService}: either a shared HMAC secret or an asymmetric key pair.
 * A pair without private key yields a verifier that cannot encode.
 */
public final class SigningKeys {

    private final byte[] secret;
    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    private SigningKeys(byte[] secret, PrivateKey privateKey, PublicKey publicKey) {
        this.secret = secret;
        this.privateKey = privateKey;
        this.publicKey = publicKey;
    }

    public static SigningKeys hmac(byte[] secret) {
        Objects.requireNonNull(secret, "secret");
        return new SigningKeys(secret.clone(), null, null);
    }

    public static SigningKeys hmac(String secret) {
        Objects.requireNonNull(secret, "secret");
        return hmac(secret.getBytes(StandardCharsets.UTF_8));
    }

    public static SigningKeys keyPair(KeyPair keyPair) {
        Objects.requireNonNull(keyPair, "keyPair");
        return new SigningKeys(null, keyPair.getPrivate(), Objects.requireNonNull(keyPair.getPublic(), "public key"));
    }

    public static SigningKeys verifyOnly(PublicKey publicKey) {
        return new SigningKeys(null, null, Objects.requireNonNull(publicKey, "publicKey"));
    }

    public boolean canSign() {
        return secret != null || privateKey != null;
    }

    Key signingKey(TokenAlgorithm algorithm) {
        if (algorithm.isSymmetric()) {
            return secretKey(algorithm);
        }
        if (privateKey == null) {
            throw new EncodeException("No private key configured for " + algorithm + "; this service can only verify");
        }
        return privateKey;
    }

    Key verificationKey(TokenAlgorithm algorithm) {
        return algorithm.isSymmetric() ? secretKey(algorithm) : requirePublic(algorithm);
    }

    private SecretKey secretKey(TokenAlgorithm algorithm) {
        if (secret == null) {
            throw new IllegalStateException(algorithm + " requires an HMAC secret, but a key pair was configured");
        }
        if (secret.length == 0) {
            throw new IllegalStateException("HMAC secret must not be empty");
        }
        return new SecretKeySpec(secret, algorithm.jcaName());
    }

    private PublicKey requirePublic(TokenAlgorithm algorithm) {
        if (publicKey == null) {
            throw new IllegalStateException(algorithm + " requires a public key, but an HMAC secret was configured");
        }
        if (!algorithm.jcaName().equals(publicKey.getAlgorithm())) {
            throw new IllegalStateException(algorithm + " requires a " + algorithm.jcaName()
                + " key, got " + publicKey.getAlgorithm());
        }
        return publicKey;
    }

    @Override
    public String toString() {
        return secret != null
            ? "SigningKeys[hmac, " + secret.length + " bytes]"
            : "SigningKeys[" + publicKey.getAlgorithm() + (privateKey == null ? ", verify-only]" : "]");
    }
}
