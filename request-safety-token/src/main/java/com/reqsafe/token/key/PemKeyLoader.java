package com.reqsafe.token.key;

import com.reqsafe.token.TokenAlgorithm;

import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Loads RSA and EC keys from PEM text (PKCS#8 private, X.509 public) for the asymmetric {@link TokenAlgorithm}s.
 */
public final class PemKeyLoader {
    private PemKeyLoader() {}

    public static KeyPair loadKeyPair(TokenAlgorithm algorithm, String publicPem, String privatePem) {
        PublicKey pub = loadPublicKey(algorithm, publicPem);
        PrivateKey priv = loadPrivateKey(algorithm, privatePem);
        return new KeyPair(pub, priv);
    }

    /**
     * Generates a fresh key pair sized for the algorithm (2048+ bit RSA, or the matching NIST curve).
     */
    public static KeyPair generateKeyPair(TokenAlgorithm algorithm) {
        requireAsymmetric(algorithm);
        return algorithm.signatureAlgorithm().keyPair().build();
    }

    public static PrivateKey loadPrivateKey(TokenAlgorithm algorithm, String pem) {
        requireAsymmetric(algorithm);
        try {
            byte[] der = decodeBody(pem, "PRIVATE KEY");
            PKCS8EncodedKeySpec keySpec = new PKCS8EncodedKeySpec(der);
            return KeyFactory.getInstance(algorithm.jcaName()).generatePrivate(keySpec);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm.jcaName() + " not available", e);
        } catch (InvalidKeySpecException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to parse " + algorithm.jcaName() + " private key from PEM", e);
        }
    }

    public static PublicKey loadPublicKey(TokenAlgorithm algorithm, String pem) {
        requireAsymmetric(algorithm);
        try {
            byte[] der = decodeBody(pem, "PUBLIC KEY");
            X509EncodedKeySpec keySpec = new X509EncodedKeySpec(der);
            return KeyFactory.getInstance(algorithm.jcaName()).generatePublic(keySpec);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm.jcaName() + " not available", e);
        } catch (InvalidKeySpecException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to parse " + algorithm.jcaName() + " public key from PEM", e);
        }
    }

    public static String toPem(Key key) {
        String type = key instanceof PrivateKey ? "PRIVATE KEY" : "PUBLIC KEY";
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
            .encodeToString(key.getEncoded());
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }

    private static byte[] decodeBody(String pem, String type) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("PEM text for " + type + " is empty");
        }
        String content = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s+", "");
        return Base64.getDecoder().decode(content.getBytes(StandardCharsets.US_ASCII));
    }

    private static void requireAsymmetric(TokenAlgorithm algorithm) {
        if (algorithm.isSymmetric()) {
            throw new IllegalArgumentException(algorithm + " uses a shared secret, not a key pair");
        }
    }
}
