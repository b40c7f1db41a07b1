package com.reqsafe.idempotency;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Hashes of request content, stored with a record so a reused key with a different request is caught.
 */
public final class RequestFingerprints {
    private RequestFingerprints() {}

    /**
     * SHA-256 hex of the parts joined by {@code '|'}; null parts hash as empty strings.
     */
    public static String sha256(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append('|');
            if (parts[i] != null) sb.append(parts[i]);
        }
        return DigestUtils.sha256Hex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256(byte[] body) {
        return DigestUtils.sha256Hex(body);
    }
}
