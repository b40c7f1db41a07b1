package com.reqsafe.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Structural view of a compact token, read before any key is touched.
 */
record TokenSegments(Map<String, Object> header, Map<String, Object> payload) {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};
    private static final Base64.Decoder BASE64URL = Base64.getUrlDecoder();

    static TokenSegments parse(String token, ObjectMapper mapper) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token is empty");
        }
        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != 3) {
            throw new MalformedTokenException("Token must have 3 segments, found " + parts.length);
        }
        if (parts[2].isEmpty()) {
            throw new MalformedTokenException("Token is not signed");
        }
        // signature bytes are only checked for encoding here; the verifier compares them
        decode("signature", parts[2]);
        return new TokenSegments(
            readObject("header", parts[0], mapper),
            readObject("payload", parts[1], mapper));
    }

    String algorithm() {
        Object alg = header.get("alg");
        if (!(alg instanceof String name) || name.isBlank()) {
            throw new MalformedTokenException("Token header has no 'alg'");
        }
        return name;
    }

    private static Map<String, Object> readObject(String segment, String encoded, ObjectMapper mapper) {
        String json = new String(decode(segment, encoded), StandardCharsets.UTF_8);
        try {
            Map<String, Object> value = mapper.readValue(json, JSON_OBJECT);
            if (value == null) {
                throw new MalformedTokenException("Token " + segment + " is not a JSON object");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new MalformedTokenException("Token " + segment + " is not valid JSON", e);
        }
    }

    private static byte[] decode(String segment, String encoded) {
        if (encoded.isEmpty()) {
            throw new MalformedTokenException("Token " + segment + " is empty");
        }
        try {
            return BASE64URL.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new MalformedTokenException("Token " + segment + " is not base64url", e);
        }
    }
}
