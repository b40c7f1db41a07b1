package com.reqsafe.token;

/**
 * Which checks {@link TokenService#decode(String, DecodeOptions)} performs.
 * Structure and the algorithm binding are always checked.
 */
public record DecodeOptions(boolean verifySignature, boolean verifyExpiration) {

    public static final DecodeOptions STRICT = new DecodeOptions(true, true);
    public static final DecodeOptions IGNORE_EXPIRATION = new DecodeOptions(true, false);
    public static final DecodeOptions UNVERIFIED = new DecodeOptions(false, false);
}
