package com.reqsafe.token;

import java.time.Duration;
import java.util.Map;

/**
 * Issues, verifies and re-issues signed, optionally expiring tokens.
 * Implementations are stateless: nothing about issued tokens is remembered.
 */
public interface TokenService {

    /**
     * Encodes the claims with a fresh {@code iat} and, when {@code expiresIn} is non-null,
     * {@code exp = iat + expiresIn}. A negative lifetime produces an already expired token.
     *
     * @throws EncodeException if the claims are not serializable or the key cannot sign
     */
    IssuedToken issue(ClaimsBundle claims, Duration expiresIn);

    /**
     * Same as {@link #issue(ClaimsBundle, Duration)} with the configured default lifetime.
     */
    IssuedToken issue(ClaimsBundle claims);

    default String encode(ClaimsBundle claims, Duration expiresIn) {
        return issue(claims, expiresIn).token();
    }

    default String encode(ClaimsBundle claims) {
        return issue(claims).token();
    }

    default String encode(Map<String, ?> claims, Duration expiresIn) {
        return encode(ClaimsBundle.of(claims), expiresIn);
    }

    default String encode(Map<String, ?> claims) {
        return encode(ClaimsBundle.of(claims));
    }

    /**
     * @throws MalformedTokenException   if the token is not three base64url JSON segments
     * @throws InvalidSignatureException if the signature or the declared algorithm does not match
     * @throws ExpiredTokenException     if {@code exp} has passed and expiration is verified
     * @throws DecodeException           for any other failure
     */
    ClaimsBundle decode(String token, DecodeOptions options);

    default ClaimsBundle decode(String token) {
        return decode(token, DecodeOptions.STRICT);
    }

    /**
     * Decodes and maps the payload onto {@code payloadType} with Jackson. Unknown payload fields are
     * ignored; {@code iat}/{@code exp} map onto {@link java.time.Instant} fields as epoch seconds.
     *
     * @throws DecodeException if the payload does not fit the type, besides everything
     *                         {@link #decode(String, DecodeOptions)} throws
     */
    <T> T decode(String token, DecodeOptions options, Class<T> payloadType);

    default <T> T decode(String token, Class<T> payloadType) {
        return decode(token, DecodeOptions.STRICT, payloadType);
    }

    /**
     * Verifies the signature, drops {@code iat}/{@code exp} and encodes the remaining claims again.
     *
     * @param allowExpired whether a token past its {@code exp} may still be refreshed
     */
    IssuedToken refresh(String token, Duration expiresIn, boolean allowExpired);

    /**
     * Refresh with the configured default lifetime and expired-token policy.
     */
    IssuedToken refresh(String token);

    /**
     * Strict decode that reports failures as a value instead of throwing.
     */
    TokenValidation validate(String token);
}
