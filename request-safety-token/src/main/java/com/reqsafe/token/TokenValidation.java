package com.reqsafe.token;

import com.reqsafe.common.ErrorKind;

/**
 * Outcome of {@link TokenService#validate(String)}: the claims, or the kind of rejection.
 */
public sealed interface TokenValidation {

    record Valid(ClaimsBundle claims) implements TokenValidation {
    }

    record Rejected(ErrorKind kind, String reason) implements TokenValidation {
    }

    default boolean isValid() {
        return this instanceof Valid;
    }
}
