package com.reqsafe.token;

import com.reqsafe.common.ErrorKind;

import java.time.Instant;

public class ExpiredTokenException extends DecodeException {

    private final Instant expiredAt;

    public ExpiredTokenException(Instant expiredAt) {
        super(ErrorKind.EXPIRED, "Token expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    public ExpiredTokenException(Instant expiredAt, Throwable cause) {
        super(ErrorKind.EXPIRED, "Token expired at " + expiredAt, cause);
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
