package com.reqsafe.token;

import com.reqsafe.common.ErrorKind;

/**
 * A token could not be turned back into claims. Subtypes narrow the reason down;
 * this type itself covers everything that is not malformed, forged or expired.
 */
public class DecodeException extends TokenException {

    public DecodeException(String message, Throwable cause) {
        super(ErrorKind.DECODE, message, cause);
    }

    protected DecodeException(ErrorKind kind, String message) {
        super(kind, message);
    }

    protected DecodeException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
