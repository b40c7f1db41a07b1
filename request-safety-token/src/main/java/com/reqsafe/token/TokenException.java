package com.reqsafe.token;

import com.reqsafe.common.ErrorKind;
import com.reqsafe.common.RequestSafetyException;

/**
 * Base type of all token encode/decode failures.
 */
public abstract class TokenException extends RequestSafetyException {

    protected TokenException(ErrorKind kind, String message) {
        super(kind, message);
    }

    protected TokenException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
