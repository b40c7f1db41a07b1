package com.reqsafe.token;

import com.reqsafe.common.ErrorKind;

/**
 * Signature mismatch, or a token that claims a different algorithm than the one this service is bound to.
 */
public class InvalidSignatureException extends DecodeException {

    public InvalidSignatureException(String message) {
        super(ErrorKind.INVALID_SIGNATURE, message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(ErrorKind.INVALID_SIGNATURE, message, cause);
    }
}
