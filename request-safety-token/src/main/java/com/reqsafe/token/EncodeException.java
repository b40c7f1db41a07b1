package com.reqsafe.token;

import com.reqsafe.common.ErrorKind;

/**
 * Claims could not be serialized, or the configured algorithm/key cannot produce a signature.
 */
public class EncodeException extends TokenException {

    public EncodeException(String message) {
        super(ErrorKind.ENCODE, message);
    }

    public EncodeException(String message, Throwable cause) {
        super(ErrorKind.ENCODE, message, cause);
    }
}
