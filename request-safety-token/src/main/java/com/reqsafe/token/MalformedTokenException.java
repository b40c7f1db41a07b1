package com.reqsafe.token;

import com.reqsafe.common.ErrorKind;

public class MalformedTokenException extends DecodeException {

    public MalformedTokenException(String message) {
        super(ErrorKind.MALFORMED_TOKEN, message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_TOKEN, message, cause);
    }
}
