package com.reqsafe.common;

import java.util.Objects;

/**
 * Root of every failure raised by the library. Unchecked; the kind tells callers what went wrong.
 */
public abstract class RequestSafetyException extends RuntimeException {

    private final ErrorKind kind;

    protected RequestSafetyException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected RequestSafetyException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
