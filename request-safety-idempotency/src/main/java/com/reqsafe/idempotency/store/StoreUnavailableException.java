package com.reqsafe.idempotency.store;

import com.reqsafe.common.ErrorKind;
import com.reqsafe.common.RequestSafetyException;

/**
 * The backing store could not be reached or returned something unusable. Never retried inside the guard.
 */
public class StoreUnavailableException extends RequestSafetyException {

    public StoreUnavailableException(String message) {
        super(ErrorKind.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
