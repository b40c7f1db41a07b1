package com.reqsafe.idempotency;

/**
 * The side-effecting unit of work a guard runs at most once per key.
 */
@FunctionalInterface
public interface IdempotentOperation<T> {

    T execute() throws Exception;
}
