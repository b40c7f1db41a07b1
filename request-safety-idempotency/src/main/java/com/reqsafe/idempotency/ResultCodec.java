package com.reqsafe.idempotency;

/**
 * Turns an operation's result into the bytes kept in a completed record, and back for replays.
 */
public interface ResultCodec<T> {

    byte[] encode(T value);

    T decode(byte[] payload);
}
