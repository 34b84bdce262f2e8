package io.callroster.sync.net;

/**
 * A transport request failed (I/O error, non-2xx status, undecodable body).
 * Delivered through failed futures, never thrown into the call queue.
 */
public class CallNetworkException extends RuntimeException {

    public CallNetworkException(String message) {
        super(message);
    }

    public CallNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
