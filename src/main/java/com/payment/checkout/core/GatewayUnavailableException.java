package com.payment.checkout.core;

/**
 * The gateway gave no answer: connection failure, timeout or an open circuit breaker.
 * The charge may or may not have happened on the gateway side.
 */
public class GatewayUnavailableException extends RuntimeException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
