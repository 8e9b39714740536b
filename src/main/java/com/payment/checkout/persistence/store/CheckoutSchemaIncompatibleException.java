package com.payment.checkout.persistence.store;

/** No column set in the insert plan was accepted by {@code payment_checkouts}. */
public class CheckoutSchemaIncompatibleException extends RuntimeException {

    public CheckoutSchemaIncompatibleException(String message, Throwable cause) {
        super(message, cause);
    }
}
