package com.payment.checkout.api;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Business failure of a checkout. Rendered by {@link GlobalExceptionHandler}; {@code attributes}
 * are written next to the standard error fields so clients can read them without unwrapping.
 */
@Getter
public class CheckoutException extends RuntimeException {

    private final CheckoutErrorCode errorCode;
    private final Map<String, Object> attributes;

    public CheckoutException(CheckoutErrorCode errorCode) {
        this(errorCode, Collections.emptyMap(), null);
    }

    public CheckoutException(CheckoutErrorCode errorCode, Throwable cause) {
        this(errorCode, Collections.emptyMap(), cause);
    }

    public CheckoutException(CheckoutErrorCode errorCode, Map<String, Object> attributes) {
        this(errorCode, attributes, null);
    }

    public CheckoutException(CheckoutErrorCode errorCode, Map<String, Object> attributes, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
        // LinkedHashMap keeps order and tolerates null values (e.g. a missing tid)
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
