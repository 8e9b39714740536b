package com.payment.checkout.api;

import com.payment.checkout.observability.RequestIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every API failure as {@code {error, code, message, requestId, ...attributes}}.
 * Stack traces and provider payloads never reach the client.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CheckoutException.class)
    public ResponseEntity<Map<String, Object>> handleCheckout(CheckoutException ex) {
        CheckoutErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.warn("Checkout failed: code={} cause={}", errorCode.getCode(),
                    ex.getCause() != null ? ex.getCause().getClass().getSimpleName() : "-");
        } else {
            log.debug("Checkout rejected: code={}", errorCode.getCode());
        }
        return ResponseEntity.status(errorCode.getStatus()).body(body(errorCode, ex.getAttributes()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(CheckoutErrorCode.INVALID_JSON.getStatus())
                .body(body(CheckoutErrorCode.INVALID_JSON, Map.of()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(CheckoutErrorCode.METHOD_NOT_ALLOWED.getStatus());
        if (ex.getSupportedMethods() != null) {
            builder.header(HttpHeaders.ALLOW, String.join(", ", ex.getSupportedMethods()));
        }
        Map<String, Object> body = body(CheckoutErrorCode.METHOD_NOT_ALLOWED, Map.of());
        body.put("message", "Method " + ex.getMethod() + " is not allowed.");
        return builder.body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(CheckoutErrorCode.INTERNAL_ERROR.getStatus())
                .body(body(CheckoutErrorCode.INTERNAL_ERROR, Map.of()));
    }

    private static Map<String, Object> body(CheckoutErrorCode errorCode, Map<String, Object> attributes) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", errorCode.getCode());
        body.put("code", errorCode.getCode());
        body.put("message", errorCode.getMessage());
        body.put("requestId", MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
        attributes.forEach(body::putIfAbsent);
        return body;
    }
}
