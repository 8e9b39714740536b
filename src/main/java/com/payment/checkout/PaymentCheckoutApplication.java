package com.payment.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the enrollment checkout service:
 * <ul>
 *   <li>Card checkout with idempotent retries and a processing record written before every charge</li>
 *   <li>Mock and live (Rede) transaction gateways, the live one behind a Resilience4j circuit breaker</li>
 *   <li>Checkout storage that tolerates and repairs partially migrated schemas</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui.html</li>
 * </ul>
 */
@SpringBootApplication
public class PaymentCheckoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentCheckoutApplication.class, args);
    }
}
