package com.payment.checkout.domain;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * A validated card. Month is two digits, year four digits. Number and CVV never appear in toString.
 */
@Value
@Builder
public class CardInstrument {

    String holderName;
    @ToString.Exclude
    String number;
    @ToString.Exclude
    String securityCode;
    String expirationMonth;
    String expirationYear;

    public String bin() {
        return number.substring(0, Math.min(6, number.length()));
    }

    public String last4() {
        return number.substring(Math.max(0, number.length() - 4));
    }
}
