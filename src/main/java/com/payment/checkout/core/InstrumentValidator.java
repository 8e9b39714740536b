package com.payment.checkout.core;

import com.payment.checkout.api.CheckoutErrorCode;
import com.payment.checkout.api.CheckoutException;
import com.payment.checkout.domain.CardInstrument;
import com.payment.checkout.domain.CheckoutCommand;
import com.payment.checkout.domain.FieldSanitizer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;

/**
 * Validates the card before any checkout row exists. Checks run in a fixed order and the first failure wins,
 * so a client always gets the same error code for the same bad input.
 */
@Component
public class InstrumentValidator {

    static final int MAX_INSTALLMENTS = 12;

    private final Clock clock;

    public InstrumentValidator(Clock clock) {
        this.clock = clock;
    }

    public CardInstrument validate(CheckoutCommand command) {
        String holderName = FieldSanitizer.clean(command.getCardHolderName(), 160);
        if (holderName == null) {
            throw new CheckoutException(CheckoutErrorCode.INVALID_CARD_HOLDER_NAME);
        }

        String number = FieldSanitizer.onlyDigits(command.getCardNumber());
        if (number.length() < 13 || number.length() > 19 || !luhnValid(number)) {
            throw new CheckoutException(CheckoutErrorCode.INVALID_CARD_NUMBER);
        }

        String securityCode = FieldSanitizer.onlyDigits(command.getCardCvv());
        if (securityCode.length() < 3 || securityCode.length() > 4) {
            throw new CheckoutException(CheckoutErrorCode.INVALID_CARD_CVV);
        }

        String month = normalizeMonth(command.getCardExpirationMonth());
        String year = normalizeYear(command.getCardExpirationYear());
        if (month == null || year == null) {
            throw new CheckoutException(CheckoutErrorCode.INVALID_CARD_EXPIRATION);
        }
        if (isExpired(month, year)) {
            throw new CheckoutException(CheckoutErrorCode.EXPIRED_CARD);
        }

        return CardInstrument.builder()
                .holderName(holderName)
                .number(number)
                .securityCode(securityCode)
                .expirationMonth(month)
                .expirationYear(year)
                .build();
    }

    /** A card expires after the last day of its expiration month. */
    boolean isExpired(String month, String year) {
        YearMonth expiry = YearMonth.of(Integer.parseInt(year), Integer.parseInt(month));
        return expiry.isBefore(YearMonth.now(clock));
    }

    public static boolean luhnValid(String digits) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') return false;
            int digit = c - '0';
            if (doubleIt) {
                digit *= 2;
                if (digit > 9) digit -= 9;
            }
            sum += digit;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }

    /** Two-digit month 01..12, or null. */
    static String normalizeMonth(String raw) {
        String digits = FieldSanitizer.onlyDigits(raw).replaceFirst("^0+", "");
        if (digits.isEmpty() || digits.length() > 2) return null;
        int month = Integer.parseInt(digits);
        if (month < 1 || month > 12) return null;
        return String.format("%02d", month);
    }

    /** Four-digit year; two digits mean 20xx. Anything else is null. */
    static String normalizeYear(String raw) {
        String digits = FieldSanitizer.onlyDigits(raw);
        if (digits.length() == 2) return String.valueOf(2000 + Integer.parseInt(digits));
        if (digits.length() == 4) return digits;
        return null;
    }

    /** Installment count truncated toward zero and clamped to 1..12; unparseable input means 1. */
    public static int clampInstallments(String raw) {
        if (raw == null || raw.isBlank()) return 1;
        double parsed;
        try {
            parsed = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return 1;
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) return 1;
        long value = (long) parsed;
        if (value < 1) return 1;
        return (int) Math.min(value, MAX_INSTALLMENTS);
    }
}
