package com.payment.checkout.core;

import com.payment.checkout.api.CheckoutErrorCode;
import com.payment.checkout.api.CheckoutException;
import com.payment.checkout.domain.CheckoutCommand;
import com.payment.checkout.domain.CustomerContact;
import com.payment.checkout.domain.FieldSanitizer;
import com.payment.checkout.domain.LeadRecord;

import java.util.regex.Pattern;

/**
 * Customer fields for the checkout: what the client sent, else what the lead already has on file.
 */
public final class CustomerContactResolver {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private CustomerContactResolver() {}

    public static CustomerContact resolve(CheckoutCommand command, LeadRecord lead) {
        String name = firstNonNull(
                FieldSanitizer.clean(command.getCustomerName(), 160),
                FieldSanitizer.clean(lead.getCustomerName(), 160));
        String email = firstNonNull(
                FieldSanitizer.clean(command.getCustomerEmail(), 180),
                FieldSanitizer.clean(lead.getCustomerEmail(), 180));
        String phone = firstNonNull(
                FieldSanitizer.clean(command.getCustomerPhone(), 40),
                FieldSanitizer.clean(lead.getCustomerPhone(), 40));
        String cpf = FieldSanitizer.onlyDigits(
                command.getCustomerCpf() != null ? command.getCustomerCpf() : lead.getCpf());

        if (name == null) {
            throw new CheckoutException(CheckoutErrorCode.INVALID_CUSTOMER_NAME);
        }
        if (email == null || !EMAIL.matcher(email).matches()) {
            throw new CheckoutException(CheckoutErrorCode.INVALID_CUSTOMER_EMAIL);
        }
        int phoneDigits = FieldSanitizer.onlyDigits(phone).length();
        if (phone == null || phoneDigits < 10 || phoneDigits > 13) {
            throw new CheckoutException(CheckoutErrorCode.INVALID_CUSTOMER_PHONE);
        }
        if (!cpf.isEmpty() && cpf.length() != 11) {
            throw new CheckoutException(CheckoutErrorCode.INVALID_CUSTOMER_CPF);
        }

        return CustomerContact.builder()
                .name(name)
                .email(email)
                .phone(phone)
                .cpf(cpf.isEmpty() ? null : cpf)
                .build();
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
