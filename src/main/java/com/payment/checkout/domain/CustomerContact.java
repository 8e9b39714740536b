package com.payment.checkout.domain;

import lombok.Builder;
import lombok.Value;

/** Customer data snapshotted onto the checkout record. {@code cpf} is digits only and may be null. */
@Value
@Builder
public class CustomerContact {

    String name;
    String email;
    String phone;
    String cpf;
}
