package com.payment.checkout.domain;

import lombok.Builder;
import lombok.Value;

/** Catalog course as priced for a checkout. */
@Value
@Builder
public class CourseOffer {

    String id;
    String slug;
    String name;
    Integer priceCents;
}
