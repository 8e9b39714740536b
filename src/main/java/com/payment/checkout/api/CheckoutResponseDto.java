package com.payment.checkout.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.payment.checkout.domain.CheckoutOutcome;
import com.payment.checkout.domain.LeadRecord;
import lombok.Builder;
import lombok.Value;

/**
 * REST API response for a checkout, fresh or replayed. Serialized in snake_case.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckoutResponseDto {

    boolean ok;
    boolean approved;
    String status;
    String checkoutId;
    String leadId;
    String leadCode;
    boolean leadAlreadyPaid;
    String reference;
    String tid;
    String authorizationCode;
    String returnCode;
    String returnMessage;
    int amountCents;
    int installments;
    boolean requiresAction;
    String redirectUrl;
    String idempotencyKey;
    boolean idempotentReused;
    boolean idempotencyPersisted;
    String providerMode;
    Customer customer;
    Lead lead;
    Course course;

    public static CheckoutResponseDto from(CheckoutOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("CheckoutOutcome cannot be null");
        }
        LeadRecord lead = outcome.getLead();
        return CheckoutResponseDto.builder()
                .ok(outcome.isApproved())
                .approved(outcome.isApproved())
                .status(outcome.getStatus())
                .checkoutId(outcome.getCheckoutId())
                .leadId(lead.getId())
                .leadCode(lead.code())
                .leadAlreadyPaid(outcome.isLeadAlreadyPaid())
                .reference(outcome.getReference())
                .tid(outcome.getTid())
                .authorizationCode(outcome.getAuthorizationCode())
                .returnCode(outcome.getReturnCode())
                .returnMessage(outcome.getReturnMessage())
                .amountCents(outcome.getAmountCents())
                .installments(outcome.getInstallments())
                .requiresAction(outcome.isRequiresAction())
                .redirectUrl(outcome.getRedirectUrl())
                .idempotencyKey(outcome.getIdempotencyKey())
                .idempotentReused(outcome.isIdempotentReused())
                .idempotencyPersisted(outcome.isIdempotencyPersisted())
                .providerMode(outcome.getProviderMode().wireValue())
                .customer(new Customer(outcome.getCustomer().getName(), outcome.getCustomer().getEmail(),
                        outcome.getCustomer().getPhone()))
                .lead(new Lead(lead.getId(), lead.code(), lead.getCity(), lead.getState()))
                .course(new Course(outcome.getCourseSlug(), outcome.getCourseName(), outcome.getAmountCents()))
                .build();
    }

    @Value
    public static class Customer {
        String name;
        String email;
        String phone;
    }

    @Value
    public static class Lead {
        String id;
        String code;
        String city;
        String state;
    }

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Course {
        String slug;
        String name;
        int priceCents;
    }
}
