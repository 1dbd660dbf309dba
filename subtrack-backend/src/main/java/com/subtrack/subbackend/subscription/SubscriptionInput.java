package com.subtrack.subbackend.subscription;

/**
 * Raw caller input for create and full-replacement update. Dates are {@code MM-YYYY} strings;
 * a null {@code endDate} means the subscription is ongoing.
 */
public record SubscriptionInput(
        String userId,
        String serviceName,
        Integer price,
        String startDate,
        String endDate
) {}
