package com.subtrack.subbackend.subscription;

import java.time.YearMonth;
import java.util.UUID;

/**
 * A recurring subscription. {@code endDate} is null for an ongoing (open-ended) subscription.
 */
public record Subscription(
        UUID id,
        String userId,
        String serviceName,
        int price,          // minor currency unit
        YearMonth startDate,
        YearMonth endDate
) {

    public boolean isOngoing() {
        return endDate == null;
    }

    public Subscription withId(UUID newId) {
        return new Subscription(newId, userId, serviceName, price, startDate, endDate);
    }
}
