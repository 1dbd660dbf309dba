package com.subtrack.subbackend.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.subtrack.subbackend.subscription.SubscriptionInput;

// Same body for POST and PUT; PUT replaces every field.
public record SubscriptionRequest(
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("price") Integer price,
        @JsonProperty("user_id") String userId,
        @JsonProperty("start_date") String startDate,   // MM-YYYY
        @JsonProperty("end_date") String endDate        // MM-YYYY, optional
) {
    public SubscriptionInput toInput() {
        return new SubscriptionInput(userId, serviceName, price, startDate, endDate);
    }
}
