package com.subtrack.subbackend.subscription.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.subtrack.subbackend.subscription.MonthFormat;
import com.subtrack.subbackend.subscription.Subscription;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubscriptionDto(
        @JsonProperty("id") String id,
        @JsonProperty("user_id") String userId,
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("price") int price,
        @JsonProperty("start_date") String startDate,
        @JsonProperty("end_date") String endDate
) {
    public static SubscriptionDto from(Subscription sub) {
        return new SubscriptionDto(
                sub.id().toString(),
                sub.userId(),
                sub.serviceName(),
                sub.price(),
                MonthFormat.format(sub.startDate()),
                MonthFormat.format(sub.endDate())
        );
    }
}
