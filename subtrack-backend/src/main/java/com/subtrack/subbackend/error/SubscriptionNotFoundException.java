package com.subtrack.subbackend.error;

import lombok.Getter;

@Getter
public class SubscriptionNotFoundException extends StoreException {

    private final String subscriptionId;

    public SubscriptionNotFoundException(String subscriptionId) {
        super("Subscription not found: " + subscriptionId);
        this.subscriptionId = subscriptionId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
