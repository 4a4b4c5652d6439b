package com.livehub.hub;

public class SubscriberOverflowException extends HubException {

    private final long subscriptionId;
    private final int capacity;

    public SubscriberOverflowException(String hubName, long subscriptionId, int capacity) {
        super(hubName, "Subscription " + subscriptionId + " of hub '" + hubName
                + "' exceeded its buffer of " + capacity + " elements");
        this.subscriptionId = subscriptionId;
        this.capacity = capacity;
    }

    public long subscriptionId() {
        return subscriptionId;
    }

    public int capacity() {
        return capacity;
    }
}
