package com.livehub.hub;

/**
 * Rule applied when a subscription's buffer is full and another element arrives.
 */
public enum OverflowPolicy {

    /**
     * Fail the whole hub; every subscription observes {@link HubFailedException}.
     */
    FAIL_FAST,

    /**
     * Discard the incoming element for the full subscription only.
     */
    DROP_NEWEST,

    /**
     * Evict the oldest buffered element of the full subscription to make room.
     */
    DROP_OLDEST,

    /**
     * Park the producer until the slow subscription makes room, detaches or the hub ends.
     */
    BLOCK_PRODUCER
}
