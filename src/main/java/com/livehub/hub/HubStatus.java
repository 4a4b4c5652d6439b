package com.livehub.hub;

public record HubStatus(
        String name,
        HubState state,
        int subscribers,
        long pushed,
        long dropped,
        long anchorDiscarded,
        int bufferSize,
        OverflowPolicy overflowPolicy) {
}
