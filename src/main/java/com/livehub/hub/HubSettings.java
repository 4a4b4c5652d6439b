package com.livehub.hub;

import java.util.Objects;

public record HubSettings(String name, int bufferSize, OverflowPolicy overflowPolicy) {

    public static final int DEFAULT_BUFFER_SIZE = 256;

    public HubSettings {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("hub name must not be blank");
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be > 0, got: " + bufferSize);
        }
        Objects.requireNonNull(overflowPolicy, "overflowPolicy");
    }

    public static HubSettings of(String name) {
        return new HubSettings(name, DEFAULT_BUFFER_SIZE, OverflowPolicy.DROP_OLDEST);
    }

    public HubSettings withName(String newName) {
        return new HubSettings(newName, bufferSize, overflowPolicy);
    }
}
