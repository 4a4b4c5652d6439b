package com.livehub.hub;

public class HubException extends RuntimeException {

    private final String hubName;

    public HubException(String hubName, String message) {
        super(message);
        this.hubName = hubName;
    }

    public HubException(String hubName, String message, Throwable cause) {
        super(message, cause);
        this.hubName = hubName;
    }

    public String hubName() {
        return hubName;
    }
}
