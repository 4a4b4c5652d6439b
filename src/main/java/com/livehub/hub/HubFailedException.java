package com.livehub.hub;

public class HubFailedException extends HubException {

    public HubFailedException(String hubName, Throwable cause) {
        super(hubName, "Hub '" + hubName + "' failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
    }
}
