package com.livehub.hub;

public class ProducerContractViolationException extends HubException {

    private final HubState state;

    public ProducerContractViolationException(String hubName, String operation, HubState state) {
        super(hubName, "Hub '" + hubName + "' rejected " + operation + " in state " + state);
        this.state = state;
    }

    public HubState state() {
        return state;
    }
}
