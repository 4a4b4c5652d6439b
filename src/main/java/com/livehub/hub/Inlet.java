package com.livehub.hub;

/**
 * Ingress side of a hub. Held by exactly one producer; every method may be called from any thread,
 * including callback threads the hub does not manage.
 */
public interface Inlet<T> {

    /**
     * Fans {@code element} out to every subscription attached at this moment.
     *
     * @throws ProducerContractViolationException if the hub already completed or failed
     */
    void push(T element);

    /**
     * Ends the stream; every attached subscription receives end-of-stream once.
     *
     * @throws ProducerContractViolationException if the hub already completed or failed
     */
    void complete();

    /**
     * Ends the stream abnormally; every attached subscription receives a {@link HubFailedException}.
     *
     * @throws ProducerContractViolationException if the hub already completed or failed
     */
    void fail(Throwable error);

    boolean isOpen();
}
