package com.livehub.hub;

import java.util.Objects;

/**
 * One item delivered to a hub consumer: a pushed element, a notice that elements were dropped by the
 * overflow policy, or the terminal end-of-stream / failure signal.
 */
public record HubSignal<T>(Kind kind, T element, long droppedCount, Throwable error) {

    public enum Kind {
        ELEMENT,
        DROPPED,
        COMPLETED,
        FAILED
    }

    public static <T> HubSignal<T> next(T element) {
        return new HubSignal<>(Kind.ELEMENT, Objects.requireNonNull(element, "element"), 0L, null);
    }

    public static <T> HubSignal<T> dropped(long count) {
        return new HubSignal<>(Kind.DROPPED, null, count, null);
    }

    public static <T> HubSignal<T> completed() {
        return new HubSignal<>(Kind.COMPLETED, null, 0L, null);
    }

    public static <T> HubSignal<T> failed(Throwable error) {
        return new HubSignal<>(Kind.FAILED, null, 0L, Objects.requireNonNull(error, "error"));
    }

    public boolean isElement() {
        return kind == Kind.ELEMENT;
    }

    public boolean isDropped() {
        return kind == Kind.DROPPED;
    }

    public boolean isTerminal() {
        return kind == Kind.COMPLETED || kind == Kind.FAILED;
    }
}
