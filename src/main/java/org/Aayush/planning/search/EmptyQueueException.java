package org.Aayush.planning.search;

/**
 * Raised by {@link SearchQueue#extractMin()} when the frontier has run dry.
 */
public class EmptyQueueException extends IllegalStateException {

    public EmptyQueueException(String message) {
        super(message);
    }
}
