package com.autonomous.socialcrew.exception;

/**
 * Signalled to a subscriber whose event buffer filled up. The subscriber has been dropped.
 */
public class SubscriberOverflowException extends RuntimeException {

    public SubscriberOverflowException(int capacity) {
        super("Subscriber buffer of " + capacity + " events overflowed; re-subscribe to continue");
    }
}
