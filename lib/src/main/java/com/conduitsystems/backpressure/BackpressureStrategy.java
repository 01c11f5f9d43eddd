package com.conduitsystems.backpressure;

/**
 * How a full mailbox treats further sends.
 */
public enum BackpressureStrategy {
    /**
     * Block the sender until space is available, up to the configured send timeout.
     * This is the default behavior.
     */
    BLOCK,

    /**
     * Drop the new message when the mailbox is full.
     */
    DROP_NEW,

    /**
     * Drop the oldest queued message to make room for the new one.
     */
    DROP_OLDEST,

    /**
     * Fail the send immediately with a mailbox-full error.
     */
    REJECT
}
