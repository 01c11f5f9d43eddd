package com.conduitsystems.message;

/**
 * Priority tag carried by every envelope. Informational: mailboxes stay FIFO.
 */
public enum MessagePriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
