package com.conduitsystems.monitoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes events to SLF4J, at a level derived from their severity.
 */
public class LoggingMonitor<E extends MonitoringEvent> implements Monitor<E> {

    private final Logger logger;

    public LoggingMonitor() {
        this(LoggerFactory.getLogger(LoggingMonitor.class));
    }

    public LoggingMonitor(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void record(E event) {
        switch (event.severity()) {
            case TRACE:
                logger.trace("{} {}", event.eventType(), event.metadata());
                break;
            case DEBUG:
                logger.debug("{} {}", event.eventType(), event.metadata());
                break;
            case INFO:
                logger.info("{} {}", event.eventType(), event.metadata());
                break;
            case WARNING:
                logger.warn("{} {}", event.eventType(), event.metadata());
                break;
            default:
                logger.error("{} [{}] {}", event.eventType(), event.severity(), event.metadata());
        }
    }
}
