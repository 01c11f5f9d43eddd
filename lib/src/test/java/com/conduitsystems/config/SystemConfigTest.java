package com.conduitsystems.config;

import com.conduitsystems.backpressure.BackpressureStrategy;
import com.conduitsystems.monitoring.BrokerEvent;
import com.conduitsystems.monitoring.InMemoryMonitor;
import com.conduitsystems.supervisor.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SystemConfigTest {

    @Test
    void defaultsAreValid() {
        SystemConfig config = new SystemConfig();

        assertDoesNotThrow(config::validate);
        assertEquals(SystemConfig.DEFAULT_MAILBOX_CAPACITY, config.getMailboxCapacity());
        assertEquals(BackpressureStrategy.BLOCK, config.getBackpressureStrategy());
        assertEquals(Duration.ofSeconds(5), config.getSendTimeout());
        assertEquals(0, config.getMaxActors());
        assertEquals(10, config.getBatchSize());
        assertNotNull(config.getThreadPoolFactory());
    }

    @Test
    void settersChain() {
        InMemoryMonitor<BrokerEvent> monitor = new InMemoryMonitor<>();
        SystemConfig config = new SystemConfig()
                .setMailboxCapacity(8)
                .setBackpressureStrategy(BackpressureStrategy.DROP_OLDEST)
                .setMaxActors(3)
                .setBrokerMonitor(monitor);

        assertEquals(8, config.getMailboxCapacity());
        assertEquals(BackpressureStrategy.DROP_OLDEST, config.getBackpressureStrategy());
        assertEquals(3, config.getMaxActors());
        assertSame(monitor, config.getBrokerMonitor());
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThrows(InvalidConfigurationException.class,
                () -> new SystemConfig().setMailboxCapacity(0).validate());
        assertThrows(InvalidConfigurationException.class,
                () -> new SystemConfig().setSendTimeout(Duration.ZERO).validate());
        assertThrows(InvalidConfigurationException.class,
                () -> new SystemConfig().setSpawnTimeout(Duration.ofMillis(-1)).validate());
        assertThrows(InvalidConfigurationException.class,
                () -> new SystemConfig().setMaxActors(-1).validate());
        assertThrows(InvalidConfigurationException.class,
                () -> new SystemConfig().setBatchSize(0).validate());
        assertThrows(InvalidConfigurationException.class,
                () -> new SystemConfig().setDeadLetterCapacity(0).validate());
        assertThrows(InvalidConfigurationException.class,
                () -> new SystemConfig().setBackpressureStrategy(null).validate());
        assertThrows(InvalidConfigurationException.class,
                () -> new SystemConfig().setThreadPoolFactory(null).validate());
    }
}
