package com.conduitsystems.supervisor;

import com.conduitsystems.monitoring.InMemoryMonitor;
import com.conduitsystems.monitoring.SupervisionEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(20)
class ChildBatchTest {

    private final List<String> log = Collections.synchronizedList(new ArrayList<>());
    private InMemoryMonitor<SupervisionEvent> monitor;
    private SupervisorNode node;

    @BeforeEach
    void setUp() {
        monitor = new InMemoryMonitor<>();
        node = new SupervisorNode(SupervisorConfig.named("batch").setMonitor(monitor));
    }

    @AfterEach
    void tearDown() {
        node.shutdown();
    }

    @Test
    void startsChildrenInOrderAndReturnsTheirIds() {
        List<ChildId> ids = node.childBatch()
                .backoffDelay(BackoffDelay.none())
                .child("a", TestChild.factory("a", log))
                .child("b", TestChild.factory("b", log))
                .child("c", TestChild.factory("c", log))
                .startAll();

        assertEquals(3, ids.size());
        assertEquals(List.of("start:a", "start:b", "start:c"), log);
        assertEquals(ids, node.childIds());
        assertEquals("b", node.child(ids.get(1)).orElseThrow().name());
    }

    @Test
    void sharedDefaultsApplyAndCustomizerOverrides() {
        ChildBatch batch = node.childBatch()
                .restartPolicy(RestartPolicy.TRANSIENT)
                .shutdownPolicy(ShutdownPolicy.immediate())
                .startTimeout(Duration.ofSeconds(3))
                .restartIntensity(2, Duration.ofSeconds(30))
                .child("plain", TestChild.factory("plain", log))
                .child("special", TestChild.factory("special", log),
                        spec -> spec.restartPolicy(RestartPolicy.PERMANENT).startTimeout(Duration.ofSeconds(7)));

        List<ChildSpec> specs = batch.specs();

        assertEquals(2, batch.size());
        ChildSpec plain = specs.get(0);
        assertEquals(RestartPolicy.TRANSIENT, plain.restartPolicy());
        assertEquals(ShutdownPolicy.Kind.IMMEDIATE, plain.shutdownPolicy().kind());
        assertEquals(Duration.ofSeconds(3), plain.startTimeout());
        assertEquals(2, plain.maxRestarts());
        assertEquals(ChildSpec.DEFAULT_SHUTDOWN_TIMEOUT, plain.shutdownTimeout());

        ChildSpec special = specs.get(1);
        assertEquals(RestartPolicy.PERMANENT, special.restartPolicy());
        assertEquals(Duration.ofSeconds(7), special.startTimeout());
        assertEquals(ShutdownPolicy.Kind.IMMEDIATE, special.shutdownPolicy().kind());
        assertEquals(Duration.ofSeconds(30), special.restartWindow());
    }

    @Test
    void startAllByNameKeepsInsertionOrder() {
        Map<String, ChildId> ids = node.childBatch()
                .child("first", TestChild.factory("first", log))
                .child("second", TestChild.factory("second", log))
                .startAllByName();

        assertEquals(List.of("first", "second"), new ArrayList<>(ids.keySet()));
        assertEquals(ids.get("second"), node.findChild("second").orElseThrow());
    }

    @Test
    void invalidSpecStartsNothing() {
        ChildBatch batch = node.childBatch()
                .child("fine", TestChild.factory("fine", log))
                .child("broken", TestChild.factory("broken", log),
                        spec -> spec.restartIntensity(0, Duration.ofSeconds(1)));

        assertThrows(InvalidConfigurationException.class, batch::startAll);
        assertEquals(0, node.childCount());
        assertTrue(log.isEmpty());
    }

    @Test
    void duplicateNameInBatchIsRejected() {
        ChildBatch batch = node.childBatch()
                .child("twin", TestChild.factory("twin", log))
                .child("twin", TestChild.factory("twin", log));

        assertThrows(InvalidConfigurationException.class, batch::startAll);
        assertEquals(0, node.childCount());
    }

    @Test
    void startFailureStopsTheChildrenAlreadyStarted() {
        ChildBatch batch = node.childBatch()
                .child("a", TestChild.factory("a", log))
                .child("b", TestChild.factory("b", log))
                .child("c", () -> {
                    throw new IllegalStateException("port in use");
                });

        ChildStartException e = assertThrows(ChildStartException.class, batch::startAll);

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(0, node.childCount());
        assertEquals(List.of("start:a", "start:b", "stop:b", "stop:a"), log);
        assertEquals(2, monitor.history(event -> event.kind() == SupervisionEvent.Kind.CHILD_STOPPED).size());
    }
}
