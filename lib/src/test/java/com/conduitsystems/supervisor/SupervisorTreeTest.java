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

import static org.junit.jupiter.api.Assertions.*;

@Timeout(20)
class SupervisorTreeTest {

    private final List<String> log = Collections.synchronizedList(new ArrayList<>());
    private SupervisorTree tree;

    @BeforeEach
    void setUp() {
        tree = new SupervisorTree();
    }

    @AfterEach
    void tearDown() {
        tree.shutdown();
    }

    private static ChildSpec worker(String name, List<String> log) {
        return ChildSpec.builder(name, TestChild.factory(name, log)).backoffDelay(BackoffDelay.none()).build();
    }

    @Test
    void childSupervisorRunsAsChildOfItsParent() {
        SupervisorId root = tree.createSupervisor(null, SupervisorConfig.named("root"));
        SupervisorId child = tree.createSupervisor(root, SupervisorConfig.named("child"));

        assertEquals(2, tree.supervisorCount());
        assertEquals(1, tree.rootCount());
        assertEquals(root, tree.parent(child).orElseThrow());
        assertTrue(tree.parent(root).isEmpty());
        assertEquals(List.of(child), tree.children(root));

        SupervisorNode rootNode = tree.supervisor(root).orElseThrow();
        assertEquals(1, rootNode.childCount());
        assertEquals("child", rootNode.child(rootNode.childIds().get(0)).orElseThrow().name());
    }

    @Test
    void unknownParentIsRejected() {
        assertThrows(TreeIntegrityException.class,
                () -> tree.createSupervisor(SupervisorId.random(), SupervisorConfig.named("orphan")));
        assertEquals(0, tree.supervisorCount());
    }

    @Test
    void escalatingFromRootIsRejected() {
        SupervisorId root = tree.createSupervisor(null, SupervisorConfig.named("root"));

        TreeIntegrityException e = assertThrows(TreeIntegrityException.class,
                () -> tree.escalate(root, new RuntimeException("nowhere to go")));
        assertTrue(e.isFatal());
    }

    @Test
    void escalationRestartsSubtreeAsAUnit() {
        InMemoryMonitor<SupervisionEvent> rootMonitor = new InMemoryMonitor<>();
        SupervisorId root = tree.createSupervisor(null, SupervisorConfig.named("root").setMonitor(rootMonitor));
        SupervisorId child = tree.createSupervisor(root, SupervisorConfig.named("child"));
        SupervisorNode childNode = tree.supervisor(child).orElseThrow();
        childNode.startChild(worker("w1", log));
        childNode.startChild(worker("w2", log));
        log.clear();

        SupervisionDecision decision = tree.escalate(child, new RuntimeException("subtree broken"));

        assertEquals(SupervisionDecision.Directive.RESTART_CHILD, decision.directive());
        assertEquals(List.of("stop:w2", "stop:w1", "start:w1", "start:w2"), log);
        assertSame(childNode, tree.supervisor(child).orElseThrow());
        assertEquals(SupervisorState.RUNNING, childNode.state());
        assertEquals(1, rootMonitor.history(e -> e.kind() == SupervisionEvent.Kind.CHILD_RESTARTED).size());
    }

    @Test
    void exhaustedChildEscalatesToParentWhenConfigured() throws InterruptedException {
        SupervisorId root = tree.createSupervisor(null, SupervisorConfig.named("root"));
        SupervisorId child = tree.createSupervisor(root, SupervisorConfig.named("child")
                .setEscalateOnLimitExceeded(true));
        SupervisorNode childNode = tree.supervisor(child).orElseThrow();
        ChildId workerId = childNode.startChild(ChildSpec.builder("fragile", TestChild.factory("fragile", log))
                .backoffDelay(BackoffDelay.none())
                .restartIntensity(1, Duration.ofSeconds(30))
                .build());

        childNode.handleChildFailure(workerId, new RuntimeException("first"));
        assertThrows(RestartLimitExceededException.class,
                () -> childNode.handleChildFailure(workerId, new RuntimeException("second")));

        // the parent restarts the whole child supervisor, which revives the worker
        long deadline = System.currentTimeMillis() + 5_000;
        while (childNode.child(workerId).orElseThrow().state() != ChildState.RUNNING
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(ChildState.RUNNING, childNode.child(workerId).orElseThrow().state());
        SupervisorNode rootNode = tree.supervisor(root).orElseThrow();
        assertEquals(1, rootNode.child(rootNode.childIds().get(0)).orElseThrow().restartCount());
    }

    @Test
    void removeSupervisorTakesDescendantsAlong() {
        SupervisorId root = tree.createSupervisor(null, SupervisorConfig.named("root"));
        SupervisorId mid = tree.createSupervisor(root, SupervisorConfig.named("mid"));
        SupervisorId leaf = tree.createSupervisor(mid, SupervisorConfig.named("leaf"));
        SupervisorNode midNode = tree.supervisor(mid).orElseThrow();
        SupervisorNode leafNode = tree.supervisor(leaf).orElseThrow();
        leafNode.startChild(worker("w", log));

        tree.removeSupervisor(mid);

        assertEquals(1, tree.supervisorCount());
        assertTrue(tree.supervisor(leaf).isEmpty());
        assertEquals(SupervisorState.STOPPED, midNode.state());
        assertEquals(SupervisorState.STOPPED, leafNode.state());
        assertEquals(0, tree.supervisor(root).orElseThrow().childCount());
        assertTrue(log.contains("stop:w"));
        assertThrows(TreeIntegrityException.class, () -> tree.removeSupervisor(mid));
    }

    @Test
    void shutdownStopsEverything() {
        SupervisorId first = tree.createSupervisor(null, SupervisorConfig.named("first"));
        SupervisorId second = tree.createSupervisor(null, SupervisorConfig.named("second"));
        tree.createSupervisor(first, SupervisorConfig.named("nested"));
        SupervisorNode firstNode = tree.supervisor(first).orElseThrow();
        SupervisorNode secondNode = tree.supervisor(second).orElseThrow();

        tree.shutdown();

        assertEquals(0, tree.supervisorCount());
        assertEquals(0, tree.rootCount());
        assertEquals(SupervisorState.STOPPED, firstNode.state());
        assertEquals(SupervisorState.STOPPED, secondNode.state());
    }
}
