package com.conduitsystems.test;

import com.conduitsystems.ActorContext;
import com.conduitsystems.ActorSystem;
import com.conduitsystems.address.Address;
import com.conduitsystems.handler.Handler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(20)
class TestProbeTest {

    private ActorSystem system;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
    }

    @AfterEach
    void tearDown() {
        system.shutdown();
    }

    sealed interface Reply permits Echoed, Counted {
    }

    record Echoed(String text) implements Reply {
    }

    record Counted(int count) implements Reply {
    }

    private Address echo() {
        return system.spawn(Address.named("echo"), () -> new Handler<String>() {
            private int seen;

            @Override
            public void receive(String message, ActorContext context) {
                seen++;
                context.reply(Reply.class, new Echoed(message));
                if (seen % 2 == 0) {
                    context.reply(Reply.class, new Counted(seen));
                }
            }
        });
    }

    @Test
    void probeReceivesRepliesSentToIt() {
        Address echo = echo();
        TestProbe<Reply> probe = TestProbe.create(system);

        probe.send(echo, "hello");

        assertEquals(new Echoed("hello"), probe.expectMessage(Duration.ofSeconds(2)));
        probe.expectNoMessage(Duration.ofMillis(100));
    }

    @Test
    void expectByTypeAndPredicate() {
        Address echo = echo();
        TestProbe<Reply> probe = TestProbe.create(system, "probe");

        probe.send(echo, "one");
        probe.send(echo, "two");

        assertEquals("one", probe.expectMessage(Echoed.class, Duration.ofSeconds(2)).text());
        probe.expectMessage(r -> r.equals(new Echoed("two")), Duration.ofSeconds(2));
        assertEquals(2, probe.expectMessage(Counted.class, Duration.ofSeconds(2)).count());
        assertEquals(Address.named("probe"), probe.address());
    }

    @Test
    void receivedCarriesSender() {
        Address echo = echo();
        TestProbe<Reply> probe = TestProbe.create(system);

        probe.send(echo, "who");

        TestProbe.Received<Reply> received = probe.expectReceived(Duration.ofSeconds(2));
        assertEquals(echo, received.sender().orElseThrow());
    }

    @Test
    void expectMessagesCollectsInOrder() {
        TestProbe<Integer> probe = TestProbe.create(system);

        for (int i = 0; i < 5; i++) {
            system.tell(probe.address(), i);
        }

        assertEquals(List.of(0, 1, 2, 3, 4), probe.expectMessages(5, Duration.ofSeconds(2)));
        assertEquals(0, probe.pendingCount());
    }

    @Test
    void missingMessageFailsWithAssertionError() {
        TestProbe<String> probe = TestProbe.create(system);

        assertThrows(AssertionError.class, () -> probe.expectMessage(Duration.ofMillis(100)));
        assertThrows(AssertionError.class, () -> probe.expectMessages(2, Duration.ofMillis(100)));
    }

    @Test
    void wrongTypeFailsWithAssertionError() {
        TestProbe<Object> probe = TestProbe.create(system);
        system.tell(probe.address(), 42);

        AssertionError error = assertThrows(AssertionError.class,
                () -> probe.expectMessage(String.class, Duration.ofSeconds(2)));
        assertTrue(error.getMessage().contains("java.lang.Integer"));
    }
}
