package com.conduitsystems.test;

import com.conduitsystems.ActorContext;
import com.conduitsystems.ActorSystem;
import com.conduitsystems.address.Address;
import com.conduitsystems.handler.Handler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * An actor that records what it receives, for asserting on messages an actor under test
 * sends. Pass {@link #address()} wherever the code under test expects a reply target.
 *
 * <pre>{@code
 * TestProbe<String> probe = TestProbe.create(system);
 * system.tell(probe.address(), worker, new Request("data"));
 * assertEquals("done", probe.expectMessage(Duration.ofSeconds(1)));
 * }</pre>
 *
 * @param <T> the message type
 */
public class TestProbe<T> {

    /**
     * A received message with the sender it came from, if any.
     */
    public record Received<T>(T message, Optional<Address> sender) {
    }

    private final ActorSystem system;
    private final Address address;
    private final BlockingQueue<Received<T>> received;

    private TestProbe(ActorSystem system, Address address, BlockingQueue<Received<T>> received) {
        this.system = system;
        this.address = address;
        this.received = received;
    }

    public static <T> TestProbe<T> create(ActorSystem system) {
        return create(system, Address.anonymous());
    }

    public static <T> TestProbe<T> create(ActorSystem system, String name) {
        return create(system, Address.named(name));
    }

    private static <T> TestProbe<T> create(ActorSystem system, Address address) {
        BlockingQueue<Received<T>> queue = new LinkedBlockingQueue<>();
        // one queue for all incarnations, so nothing is lost if the probe is restarted
        system.spawn(address, () -> new Handler<T>() {
            @Override
            public void receive(T message, ActorContext context) {
                queue.offer(new Received<>(message, context.sender()));
            }
        });
        return new TestProbe<>(system, address, queue);
    }

    public Address address() {
        return address;
    }

    /**
     * Sends {@code message} to {@code target} with this probe as the sender.
     */
    public void send(Address target, Object message) {
        system.tell(address, target, message);
    }

    /**
     * @throws AssertionError if nothing arrives within {@code timeout}
     */
    public T expectMessage(Duration timeout) {
        return expectReceived(timeout).message();
    }

    public Received<T> expectReceived(Duration timeout) {
        Received<T> next = poll(timeout);
        if (next == null) {
            throw new AssertionError("Expected message at " + address + " within " + timeout + " but none received");
        }
        return next;
    }

    public <M extends T> M expectMessage(Class<M> type, Duration timeout) {
        T message = expectMessage(timeout);
        if (!type.isInstance(message)) {
            throw new AssertionError("Expected " + type.getName() + " but got "
                    + (message == null ? "null" : message.getClass().getName()) + ": " + message);
        }
        return type.cast(message);
    }

    public T expectMessage(Predicate<? super T> predicate, Duration timeout) {
        T message = expectMessage(timeout);
        if (!predicate.test(message)) {
            throw new AssertionError("Message does not match: " + message);
        }
        return message;
    }

    /**
     * Collects exactly {@code count} messages, all within one overall {@code timeout}.
     */
    public List<T> expectMessages(int count, Duration timeout) {
        List<T> messages = new ArrayList<>(count);
        long deadline = System.nanoTime() + timeout.toNanos();
        while (messages.size() < count) {
            long remaining = deadline - System.nanoTime();
            Received<T> next = remaining > 0 ? poll(Duration.ofNanos(remaining)) : null;
            if (next == null) {
                throw new AssertionError("Expected " + count + " messages but received " + messages.size()
                        + " within " + timeout + ": " + messages);
            }
            messages.add(next.message());
        }
        return messages;
    }

    /**
     * @throws AssertionError if anything arrives within {@code duration}
     */
    public void expectNoMessage(Duration duration) {
        Received<T> next = poll(duration);
        if (next != null) {
            throw new AssertionError("Expected no message at " + address + " but received: " + next.message());
        }
    }

    /**
     * Messages received but not yet expected.
     */
    public int pendingCount() {
        return received.size();
    }

    private Received<T> poll(Duration timeout) {
        try {
            return received.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for a message", e);
        }
    }
}
