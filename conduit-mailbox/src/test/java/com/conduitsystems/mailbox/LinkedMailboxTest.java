package com.conduitsystems.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class LinkedMailboxTest {

    @Test
    void testOfferRejectsNull() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
        assertThrows(NullPointerException.class, () -> mailbox.put(null));
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new LinkedMailbox<String>(0));
    }

    @Test
    void testFifoOrder() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();

        assertTrue(mailbox.offer("message1"));
        assertTrue(mailbox.offer("message2"));

        assertEquals("message1", mailbox.poll());
        assertEquals("message2", mailbox.poll());
        assertNull(mailbox.poll());
    }

    @Test
    void testBoundedCapacity() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(2);

        assertTrue(mailbox.offer("msg1"));
        assertTrue(mailbox.offer("msg2"));
        assertFalse(mailbox.offer("msg3"));
        assertEquals(0, mailbox.remainingCapacity());
        assertEquals(2, mailbox.capacity());

        assertEquals("msg1", mailbox.poll());
        assertTrue(mailbox.offer("msg3"));
    }

    @Test
    void testOfferWithTimeoutOnFullMailbox() throws InterruptedException {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(1);
        mailbox.offer("first");

        long start = System.nanoTime();
        assertFalse(mailbox.offer("second", 50, TimeUnit.MILLISECONDS));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50));
    }

    @Test
    void testClosedMailboxRejectsNewMessagesButKeepsQueued() throws InterruptedException {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();
        mailbox.offer("queued");
        mailbox.close();

        assertTrue(mailbox.isClosed());
        assertFalse(mailbox.offer("late"));
        assertFalse(mailbox.offer("late", 10, TimeUnit.MILLISECONDS));
        assertThrows(IllegalStateException.class, () -> mailbox.put("late"));
        assertEquals("queued", mailbox.poll());
    }

    @Test
    @Timeout(5)
    void testTakeWithInterruption() throws Exception {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();
        CountDownLatch threadStarted = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean(false);

        Thread waiter = new Thread(() -> {
            threadStarted.countDown();
            try {
                mailbox.take();
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });

        waiter.start();
        threadStarted.await();
        Thread.sleep(50);
        waiter.interrupt();
        waiter.join(1000);

        assertTrue(interrupted.get(), "Thread should have been interrupted");
    }

    @Test
    void testDrainTo() {
        LinkedMailbox<Integer> mailbox = new LinkedMailbox<>();
        for (int i = 0; i < 5; i++) {
            mailbox.offer(i);
        }

        List<Integer> drained = new ArrayList<>();
        assertEquals(3, mailbox.drainTo(drained, 3));
        assertEquals(List.of(0, 1, 2), drained);
        assertEquals(2, mailbox.size());
    }
}
