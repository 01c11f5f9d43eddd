package com.conduitsystems.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MpscMailboxTest {

    @Test
    void testUnbounded() {
        MpscMailbox<Integer> mailbox = new MpscMailbox<>(2);
        for (int i = 0; i < 1000; i++) {
            assertTrue(mailbox.offer(i));
        }
        assertEquals(1000, mailbox.size());
        assertEquals(Integer.MAX_VALUE, mailbox.remainingCapacity());
        assertEquals(Integer.MAX_VALUE, mailbox.capacity());
    }

    @Test
    void testPollTimesOutOnEmptyMailbox() throws InterruptedException {
        MpscMailbox<String> mailbox = new MpscMailbox<>();

        long start = System.nanoTime();
        assertNull(mailbox.poll(100, TimeUnit.MILLISECONDS));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(90));
    }

    @Test
    @Timeout(5)
    void testWaitingConsumerIsWokenByProducer() throws Exception {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        CountDownLatch received = new CountDownLatch(1);
        List<String> result = new ArrayList<>();

        Thread consumer = new Thread(() -> {
            try {
                result.add(mailbox.take());
                received.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();
        Thread.sleep(50);

        mailbox.offer("wake");
        assertTrue(received.await(2, TimeUnit.SECONDS));
        consumer.join(1000);
        assertEquals(List.of("wake"), result);
    }

    @Test
    @Timeout(10)
    void testConcurrentProducersLoseNothing() throws Exception {
        MpscMailbox<Integer> mailbox = new MpscMailbox<>();
        int producers = 4;
        int perProducer = 2500;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        try {
            for (int p = 0; p < producers; p++) {
                int base = p * perProducer;
                executor.submit(() -> {
                    for (int i = 0; i < perProducer; i++) {
                        mailbox.offer(base + i);
                    }
                });
            }

            Set<Integer> seen = new HashSet<>();
            while (seen.size() < producers * perProducer) {
                Integer value = mailbox.poll(1, TimeUnit.SECONDS);
                assertNotNull(value, "Producer messages went missing");
                seen.add(value);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testClosedMailboxRejectsOffers() {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        mailbox.offer("before");
        mailbox.close();

        assertFalse(mailbox.offer("after"));
        assertThrows(IllegalStateException.class, () -> mailbox.put("after"));
        assertEquals("before", mailbox.poll());
    }
}
