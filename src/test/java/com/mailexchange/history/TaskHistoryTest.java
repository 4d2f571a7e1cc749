package com.mailexchange.history;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TaskHistoryTest {

    private ForwardTask task(long id) {
        return new ForwardTask(id, "2026-01-02T03:04:05Z", "Subject " + id, "alice@example.com", "[PHOTO]",
                List.of("a@x.com"), ForwardStatus.SUCCESS, null);
    }

    @Test
    void newestFirst() {
        TaskHistory history = new TaskHistory();
        history.append(task(1));
        history.append(task(2));
        history.append(task(3));

        List<ForwardTask> snapshot = history.snapshot();
        assertEquals(3, snapshot.size());
        assertEquals(3L, snapshot.get(0).getId());
        assertEquals(1L, snapshot.get(2).getId());
    }

    @Test
    void boundedAtHundred() {
        TaskHistory history = new TaskHistory();
        for (long i = 1; i <= 101; i++) {
            history.append(task(i));
        }

        List<ForwardTask> snapshot = history.snapshot();
        assertEquals(TaskHistory.DEFAULT_CAPACITY, snapshot.size());
        assertEquals(101L, snapshot.get(0).getId());
        assertEquals(2L, snapshot.get(99).getId());
        assertTrue(snapshot.stream().noneMatch(t -> t.getId() == 1L));
    }

    @Test
    void snapshotIsImmutableAndStable() {
        TaskHistory history = new TaskHistory(2);
        history.append(task(1));
        List<ForwardTask> before = history.snapshot();

        history.append(task(2));
        history.append(task(3));

        assertEquals(1, before.size());
        assertEquals(1L, before.get(0).getId());
        assertThrows(UnsupportedOperationException.class, () -> before.add(task(9)));
        assertEquals(2, history.size());
    }

    @Test
    void sequenceIsMonotonic() {
        TaskHistory history = new TaskHistory();

        assertEquals(1L, history.nextId());
        assertEquals(2L, history.nextId());
    }

    @Test
    void concurrentReadersNeverSeeOversizedOrUnorderedList() throws InterruptedException {
        TaskHistory history = new TaskHistory(10);
        AtomicBoolean broken = new AtomicBoolean();
        AtomicBoolean done = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);

        Thread reader = new Thread(() -> {
            started.countDown();
            while (!done.get()) {
                List<ForwardTask> snapshot = history.snapshot();
                if (snapshot.size() > 10) {
                    broken.set(true);
                }
                for (int i = 1; i < snapshot.size(); i++) {
                    if (snapshot.get(i - 1).getId() <= snapshot.get(i).getId()) {
                        broken.set(true);
                    }
                }
            }
        });
        reader.start();
        started.await();

        List<Thread> writers = new ArrayList<>();
        for (int w = 0; w < 4; w++) {
            Thread writer = new Thread(() -> {
                for (int i = 0; i < 500; i++) {
                    synchronized (history) {
                        history.append(task(history.nextId()));
                    }
                }
            });
            writers.add(writer);
            writer.start();
        }
        for (Thread writer : writers) {
            writer.join();
        }
        done.set(true);
        reader.join();

        assertFalse(broken.get());
        assertEquals(10, history.size());
        assertEquals(2000L, history.snapshot().get(0).getId());
    }

    @Test
    void rejectsZeroCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new TaskHistory(0));
    }
}
