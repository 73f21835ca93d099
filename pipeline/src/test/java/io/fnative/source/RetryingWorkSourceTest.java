package io.fnative.source;

import io.fnative.core.Delivery;
import io.fnative.retry.ExponentialBackoffRetryPolicy;
import io.fnative.runtime.ReorderScheduler;
import io.fnative.runtime.ReorderSchedulerBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryingWorkSourceTest {
    private final Map<Long, AtomicInteger> attempts = new ConcurrentHashMap<>();

    private ExecutorWorkSource<Long> flaky(int failuresPerIndex) {
        return ExecutorWorkSource.bounded(i -> {
            int n = attempts.computeIfAbsent(i, k -> new AtomicInteger()).incrementAndGet();
            if (n <= failuresPerIndex) throw new java.io.IOException("transient " + i + "#" + n);
            return i;
        }, 8, 3);
    }

    @Test
    void transient_failures_are_retried() throws Exception {
        try (var src = new RetryingWorkSource<>(flaky(2), new ExponentialBackoffRetryPolicy(3, 1, 5))) {
            ReorderScheduler<Long> s = new ReorderSchedulerBuilder<Long>().source(src).build();
            List<Long> values = new ArrayList<>();
            for (long v : s) values.add(v);
            assertEquals(List.of(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L), values);
            assertEquals(3, attempts.get(0L).get());
        }
    }

    @Test
    void gives_up_after_max_attempts() throws Exception {
        try (var src = new RetryingWorkSource<>(flaky(2), new ExponentialBackoffRetryPolicy(2, 1, 5))) {
            assertEquals(3, src.workerCount());
            assertEquals(8, src.length().getAsLong());
            ReorderScheduler<Long> s = new ReorderSchedulerBuilder<Long>().source(src).build();
            Delivery<Long> d = s.next();
            assertTrue(d.isFailure());
            assertEquals(0, d.error().index());
            assertInstanceOf(java.io.IOException.class, d.error().getCause());
            assertEquals("transient 0#2", d.error().getCause().getMessage());
            assertTrue(s.next().isDone());
            s.close();
        }
    }
}
