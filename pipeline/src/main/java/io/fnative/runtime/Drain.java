package io.fnative.runtime;

import io.fnative.core.Delivery;
import io.fnative.core.Sink;

/**
 * Consumer loop feeding every delivered value of a scheduler into a sink.
 */
public final class Drain {
    private Drain() {}

    /**
     * Delivers values in index order until the sequence ends and returns how many were delivered.
     * The scheduler is closed on every exit path.
     *
     * @throws io.fnative.error.ComputationException when a unit failed
     * @throws Exception whatever the sink throws
     */
    public static <T> long to(ReorderScheduler<T> scheduler, Sink<? super T> sink) throws Exception {
        long delivered = 0;
        try (scheduler) {
            while (true) {
                Delivery<T> d = scheduler.next();
                if (d.isDone()) return delivered;
                if (d.isFailure()) throw d.error();
                sink.accept(d.index(), d.value());
                delivered++;
            }
        }
    }
}
