package com.z254.lumina.tutor.agent;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Non-blocking permit pool. Tasks beyond the limit wait in arrival order for a running task to
 * finish instead of failing. A waiting task that is cancelled gives up its place in the queue.
 */
final class ConcurrencyLimiter {

    private final int limit;
    private final Deque<Waiter> waiting = new ArrayDeque<>();
    private int active;

    ConcurrencyLimiter(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        this.limit = limit;
    }

    /**
     * Run {@code task} once a permit is free. The permit is released when the task terminates or
     * is cancelled.
     */
    <T> Mono<T> run(Supplier<Mono<T>> task) {
        return Mono.defer(() -> {
            Waiter waiter = new Waiter();
            synchronized (this) {
                if (active < limit) {
                    active++;
                    waiter.granted = true;
                } else {
                    waiting.addLast(waiter);
                }
            }
            Mono<Void> permit = waiter.granted ? Mono.empty() : waiter.signal.asMono();
            return permit.then(Mono.defer(task))
                    .doFinally(signal -> leave(waiter));
        });
    }

    synchronized int active() {
        return active;
    }

    synchronized int waiting() {
        return waiting.size();
    }

    private void leave(Waiter waiter) {
        Waiter next;
        synchronized (this) {
            if (!waiter.granted) {
                waiting.remove(waiter);
                return;
            }
            next = waiting.pollFirst();
            if (next == null) {
                active--;
                return;
            }
            // permit passes straight to the next waiter
            next.granted = true;
        }
        next.signal.tryEmitEmpty();
    }

    private static final class Waiter {
        private final Sinks.Empty<Void> signal = Sinks.empty();
        private boolean granted;
    }
}
