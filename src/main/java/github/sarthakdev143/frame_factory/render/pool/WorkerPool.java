package github.sarthakdev143.frame_factory.render.pool;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of reusable workers handed out one caller at a time.
 *
 * <p>{@link #acquire()} never blocks: when every worker is checked out it returns a pending
 * future which {@link #release(Object)} completes, longest waiter first. A released worker goes
 * straight to the next waiter without passing through the free list. The pool does not inspect
 * or heal workers; broken workers are released like healthy ones.
 *
 * @param <T> worker type, compared by identity
 */
public class WorkerPool<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<T> workers;
    private final Deque<T> free = new ArrayDeque<>();
    private final Set<T> checkedOut = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Deque<CompletableFuture<T>> waiters = new ArrayDeque<>();

    public WorkerPool(List<T> workers) {
        if (workers == null || workers.isEmpty()) {
            throw new IllegalArgumentException("A worker pool needs at least one worker.");
        }
        this.workers = List.copyOf(workers);
        this.free.addAll(this.workers);
    }

    public CompletableFuture<T> acquire() {
        lock.lock();
        try {
            T worker = free.pollFirst();
            if (worker != null) {
                checkedOut.add(worker);
                return CompletableFuture.completedFuture(worker);
            }

            CompletableFuture<T> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        } finally {
            lock.unlock();
        }
    }

    public void release(T worker) {
        while (true) {
            CompletableFuture<T> next;
            lock.lock();
            try {
                if (!checkedOut.contains(worker)) {
                    throw new IllegalStateException("Worker " + worker + " is not checked out of this pool.");
                }

                next = waiters.pollFirst();
                if (next == null) {
                    checkedOut.remove(worker);
                    free.addLast(worker);
                    return;
                }
            } finally {
                lock.unlock();
            }

            // Completed outside the lock since the waiter's continuation may run inline.
            if (next.complete(worker)) {
                return;
            }
        }
    }

    public List<T> workers() {
        return workers;
    }

    public int size() {
        return workers.size();
    }

    public int availableCount() {
        lock.lock();
        try {
            return free.size();
        } finally {
            lock.unlock();
        }
    }

    public int waitingCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }
}
