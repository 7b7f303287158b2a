package space.maatini.transfer.sync;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Goal-counted semaphore: a goal is set, any number of threads count it down, and a waiter blocks
 * until the count reaches zero.
 * <p>
 * This is the hand-off between many concurrent remote completions and one blocking consumer. A
 * semaphore may be reused once a cycle has drained.
 */
public class CountingSemaphore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();

    private long goal;
    private long remaining;

    /**
     * Start a cycle that finishes after {@code n} calls to {@link #decrementOne()}.
     *
     * @throws IllegalArgumentException if {@code n} is negative
     * @throws IllegalStateException    if the previous cycle has not drained
     */
    public void setGoal(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("Goal must not be negative: " + n);
        }
        lock.lock();
        try {
            if (remaining != 0) {
                throw new IllegalStateException(String.format(
                        "Goal set while previous cycle unfinished: goal=%d remaining=%d", goal, remaining));
            }
            goal = n;
            remaining = n;
            if (n == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Count one completion. Safe to call from any thread.
     *
     * @throws IllegalStateException if the count is already zero
     */
    public void decrementOne() {
        lock.lock();
        try {
            if (remaining == 0) {
                throw new IllegalStateException("Decrement past zero, goal was " + goal);
            }
            remaining--;
            if (remaining == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the count reaches zero. Returns at once if no goal was set or the goal was zero.
     */
    public void waitUntilZero() {
        lock.lock();
        try {
            boolean interrupted = false;
            while (remaining > 0) {
                try {
                    drained.await();
                } catch (InterruptedException e) {
                    // outstanding remote work cannot be cancelled, keep waiting and restore the flag
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        } finally {
            lock.unlock();
        }
    }

    public long remaining() {
        lock.lock();
        try {
            return remaining;
        } finally {
            lock.unlock();
        }
    }

    public long goal() {
        lock.lock();
        try {
            return goal;
        } finally {
            lock.unlock();
        }
    }
}
