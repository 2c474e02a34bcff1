package party.iroiro.r2oracle.util;

import reactor.util.annotation.Nullable;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * A queue where many producers offer without blocking and a single consumer thread blocks
 *
 * <p>
 * Worker threads offer their completions here so that they never wait on the dispatcher.
 * </p>
 *
 * @param <T> element type
 */
public class SemiBlockingQueue<T> {
    private final ConcurrentLinkedQueue<T> queue = new ConcurrentLinkedQueue<>();
    /*
     * Number of queued elements, or -1 while the consumer is parked on an empty queue.
     */
    private final AtomicInteger size = new AtomicInteger(0);
    private final AtomicReference<Thread> consumer = new AtomicReference<>(null);

    /**
     * @param consumer the only thread allowed to {@link #take()}
     * @throws IllegalStateException if a consumer is already set
     */
    public void setConsumer(Thread consumer) {
        if (!this.consumer.compareAndSet(null, consumer)) {
            throw new IllegalStateException("Only one consumer supported");
        }
    }

    public void offer(T t) {
        queue.offer(t);
        if (size.getAndIncrement() < 0) {
            // a pending unpark makes the next park return at once, so this cannot be lost
            LockSupport.unpark(consumer.get());
        }
    }

    @Nullable
    public T poll() {
        T t = queue.poll();
        if (t != null) {
            size.decrementAndGet();
        }
        return t;
    }

    @Nullable
    public T peek() {
        return queue.peek();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Waits for an element
     *
     * @return the head of the queue
     * @throws InterruptedException if the consumer is interrupted while waiting
     * @throws IllegalStateException if called from a thread other than the consumer
     */
    public T take() throws InterruptedException {
        if (!Thread.currentThread().equals(consumer.get())) {
            throw new IllegalStateException("Not the consumer thread");
        }
        T t = poll();
        while (t == null) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException();
            }
            if (size.compareAndSet(0, -1)) {
                LockSupport.park(this);
                size.incrementAndGet();
            }
            t = poll();
        }
        return t;
    }
}
