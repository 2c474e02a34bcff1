package party.iroiro.r2oracle.util;

import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Dispatches {@link QueueItem}s to their {@link QueueItem#consumer}
 *
 * <p>The work is off-loaded to a scheduler of {@link Schedulers#parallel} by default, so
 * that subscribers never run on a worker thread.</p>
 *
 * @param <T> see {@link QueueItem}
 */
@Slf4j
public class QueueDispatcher<T> implements Runnable {
    private final SemiBlockingQueue<QueueItem<T>> queue;
    private final Scheduler scheduler;

    public QueueDispatcher() {
        this(Schedulers.parallel());
    }

    public QueueDispatcher(Scheduler scheduler) {
        this.queue = new SemiBlockingQueue<>();
        this.scheduler = scheduler;
    }

    public SemiBlockingQueue<QueueItem<T>> subQueue() {
        return queue;
    }

    private void dispatch(QueueItem<T> item) {
        try {
            scheduler.schedule(item);
        } catch (RuntimeException e) {
            log.error("Unable to schedule completion, running it on the dispatcher", e);
            item.run();
        }
    }

    @Override
    public void run() {
        queue.setConsumer(Thread.currentThread());
        Thread.currentThread().setName("R2oracleDispatcher");
        log.debug("Listening");
        try {
            while (!Thread.interrupted()) {
                dispatch(queue.take());
            }
        } catch (InterruptedException e) {
            log.debug("Interrupted, shutting down");
        }
        log.debug("Cleaning up");
        QueueItem<T> item;
        while ((item = queue.poll()) != null) {
            dispatch(item);
        }
        log.debug("Exiting");
    }
}
