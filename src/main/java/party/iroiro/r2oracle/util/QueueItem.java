package party.iroiro.r2oracle.util;

import lombok.AllArgsConstructor;
import reactor.util.annotation.Nullable;

import java.util.function.BiConsumer;

/**
 * Conceptually just a {@link reactor.core.publisher.Mono}, subscribed by the {@link #consumer}
 *
 * @param <T> the published object type of this conceptual {@link reactor.core.publisher.Mono}
 */
@AllArgsConstructor
public class QueueItem<T> implements Runnable {
    @Nullable
    public final T item;
    @Nullable
    public final Throwable e;
    public final BiConsumer<T, Throwable> consumer;

    @Override
    public void run() {
        consumer.accept(item, e);
    }
}
