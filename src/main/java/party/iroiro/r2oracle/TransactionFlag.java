package party.iroiro.r2oracle;

import party.iroiro.lock.Lock;
import party.iroiro.lock.ReactiveLock;
import reactor.core.publisher.Mono;

/**
 * Whether an explicit transaction is open, shared by all duplicates of a connection
 *
 * <p>
 * The lock only guards reads and writes of the flag. Statements run outside it.
 * </p>
 */
class TransactionFlag {
    private final Lock lock;
    private volatile boolean inTransaction;

    TransactionFlag() {
        lock = new ReactiveLock();
        inTransaction = false;
    }

    Mono<Boolean> get() {
        return lock.withLock(() -> Mono.fromSupplier(() -> inTransaction)).next();
    }

    Mono<Void> set(boolean value) {
        return lock.withLock(() -> Mono.<Void>fromRunnable(() -> inTransaction = value)).then();
    }

    boolean snapshot() {
        return inTransaction;
    }
}
