package party.iroiro.r2oracle;

import lombok.extern.slf4j.Slf4j;
import party.iroiro.r2oracle.util.PlaceholderTranslator;
import party.iroiro.r2oracle.util.QueueDispatcher;
import party.iroiro.r2oracle.value.Value;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * A non-blocking handle to one native Oracle connection
 *
 * <p>
 * The connection starts in autocommit mode: every statement passed to
 * {@link #exec(String, List)} is committed right after it runs. Executing the exact
 * statement {@code begin} opens an explicit transaction, which lasts until
 * {@code commit} or {@code rollback} is executed. These three statements are never
 * sent to the database as text.
 * </p>
 */
@Slf4j
public class OracleConnection {
    static final String BEGIN = "begin";
    static final String COMMIT = "commit";
    static final String ROLLBACK = "rollback";

    private final OracleWorker worker;
    private final TransactionFlag flag;
    private final PlaceholderTranslator translator;
    private final AtomicBoolean closed;

    OracleConnection(OracleWorker worker, TransactionFlag flag, PlaceholderTranslator translator) {
        this.worker = worker;
        this.flag = flag;
        this.translator = translator;
        this.closed = new AtomicBoolean(false);
    }

    /**
     * Opens a connection with the shared default {@link OracleDriver}
     *
     * @param options connect options
     * @return the connection, once the native connection is open
     */
    public static Mono<OracleConnection> establish(OracleConnectOptions options) {
        return OracleDriver.getDefault().connect(options);
    }

    static Mono<OracleConnection> establish(QueueDispatcher<OraclePacket> dispatcher,
                                            PlaceholderTranslator translator,
                                            OracleConnectOptions options) {
        return Mono.defer(() -> {
            OracleWorker worker = new OracleWorker(
                    new LinkedBlockingDeque<>(OracleWorker.QUEUE_CAPACITY),
                    dispatcher.subQueue(),
                    options
            );
            log.debug("Connecting to {}", options);
            return worker.start().thenReturn(new OracleConnection(worker, new TransactionFlag(), translator));
        });
    }

    private <T> Mono<T> whenOpen(Supplier<Mono<T>> action) {
        return Mono.defer(() -> {
            if (closed.get() || worker.isEnded()) {
                return Mono.error(new ConnectionException("Connection closed"));
            }
            return action.get();
        });
    }

    public Mono<List<OracleRow>> getRows(String sql) {
        return getRows(sql, Collections.emptyList());
    }

    /**
     * Runs a query and decodes every row, without committing
     *
     * @param sql    SQL with {@code ?} markers
     * @param params one value per marker
     * @return all rows, sharing one {@link OracleMetaData}
     */
    public Mono<List<OracleRow>> getRows(String sql, List<Value> params) {
        return whenOpen(() -> OracleWorker.send(
                worker,
                OracleJob.Job.QUERY,
                new OracleJob.Request(translator.translate(sql), params, false),
                OracleConnection::rowsOf
        ));
    }

    @SuppressWarnings("unchecked")
    private static List<OracleRow> rowsOf(OraclePacket packet) {
        return (List<OracleRow>) packet.data;
    }

    public Mono<ExecResult> exec(String sql) {
        return exec(sql, Collections.emptyList());
    }

    /**
     * Executes a statement, following the transaction state
     *
     * @param sql    SQL with {@code ?} markers, or one of {@code begin}, {@code commit}
     *               and {@code rollback}
     * @param params one value per marker, ignored for the transaction statements
     * @return rows affected, {@link ExecResult#NONE} for the transaction statements
     */
    public Mono<ExecResult> exec(String sql, List<Value> params) {
        return whenOpen(() -> {
            switch (sql) {
                case BEGIN:
                    return flag.set(true).thenReturn(ExecResult.NONE);
                case COMMIT:
                    return OracleWorker.voidSend(worker, OracleJob.Job.COMMIT, null)
                            .then(flag.set(false))
                            .thenReturn(ExecResult.NONE);
                case ROLLBACK:
                    return OracleWorker.voidSend(worker, OracleJob.Job.ROLLBACK, null)
                            .then(flag.set(false))
                            .thenReturn(ExecResult.NONE);
                default:
                    String translated = translator.translate(sql);
                    return flag.get().flatMap(inTransaction -> OracleWorker.send(
                            worker,
                            OracleJob.Job.EXECUTE,
                            new OracleJob.Request(translated, params, !inTransaction),
                            packet -> (ExecResult) packet.data
                    ));
            }
        });
    }

    public Mono<Void> ping() {
        return whenOpen(() -> OracleWorker.voidSend(worker, OracleJob.Job.PING, null));
    }

    /**
     * Commits whatever is pending and closes the native connection, unless a duplicate
     * still holds it
     *
     * @return completion, or a {@link ConnectionException} if the native close fails
     */
    public Mono<Void> close() {
        return Mono.defer(() -> {
            if (closed.compareAndSet(false, true)) {
                return worker.release();
            }
            return Mono.empty();
        });
    }

    /**
     * @return another handle to the same native connection and transaction state
     * @throws ConnectionException if this handle is closed
     */
    public OracleConnection duplicate() {
        if (closed.get() || worker.isEnded()) {
            throw new ConnectionException("Connection closed");
        }
        worker.retain();
        return new OracleConnection(worker, flag, translator);
    }

    public boolean isInTransaction() {
        return flag.snapshot();
    }

    public boolean isClosed() {
        return closed.get() || worker.isEnded();
    }

    OracleWorker getWorker() {
        return worker;
    }
}
