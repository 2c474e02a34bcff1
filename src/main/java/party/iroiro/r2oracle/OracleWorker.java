package party.iroiro.r2oracle;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.beanutils.ConstructorUtils;
import party.iroiro.r2oracle.codecs.Codec;
import party.iroiro.r2oracle.codecs.OracleCodec;
import party.iroiro.r2oracle.util.QueueItem;
import party.iroiro.r2oracle.util.SemiBlockingQueue;
import party.iroiro.r2oracle.value.Value;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

import java.lang.reflect.InvocationTargetException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Owns one JDBC connection and runs every blocking call against it on a dedicated thread
 *
 * <p>
 * Jobs are taken from a bounded queue one at a time, so all calls to the native
 * connection are serialized. Completions are offered to a {@link SemiBlockingQueue}
 * drained by a {@link party.iroiro.r2oracle.util.QueueDispatcher}, never run here.
 * </p>
 */
@Slf4j
class OracleWorker implements Runnable {
    static final int QUEUE_CAPACITY = 1024;

    private final BlockingQueue<OracleJob> jobs;
    private final SemiBlockingQueue<QueueItem<OraclePacket>> out;
    private final OracleConnectOptions options;
    private final Thread thread;
    private final AtomicInteger refCount;
    private State state;
    private Codec codec;
    private ResultAssembler assembler;
    /**
     * Be sure NEVER to access it outside the worker thread
     */
    private Connection conn;

    OracleWorker(BlockingQueue<OracleJob> jobs,
                 SemiBlockingQueue<QueueItem<OraclePacket>> out,
                 OracleConnectOptions options) {
        this.jobs = jobs;
        this.out = out;
        this.options = options;
        this.conn = null;
        this.thread = new Thread(this);
        this.thread.setDaemon(true);
        refCount = new AtomicInteger(1);
        codec = new OracleCodec();
        assembler = new ResultAssembler(codec);
        state = State.RUNNABLE;
    }

    static Mono<Void> voidSend(OracleWorker worker, OracleJob.Job job, @Nullable Object data) {
        return send(worker, job, data, packet -> packet).then();
    }

    static boolean offerNow(OracleWorker worker,
                            OracleJob.Job job,
                            @Nullable Object data,
                            BiConsumer<OraclePacket, Throwable> consumer) {
        return worker.offerJob(new OracleJob(job, data, consumer));
    }

    static <T> Mono<T> send(OracleWorker worker, OracleJob.Job job,
                            @Nullable Object data, Function<OraclePacket, T> converter) {
        return Mono.create(sink -> sink.onRequest(
                ignored -> {
                    if (!offerNow(worker, job, data, (packet, e) -> {
                        if (e == null) {
                            try {
                                sink.success(converter.apply(packet));
                            } catch (RuntimeException conversion) {
                                sink.error(new ConcurrencyException("Unexpected reply to " + job, conversion));
                            }
                        } else {
                            sink.error(e);
                        }
                    })) {
                        sink.error(new ConcurrencyException("Unable to push " + job + " to queue"));
                    }
                }));
    }

    /*
     * Offering and ending are both guarded by this, so a job is either queued before the
     * worker ends (and then failed by the final drain) or rejected here.
     */
    synchronized boolean offerJob(OracleJob job) {
        if (state == State.ENDED) {
            return false;
        }
        return jobs.offer(job);
    }

    private Codec initCodec()
            throws ClassNotFoundException, ClassCastException, InvocationTargetException,
            NoSuchMethodException, IllegalAccessException, InstantiationException {
        String value = options.getCodec();
        if (value == null) {
            return codec;
        }
        Class<?> aClass = Class.forName(value);
        if (Codec.class.isAssignableFrom(aClass)) {
            return (Codec) ConstructorUtils.invokeConstructor(aClass, new Object[0]);
        } else {
            throw new ClassCastException(aClass.getName());
        }
    }

    private void offer(OraclePacket packet, BiConsumer<OraclePacket, Throwable> consumer) {
        out.offer(new QueueItem<>(packet, null, consumer));
    }

    private void offer(Throwable e, BiConsumer<OraclePacket, Throwable> consumer) {
        out.offer(new QueueItem<>(null, e, consumer));
    }

    private void takeAndProcess() throws InterruptedException {
        OracleJob job = jobs.take();
        try {
            process(job);
        } catch (InterruptedException e) {
            throw e;
        } catch (OracleException e) {
            offer(e, job.consumer);
        } catch (Throwable any) {
            log.error("Unexpected exception", any);
            offer(new ConcurrencyException("Job " + job.job + " failed unexpectedly", any), job.consumer);
        }
    }

    private void process(OracleJob job) throws InterruptedException {
        log.trace("Processing: {}", job.job);
        if (conn == null && job.job != OracleJob.Job.CONNECT && job.job != OracleJob.Job.CLOSE) {
            offer(new ConnectionException("Not connected"), job.consumer);
            return;
        }
        switch (job.job) {
            case CONNECT:
                if (conn != null) {
                    offer(new ConnectionException("Tries to connect twice"), job.consumer);
                    break;
                }
                try {
                    codec = initCodec();
                    assembler = new ResultAssembler(codec);
                } catch (ClassNotFoundException | ClassCastException
                        | InvocationTargetException | NoSuchMethodException
                        | IllegalAccessException | InstantiationException e) {
                    end();
                    offer(new ConnectionException("Failed to instantiate Codec", e), job.consumer);
                    throw new InterruptedException("Connection failed");
                }
                try {
                    conn = DriverManager.getConnection(options.getJdbcUrl(), options.getProperties());
                    conn.setAutoCommit(false);
                    offer(OraclePacket.EMPTY, job.consumer);
                } catch (SQLException e) {
                    closeQuietly();
                    end();
                    offer(new ConnectionException(e), job.consumer);
                    throw new InterruptedException("Connection failed");
                }
                break;
            case QUERY:
                OracleJob.Request query = (OracleJob.Request) job.data;
                try (PreparedStatement statement = conn.prepareStatement(query.sql)) {
                    bind(statement, query.params);
                    List<OracleRow> rows;
                    try (ResultSet result = statement.executeQuery()) {
                        rows = assembler.rows(result);
                    }
                    offer(new OraclePacket(rows), job.consumer);
                } catch (SQLException e) {
                    offer(new StatementException(e), job.consumer);
                }
                break;
            case EXECUTE:
                OracleJob.Request request = (OracleJob.Request) job.data;
                try (PreparedStatement statement = conn.prepareStatement(request.sql)) {
                    bind(statement, request.params);
                    statement.execute();
                    long updated = Math.max(statement.getUpdateCount(), 0);
                    if (request.commit) {
                        conn.commit();
                    }
                    offer(new OraclePacket(new ExecResult(updated, Value.NULL)), job.consumer);
                } catch (SQLException e) {
                    offer(new StatementException(e), job.consumer);
                }
                break;
            case COMMIT:
                try {
                    conn.commit();
                    offer(OraclePacket.EMPTY, job.consumer);
                } catch (SQLException e) {
                    offer(new StatementException(e), job.consumer);
                }
                break;
            case ROLLBACK:
                try {
                    conn.rollback();
                    offer(OraclePacket.EMPTY, job.consumer);
                } catch (SQLException e) {
                    offer(new StatementException(e), job.consumer);
                }
                break;
            case PING:
                try {
                    if (conn.isValid(0)) {
                        offer(OraclePacket.EMPTY, job.consumer);
                    } else {
                        offer(new ConnectionException("Connection is not valid"), job.consumer);
                    }
                } catch (SQLException e) {
                    offer(new ConnectionException(e), job.consumer);
                }
                break;
            case CLOSE:
                end();
                if (conn != null) {
                    try {
                        conn.commit();
                    } catch (SQLException e) {
                        log.warn("Error committing the last transaction before closing", e);
                    }
                    try {
                        conn.close();
                        offer(OraclePacket.EMPTY, job.consumer);
                    } catch (SQLException e) {
                        offer(new ConnectionException(e), job.consumer);
                    } finally {
                        conn = null;
                    }
                } else {
                    offer(OraclePacket.EMPTY, job.consumer);
                }
                throw new InterruptedException("Connection closing");
        }
        log.trace("Process finished: {}", job.job);
    }

    private void bind(PreparedStatement statement, List<Value> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            codec.encode(params.get(i), i, statement);
        }
    }

    private synchronized void end() {
        state = State.ENDED;
    }

    private void closeQuietly() {
        if (conn != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                log.warn("Error closing database", e);
            }
            conn = null;
        }
    }

    @Override
    public void run() {
        Thread current = Thread.currentThread();
        current.setName("R2oracleWorker-" + current.getId());

        log.debug("Listening");
        try {
            while (!Thread.interrupted()) {
                takeAndProcess();
            }
        } catch (InterruptedException e) {
            log.debug("Stopping: {}", e.getMessage());
        } finally {
            end();
            log.debug("Cleaning up");
            OracleJob job;
            while ((job = jobs.poll()) != null) {
                offer(new ConcurrencyException("Worker ended before running " + job.job), job.consumer);
            }
            closeQuietly();
            log.debug("Exiting");
        }
    }

    Mono<Void> start() {
        synchronized (this) {
            if (state != State.RUNNABLE) {
                return Mono.error(new ConcurrencyException("Worker already started"));
            }
            state = State.RUNNING;
            thread.start();
        }
        return voidSend(this, OracleJob.Job.CONNECT, null);
    }

    void retain() {
        refCount.incrementAndGet();
    }

    /**
     * Releases one reference, closing the native connection when it was the last one
     */
    Mono<Void> release() {
        return Mono.defer(() -> {
            if (refCount.decrementAndGet() == 0 && !isEnded()) {
                return voidSend(this, OracleJob.Job.CLOSE, null);
            }
            return Mono.empty();
        });
    }

    /**
     * Closes the native connection whatever the reference count
     */
    Mono<Void> shutdown() {
        return Mono.defer(() -> isEnded() ? Mono.empty() : voidSend(this, OracleJob.Job.CLOSE, null));
    }

    synchronized boolean isAlive() {
        return state != State.ENDED && thread.isAlive();
    }

    synchronized boolean isEnded() {
        return state == State.ENDED;
    }

    enum State {
        RUNNABLE, RUNNING, ENDED,
    }
}
