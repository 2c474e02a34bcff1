package party.iroiro.r2oracle;

import lombok.AllArgsConstructor;
import party.iroiro.r2oracle.value.Value;
import reactor.util.annotation.Nullable;

import java.util.List;
import java.util.function.BiConsumer;

@AllArgsConstructor
class OracleJob {
    enum Job {
        CONNECT,
        QUERY,
        EXECUTE,
        COMMIT,
        ROLLBACK,
        PING,
        CLOSE,
    }

    public final Job job;
    @Nullable
    public final Object data;
    public final BiConsumer<OraclePacket, Throwable> consumer;

    /**
     * Payload of {@link Job#QUERY} and {@link Job#EXECUTE}
     */
    @AllArgsConstructor
    static class Request {
        final String sql;
        final List<Value> params;
        final boolean commit;
    }
}
