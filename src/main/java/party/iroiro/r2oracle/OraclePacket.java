package party.iroiro.r2oracle;

import lombok.AllArgsConstructor;
import reactor.util.annotation.Nullable;

/**
 * Result of a job, handed from the worker back to the reactive side
 */
@AllArgsConstructor
public class OraclePacket {
    public static final OraclePacket EMPTY = new OraclePacket(null);

    @Nullable
    public final Object data;
}
