package party.iroiro.r2oracle;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import party.iroiro.r2oracle.value.Value;

/**
 * Outcome of {@link OracleConnection#exec}
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ExecResult {
    public static final ExecResult NONE = new ExecResult(0, Value.NULL);

    private final long rowsAffected;
    /**
     * Always {@link Value#NULL}: Oracle has no auto-increment ids to report
     */
    private final Value lastInsertId;
}
