package party.iroiro.r2oracle;

import io.r2dbc.spi.R2dbcException;

import java.sql.SQLException;

/**
 * Base of every error reported by this driver
 *
 * <p>
 * When caused by a {@link SQLException}, its SQL state and vendor code are kept.
 * </p>
 */
public abstract class OracleException extends R2dbcException {

    protected OracleException(String reason) {
        super(reason);
    }

    protected OracleException(String reason, Throwable cause) {
        super(reason, sqlState(cause), errorCode(cause), cause);
    }

    protected OracleException(Throwable cause) {
        this(cause.getMessage() == null ? cause.toString() : cause.getMessage(), cause);
    }

    private static String sqlState(Throwable cause) {
        return cause instanceof SQLException ? ((SQLException) cause).getSQLState() : null;
    }

    private static int errorCode(Throwable cause) {
        return cause instanceof SQLException ? ((SQLException) cause).getErrorCode() : 0;
    }
}
