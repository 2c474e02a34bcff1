package party.iroiro.r2oracle.codecs;

import party.iroiro.r2oracle.value.Value;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Binds a {@link Value} into a JDBC statement parameter
 */
public interface Encoder {
    /**
     * From dynamic values into JDBC parameters
     *
     * <p>
     * Called on the worker thread only.
     * </p>
     *
     * @param value     the value to bind
     * @param index     parameter index, starting from 0 (unlike JDBC)
     * @param statement the prepared statement
     * @throws party.iroiro.r2oracle.ConversionException if the value cannot be represented
     * @throws SQLException if the driver rejects the binding
     */
    void encode(Value value, int index, PreparedStatement statement) throws SQLException;
}
