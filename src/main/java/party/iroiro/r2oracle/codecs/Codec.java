package party.iroiro.r2oracle.codecs;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;

/**
 * Encoding, decoding and column type detection used by a connection
 *
 * <p>
 * Encoding and type detection run on the worker thread, so implementations should not
 * touch any Reactor API there.
 * </p>
 */
public interface Codec extends Encoder, Decoder {
    /**
     * Guesses the native type of a column
     *
     * <p>
     * The result decides how the worker fetches the column (bytes or text) and is kept in
     * the column descriptor for decoding.
     * </p>
     *
     * @param metadata the result set metadata
     * @param column   column index (starts from 1, as is in JDBC)
     * @return the native type
     * @throws SQLException when errors occur
     */
    OracleType guess(ResultSetMetaData metadata, int column) throws SQLException;
}
