package party.iroiro.r2oracle;

import lombok.extern.slf4j.Slf4j;
import party.iroiro.r2oracle.codecs.Codec;
import party.iroiro.r2oracle.codecs.OracleData;
import party.iroiro.r2oracle.codecs.OracleType;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a JDBC {@link ResultSet} into {@link OracleRow}s, on the worker thread
 *
 * <p>
 * Column descriptors are built once per result set and the same {@link OracleMetaData}
 * is attached to every row.
 * </p>
 */
@Slf4j
class ResultAssembler {
    private final Codec codec;

    ResultAssembler(Codec codec) {
        this.codec = codec;
    }

    OracleMetaData metadata(ResultSetMetaData metadata) throws SQLException {
        int count = metadata.getColumnCount();
        ArrayList<OracleColumn> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            OracleType type = codec.guess(metadata, i);
            log.trace("Column {}: {} -> {}", i, metadata.getColumnTypeName(i), type);
            columns.add(new OracleColumn(metadata.getColumnLabel(i).toLowerCase(Locale.ROOT), type));
        }
        return new OracleMetaData(columns);
    }

    List<OracleRow> rows(ResultSet result) throws SQLException {
        OracleMetaData metadata = metadata(result.getMetaData());
        int count = metadata.getColumnCount();
        ArrayList<OracleRow> rows = new ArrayList<>();
        while (result.next()) {
            ArrayList<OracleData> data = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                data.add(read(result, i + 1, metadata.getColumn(i).getType()));
            }
            rows.add(new OracleRow(metadata, data, codec));
        }
        return rows;
    }

    /**
     * Reads one column; a failing getter leaves the column without payload
     */
    OracleData read(ResultSet result, int column, OracleType type) {
        try {
            if (type.isBinary()) {
                byte[] bytes = result.getBytes(column);
                return result.wasNull() || bytes == null ? OracleData.ofNull(type) : OracleData.ofBinary(type, bytes);
            } else {
                String text = result.getString(column);
                return result.wasNull() || text == null ? OracleData.ofNull(type) : OracleData.ofText(type, text);
            }
        } catch (SQLException e) {
            log.warn("Unable to read column {} of type {}", column, type, e);
            return OracleData.empty(type);
        }
    }
}
