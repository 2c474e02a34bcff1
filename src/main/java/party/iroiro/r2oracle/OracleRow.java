package party.iroiro.r2oracle;

import party.iroiro.r2oracle.codecs.Decoder;
import party.iroiro.r2oracle.codecs.OracleData;
import party.iroiro.r2oracle.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One fetched row, decoded column by column on access
 */
public class OracleRow {
    private final OracleMetaData metadata;
    private final List<OracleData> data;
    private final Decoder decoder;

    OracleRow(OracleMetaData metadata, List<OracleData> data, Decoder decoder) {
        if (metadata.getColumnCount() != data.size()) {
            throw new IllegalArgumentException("Expecting " + metadata.getColumnCount()
                    + " columns, got " + data.size());
        }
        this.metadata = metadata;
        this.data = data;
        this.decoder = decoder;
    }

    /**
     * @param index column index, starting from 0
     * @return the decoded value
     * @throws IndexOutOfBoundsException if there is no such column
     * @throws ConversionException if the column cannot be decoded
     */
    public Value get(int index) {
        if (index < 0 || index >= data.size()) {
            throw new IndexOutOfBoundsException("Index out of bounds: " + index);
        }
        return decoder.decode(data.get(index));
    }

    public Value get(String name) {
        return get(metadata.getColumnIndex(name));
    }

    public List<Value> getValues() {
        List<Value> values = new ArrayList<>(data.size());
        for (OracleData datum : data) {
            values.add(decoder.decode(datum));
        }
        return values;
    }

    public OracleData getRaw(int index) {
        return data.get(index);
    }

    public OracleMetaData getMetadata() {
        return metadata;
    }

    public int size() {
        return data.size();
    }
}
