package party.iroiro.r2oracle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Read-only column descriptors of one result set, shared by all of its rows
 */
public class OracleMetaData {
    private final List<OracleColumn> columns;

    OracleMetaData(List<OracleColumn> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public int getColumnCount() {
        return columns.size();
    }

    public OracleColumn getColumn(int index) {
        return columns.get(index);
    }

    public String getColumnName(int index) {
        return columns.get(index).getName();
    }

    public String getColumnType(int index) {
        return columns.get(index).getType().toString();
    }

    /**
     * @param name column name, case-insensitive
     * @return the column index
     * @throws NoSuchElementException if no column has this name
     */
    public int getColumnIndex(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getName().equalsIgnoreCase(name)) {
                return i;
            }
        }
        throw new NoSuchElementException(name);
    }

    public List<OracleColumn> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return columns.stream().map(OracleColumn::getName).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
