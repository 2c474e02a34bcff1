package party.iroiro.r2oracle.codecs;

import reactor.util.annotation.Nullable;

/**
 * One column value as fetched on the worker thread, not yet decoded
 *
 * <p>
 * At most one of {@link #getText()} and {@link #getBinary()} is set. Binary types only
 * ever fill the binary slot. A value that is neither null nor carries a payload comes from
 * a column whose native getter failed.
 * </p>
 */
public final class OracleData {
    @Nullable
    private final String text;
    @Nullable
    private final byte[] binary;
    private final OracleType type;
    private final boolean sqlNull;

    private OracleData(@Nullable String text, @Nullable byte[] binary, OracleType type, boolean sqlNull) {
        this.text = text;
        this.binary = binary;
        this.type = type;
        this.sqlNull = sqlNull;
    }

    public static OracleData ofNull(OracleType type) {
        return new OracleData(null, null, type, true);
    }

    public static OracleData ofText(OracleType type, String text) {
        return new OracleData(text, null, type, false);
    }

    public static OracleData ofBinary(OracleType type, byte[] binary) {
        return new OracleData(null, binary, type, false);
    }

    public static OracleData empty(OracleType type) {
        return new OracleData(null, null, type, false);
    }

    @Nullable
    public String getText() {
        return text;
    }

    @Nullable
    public byte[] getBinary() {
        return binary;
    }

    public OracleType getType() {
        return type;
    }

    public boolean isSqlNull() {
        return sqlNull;
    }

    @Override
    public String toString() {
        if (sqlNull) {
            return "NULL " + type;
        }
        if (binary != null) {
            return "<" + binary.length + " bytes> " + type;
        }
        return text + " " + type;
    }
}
