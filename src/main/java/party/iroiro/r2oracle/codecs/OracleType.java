package party.iroiro.r2oracle.codecs;

import lombok.EqualsAndHashCode;

/**
 * Native column type as declared by the database
 *
 * <p>
 * {@link Kind#NUMBER} carries precision and scale, {@link Kind#FLOAT} a binary precision
 * and {@link Kind#OTHER} the vendor type name. An unconstrained {@code NUMBER} is reported
 * with precision {@code 0} and scale {@code -127}.
 * </p>
 */
@EqualsAndHashCode
public final class OracleType {
    public static final int UNCONSTRAINED_PRECISION = 0;
    public static final int UNCONSTRAINED_SCALE = -127;

    public static final OracleType INT64 = new OracleType(Kind.INT64, 0, 0, "INT64");
    public static final OracleType BINARY_FLOAT = new OracleType(Kind.BINARY_FLOAT, 0, 0, "BINARY_FLOAT");
    public static final OracleType BINARY_DOUBLE = new OracleType(Kind.BINARY_DOUBLE, 0, 0, "BINARY_DOUBLE");
    public static final OracleType DATE = new OracleType(Kind.DATE, 0, 0, "DATE");
    public static final OracleType TIMESTAMP = new OracleType(Kind.TIMESTAMP, 0, 0, "TIMESTAMP");
    public static final OracleType BLOB = new OracleType(Kind.BLOB, 0, 0, "BLOB");
    public static final OracleType RAW = new OracleType(Kind.RAW, 0, 0, "RAW");
    public static final OracleType LONG_RAW = new OracleType(Kind.LONG_RAW, 0, 0, "LONG RAW");
    public static final OracleType CLOB = new OracleType(Kind.CLOB, 0, 0, "CLOB");
    public static final OracleType NCLOB = new OracleType(Kind.NCLOB, 0, 0, "NCLOB");
    public static final OracleType LONG = new OracleType(Kind.LONG, 0, 0, "LONG");
    public static final OracleType CHAR = new OracleType(Kind.CHAR, 0, 0, "CHAR");
    public static final OracleType VARCHAR2 = new OracleType(Kind.VARCHAR2, 0, 0, "VARCHAR2");

    private final Kind kind;
    private final int precision;
    private final int scale;
    private final String name;

    private OracleType(Kind kind, int precision, int scale, String name) {
        this.kind = kind;
        this.precision = precision;
        this.scale = scale;
        this.name = name;
    }

    public static OracleType number(int precision, int scale) {
        return new OracleType(Kind.NUMBER, precision, scale, "NUMBER");
    }

    public static OracleType floating(int precision) {
        return new OracleType(Kind.FLOAT, precision, 0, "FLOAT");
    }

    public static OracleType other(String name) {
        return new OracleType(Kind.OTHER, 0, 0, name);
    }

    public Kind getKind() {
        return kind;
    }

    public int getPrecision() {
        return precision;
    }

    public int getScale() {
        return scale;
    }

    public String getName() {
        return name;
    }

    public boolean isBinary() {
        return kind == Kind.BLOB || kind == Kind.RAW || kind == Kind.LONG_RAW;
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBER:
                return "NUMBER(" + precision + ", " + scale + ")";
            case FLOAT:
                return "FLOAT(" + precision + ")";
            default:
                return name;
        }
    }

    public enum Kind {
        NUMBER,
        INT64,
        FLOAT,
        BINARY_FLOAT,
        BINARY_DOUBLE,
        DATE,
        TIMESTAMP,
        BLOB,
        RAW,
        LONG_RAW,
        CLOB,
        NCLOB,
        LONG,
        CHAR,
        VARCHAR2,
        OTHER,
    }
}
