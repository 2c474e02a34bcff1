package party.iroiro.r2oracle.codecs;

import oracle.jdbc.OracleTypes;
import party.iroiro.r2oracle.ConversionException;
import party.iroiro.r2oracle.value.ExtTag;
import party.iroiro.r2oracle.value.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.HashMap;

/**
 * The default {@link Codec}, following Oracle's type system
 *
 * <p>
 * Numbers are widened by their declared precision: up to 9 digits become
 * {@link Value.I32}, up to 18 digits {@link Value.I64}, anything wider or with a
 * fractional scale a {@link ExtTag#DECIMAL} string. Binary columns always decode from
 * bytes, never from text.
 * </p>
 */
public class OracleCodec implements Codec {
    /**
     * Oracle vendor type codes not covered by {@link Types}
     */
    public static final int ORACLE_BINARY_FLOAT = OracleTypes.BINARY_FLOAT;
    public static final int ORACLE_BINARY_DOUBLE = OracleTypes.BINARY_DOUBLE;

    static final String MISSING_STRING_VALUE = "Missing string value";

    private static final DateTimeFormatter DATE_INPUT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter DATE_TIME_INPUT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter DATE_TIME_OUTPUT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");
    private static final DateTimeFormatter COLUMN_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private final HashMap<Integer, OracleType> columnTypeGuesses;

    public OracleCodec() {
        columnTypeGuesses = new HashMap<>();

        initGuessMap();
    }

    private void initGuessMap() {
        put(OracleType.INT64, Types.BIGINT);
        put(OracleType.number(9, 0), Types.INTEGER, Types.SMALLINT, Types.TINYINT);
        put(OracleType.BINARY_FLOAT, Types.REAL, ORACLE_BINARY_FLOAT);
        put(OracleType.BINARY_DOUBLE, Types.DOUBLE, ORACLE_BINARY_DOUBLE);
        put(OracleType.DATE, Types.DATE);
        put(OracleType.TIMESTAMP, Types.TIMESTAMP);
        put(OracleType.BLOB, Types.BLOB);
        put(OracleType.RAW, Types.BINARY, Types.VARBINARY);
        put(OracleType.LONG_RAW, Types.LONGVARBINARY);
        put(OracleType.CLOB, Types.CLOB);
        put(OracleType.NCLOB, Types.NCLOB);
        put(OracleType.LONG, Types.LONGVARCHAR, Types.LONGNVARCHAR);
        put(OracleType.CHAR, Types.CHAR, Types.NCHAR);
        put(OracleType.VARCHAR2, Types.VARCHAR, Types.NVARCHAR);
    }

    private void put(OracleType type, int... jdbcTypes) {
        for (int jdbcType : jdbcTypes) {
            columnTypeGuesses.put(jdbcType, type);
        }
    }

    @Override
    public OracleType guess(ResultSetMetaData metadata, int column) throws SQLException {
        int jdbcType = metadata.getColumnType(column);
        switch (jdbcType) {
            case Types.NUMERIC:
            case Types.DECIMAL:
                return OracleType.number(metadata.getPrecision(column), metadata.getScale(column));
            case Types.FLOAT:
                return OracleType.floating(metadata.getPrecision(column));
            default:
                OracleType type = columnTypeGuesses.get(jdbcType);
                return type == null ? OracleType.other(metadata.getColumnTypeName(column)) : type;
        }
    }

    @Override
    public void encode(Value value, int index, PreparedStatement statement) throws SQLException {
        int position = index + 1;
        switch (value.getType()) {
            case NULL:
                statement.setNull(position, Types.VARCHAR);
                break;
            case BOOL:
                statement.setInt(position, ((Value.Bool) value).getValue() ? 1 : 0);
                break;
            case I32:
                statement.setInt(position, ((Value.I32) value).getValue());
                break;
            case I64:
                statement.setLong(position, ((Value.I64) value).getValue());
                break;
            case F32:
                statement.setFloat(position, ((Value.F32) value).getValue());
                break;
            case F64:
                statement.setDouble(position, ((Value.F64) value).getValue());
                break;
            case STRING:
                statement.setString(position, ((Value.Str) value).getValue());
                break;
            case BINARY:
                statement.setBytes(position, ((Value.Binary) value).getValue());
                break;
            case ARRAY:
                // no native array binding
                statement.setString(position, value.toString());
                break;
            case EXT:
                encodeExt((Value.Ext) value, position, statement);
                break;
        }
    }

    protected void encodeExt(Value.Ext value, int position, PreparedStatement statement) throws SQLException {
        ExtTag tag = value.getTag();
        switch (tag) {
            case DATE:
                statement.setString(position, parseDate(textPayload(value)).format(DATE_INPUT));
                break;
            case DATE_TIME:
                statement.setString(position, parseDateTime(textPayload(value)).format(DATE_TIME_OUTPUT));
                break;
            case DECIMAL:
                statement.setString(position, parseDecimal(textPayload(value)).toPlainString());
                break;
            case TIMESTAMP:
                statement.setLong(position, unsignedPayload(value));
                break;
            case TIME:
            case UUID:
                statement.setString(position, textPayload(value));
                break;
            case JSON:
                throw new ConversionException("JSON type not implemented");
        }
    }

    private static String textPayload(Value.Ext value) {
        Value payload = value.getPayload();
        if (payload.getType() != Value.Type.STRING) {
            throw new ConversionException(value.getTag() + " expects a string payload, got " + payload);
        }
        return ((Value.Str) payload).getValue();
    }

    private static long unsignedPayload(Value.Ext value) {
        Value payload = value.getPayload();
        long timestamp;
        if (payload.getType() == Value.Type.I64) {
            timestamp = ((Value.I64) payload).getValue();
        } else if (payload.getType() == Value.Type.I32) {
            timestamp = ((Value.I32) payload).getValue();
        } else {
            throw new ConversionException(value.getTag() + " expects an integer payload, got " + payload);
        }
        if (timestamp < 0) {
            throw new ConversionException(value.getTag() + " expects an unsigned payload, got " + timestamp);
        }
        return timestamp;
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text, DATE_INPUT);
        } catch (DateTimeParseException e) {
            throw new ConversionException(e.getMessage(), e);
        }
    }

    private static LocalDateTime parseDateTime(String text) {
        try {
            return LocalDateTime.parse(text, DATE_TIME_INPUT);
        } catch (DateTimeParseException e) {
            throw new ConversionException(e.getMessage(), e);
        }
    }

    private static BigDecimal parseDecimal(String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new ConversionException("Invalid decimal: " + text, e);
        }
    }

    @Override
    public Value decode(OracleData data) {
        if (data.isSqlNull()) {
            return Value.NULL;
        }

        OracleType type = data.getType();
        switch (type.getKind()) {
            case NUMBER:
                return decodeNumber(requireText(data), type.getPrecision(), type.getScale());
            case INT64:
                return Value.of(parseLong(requireText(data)));
            case FLOAT:
                return type.getPrecision() >= 24
                        ? Value.of(parseDouble(requireText(data)))
                        : Value.of(parseFloat(requireText(data)));
            case BINARY_FLOAT:
                return Value.of(parseFloat(requireText(data)));
            case BINARY_DOUBLE:
                return Value.of(parseDouble(requireText(data)));
            case DATE:
            case TIMESTAMP:
                return decodeDateTime(requireText(data));
            case BLOB:
            case RAW:
            case LONG_RAW:
                byte[] binary = data.getBinary();
                // the row keeps its own bytes
                return binary == null ? Value.NULL : Value.of(binary.clone());
            case LONG:
            case CLOB:
            case NCLOB:
                return Value.of(requireText(data));
            default:
                String text = data.getText();
                if (text == null) {
                    throw new ConversionException("Unimplemented conversion for " + type);
                }
                return Value.of(text);
        }
    }

    private static String requireText(OracleData data) {
        String text = data.getText();
        if (text == null) {
            throw new ConversionException(MISSING_STRING_VALUE);
        }
        return text;
    }

    private static Value decodeNumber(String text, int precision, int scale) {
        if (precision == OracleType.UNCONSTRAINED_PRECISION && scale == OracleType.UNCONSTRAINED_SCALE) {
            BigDecimal decimal = parseDecimal(text);
            BigDecimal stripped = decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
            if (stripped.scale() <= 0) {
                BigInteger integer = stripped.toBigIntegerExact();
                int digits = integer.abs().toString().length();
                if (digits <= 9) {
                    return Value.of(integer.intValueExact());
                } else if (digits <= 18) {
                    return Value.of(integer.longValueExact());
                }
            }
            return decimal(decimal);
        }

        if (scale > 0) {
            return decimal(parseDecimal(text));
        }

        if (precision >= 1 && precision <= 9) {
            return Value.of(parseInt(text));
        } else if (precision >= 10 && precision <= 18) {
            return Value.of(parseLong(text));
        } else {
            return decimal(parseDecimal(text));
        }
    }

    private static Value decimal(BigDecimal decimal) {
        return Value.ext(ExtTag.DECIMAL, Value.of(decimal.toPlainString()));
    }

    private static Value decodeDateTime(String text) {
        try {
            LocalDateTime dateTime = LocalDateTime.parse(text.trim(), COLUMN_DATE_TIME);
            return Value.ext(ExtTag.DATE_TIME, Value.of(dateTime.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)));
        } catch (DateTimeParseException e) {
            throw new ConversionException(e.getMessage(), e);
        }
    }

    private static int parseInt(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new ConversionException("Invalid 32-bit integer: " + text, e);
        }
    }

    private static long parseLong(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new ConversionException("Invalid 64-bit integer: " + text, e);
        }
    }

    private static float parseFloat(String text) {
        try {
            return Float.parseFloat(text);
        } catch (NumberFormatException e) {
            throw new ConversionException("Invalid float: " + text, e);
        }
    }

    private static double parseDouble(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ConversionException("Invalid double: " + text, e);
        }
    }
}
