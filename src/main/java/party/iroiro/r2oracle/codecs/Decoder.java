package party.iroiro.r2oracle.codecs;

import party.iroiro.r2oracle.value.Value;

/**
 * Decodes a fetched column into a {@link Value}
 */
public interface Decoder {
    /**
     * From raw column data to dynamic values
     *
     * <p>
     * Implementations must be pure: rows decode lazily on whatever thread reads them.
     * </p>
     *
     * @param data the raw column
     * @return decoded value, {@link Value#NULL} for SQL {@code NULL}
     * @throws party.iroiro.r2oracle.ConversionException if the column cannot be decoded
     */
    Value decode(OracleData data);
}
