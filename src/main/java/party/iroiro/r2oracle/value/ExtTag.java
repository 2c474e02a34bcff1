package party.iroiro.r2oracle.value;

import party.iroiro.r2oracle.ConversionException;

/**
 * Extension tags carried by {@link Value.Ext}
 *
 * <p>
 * The names match the tags used by the query front end, so {@link #of(String)}
 * is the only place where an unknown tag can show up.
 * </p>
 */
public enum ExtTag {
    DATE("Date"),
    DATE_TIME("DateTime"),
    TIME("Time"),
    DECIMAL("Decimal"),
    TIMESTAMP("Timestamp"),
    UUID("Uuid"),
    JSON("Json");

    private final String tag;

    ExtTag(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * @param tag the tag name, case-sensitive
     * @return the matching tag
     * @throws ConversionException for an unknown tag
     */
    public static ExtTag of(String tag) {
        for (ExtTag value : values()) {
            if (value.tag.equals(tag)) {
                return value;
            }
        }
        throw new ConversionException("Unknown extended type: " + tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
