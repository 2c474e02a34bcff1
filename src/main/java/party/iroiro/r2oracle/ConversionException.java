package party.iroiro.r2oracle;

/**
 * A value could not be encoded into a parameter or decoded from a column
 */
public class ConversionException extends OracleException {

    public ConversionException(String reason) {
        super(reason);
    }

    public ConversionException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
