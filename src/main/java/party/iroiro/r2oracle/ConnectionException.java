package party.iroiro.r2oracle;

/**
 * Connecting, pinging or closing failed, or the connection is no longer usable
 */
public class ConnectionException extends OracleException {

    public ConnectionException(String reason) {
        super(reason);
    }

    public ConnectionException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public ConnectionException(Throwable cause) {
        super(cause);
    }
}
