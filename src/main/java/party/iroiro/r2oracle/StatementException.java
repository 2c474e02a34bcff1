package party.iroiro.r2oracle;

/**
 * Preparing, binding, executing, committing or rolling back failed
 */
public class StatementException extends OracleException {

    public StatementException(String reason) {
        super(reason);
    }

    public StatementException(Throwable cause) {
        super(cause);
    }
}
