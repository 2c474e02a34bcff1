package party.iroiro.r2oracle;

/**
 * A job never completed on the worker thread
 *
 * <p>
 * Reported instead of a database error when the job could not be queued, when the worker
 * ended before answering, or when the job died with an unexpected runtime failure.
 * </p>
 */
public class ConcurrencyException extends OracleException {
    public static final String TASK_JOIN_ERROR = "Task join error";

    public ConcurrencyException(String reason) {
        super(TASK_JOIN_ERROR + ": " + reason);
    }

    public ConcurrencyException(String reason, Throwable cause) {
        super(TASK_JOIN_ERROR + ": " + reason, cause);
    }
}
