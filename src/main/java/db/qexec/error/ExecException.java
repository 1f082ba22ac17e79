package db.qexec.error;

/**
 * Base class of every failure raised while executing an operator tree.
 * Errors are never retried internally; they propagate to the caller, which aborts the statement.
 */
public class ExecException extends RuntimeException {
    public ExecException(String message) { super(message); }
    public ExecException(String message, Throwable cause) { super(message, cause); }
}
