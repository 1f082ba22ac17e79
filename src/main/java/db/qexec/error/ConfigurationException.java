package db.qexec.error;

/**
 * Memory budget or configuration that cannot make progress.
 * Retrying with the same settings cannot succeed.
 */
public class ConfigurationException extends ExecException {
    public ConfigurationException(String message) { super(message); }
    public ConfigurationException(String message, Throwable cause) { super(message, cause); }
}
