package db.qexec.error;

import java.io.IOException;

/**
 * Temporary storage could not be allocated, written or read.
 */
public class ResourceException extends ExecException {
    public ResourceException(String message, IOException cause) { super(message, cause); }
}
