package db.qexec.error;

/**
 * Two key values could not be compared even after numeric coercion.
 * The operator evaluating the comparison fails as a whole.
 */
public class TypeMismatchException extends ExecException {
    public TypeMismatchException(Object a, Object b) {
        super("Cannot compare " + describe(a) + " with " + describe(b));
    }

    public TypeMismatchException(String message) {
        super(message);
    }

    private static String describe(Object v) {
        return v == null ? "null" : v.getClass().getSimpleName() + "(" + v + ")";
    }
}
