package db.qexec.exec;

/**
 * Minimal predicate interface evaluated against a Row.
 */
@FunctionalInterface
public interface Predicate {
    boolean test(Row row);
}
