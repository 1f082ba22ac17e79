package db.qexec.exec;

/**
 * Predicate over a pair of rows (outer, inner). Used by joins whose condition is not a plain equality.
 */
@FunctionalInterface
public interface JoinPredicate {
    boolean test(Row outer, Row inner);
}
