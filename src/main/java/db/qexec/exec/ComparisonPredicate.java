package db.qexec.exec;

import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.TableSchema;

/**
 * Compares one column against a literal.
 * Supports operators: EQ, NE, LT, LTE, GT, GTE. A null on either side never satisfies the predicate.
 */
public class ComparisonPredicate implements Predicate {
    public enum Op {
        EQ, NE, LT, LTE, GT, GTE;

        boolean holds(int cmp) {
            return switch (this) {
                case EQ -> cmp == 0;
                case NE -> cmp != 0;
                case LT -> cmp < 0;
                case LTE -> cmp <= 0;
                case GT -> cmp > 0;
                case GTE -> cmp >= 0;
            };
        }
    }

    private final int columnIndex;
    private final Op op;
    private final Object value;

    public ComparisonPredicate(int columnIndex, Op op, Object value) {
        this.columnIndex = columnIndex;
        this.op = op;
        this.value = value;
    }

    public static ComparisonPredicate forColumnName(List<ColumnSchema> schema, String columnName, Op op, Object value) {
        return new ComparisonPredicate(TableSchema.indexOf(schema, columnName), op, value);
    }

    @Override
    public boolean test(Row row) {
        Object v = row.get(columnIndex);
        if (v == null || value == null) return false;
        return op.holds(Values.compare(v, value));
    }

    // For debugging
    @Override
    public String toString() { return "col[" + columnIndex + "] " + op + " " + value; }
}
