package db.qexec.exec;

import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.TableSchema;
import db.qexec.exec.ComparisonPredicate.Op;

/**
 * Join condition comparing a column of the outer row with a column of the inner row,
 * e.g. {@code outer.a < inner.b}. Null on either side never matches.
 */
public class ColumnComparison implements JoinPredicate {
    private final int outerIndex;
    private final Op op;
    private final int innerIndex;

    public ColumnComparison(int outerIndex, Op op, int innerIndex) {
        this.outerIndex = outerIndex;
        this.op = op;
        this.innerIndex = innerIndex;
    }

    public static ColumnComparison forColumnNames(List<ColumnSchema> outerSchema, String outerColumn, Op op,
                                                  List<ColumnSchema> innerSchema, String innerColumn) {
        return new ColumnComparison(TableSchema.indexOf(outerSchema, outerColumn), op,
                TableSchema.indexOf(innerSchema, innerColumn));
    }

    public static ColumnComparison equi(int outerIndex, int innerIndex) {
        return new ColumnComparison(outerIndex, Op.EQ, innerIndex);
    }

    @Override
    public boolean test(Row outer, Row inner) {
        Object a = outer.get(outerIndex);
        Object b = inner.get(innerIndex);
        if (a == null || b == null) return false;
        return op.holds(Values.compare(a, b));
    }

    @Override
    public String toString() { return "outer[" + outerIndex + "] " + op + " inner[" + innerIndex + "]"; }
}
