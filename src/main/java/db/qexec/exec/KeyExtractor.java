package db.qexec.exec;

import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.DataType;
import db.qexec.catalog.TableSchema;
import db.qexec.error.TypeMismatchException;

/**
 * Projects a row onto its key columns and compares keys across two (possibly different) schemas.
 */
public final class KeyExtractor {
    private final int[] indexes;

    public KeyExtractor(int... indexes) {
        if (indexes.length == 0) throw new IllegalArgumentException("At least one key column required");
        this.indexes = indexes.clone();
    }

    public static KeyExtractor forColumnNames(List<ColumnSchema> schema, List<String> columns) {
        int[] idx = new int[columns.size()];
        for (int i = 0; i < idx.length; i++) idx[i] = TableSchema.indexOf(schema, columns.get(i));
        return new KeyExtractor(idx);
    }

    public int width() { return indexes.length; }

    public int[] indexes() { return indexes.clone(); }

    public Object[] extract(Row row) {
        Object[] key = new Object[indexes.length];
        for (int i = 0; i < indexes.length; i++) key[i] = row.get(indexes[i]);
        return key;
    }

    /** True if any key component is null: such rows never take part in an equality match. */
    public boolean hasNull(Row row) {
        for (int i : indexes) if (row.get(i) == null) return true;
        return false;
    }

    /** Lexicographic comparison of this key on {@code a} with {@code other}'s key on {@code b}. */
    public int compare(Row a, KeyExtractor other, Row b) {
        if (other.indexes.length != indexes.length) {
            throw new IllegalArgumentException("Key width mismatch: " + indexes.length + " vs " + other.indexes.length);
        }
        for (int i = 0; i < indexes.length; i++) {
            int c = Values.compare(a.get(indexes[i]), b.get(other.indexes[i]));
            if (c != 0) return c;
        }
        return 0;
    }

    /**
     * Reject key pairs whose declared types can never compare (numeric types coerce to each other),
     * before any row is read.
     */
    public static void requireComparable(List<ColumnSchema> leftSchema, KeyExtractor leftKey,
                                         List<ColumnSchema> rightSchema, KeyExtractor rightKey) {
        if (leftKey.width() != rightKey.width()) {
            throw new IllegalArgumentException("Key width mismatch: " + leftKey.width() + " vs " + rightKey.width());
        }
        for (int i = 0; i < leftKey.indexes.length; i++) {
            ColumnSchema l = leftSchema.get(leftKey.indexes[i]);
            ColumnSchema r = rightSchema.get(rightKey.indexes[i]);
            DataType lt = l.type();
            DataType rt = r.type();
            if (lt != rt && !(lt.isNumeric() && rt.isNumeric())) {
                throw new TypeMismatchException("Join key " + l.name() + " (" + lt + ") is not comparable with "
                        + r.name() + " (" + rt + ")");
            }
        }
    }

    public int hash(Row row, int seed) {
        int h = 1;
        for (int i : indexes) h = 31 * h + Values.hash(row.get(i));
        return Values.hash(h, seed);
    }
}
