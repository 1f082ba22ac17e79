package db.qexec.exec;

import java.util.ArrayList;
import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.TableSchema;

/**
 * Keeps a subset of the child's columns, in the given order, optionally renaming them.
 * Used above joins to drop the duplicated key column or to give output columns their final names.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final int[] columnIndexes;
    private final List<String> aliases; // null keeps the child's names
    private List<ColumnSchema> outputSchema;

    public ProjectionOperator(Operator child, int[] columnIndexes) {
        this(child, columnIndexes, null);
    }

    private ProjectionOperator(Operator child, int[] columnIndexes, List<String> aliases) {
        if (columnIndexes.length == 0) throw new IllegalArgumentException("Projection needs at least one column");
        if (aliases != null && aliases.size() != columnIndexes.length) {
            throw new IllegalArgumentException("Expected " + columnIndexes.length + " aliases, got " + aliases.size());
        }
        this.child = child;
        this.columnIndexes = columnIndexes.clone();
        this.aliases = aliases == null ? null : List.copyOf(aliases);
    }

    /** Resolves the names against the child's schema, which must be known before open(). */
    public static ProjectionOperator forColumnNames(Operator child, List<String> columnNames) {
        if (columnNames == null || columnNames.isEmpty()) throw new IllegalArgumentException("columnNames must be non-empty");
        List<ColumnSchema> childSchema = child.schema();
        if (childSchema == null) throw new IllegalStateException("Child schema required for name-based projection");
        int[] idxs = new int[columnNames.size()];
        for (int i = 0; i < idxs.length; i++) idxs[i] = TableSchema.indexOf(childSchema, columnNames.get(i));
        return new ProjectionOperator(child, idxs);
    }

    /** Same projection with the output columns renamed, one alias per column. */
    public ProjectionOperator as(List<String> names) {
        return new ProjectionOperator(child, columnIndexes, names);
    }

    @Override
    public void open() {
        child.open();
        outputSchema = schema();
    }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        List<Object> projected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) projected.add(r.get(idx));
        return Row.of(projected, outputSchema);
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<ColumnSchema> schema() {
        if (outputSchema != null) return outputSchema;
        List<ColumnSchema> in = child.schema();
        if (in == null) return null;
        List<ColumnSchema> out = new ArrayList<>(columnIndexes.length);
        for (int i = 0; i < columnIndexes.length; i++) {
            ColumnSchema c = in.get(columnIndexes[i]);
            out.add(aliases == null ? c : new ColumnSchema(aliases.get(i), c.type(), c.length()));
        }
        return out;
    }
}
