package db.qexec.exec.sort;

import java.util.Comparator;
import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.TableSchema;
import db.qexec.exec.ExecContext;
import db.qexec.exec.Operator;
import db.qexec.exec.Row;
import db.qexec.exec.RowIterator;

/**
 * Blocking operator that consumes its child on open() and produces the rows in order,
 * spilling sorted runs when the input exceeds {@code memoryBlocks} blocks.
 */
public class SortOperator implements Operator {
    private final Operator child;
    private final List<String> columns;
    private final boolean[] descending;
    private final int memoryBlocks;
    private final ExecContext ctx;
    private final boolean distinct;

    private ExternalSorter sorter;
    private RowIterator rows;
    private int mergePasses;

    public SortOperator(Operator child, List<String> columns, int memoryBlocks, ExecContext ctx) {
        this(child, columns, new boolean[columns.size()], memoryBlocks, ctx, false);
    }

    /**
     * @param descending per-column direction, same length as columns
     * @param distinct drop rows identical to their predecessor (full-row duplicates)
     */
    public SortOperator(Operator child, List<String> columns, boolean[] descending, int memoryBlocks,
                        ExecContext ctx, boolean distinct) {
        ExecContext.requireBlocks("Sort", memoryBlocks, 3);
        if (descending.length != columns.size()) throw new IllegalArgumentException("One direction per sort column required");
        this.child = child;
        this.columns = columns;
        this.descending = descending.clone();
        this.memoryBlocks = memoryBlocks;
        this.ctx = ctx;
        this.distinct = distinct;
    }

    @Override
    public void open() {
        child.open();
        List<ColumnSchema> schema = child.schema();
        if (schema == null) throw new IllegalStateException("SortOperator requires child to provide schema");
        int[] idx = new int[columns.size()];
        for (int i = 0; i < idx.length; i++) idx[i] = TableSchema.indexOf(schema, columns.get(i));
        RowComparator order = new RowComparator(idx, descending);
        sorter = new ExternalSorter(distinct ? order.thenAllColumns(schema.size()) : order, schema,
                ctx.partitions(), memoryBlocks, "sort");
        try {
            Row r;
            while ((r = child.next()) != null) sorter.add(r);
            child.close(); // fully consumed
            RowIterator it = sorter.sorted();
            Comparator<Row> same = RowComparator.allColumns(schema.size());
            rows = distinct ? new DistinctIterator(it, same) : it;
            mergePasses = sorter.mergePasses();
        } catch (RuntimeException e) {
            sorter.close();
            throw e;
        }
    }

    @Override
    public Row next() {
        if (rows == null || !rows.hasNext()) return null;
        return rows.next();
    }

    @Override
    public void close() {
        if (rows != null) rows.close();
        if (sorter != null) sorter.close();
        rows = null;
        sorter = null;
        child.close();
    }

    @Override
    public List<ColumnSchema> schema() { return child.schema(); }

    /** Merge passes of the last open(); 0 when the input was sorted in memory. */
    public int mergePasses() { return mergePasses; }
}
