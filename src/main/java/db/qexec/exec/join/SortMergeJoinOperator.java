package db.qexec.exec.join;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.TableSchema;
import db.qexec.error.ConfigurationException;
import db.qexec.exec.BlockScanOperator;
import db.qexec.exec.ExecContext;
import db.qexec.exec.KeyExtractor;
import db.qexec.exec.Operator;
import db.qexec.exec.Row;
import db.qexec.exec.RowIterator;
import db.qexec.exec.sort.ExternalSorter;
import db.qexec.exec.sort.RowComparator;
import db.qexec.storage.Partition;
import db.qexec.storage.PartitionStore;

/**
 * Sort-merge equi-join. Each input not already ordered on its key is externally sorted down to a
 * single run on disk; the two ordered streams are then merged, reading one block from each.
 * <p>
 * For every key present on both sides the left rows with that key are buffered (up to
 * {@code memoryBlocks - 3} blocks: one block each for the two cursors and one for output) and crossed
 * with each right row of the same key, so k left and m right rows yield k*m output rows.
 * A left group larger than the buffer is spilled together with its right group and joined by a
 * nested loop over the two partitions, or rejected with {@link ConfigurationException} when
 * {@code mergeGroupSpill} is off. Rows with a null key component never match.
 * Output is ordered by the join key.
 */
public class SortMergeJoinOperator implements Operator {
    private static final Logger logger = LoggerFactory.getLogger(SortMergeJoinOperator.class);

    private final Operator left;
    private final Operator right;
    private final List<String> leftColumns;
    private final List<String> rightColumns;
    private final int memoryBlocks;
    private final ExecContext ctx;
    private final PartitionStore store;
    private final int groupLimitRows;
    private boolean leftOrdered;
    private boolean rightOrdered;

    private List<ColumnSchema> leftSchema;
    private List<ColumnSchema> rightSchema;
    private List<ColumnSchema> joinedSchema;
    private KeyExtractor leftKey;
    private KeyExtractor rightKey;

    // Merge state
    private ExternalSorter leftSorter;
    private ExternalSorter rightSorter;
    private RowIterator leftRows;
    private RowIterator rightRows;
    private Row leftCur;
    private Row rightCur;
    private final List<Row> group = new ArrayList<>();
    private Row groupRight;       // right row currently crossed with the buffered left group
    private int groupPos;
    private RowIterator spilledGroup; // pending output of an overflowed group
    private int spilledGroups;

    public SortMergeJoinOperator(Operator left, Operator right, String leftColumn, String rightColumn,
                                 int memoryBlocks, ExecContext ctx) {
        this(left, right, List.of(leftColumn), List.of(rightColumn), memoryBlocks, ctx);
    }

    public SortMergeJoinOperator(Operator left, Operator right, List<String> leftColumns, List<String> rightColumns,
                                 int memoryBlocks, ExecContext ctx) {
        ExecContext.requireBlocks("Sort-merge join", memoryBlocks, 3);
        if (leftColumns.size() != rightColumns.size() || leftColumns.isEmpty()) {
            throw new IllegalArgumentException("Join needs the same non-zero number of key columns on both sides");
        }
        this.left = left;
        this.right = right;
        this.leftColumns = leftColumns;
        this.rightColumns = rightColumns;
        this.memoryBlocks = memoryBlocks;
        this.ctx = ctx;
        this.store = ctx.partitions();
        this.groupLimitRows = Math.max(1, memoryBlocks - 3) * ctx.blockCapacity();
        this.leftOrdered = isOrdered(left, leftColumns);
        this.rightOrdered = isOrdered(right, rightColumns);
    }

    private static boolean isOrdered(Operator op, List<String> columns) {
        return op instanceof BlockScanOperator scan && scan.isOrderedBy(columns);
    }

    /** Declare that the left child already delivers rows ordered by the left key. */
    public SortMergeJoinOperator leftOrdered() { this.leftOrdered = true; return this; }

    /** Declare that the right child already delivers rows ordered by the right key. */
    public SortMergeJoinOperator rightOrdered() { this.rightOrdered = true; return this; }

    @Override
    public void open() {
        left.open();
        right.open();
        leftSchema = left.schema();
        rightSchema = right.schema();
        if (leftSchema == null || rightSchema == null) {
            throw new IllegalStateException("SortMergeJoinOperator requires both children to provide schema");
        }
        joinedSchema = TableSchema.concat(leftSchema, rightSchema);
        leftKey = KeyExtractor.forColumnNames(leftSchema, leftColumns);
        rightKey = KeyExtractor.forColumnNames(rightSchema, rightColumns);
        KeyExtractor.requireComparable(leftSchema, leftKey, rightSchema, rightKey);
        try {
            // both sorts finish on disk before either output is opened, so the merge holds one block per side
            if (!leftOrdered) leftSorter = sortChild(left, leftSchema, leftKey, "smj-left");
            if (!rightOrdered) rightSorter = sortChild(right, rightSchema, rightKey, "smj-right");
            leftRows = leftOrdered ? RowIterator.drain(left) : leftSorter.sorted();
            rightRows = rightOrdered ? RowIterator.drain(right) : rightSorter.sorted();
            leftCur = nextKeyed(leftRows, leftKey);
            rightCur = nextKeyed(rightRows, rightKey);
        } catch (RuntimeException e) {
            release();
            throw e;
        }
    }

    private ExternalSorter sortChild(Operator child, List<ColumnSchema> schema, KeyExtractor key, String name) {
        ExternalSorter sorter = new ExternalSorter(RowComparator.ascending(key.indexes()), schema, store,
                memoryBlocks, 1, name);
        if (child == left) leftSorter = sorter; else rightSorter = sorter;
        Row r;
        while ((r = child.next()) != null) {
            if (!key.hasNull(r)) sorter.add(r);
        }
        child.close();
        sorter.finish();
        logger.debug("{}: sorted {} rows, {} initial run(s), {} merge pass(es)", name, sorter.rowCount(),
                sorter.initialRuns(), sorter.mergePasses());
        return sorter;
    }

    /** Next row whose key has no null component, or null at end. */
    private static Row nextKeyed(RowIterator rows, KeyExtractor key) {
        while (rows.hasNext()) {
            Row r = rows.next();
            if (!key.hasNull(r)) return r;
        }
        return null;
    }

    @Override
    public Row next() {
        try {
            return advance();
        } catch (RuntimeException e) {
            release();
            throw e;
        }
    }

    private Row advance() {
        while (true) {
            if (spilledGroup != null) {
                if (spilledGroup.hasNext()) return spilledGroup.next();
                spilledGroup.close();
                spilledGroup = null;
            }

            if (groupRight != null) {
                if (groupPos < group.size()) return group.get(groupPos++).concat(groupRight, joinedSchema);
                // next right row of the same key, if any
                Row r = rightCur;
                if (r != null && rightKey.compare(r, rightKey, groupRight) == 0) {
                    groupRight = r;
                    groupPos = 0;
                    rightCur = nextKeyed(rightRows, rightKey);
                    continue;
                }
                groupRight = null;
                group.clear();
            }

            if (leftCur == null || rightCur == null) return null;

            int c = leftKey.compare(leftCur, rightKey, rightCur);
            if (c < 0) {
                leftCur = nextKeyed(leftRows, leftKey);
            } else if (c > 0) {
                rightCur = nextKeyed(rightRows, rightKey);
            } else {
                startGroup();
            }
        }
    }

    /** Buffer the left rows sharing the current key; spill when they exceed the budget. */
    private void startGroup() {
        Row keyRow = leftCur;
        group.clear();
        group.add(leftCur);
        leftCur = nextKeyed(leftRows, leftKey);
        while (leftCur != null && leftKey.compare(leftCur, leftKey, keyRow) == 0) {
            if (group.size() >= groupLimitRows) {
                spillGroup(keyRow);
                return;
            }
            group.add(leftCur);
            leftCur = nextKeyed(leftRows, leftKey);
        }
        groupRight = rightCur;
        groupPos = 0;
        rightCur = nextKeyed(rightRows, rightKey);
    }

    private void spillGroup(Row keyRow) {
        if (!ctx.config().mergeGroupSpill()) {
            throw new ConfigurationException("Equal-key group on the left input exceeds " + groupLimitRows
                    + " rows (" + Math.max(1, memoryBlocks - 3) + " blocks) and group spilling is disabled");
        }
        spilledGroups++;
        Partition leftPart = store.createPartition("smj-group-left", leftSchema);
        Partition rightPart = store.createPartition("smj-group-right", rightSchema);
        try {
            for (Row r : group) leftPart.append(r);
            group.clear();
            while (leftCur != null && leftKey.compare(leftCur, leftKey, keyRow) == 0) {
                leftPart.append(leftCur);
                leftCur = nextKeyed(leftRows, leftKey);
            }
            while (rightCur != null && rightKey.compare(rightCur, leftKey, keyRow) == 0) {
                rightPart.append(rightCur);
                rightCur = nextKeyed(rightRows, rightKey);
            }
            logger.debug("Spilled equal-key group: {} left x {} right rows", leftPart.rowCount(), rightPart.rowCount());
            spilledGroup = new PartitionNestedLoop(leftPart, rightPart, groupLimitRows, null, joinedSchema);
        } catch (RuntimeException e) {
            leftPart.delete();
            rightPart.delete();
            throw e;
        }
    }

    private void release() {
        if (spilledGroup != null) spilledGroup.close();
        if (leftRows != null) leftRows.close();
        if (rightRows != null) rightRows.close();
        if (leftSorter != null) leftSorter.close();
        if (rightSorter != null) rightSorter.close();
        spilledGroup = null;
        leftRows = null;
        rightRows = null;
        leftSorter = null;
        rightSorter = null;
        group.clear();
        groupRight = null;
        leftCur = null;
        rightCur = null;
    }

    @Override
    public void close() {
        release();
        left.close();
        right.close();
    }

    @Override
    public List<ColumnSchema> schema() {
        if (joinedSchema != null) return joinedSchema;
        List<ColumnSchema> l = left.schema();
        List<ColumnSchema> r = right.schema();
        return l == null || r == null ? null : TableSchema.concat(l, r);
    }

    /** Equal-key groups that overflowed memory since construction. */
    public int spilledGroups() { return spilledGroups; }
}
