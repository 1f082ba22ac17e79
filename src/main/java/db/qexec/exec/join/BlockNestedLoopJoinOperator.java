package db.qexec.exec.join;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.TableSchema;
import db.qexec.exec.ExecContext;
import db.qexec.exec.JoinPredicate;
import db.qexec.exec.Operator;
import db.qexec.exec.Row;
import db.qexec.storage.Block;

/**
 * Block nested-loop INNER JOIN with an arbitrary predicate.
 * <p>
 * Buffers {@code memoryBlocks - 2} blocks of the outer child (one block stays reserved for the inner
 * scan, one for output) and, for each such buffer, reopens the inner child for one full scan.
 * Inner blocks read: ceil(outerBlocks / (memoryBlocks - 2)) * innerBlocks.
 * Every satisfying pair is emitted, duplicates included. A null predicate yields the cross product.
 */
public class BlockNestedLoopJoinOperator implements Operator {
    private static final Logger logger = LoggerFactory.getLogger(BlockNestedLoopJoinOperator.class);

    private final Operator outer;
    private final Operator inner;
    private final JoinPredicate predicate;
    private final int memoryBlocks;
    private final int blockCapacity;
    private List<ColumnSchema> joinedSchema;

    // State
    private final List<Row> outerBuffer = new ArrayList<>();
    private boolean outerExhausted;
    private boolean innerOpen;
    private Row innerRow;
    private int outerPos;
    private int innerScans;

    public BlockNestedLoopJoinOperator(Operator outer, Operator inner, JoinPredicate predicate,
                                       int memoryBlocks, ExecContext ctx) {
        ExecContext.requireBlocks("Block nested-loop join", memoryBlocks, 3);
        this.outer = outer;
        this.inner = inner;
        this.predicate = predicate;
        this.memoryBlocks = memoryBlocks;
        this.blockCapacity = ctx.blockCapacity();
    }

    @Override
    public void open() {
        outer.open();
        joinedSchema = schema();
        outerExhausted = false;
        innerScans = 0;
        innerRow = null;
        outerPos = 0;
        if (fillOuterBuffer()) openInner();
    }

    /** Load the next batch of outer blocks; false when the outer child has no rows left. */
    private boolean fillOuterBuffer() {
        outerBuffer.clear();
        for (int b = 0; b < memoryBlocks - 2 && !outerExhausted; b++) {
            Block block = outer.nextBlock(blockCapacity);
            if (block == null) {
                outerExhausted = true;
            } else {
                outerBuffer.addAll(block.rows());
            }
        }
        return !outerBuffer.isEmpty();
    }

    private void openInner() {
        inner.open();
        innerOpen = true;
        innerScans++;
    }

    private void closeInner() {
        if (innerOpen) {
            inner.close();
            innerOpen = false;
        }
    }

    @Override
    public Row next() {
        while (true) {
            if (outerBuffer.isEmpty()) return null;

            // Pair the current inner row with the remaining buffered outer rows.
            if (innerRow != null) {
                while (outerPos < outerBuffer.size()) {
                    Row o = outerBuffer.get(outerPos++);
                    if (predicate == null || predicate.test(o, innerRow)) {
                        return o.concat(innerRow, joinedSchema);
                    }
                }
            }

            innerRow = inner.next();
            outerPos = 0;
            if (innerRow == null) { // inner scan done for this outer buffer
                closeInner();
                if (!fillOuterBuffer()) {
                    logger.debug("BNLJ finished after {} inner scan(s)", innerScans);
                    return null;
                }
                openInner();
            }
        }
    }

    @Override
    public void close() {
        closeInner();
        outer.close();
        outerBuffer.clear();
        innerRow = null;
    }

    @Override
    public List<ColumnSchema> schema() {
        if (joinedSchema != null) return joinedSchema;
        List<ColumnSchema> l = outer.schema();
        List<ColumnSchema> r = inner.schema();
        return l == null || r == null ? null : TableSchema.concat(l, r);
    }

    /** Full scans of the inner child started since the last open(). */
    public int innerScans() { return innerScans; }
}
