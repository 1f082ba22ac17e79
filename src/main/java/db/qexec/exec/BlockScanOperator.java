package db.qexec.exec;

import java.util.Iterator;
import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.storage.Block;
import db.qexec.storage.BlockSource;

/**
 * Physical operator that scans a Block Source block by block, optionally in key order
 * when the source supports it. One block is resident at a time.
 */
public class BlockScanOperator implements Operator {
    private final BlockSource source;
    private final List<String> orderColumns; // null for a plain scan

    // State
    private Iterator<Block> blocks;
    private Iterator<Row> currentRows;
    private boolean opened;

    public BlockScanOperator(BlockSource source) {
        this(source, null);
    }

    public BlockScanOperator(BlockSource source, List<String> orderColumns) {
        this.source = source;
        this.orderColumns = orderColumns;
        if (orderColumns != null && !source.supportsSortedScan(orderColumns)) {
            throw new IllegalArgumentException(source.schema().name() + " cannot be scanned in order of " + orderColumns);
        }
    }

    /** Scan delivering rows ordered by the given columns. */
    public static BlockScanOperator sorted(BlockSource source, List<String> orderColumns) {
        return new BlockScanOperator(source, orderColumns);
    }

    @Override
    public void open() {
        blocks = orderColumns == null ? source.scan() : source.scanSorted(orderColumns);
        currentRows = null;
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened) return null;
        while (currentRows == null || !currentRows.hasNext()) {
            if (!blocks.hasNext()) return null; // done
            currentRows = blocks.next().iterator();
        }
        return currentRows.next();
    }

    @Override
    public Block nextBlock(int capacity) {
        if (capacity != source.blockCapacity() || (currentRows != null && currentRows.hasNext())) {
            return Operator.super.nextBlock(capacity);
        }
        if (!opened || !blocks.hasNext()) return null;
        return blocks.next();
    }

    @Override
    public void close() {
        opened = false;
        blocks = null;
        currentRows = null;
    }

    @Override
    public List<ColumnSchema> schema() { return source.schema().columns(); }

    /** True when rows come out ordered by the given leading columns. */
    public boolean isOrderedBy(List<String> columns) {
        return orderColumns != null && orderColumns.size() >= columns.size()
                && orderColumns.subList(0, columns.size()).equals(columns);
    }
}
