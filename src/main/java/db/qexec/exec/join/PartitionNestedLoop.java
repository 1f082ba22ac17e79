package db.qexec.exec.join;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import db.qexec.catalog.ColumnSchema;
import db.qexec.exec.JoinPredicate;
import db.qexec.exec.Row;
import db.qexec.exec.RowIterator;
import db.qexec.storage.Partition;
import db.qexec.storage.PartitionReader;

/**
 * Nested loop over two spilled partitions: loads up to {@code chunkRows} left rows at a time and
 * rescans the right partition once per chunk. A null predicate yields the cross product.
 * Output rows are left columns followed by right columns. Both partitions are deleted when the
 * iterator is exhausted or closed.
 */
final class PartitionNestedLoop implements RowIterator {
    private final Partition leftPart;
    private final Partition rightPart;
    private final int chunkRows;
    private final JoinPredicate predicate;
    private final List<ColumnSchema> joinedSchema;
    private final PartitionReader leftReader;
    private final List<Row> chunk = new ArrayList<>();
    private PartitionReader rightReader;
    private Row rightRow;
    private int pos;
    private Row pending;
    private boolean closed;

    PartitionNestedLoop(Partition leftPart, Partition rightPart, int chunkRows, JoinPredicate predicate,
                        List<ColumnSchema> joinedSchema) {
        this.leftPart = leftPart;
        this.rightPart = rightPart;
        this.chunkRows = chunkRows;
        this.predicate = predicate;
        this.joinedSchema = joinedSchema;
        this.leftReader = leftPart.readAll();
    }

    @Override
    public boolean hasNext() {
        while (pending == null && !closed) {
            if (rightRow != null && pos < chunk.size()) {
                Row l = chunk.get(pos++);
                if (predicate == null || predicate.test(l, rightRow)) pending = l.concat(rightRow, joinedSchema);
            } else if (rightReader != null && rightReader.hasNext()) {
                rightRow = rightReader.next();
                pos = 0;
            } else if (loadChunk()) {
                if (rightReader != null) rightReader.close();
                rightReader = rightPart.readAll();
                rightRow = null;
            } else {
                close();
            }
        }
        return pending != null;
    }

    private boolean loadChunk() {
        chunk.clear();
        while (chunk.size() < chunkRows && leftReader.hasNext()) chunk.add(leftReader.next());
        return !chunk.isEmpty();
    }

    @Override
    public Row next() {
        if (!hasNext()) throw new NoSuchElementException();
        Row r = pending;
        pending = null;
        return r;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        chunk.clear();
        leftPart.delete();
        rightPart.delete();
    }
}
