package db.qexec.exec.join;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.TableSchema;
import db.qexec.exec.ExecContext;
import db.qexec.exec.KeyExtractor;
import db.qexec.exec.Operator;
import db.qexec.exec.Row;
import db.qexec.exec.RowIterator;
import db.qexec.storage.Partition;
import db.qexec.storage.PartitionStore;

/**
 * External hash equi-join (GRACE style, recursive).
 * <p>
 * If the left input fits in {@code memoryBlocks - 2} blocks it is built into an in-memory table and the
 * right input is streamed against it. Otherwise the rows read so far are handed to the left partitions
 * and both inputs are hashed into {@code memoryBlocks - 1}
 * partitions each and every pair of corresponding partitions is joined independently: in memory when
 * the smaller side fits in {@code memoryBlocks - 2} blocks, else by partitioning it again with a hash
 * seeded by the recursion depth. A pair whose rows all share a single key, or which reaches
 * {@code maxHashDepth}, cannot be split further and is joined by a nested loop over the two partitions.
 * <p>
 * Pending pairs live on an explicit work stack. Output columns are always left then right, whichever
 * side was used to build. Rows with a null key component never match. Every partition is deleted once
 * its pair is done, and all of them on close or error.
 */
public class HashJoinOperator implements Operator {
    private static final Logger logger = LoggerFactory.getLogger(HashJoinOperator.class);

    private final Operator left;
    private final Operator right;
    private final List<String> leftColumns;
    private final List<String> rightColumns;
    private final int memoryBlocks;
    private final int blockCapacity;
    private final int maxHashDepth;
    private final PartitionStore store;

    private List<ColumnSchema> leftSchema;
    private List<ColumnSchema> rightSchema;
    private List<ColumnSchema> joinedSchema;
    private KeyExtractor leftKey;
    private KeyExtractor rightKey;

    private final Deque<BucketPair> work = new ArrayDeque<>();
    private final List<Partition> owned = new ArrayList<>();
    private RowIterator current;

    // Statistics, reset on open()
    private boolean spilled;
    private int maxDepthReached = -1;
    private int degeneratePairs;
    private int pairsJoined;

    public HashJoinOperator(Operator left, Operator right, String leftColumn, String rightColumn,
                            int memoryBlocks, ExecContext ctx) {
        this(left, right, List.of(leftColumn), List.of(rightColumn), memoryBlocks, ctx);
    }

    public HashJoinOperator(Operator left, Operator right, List<String> leftColumns, List<String> rightColumns,
                            int memoryBlocks, ExecContext ctx) {
        ExecContext.requireBlocks("Hash join", memoryBlocks, 3);
        if (leftColumns.size() != rightColumns.size() || leftColumns.isEmpty()) {
            throw new IllegalArgumentException("Join needs the same non-zero number of key columns on both sides");
        }
        this.left = left;
        this.right = right;
        this.leftColumns = leftColumns;
        this.rightColumns = rightColumns;
        this.memoryBlocks = memoryBlocks;
        this.blockCapacity = ctx.blockCapacity();
        this.maxHashDepth = ctx.config().maxHashDepth();
        this.store = ctx.partitions();
    }

    /** One side of a bucket pair, with whether every row in it carries the same key. */
    private record BucketSide(Partition partition, boolean singleKey) {}

    private record BucketPair(BucketSide left, BucketSide right, int depth) {}

    @Override
    public void open() {
        spilled = false;
        maxDepthReached = -1;
        degeneratePairs = 0;
        pairsJoined = 0;
        left.open();
        right.open();
        leftSchema = left.schema();
        rightSchema = right.schema();
        if (leftSchema == null || rightSchema == null) {
            throw new IllegalStateException("HashJoinOperator requires both children to provide schema");
        }
        joinedSchema = TableSchema.concat(leftSchema, rightSchema);
        leftKey = KeyExtractor.forColumnNames(leftSchema, leftColumns);
        rightKey = KeyExtractor.forColumnNames(rightSchema, rightColumns);
        KeyExtractor.requireComparable(leftSchema, leftKey, rightSchema, rightKey);
        try {
            start();
        } catch (RuntimeException e) {
            release();
            throw e;
        }
    }

    private void start() {
        int buildLimit = (memoryBlocks - 2) * blockCapacity;
        List<Row> buffered = new ArrayList<>();
        Row overflow = null;
        Row r;
        while ((r = left.next()) != null) {
            if (leftKey.hasNull(r)) continue;
            if (buffered.size() == buildLimit) {
                overflow = r;
                break;
            }
            buffered.add(r);
        }
        if (overflow == null) {
            logger.debug("Hash join: left input ({} rows) fits in memory", buffered.size());
            current = new HashProbe(buffered, true, RowIterator.drain(right));
            return;
        }

        spilled = true;
        BucketWriter leftWriter = new BucketWriter(leftKey, leftSchema, 0, "hj-left");
        for (Row b : buffered) leftWriter.add(b);
        buffered.clear();
        leftWriter.add(overflow);
        while ((r = left.next()) != null) leftWriter.add(r);
        List<BucketSide> leftBuckets = leftWriter.sides();
        List<BucketSide> rightBuckets = partition(RowIterator.drain(right), rightKey, rightSchema, 0, "hj-right");
        pushPairs(leftBuckets, rightBuckets, 0);
        logger.debug("Hash join: partitioned both inputs into {} bucket pairs", leftBuckets.size());
    }

    /** Hash the rows into memoryBlocks - 1 new partitions using the hash for {@code depth}. */
    private List<BucketSide> partition(RowIterator rows, KeyExtractor key, List<ColumnSchema> schema,
                                       int depth, String name) {
        BucketWriter writer = new BucketWriter(key, schema, depth, name);
        try {
            while (rows.hasNext()) writer.add(rows.next());
        } finally {
            rows.close();
        }
        return writer.sides();
    }

    /** Routes rows into memoryBlocks - 1 partitions by the key hash seeded with the depth. */
    private final class BucketWriter {
        private final KeyExtractor key;
        private final int depth;
        private final int fanOut = memoryBlocks - 1;
        private final List<Partition> parts = new ArrayList<>(fanOut);
        private final JoinKey[] firstKey = new JoinKey[fanOut];
        private final boolean[] mixed = new boolean[fanOut];

        BucketWriter(KeyExtractor key, List<ColumnSchema> schema, int depth, String name) {
            this.key = key;
            this.depth = depth;
            maxDepthReached = Math.max(maxDepthReached, depth);
            for (int i = 0; i < fanOut; i++) {
                Partition p = store.createPartition(name + "-d" + depth + "-b" + i, schema);
                owned.add(p);
                parts.add(p);
            }
        }

        void add(Row r) {
            if (key.hasNull(r)) return;
            int b = key.hash(r, depth) % fanOut;
            parts.get(b).append(r);
            if (!mixed[b]) {
                JoinKey k = JoinKey.of(key, r);
                if (firstKey[b] == null) firstKey[b] = k;
                else if (!firstKey[b].equals(k)) mixed[b] = true;
            }
        }

        List<BucketSide> sides() {
            List<BucketSide> sides = new ArrayList<>(fanOut);
            for (int i = 0; i < fanOut; i++) sides.add(new BucketSide(parts.get(i), !mixed[i]));
            return sides;
        }
    }

    private void pushPairs(List<BucketSide> leftBuckets, List<BucketSide> rightBuckets, int depth) {
        // Pushed in reverse so bucket 0 is joined first.
        for (int i = leftBuckets.size() - 1; i >= 0; i--) {
            BucketSide l = leftBuckets.get(i);
            BucketSide r = rightBuckets.get(i);
            if (l.partition().rowCount() == 0 || r.partition().rowCount() == 0) {
                discard(l.partition());
                discard(r.partition());
            } else {
                work.push(new BucketPair(l, r, depth));
            }
        }
    }

    @Override
    public Row next() {
        try {
            while (true) {
                if (current != null) {
                    if (current.hasNext()) return current.next();
                    current.close();
                    current = null;
                }
                if (work.isEmpty()) return null;
                current = joinPair(work.pop());
            }
        } catch (RuntimeException e) {
            release();
            throw e;
        }
    }

    /** Join one bucket pair, or split it and return null so the sub-pairs are taken from the stack. */
    private RowIterator joinPair(BucketPair pair) {
        Partition l = pair.left().partition();
        Partition r = pair.right().partition();
        long buildBlocks = Math.min(l.blockCount(), r.blockCount());
        if (buildBlocks <= memoryBlocks - 2) {
            pairsJoined++;
            boolean buildLeft = l.blockCount() <= r.blockCount();
            Partition build = buildLeft ? l : r;
            Partition probe = buildLeft ? r : l;
            List<Row> buildRows = new ArrayList<>((int) build.rowCount());
            try (RowIterator it = build.readAll()) {
                while (it.hasNext()) buildRows.add(it.next());
            }
            discard(build);
            return new HashProbe(buildRows, buildLeft, new DeletingReader(probe));
        }

        if ((pair.left().singleKey() && pair.right().singleKey()) || pair.depth() + 1 >= maxHashDepth) {
            degeneratePairs++;
            pairsJoined++;
            logger.debug("Hash join: bucket pair at depth {} ({} x {} blocks) cannot be split further, using nested loop",
                    pair.depth(), l.blockCount(), r.blockCount());
            owned.remove(l);
            owned.remove(r);
            return new PartitionNestedLoop(l, r, (memoryBlocks - 2) * blockCapacity,
                    (o, i) -> leftKey.compare(o, rightKey, i) == 0, joinedSchema);
        }

        int depth = pair.depth() + 1;
        logger.debug("Hash join: repartitioning bucket pair ({} x {} blocks) at depth {}",
                l.blockCount(), r.blockCount(), depth);
        List<BucketSide> leftBuckets = partition(l.readAll(), leftKey, leftSchema, depth, "hj-left");
        discard(l);
        List<BucketSide> rightBuckets = partition(r.readAll(), rightKey, rightSchema, depth, "hj-right");
        discard(r);
        pushPairs(leftBuckets, rightBuckets, depth);
        return null;
    }

    private void discard(Partition p) {
        p.delete();
        owned.remove(p);
    }

    private void release() {
        if (current != null) current.close();
        current = null;
        work.clear();
        for (Partition p : owned) p.delete();
        owned.clear();
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

    /** True if the last open() had to partition its inputs. */
    public boolean spilled() { return spilled; }

    /** Deepest partitioning level used since open(); -1 when the join ran in memory, 0 for one level. */
    public int maxDepthReached() { return maxDepthReached; }

    /** Bucket pairs joined by the nested-loop fallback. */
    public int degeneratePairs() { return degeneratePairs; }

    /** Bucket pairs joined after partitioning, by either method. */
    public int pairsJoined() { return pairsJoined; }

    /** Reads a partition once and deletes it when drained or closed. */
    private final class DeletingReader implements RowIterator {
        private final Partition partition;
        private final RowIterator reader;

        DeletingReader(Partition partition) {
            this.partition = partition;
            this.reader = partition.readAll();
        }

        @Override public boolean hasNext() {
            if (reader.hasNext()) return true;
            close();
            return false;
        }
        @Override public Row next() { return reader.next(); }
        @Override public void close() { discard(partition); }
    }

    /**
     * Probes an in-memory table built from one side with the rows of the other side.
     * Closing it closes the probe input.
     */
    private final class HashProbe implements RowIterator {
        private final Map<JoinKey, List<Row>> table = new HashMap<>();
        private final boolean buildIsLeft;
        private final KeyExtractor probeKey;
        private final RowIterator probe;
        private Row probeRow;
        private List<Row> matches = Collections.emptyList();
        private int pos;

        HashProbe(List<Row> buildRows, boolean buildIsLeft, RowIterator probe) {
            this.buildIsLeft = buildIsLeft;
            this.probe = probe;
            KeyExtractor buildKey = buildIsLeft ? leftKey : rightKey;
            this.probeKey = buildIsLeft ? rightKey : leftKey;
            for (Row r : buildRows) {
                if (buildKey.hasNull(r)) continue;
                table.computeIfAbsent(JoinKey.of(buildKey, r), k -> new ArrayList<>()).add(r);
            }
        }

        @Override
        public boolean hasNext() {
            while (pos >= matches.size()) {
                if (!probe.hasNext()) return false;
                probeRow = probe.next();
                pos = 0;
                matches = probeKey.hasNull(probeRow)
                        ? Collections.emptyList()
                        : table.getOrDefault(JoinKey.of(probeKey, probeRow), Collections.emptyList());
            }
            return true;
        }

        @Override
        public Row next() {
            if (!hasNext()) throw new NoSuchElementException();
            Row b = matches.get(pos++);
            return buildIsLeft ? b.concat(probeRow, joinedSchema) : probeRow.concat(b, joinedSchema);
        }

        @Override
        public void close() {
            table.clear();
            probe.close();
        }
    }
}
