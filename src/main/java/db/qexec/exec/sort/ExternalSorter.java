package db.qexec.exec.sort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.qexec.catalog.ColumnSchema;
import db.qexec.exec.ExecContext;
import db.qexec.exec.Row;
import db.qexec.exec.RowIterator;
import db.qexec.storage.Partition;
import db.qexec.storage.PartitionReader;
import db.qexec.storage.PartitionStore;

/**
 * External merge sort under a budget of {@code memoryBlocks} blocks.
 * <p>
 * Pass 0 fills memory with up to {@code memoryBlocks} blocks of rows, sorts them and spills each
 * full buffer as a sorted run. If the input never overflows memory nothing touches disk.
 * Merge passes combine {@code memoryBlocks - 1} runs at a time (one block per input run plus one
 * output block) until at most {@code finalFanIn} runs remain; merging those is the final pass,
 * streamed straight to the caller. With {@code finalFanIn == 1} the rows always end up in a single
 * run on disk, even when they fit in memory, and the caller reads it back using one block.
 * Ties keep insertion order.
 * <p>
 * All rows must be added before {@link #finish()} or {@link #sorted()} is called. Runs are deleted
 * as soon as they are merged, and on {@link #close()}.
 */
public class ExternalSorter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ExternalSorter.class);

    private final Comparator<Row> comparator;
    private final List<ColumnSchema> schema;
    private final PartitionStore store;
    private final int memoryBlocks;
    private final int bufferRows;
    private final int finalFanIn;
    private final String name;

    private List<Row> buffer = new ArrayList<>();
    private List<Partition> runs = new ArrayList<>();
    private int initialRuns;
    private int mergePasses;
    private long rowCount;
    private boolean finished;
    private boolean opened;
    private RowIterator output;

    public ExternalSorter(Comparator<Row> comparator, List<ColumnSchema> schema, PartitionStore store,
                          int memoryBlocks, String name) {
        this(comparator, schema, store, memoryBlocks, memoryBlocks - 1, name);
    }

    public ExternalSorter(Comparator<Row> comparator, List<ColumnSchema> schema, PartitionStore store,
                          int memoryBlocks, int finalFanIn, String name) {
        ExecContext.requireBlocks("External sort", memoryBlocks, 3);
        if (finalFanIn < 1 || finalFanIn > memoryBlocks - 1) {
            throw new IllegalArgumentException("finalFanIn must be in [1, " + (memoryBlocks - 1) + "], got " + finalFanIn);
        }
        this.finalFanIn = finalFanIn;
        this.comparator = comparator;
        this.schema = schema;
        this.store = store;
        this.memoryBlocks = memoryBlocks;
        this.bufferRows = memoryBlocks * store.blockCapacity();
        this.name = name;
    }

    public void add(Row row) {
        if (finished) throw new IllegalStateException("Sorter already finished: " + name);
        if (buffer.size() >= bufferRows) spillRun();
        buffer.add(row);
        rowCount++;
    }

    private void spillRun() {
        buffer.sort(comparator); // stable
        Partition run = store.createPartition(name + "-run0-" + runs.size(), schema);
        runs.add(run);
        for (Row r : buffer) run.append(r);
        run.flush();
        buffer = new ArrayList<>();
        initialRuns++;
    }

    /**
     * Finish input: spill what is still buffered when needed and merge down to at most
     * {@code finalFanIn} runs. Afterwards the sorter holds no rows in memory unless nothing was
     * spilled and {@code finalFanIn > 1}. Idempotent.
     */
    public void finish() {
        if (finished) return;
        finished = true;
        try {
            if (runs.isEmpty() && (finalFanIn > 1 || buffer.isEmpty())) {
                buffer.sort(comparator); // stays in memory
                return;
            }
            if (!buffer.isEmpty()) spillRun();
            int fanIn = memoryBlocks - 1;
            int level = 1;
            while (runs.size() > finalFanIn) {
                logger.debug("{}: merge pass {} over {} runs", name, level, runs.size());
                List<Partition> next = new ArrayList<>();
                for (int i = 0; i < runs.size(); i += fanIn) {
                    List<Partition> group = runs.subList(i, Math.min(runs.size(), i + fanIn));
                    Partition merged = store.createPartition(name + "-run" + level + "-" + next.size(), schema);
                    next.add(merged);
                    try (MergeIterator it = new MergeIterator(group, comparator)) {
                        while (it.hasNext()) merged.append(it.next());
                    }
                    merged.flush();
                }
                for (Partition old : runs) old.delete();
                runs = next;
                mergePasses++;
                level++;
            }
        } catch (RuntimeException e) {
            deleteRuns();
            throw e;
        }
    }

    /**
     * Finish input if not done yet and stream all rows in order. Closing the returned iterator
     * early releases every remaining run.
     */
    public RowIterator sorted() {
        if (opened) throw new IllegalStateException("Sorter output already opened: " + name);
        finish();
        opened = true;
        if (runs.isEmpty()) {
            List<Row> rows = buffer;
            buffer = new ArrayList<>();
            output = RowIterator.of(rows.iterator());
            return output;
        }
        logger.debug("{}: final merge of {} runs ({} rows)", name, runs.size(), rowCount);
        if (runs.size() > 1) mergePasses++;
        try {
            output = new MergeIterator(runs, comparator) {
                @Override
                public boolean hasNext() {
                    if (super.hasNext()) return true;
                    close(); // drained: release runs right away
                    return false;
                }

                @Override
                public void close() {
                    super.close();
                    deleteRuns();
                }
            };
            return output;
        } catch (RuntimeException e) {
            deleteRuns();
            throw e;
        }
    }

    /** Runs produced by pass 0 (0 when everything stayed in memory). */
    public int initialRuns() { return initialRuns; }

    /** Merge passes performed, counting the streamed final merge: ceil(log_{memoryBlocks-1}(initialRuns)). */
    public int mergePasses() { return mergePasses; }

    public long rowCount() { return rowCount; }

    private void deleteRuns() {
        for (Partition p : runs) p.delete();
        runs = new ArrayList<>();
    }

    @Override
    public void close() {
        if (output != null) output.close();
        buffer = new ArrayList<>();
        deleteRuns();
    }

    /**
     * k-way merge over sorted runs, one reader (block) per run. Equal rows come out in run order,
     * which keeps the sort stable.
     */
    private static class MergeIterator implements RowIterator {
        private final List<PartitionReader> readers = new ArrayList<>();
        private final PriorityQueue<Head> heap;

        private record Head(Row row, int run) {}

        MergeIterator(List<Partition> runs, Comparator<Row> comparator) {
            heap = new PriorityQueue<>(Math.max(1, runs.size()), (a, b) -> {
                int c = comparator.compare(a.row, b.row);
                return c != 0 ? c : Integer.compare(a.run, b.run);
            });
            try {
                for (int i = 0; i < runs.size(); i++) {
                    PartitionReader reader = runs.get(i).readAll();
                    readers.add(reader);
                    if (reader.hasNext()) heap.add(new Head(reader.next(), i));
                }
            } catch (RuntimeException e) {
                close();
                throw e;
            }
        }

        @Override
        public boolean hasNext() { return !heap.isEmpty(); }

        @Override
        public Row next() {
            Head head = heap.poll();
            if (head == null) throw new NoSuchElementException();
            PartitionReader reader = readers.get(head.run);
            if (reader.hasNext()) heap.add(new Head(reader.next(), head.run));
            return head.row;
        }

        @Override
        public void close() {
            heap.clear();
            for (PartitionReader r : readers) r.close();
        }
    }
}
