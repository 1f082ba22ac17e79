package db.qexec.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import db.qexec.catalog.TableSchema;
import db.qexec.exec.Row;
import db.qexec.exec.Values;

/**
 * Relation held in memory and served block by block. Every block handed out is counted as one read.
 * Supports sorted scans on any column list and equality lookups on any column.
 */
public class MemoryBlockSource implements BlockSource {
    private final TableSchema schema;
    private final List<Row> rows;
    private final int blockCapacity;
    private final IoStats stats;
    private final Map<String, Map<Object, List<Row>>> indexes = new HashMap<>();

    public MemoryBlockSource(TableSchema schema, List<Row> rows, int blockCapacity, IoStats stats) {
        if (blockCapacity <= 0) throw new IllegalArgumentException("blockCapacity must be positive");
        this.schema = schema;
        this.blockCapacity = blockCapacity;
        this.stats = stats;
        List<Row> withSchema = new ArrayList<>(rows.size());
        for (Row r : rows) {
            if (r.size() != schema.columns().size()) {
                throw new IllegalArgumentException("Arity mismatch: expected " + schema.columns().size() + " values, got " + r.size());
            }
            withSchema.add(Row.of(r.record(), schema.columns()));
        }
        this.rows = Collections.unmodifiableList(withSchema);
    }

    public MemoryBlockSource(TableSchema schema, List<Row> rows, int blockCapacity) {
        this(schema, rows, blockCapacity, new IoStats());
    }

    public static MemoryBlockSource ofValues(TableSchema schema, List<List<Object>> values, int blockCapacity, IoStats stats) {
        List<Row> rows = new ArrayList<>(values.size());
        for (List<Object> v : values) rows.add(Row.of(v, schema.columns()));
        return new MemoryBlockSource(schema, rows, blockCapacity, stats);
    }

    @Override
    public TableSchema schema() { return schema; }

    @Override
    public int blockCapacity() { return blockCapacity; }

    public List<Row> rows() { return rows; }

    public IoStats stats() { return stats; }

    public long blockCount() { return Block.blocksFor(rows.size(), blockCapacity); }

    @Override
    public Iterator<Block> scan() { return countingIterator(Block.chunk(rows, blockCapacity)); }

    @Override
    public boolean supportsSortedScan(List<String> columns) {
        for (String c : columns) schema.indexOf(c);
        return true;
    }

    @Override
    public Iterator<Block> scanSorted(List<String> columns) {
        int[] idx = new int[columns.size()];
        for (int i = 0; i < idx.length; i++) idx[i] = schema.indexOf(columns.get(i));
        Comparator<Row> cmp = (a, b) -> {
            for (int i : idx) {
                int c = Values.compare(a.get(i), b.get(i));
                if (c != 0) return c;
            }
            return 0;
        };
        List<Row> sorted = new ArrayList<>(rows);
        sorted.sort(cmp);
        return countingIterator(Block.chunk(sorted, blockCapacity));
    }

    @Override
    public boolean supportsIndexLookup(String column) {
        schema.indexOf(column);
        return true;
    }

    @Override
    public Iterator<Row> indexLookup(String column, Object value) {
        Map<Object, List<Row>> index = indexes.computeIfAbsent(column, this::buildIndex);
        if (value == null) return Collections.emptyIterator();
        return index.getOrDefault(Values.canonical(value), List.of()).iterator();
    }

    private Map<Object, List<Row>> buildIndex(String column) {
        int i = schema.indexOf(column);
        Map<Object, List<Row>> index = new HashMap<>();
        for (Row r : rows) {
            Object v = r.get(i);
            if (v != null) index.computeIfAbsent(Values.canonical(v), k -> new ArrayList<>()).add(r);
        }
        return index;
    }

    private Iterator<Block> countingIterator(List<Block> blocks) {
        Iterator<Block> it = blocks.iterator();
        return new Iterator<>() {
            @Override public boolean hasNext() { return it.hasNext(); }
            @Override public Block next() {
                Block b = it.next();
                stats.recordRead();
                return b;
            }
        };
    }
}
