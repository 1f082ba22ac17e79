package db.qexec.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import db.qexec.exec.Row;

/**
 * Bounded, ordered sequence of rows: the unit of I/O and of memory accounting.
 */
public final class Block implements Iterable<Row> {
    private final List<Row> rows;
    private final int capacity;

    public Block(List<Row> rows, int capacity) {
        if (rows.size() > capacity) {
            throw new IllegalArgumentException("Block holds at most " + capacity + " rows, got " + rows.size());
        }
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.capacity = capacity;
    }

    public List<Row> rows() { return rows; }
    public int size() { return rows.size(); }
    public int capacity() { return capacity; }
    public boolean isEmpty() { return rows.isEmpty(); }

    @Override
    public Iterator<Row> iterator() { return rows.iterator(); }

    /** Number of blocks needed to hold rowCount rows. */
    public static long blocksFor(long rowCount, int capacity) {
        return (rowCount + capacity - 1) / capacity;
    }

    /** Chop rows into consecutive full blocks (the last one possibly partial). */
    public static List<Block> chunk(List<Row> rows, int capacity) {
        List<Block> out = new ArrayList<>();
        for (int i = 0; i < rows.size(); i += capacity) {
            out.add(new Block(rows.subList(i, Math.min(rows.size(), i + capacity)), capacity));
        }
        return out;
    }
}
