package db.qexec.storage;

import java.util.Iterator;
import java.util.List;

import db.qexec.catalog.TableSchema;
import db.qexec.exec.Row;

/**
 * A relation seen as an ordered sequence of fixed-capacity blocks.
 * Sorted and indexed access are optional capabilities.
 */
public interface BlockSource {
    TableSchema schema();

    int blockCapacity();

    Iterator<Block> scan();

    default boolean supportsSortedScan(List<String> columns) { return false; }

    /** Blocks in ascending order of the given columns. */
    default Iterator<Block> scanSorted(List<String> columns) {
        throw new UnsupportedOperationException(schema().name() + " has no order on " + columns);
    }

    default boolean supportsIndexLookup(String column) { return false; }

    default Iterator<Row> indexLookup(String column, Object value) {
        throw new UnsupportedOperationException(schema().name() + " has no index on " + column);
    }
}
