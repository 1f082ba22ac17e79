package db.qexec.exec;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.qexec.catalog.ColumnSchema;

/**
 * Selection: passes on the child's rows that satisfy a predicate. Needs no memory beyond the
 * child's, so it takes no block budget. Counts rows seen and passed since open().
 */
public class FilterOperator implements Operator {
    private static final Logger logger = LoggerFactory.getLogger(FilterOperator.class);

    private final Operator child;
    private final Predicate predicate;
    private long rowsIn;
    private long rowsOut;
    private boolean open;

    public FilterOperator(Operator child, Predicate predicate) {
        if (predicate == null) throw new IllegalArgumentException("FilterOperator needs a predicate");
        this.child = child;
        this.predicate = predicate;
    }

    @Override
    public void open() {
        rowsIn = 0;
        rowsOut = 0;
        child.open();
        open = true;
    }

    @Override
    public Row next() {
        for (Row r = child.next(); r != null; r = child.next()) {
            rowsIn++;
            if (predicate.test(r)) {
                rowsOut++;
                return r;
            }
        }
        return null;
    }

    @Override
    public void close() {
        if (open) {
            logger.debug("Filter {} passed {} of {} row(s)", predicate, rowsOut, rowsIn);
            open = false;
        }
        child.close();
    }

    @Override
    public List<ColumnSchema> schema() { return child.schema(); }

    public long rowsIn() { return rowsIn; }

    public long rowsOut() { return rowsOut; }
}
