package db.qexec.exec.aggr;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.DataType;
import db.qexec.catalog.TableSchema;
import db.qexec.exec.ExecContext;
import db.qexec.exec.Operator;
import db.qexec.exec.Predicate;
import db.qexec.exec.Row;
import db.qexec.exec.RowIterator;
import db.qexec.exec.sort.DistinctIterator;
import db.qexec.exec.sort.ExternalSorter;
import db.qexec.exec.sort.RowComparator;
import db.qexec.storage.Partition;
import db.qexec.storage.PartitionStore;

/**
 * GROUP BY / aggregate operator. Output rows are the group-by values followed by one value per
 * aggregate call; HAVING is evaluated on that output row. Group order is first-seen order.
 * <p>
 * When every call is incremental the input is streamed once into one set of accumulators per group.
 * Otherwise the input rows are also written to one temporary partition per group; at finalization each
 * group's partition is externally sorted once per DISTINCT argument column and read through an
 * adjacent-duplicate filter, so every non-incremental accumulator sees each distinct value exactly once.
 * Incremental accumulators are always updated during the initial pass.
 * <p>
 * Without GROUP BY columns the operator produces exactly one row, even for empty input.
 */
public class AggregateOperator implements Operator {
    private static final Logger logger = LoggerFactory.getLogger(AggregateOperator.class);

    private final Operator child;
    private final List<String> groupBy;
    private final List<AggregateCall> calls;
    private final Predicate having;
    private final int memoryBlocks;
    private final int blockCapacity;
    private final PartitionStore store;
    private final boolean needsSort;

    private List<ColumnSchema> inputSchema;
    private List<ColumnSchema> outputSchema;
    private int[] groupIndexes;
    private int[] argIndexes;
    private DataType[] argTypes;
    private int[] distinctColumns;

    private final Map<GroupKey, GroupState> groups = new LinkedHashMap<>();
    private Iterator<GroupState> pending;
    private ExternalSorter sorter;
    private int spilledGroups;

    public AggregateOperator(Operator child, List<String> groupBy, List<AggregateCall> calls,
                             Predicate having, int memoryBlocks, ExecContext ctx) {
        this.needsSort = calls.stream().anyMatch(c -> !c.isIncremental());
        ExecContext.requireBlocks("Aggregation", memoryBlocks, needsSort ? 3 : 1);
        if (groupBy.isEmpty() && calls.isEmpty()) {
            throw new IllegalArgumentException("Aggregation needs group-by columns or aggregate calls");
        }
        this.child = child;
        this.groupBy = List.copyOf(groupBy);
        this.calls = List.copyOf(calls);
        this.having = having;
        this.memoryBlocks = memoryBlocks;
        this.blockCapacity = ctx.blockCapacity();
        this.store = ctx.partitions();
    }

    public AggregateOperator(Operator child, List<String> groupBy, List<AggregateCall> calls,
                             int memoryBlocks, ExecContext ctx) {
        this(child, groupBy, calls, null, memoryBlocks, ctx);
    }

    private final class GroupState {
        final List<Object> keyValues;
        final Accumulator[] accumulators;
        Partition rows;

        GroupState(List<Object> keyValues) {
            this.keyValues = keyValues;
            this.accumulators = new Accumulator[calls.size()];
            for (int i = 0; i < calls.size(); i++) {
                accumulators[i] = calls.get(i).function().newAccumulator(argTypes[i]);
            }
        }
    }

    @Override
    public void open() {
        groups.clear();
        spilledGroups = 0;
        child.open();
        inputSchema = child.schema();
        if (inputSchema == null) {
            throw new IllegalStateException("AggregateOperator requires child to provide schema");
        }
        resolve();
        try {
            consume();
        } catch (RuntimeException e) {
            release();
            throw e;
        }
        pending = groups.values().iterator();
    }

    private void resolve() {
        groupIndexes = new int[groupBy.size()];
        List<ColumnSchema> out = new ArrayList<>();
        for (int i = 0; i < groupIndexes.length; i++) {
            groupIndexes[i] = TableSchema.indexOf(inputSchema, groupBy.get(i));
            out.add(inputSchema.get(groupIndexes[i]));
        }
        argIndexes = new int[calls.size()];
        argTypes = new DataType[calls.size()];
        List<Integer> distinct = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            AggregateCall call = calls.get(i);
            if (call.column() == null) {
                argIndexes[i] = -1;
            } else {
                argIndexes[i] = TableSchema.indexOf(inputSchema, call.column());
                argTypes[i] = inputSchema.get(argIndexes[i]).type();
                if (!call.isIncremental() && !distinct.contains(argIndexes[i])) distinct.add(argIndexes[i]);
            }
            out.add(ColumnSchema.of(call.name(), call.function().resultType(argTypes[i])));
        }
        distinctColumns = distinct.stream().mapToInt(Integer::intValue).toArray();
        outputSchema = out;
    }

    /** Single pass over the input: incremental updates, plus per-group spilling when needed. */
    private void consume() {
        int flushThreshold = (memoryBlocks - 1) * blockCapacity;
        int buffered = 0;
        Row r;
        while ((r = child.next()) != null) {
            GroupKey key = GroupKey.of(r, groupIndexes);
            GroupState g = groups.get(key);
            if (g == null) {
                List<Object> keyValues = new ArrayList<>(groupIndexes.length);
                for (int i : groupIndexes) keyValues.add(r.get(i));
                g = new GroupState(keyValues);
                groups.put(key, g);
            }
            for (int i = 0; i < calls.size(); i++) {
                if (calls.get(i).isIncremental()) g.accumulators[i].add(argIndexes[i] < 0 ? r : r.get(argIndexes[i]));
            }
            if (needsSort) {
                if (g.rows == null) g.rows = store.createPartition("aggr-group", inputSchema);
                int before = g.rows.bufferedRows();
                g.rows.append(r);
                buffered += g.rows.bufferedRows() - before;
                if (buffered > flushThreshold) {
                    for (GroupState s : groups.values()) if (s.rows != null) s.rows.flush();
                    buffered = 0;
                }
            }
        }
        child.close();
        if (groups.isEmpty() && groupIndexes.length == 0) groups.put(GroupKey.of(null, groupIndexes), new GroupState(List.of()));
        if (needsSort) {
            logger.debug("Aggregation spilled input into {} group partition(s); {} distinct column(s) to sort",
                    groups.size(), distinctColumns.length);
        } else {
            logger.debug("Aggregation finished incrementally with {} group(s)", groups.size());
        }
    }

    @Override
    public Row next() {
        try {
            while (pending != null && pending.hasNext()) {
                GroupState g = pending.next();
                pending.remove();
                Row out = finish(g);
                if (having == null || having.test(out)) return out;
            }
            return null;
        } catch (RuntimeException e) {
            release();
            throw e;
        }
    }

    private Row finish(GroupState g) {
        if (g.rows != null) {
            spilledGroups++;
            try {
                for (int column : distinctColumns) feedDistinct(g, column);
            } finally {
                g.rows.delete();
                g.rows = null;
            }
        }
        List<Object> values = new ArrayList<>(g.keyValues);
        for (Accumulator a : g.accumulators) values.add(a.result());
        return Row.of(values, outputSchema);
    }

    /** Sort the group's rows on one column and feed each distinct value to the calls over it. */
    private void feedDistinct(GroupState g, int column) {
        RowComparator byColumn = RowComparator.ascending(column);
        sorter = new ExternalSorter(byColumn, inputSchema, store, memoryBlocks, "aggr-distinct");
        try {
            try (RowIterator it = g.rows.readAll()) {
                while (it.hasNext()) sorter.add(it.next());
            }
            try (RowIterator distinct = new DistinctIterator(sorter.sorted(), byColumn)) {
                while (distinct.hasNext()) {
                    Object v = distinct.next().get(column);
                    for (int i = 0; i < calls.size(); i++) {
                        if (!calls.get(i).isIncremental() && argIndexes[i] == column) g.accumulators[i].add(v);
                    }
                }
            }
        } finally {
            sorter.close();
            sorter = null;
        }
    }

    private void release() {
        if (sorter != null) sorter.close();
        sorter = null;
        for (GroupState g : groups.values()) {
            if (g.rows != null) g.rows.delete();
            g.rows = null;
        }
        groups.clear();
        pending = null;
    }

    @Override
    public void close() {
        release();
        child.close();
    }

    @Override
    public List<ColumnSchema> schema() {
        return outputSchema;
    }

    /** Groups whose spilled rows were re-read for DISTINCT aggregates since open(). */
    public int spilledGroups() { return spilledGroups; }

    /** True when some call needs the sort-based path. */
    public boolean usesSortPath() { return needsSort; }
}
