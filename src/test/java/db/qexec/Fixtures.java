package db.qexec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.DataType;
import db.qexec.catalog.TableSchema;
import db.qexec.config.ExecConfig;
import db.qexec.exec.BlockScanOperator;
import db.qexec.exec.ExecContext;
import db.qexec.exec.Operator;
import db.qexec.exec.Row;
import db.qexec.query.QueryExecutor;
import db.qexec.storage.MemoryBlockSource;

/**
 * Shared builders for operator tests.
 */
public final class Fixtures {
    private Fixtures() {}

    public static ExecConfig config(Path tempDir, int blockCapacity, int memoryBlocks) {
        return new ExecConfig(blockCapacity, memoryBlocks, tempDir.toString(), ExecConfig.DEFAULT_MAX_HASH_DEPTH, true);
    }

    public static ExecContext context(Path tempDir, int blockCapacity, int memoryBlocks) {
        return new ExecContext(config(tempDir, blockCapacity, memoryBlocks));
    }

    public static TableSchema schema(String name, String... intColumns) {
        List<ColumnSchema> cols = new ArrayList<>();
        for (String c : intColumns) cols.add(ColumnSchema.of(c, DataType.INT));
        return new TableSchema(name, cols);
    }

    public static MemoryBlockSource source(ExecContext ctx, TableSchema schema, List<List<Object>> rows) {
        return MemoryBlockSource.ofValues(schema, rows, ctx.blockCapacity(), ctx.stats());
    }

    public static BlockScanOperator scan(ExecContext ctx, TableSchema schema, List<List<Object>> rows) {
        return new BlockScanOperator(source(ctx, schema, rows));
    }

    public static List<Row> collect(Operator op) {
        return new QueryExecutor().collect(op);
    }

    /** Row values as a multiset: value list to occurrence count. */
    public static Map<List<Object>, Integer> multiset(List<Row> rows) {
        Map<List<Object>, Integer> m = new HashMap<>();
        for (Row r : rows) m.merge(r.values(), 1, Integer::sum);
        return m;
    }

    /** {@code count} rows of (key, payload) with keys drawn from [0, keyRange). */
    public static List<List<Object>> randomRows(Random rnd, int count, int keyRange) {
        List<List<Object>> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) rows.add(List.of(rnd.nextInt(keyRange), i));
        return rows;
    }

    /** Reference equi-join on column 0 by brute force. */
    public static Map<List<Object>, Integer> expectedEquiJoin(List<List<Object>> left, List<List<Object>> right) {
        Map<List<Object>, Integer> m = new HashMap<>();
        for (List<Object> l : left) {
            for (List<Object> r : right) {
                if (l.get(0) != null && l.get(0).equals(r.get(0))) {
                    List<Object> joined = new ArrayList<>(l);
                    joined.addAll(r);
                    m.merge(joined, 1, Integer::sum);
                }
            }
        }
        return m;
    }
}
