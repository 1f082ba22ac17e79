package db.qexec.exec;

import java.util.ArrayList;
import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.storage.Record;

/**
 * Row is an execution pipeline unit (values + optional schema metadata).
 * Record is the value carrier and spill serialization; Row wraps Record with schema (optionally).
 * Rows are immutable once produced; equality is by values only.
 */
public class Row {
    private final Record record;
    private final List<ColumnSchema> schema; // can be null

    public static Row of(Record record) { return new Row(record, null); }
    public static Row of(Record record, List<ColumnSchema> schema) { return new Row(record, schema); }
    public static Row of(List<Object> values, List<ColumnSchema> schema) { return new Row(new Record(values), schema); }

    public Row(Record record, List<ColumnSchema> schema) {
        this.record = record;
        this.schema = schema;
    }

    public Record record() { return record; }
    public List<Object> values() { return record.getValues(); }
    public Object get(int index) { return record.getValues().get(index); }
    public int size() { return record.size(); }
    public List<ColumnSchema> schema() { return schema; }

    /** Left values followed by right values. */
    public Row concat(Row right, List<ColumnSchema> joinedSchema) {
        List<Object> combined = new ArrayList<>(size() + right.size());
        combined.addAll(values());
        combined.addAll(right.values());
        return Row.of(combined, joinedSchema);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row r)) return false;
        return record.equals(r.record);
    }

    @Override
    public int hashCode() { return record.hashCode(); }

    @Override
    public String toString() {
        return "Row" + values() + (schema != null ? " schemaCols=" + schema.size() : "");
    }
}
