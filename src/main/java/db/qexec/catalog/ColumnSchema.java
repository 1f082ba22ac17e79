package db.qexec.catalog;

// Immutable data carrier for a column.
// length: only matters for variable-length types like VARCHAR else may be 0.
public record ColumnSchema(String name, DataType type, int length) {
    public static ColumnSchema of(String name, DataType type) { return new ColumnSchema(name, type, 0); }
}
