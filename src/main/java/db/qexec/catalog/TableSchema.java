package db.qexec.catalog;

import java.util.ArrayList;
import java.util.List;

// Immutable data carrier for a relation schema.
public record TableSchema(String name, List<ColumnSchema> columns) {

    public int indexOf(String columnName) {
        return indexOf(columns, columnName);
    }

    public static int indexOf(List<ColumnSchema> columns, String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) return i;
        }
        throw new IllegalArgumentException("Column not found: " + columnName);
    }

    public static List<ColumnSchema> concat(List<ColumnSchema> left, List<ColumnSchema> right) {
        ArrayList<ColumnSchema> list = new ArrayList<>(left.size() + right.size());
        list.addAll(left); list.addAll(right); return List.copyOf(list);
    }
}
