package db.qexec.cli;

import java.io.PrintStream;
import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.exec.Row;

/**
 * Simple ASCII table printer for result rows.
 * Numbers are right-aligned, nulls print as NULL.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(List<Row> rows) {
        List<ColumnSchema> schema = rows == null || rows.isEmpty() ? null : rows.get(0).schema();
        print(System.out, schema, rows);
    }

    public static void print(PrintStream out, List<ColumnSchema> schema, List<Row> rows) {
        int rowCount = rows == null ? 0 : rows.size();
        if (schema == null && rowCount == 0) {
            out.println("(0 row(s))");
            return;
        }
        int colCount = schema != null ? schema.size() : rows.get(0).size();
        String[] headers = new String[colCount];
        for (int i = 0; i < colCount; i++) {
            headers[i] = schema != null ? schema.get(i).name() : ("col" + (i + 1));
        }
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers[i].length();
        for (int r = 0; r < rowCount; r++) {
            Row row = rows.get(r);
            for (int i = 0; i < colCount; i++) widths[i] = Math.max(widths[i], format(row.get(i)).length());
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildLine(headers, widths, null));
        out.println(divLine);
        for (int r = 0; r < rowCount; r++) {
            Row row = rows.get(r);
            String[] cells = new String[colCount];
            boolean[] numeric = new boolean[colCount];
            for (int i = 0; i < colCount; i++) {
                cells[i] = format(row.get(i));
                numeric[i] = row.get(i) instanceof Number;
            }
            out.println(buildLine(cells, widths, numeric));
        }
        out.println(divLine);
        out.println("(" + rowCount + " row(s))");
    }

    static String format(Object value) {
        return value == null ? "NULL" : String.valueOf(value);
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            divider.append("-".repeat(w + 2));
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(String[] cells, int[] widths, boolean[] rightAlign) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            boolean right = rightAlign != null && rightAlign[i];
            sb.append(' ').append(pad(cells[i], widths[i], right)).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width, boolean right) {
        if (s.length() >= width) return s;
        String fill = " ".repeat(width - s.length());
        return right ? fill + s : s + fill;
    }
}
