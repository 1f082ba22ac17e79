package db.qexec.storage;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import db.qexec.catalog.ColumnSchema;

/**
 * Immutable list of column values plus its binary form used by spill files.
 *
 * Layout: [null bitmap, ceil(n/8) bytes][non-null values in column order]
 *   INT      4 bytes
 *   BIGINT   8 bytes
 *   FLOAT    8 bytes (IEEE double)
 *   BOOLEAN  1 byte (1 or 0)
 *   VARCHAR  4 byte length prefix + UTF-8 bytes
 *   DATETIME 8 byte epoch second (UTC) + 4 byte nano
 */
public class Record {
    private final List<Object> values;

    private static final int INT_BYTES = 4;
    private static final int LONG_BYTES = 8;
    private static final int DOUBLE_BYTES = 8;
    private static final int BOOLEAN_BYTES = 1;
    private static final int VARCHAR_PREFIX_BYTES = 4;
    private static final int DATETIME_BYTES = 12;

    public Record(List<Object> values) {
        // copy tolerates nulls, unlike List.copyOf
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Object> getValues() {
        return values;
    }

    public int size() { return values.size(); }

    // Serialize record to byte[]
    public byte[] toBytes(List<ColumnSchema> columns) {
        if (values.size() != columns.size()) {
            throw new IllegalArgumentException("Arity mismatch: expected " + columns.size() + " values, got " + values.size());
        }
        ByteBuffer buffer = ByteBuffer.allocate(computeSerializedSize(columns));
        byte[] bitmap = new byte[bitmapBytes(columns.size())];
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) bitmap[i >> 3] |= (byte) (1 << (i & 7));
        }
        buffer.put(bitmap);

        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema col = columns.get(i);
            Object val = values.get(i);
            if (val == null) continue;
            try {
                switch (col.type()) {
                    case INT -> buffer.putInt(((Number) val).intValue());
                    case BIGINT -> buffer.putLong(((Number) val).longValue());
                    case FLOAT -> buffer.putDouble(((Number) val).doubleValue());
                    case BOOLEAN -> buffer.put((byte) ((Boolean) val ? 1 : 0));
                    case VARCHAR -> {
                        byte[] strBytes = ((String) val).getBytes(StandardCharsets.UTF_8);
                        buffer.putInt(strBytes.length);
                        buffer.put(strBytes);
                    }
                    case DATETIME -> {
                        LocalDateTime t = (LocalDateTime) val;
                        buffer.putLong(t.toEpochSecond(ZoneOffset.UTC));
                        buffer.putInt(t.getNano());
                    }
                }
            } catch (ClassCastException e) {
                throw new IllegalArgumentException("Type mismatch for column '" + col.name() + "' expected " + col.type()
                        + ", got " + val.getClass().getSimpleName(), e);
            }
        }

        return buffer.array();
    }

    private int computeSerializedSize(List<ColumnSchema> columns) {
        int size = bitmapBytes(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            Object val = values.get(i);
            if (val == null) continue;
            switch (columns.get(i).type()) {
                case INT -> size += INT_BYTES;
                case BIGINT -> size += LONG_BYTES;
                case FLOAT -> size += DOUBLE_BYTES;
                case BOOLEAN -> size += BOOLEAN_BYTES;
                case DATETIME -> size += DATETIME_BYTES;
                case VARCHAR -> size += VARCHAR_PREFIX_BYTES + String.valueOf(val).getBytes(StandardCharsets.UTF_8).length;
            }
        }
        return size;
    }

    private static int bitmapBytes(int columnCount) { return (columnCount + 7) / 8; }

    // Deserialize record from byte[]
    public static Record fromBytes(byte[] data, List<ColumnSchema> columns) {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        byte[] bitmap = new byte[bitmapBytes(columns.size())];
        buffer.get(bitmap);
        List<Object> values = new ArrayList<>(columns.size());

        for (int i = 0; i < columns.size(); i++) {
            if ((bitmap[i >> 3] & (1 << (i & 7))) != 0) {
                values.add(null);
                continue;
            }
            switch (columns.get(i).type()) {
                case INT -> values.add(buffer.getInt());
                case BIGINT -> values.add(buffer.getLong());
                case FLOAT -> values.add(buffer.getDouble());
                case BOOLEAN -> values.add(buffer.get() == 1);
                case VARCHAR -> {
                    int len = buffer.getInt();
                    byte[] strBytes = new byte[len];
                    buffer.get(strBytes);
                    values.add(new String(strBytes, StandardCharsets.UTF_8));
                }
                case DATETIME -> {
                    long seconds = buffer.getLong();
                    int nanos = buffer.getInt();
                    values.add(LocalDateTime.ofEpochSecond(seconds, nanos, ZoneOffset.UTC));
                }
            }
        }

        return new Record(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record r)) return false;
        return values.equals(r.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() {
        return values.toString();
    }
}
