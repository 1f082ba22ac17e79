package db.qexec.catalog;

/**
 * Supported primitive column data types
 */
public enum DataType {
    INT,
    BIGINT,
    FLOAT,
    VARCHAR,
    BOOLEAN,
    DATETIME;

    public boolean isNumeric() {
        return this == INT || this == BIGINT || this == FLOAT;
    }
}
