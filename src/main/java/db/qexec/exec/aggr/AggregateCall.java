package db.qexec.exec.aggr;

/**
 * One aggregate expression: a function applied to an input column, optionally DISTINCT,
 * with the name of its output column.
 */
public final class AggregateCall {
    private final AggregateFunction function;
    private final String column;
    private final boolean distinct;
    private final String name;

    public AggregateCall(AggregateFunction function, String column, boolean distinct, String name) {
        if (function == AggregateFunction.COUNT_STAR) {
            if (column != null) throw new IllegalArgumentException("COUNT(*) takes no column");
            if (distinct) throw new IllegalArgumentException("COUNT(DISTINCT *) is not supported");
        } else if (column == null) {
            throw new IllegalArgumentException(function + " needs an input column");
        }
        this.function = function;
        this.column = column;
        this.distinct = distinct;
        this.name = name != null ? name : defaultName(function, column, distinct);
    }

    private static String defaultName(AggregateFunction function, String column, boolean distinct) {
        if (function == AggregateFunction.COUNT_STAR) return "COUNT(*)";
        return function + "(" + (distinct ? "DISTINCT " : "") + column + ")";
    }

    public static AggregateCall countStar() { return new AggregateCall(AggregateFunction.COUNT_STAR, null, false, null); }
    public static AggregateCall count(String column) { return of(AggregateFunction.COUNT, column); }
    public static AggregateCall sum(String column) { return of(AggregateFunction.SUM, column); }
    public static AggregateCall avg(String column) { return of(AggregateFunction.AVG, column); }
    public static AggregateCall min(String column) { return of(AggregateFunction.MIN, column); }
    public static AggregateCall max(String column) { return of(AggregateFunction.MAX, column); }
    public static AggregateCall stddevPop(String column) { return of(AggregateFunction.STDDEV_POP, column); }

    public static AggregateCall of(AggregateFunction function, String column) {
        return new AggregateCall(function, column, false, null);
    }

    /** Same call over the distinct non-null values of its column. */
    public AggregateCall distinct() { return new AggregateCall(function, column, true, null); }

    /** Same call with an explicit output column name. */
    public AggregateCall as(String outputName) { return new AggregateCall(function, column, distinct, outputName); }

    public AggregateFunction function() { return function; }
    public String column() { return column; }
    public boolean isDistinct() { return distinct; }
    public String name() { return name; }

    /**
     * Whether the aggregate can be updated one row at a time. DISTINCT needs the full
     * deduplicated value set, so it is never incremental here, even for MIN/MAX.
     */
    public boolean isIncremental() { return !distinct; }

    @Override
    public String toString() { return name; }
}
