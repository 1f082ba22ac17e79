package db.qexec.exec.aggr;

import db.qexec.catalog.DataType;
import db.qexec.error.TypeMismatchException;

/**
 * Built-in aggregate functions.
 */
public enum AggregateFunction {
    COUNT,
    COUNT_STAR,
    SUM,
    AVG,
    MIN,
    MAX,
    STDDEV_POP;

    /** Result type for an argument of the given type ({@code null} for COUNT_STAR). */
    public DataType resultType(DataType argType) {
        switch (this) {
            case COUNT:
            case COUNT_STAR:
                return DataType.BIGINT;
            case SUM:
                requireNumeric(argType);
                return argType == DataType.FLOAT ? DataType.FLOAT : DataType.BIGINT;
            case AVG:
            case STDDEV_POP:
                requireNumeric(argType);
                return DataType.FLOAT;
            case MIN:
            case MAX:
                return argType;
            default:
                throw new IllegalStateException("Unknown aggregate " + this);
        }
    }

    private void requireNumeric(DataType argType) {
        if (argType == null || !argType.isNumeric()) {
            throw new TypeMismatchException("Operand of " + this + " is not numeric: " + argType);
        }
    }

    /** Fresh state for one group; {@code argType} decides integer vs floating-point summation. */
    public Accumulator newAccumulator(DataType argType) {
        switch (this) {
            case COUNT: return new Accumulator.Count(false);
            case COUNT_STAR: return new Accumulator.Count(true);
            case SUM: return new Accumulator.Sum(argType == DataType.FLOAT);
            case AVG: return new Accumulator.Avg();
            case MIN: return new Accumulator.Extremum(false);
            case MAX: return new Accumulator.Extremum(true);
            case STDDEV_POP: return new Accumulator.StdDevPop();
            default: throw new IllegalStateException("Unknown aggregate " + this);
        }
    }
}
