package db.qexec.exec;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * AND / OR / NOT over row predicates, for selections and HAVING clauses.
 * AND and OR stop at the first operand that decides the result.
 */
public final class CompoundPredicate implements Predicate {
    public enum Kind { AND, OR, NOT }

    private static final Predicate ALWAYS = row -> true;

    private final Kind kind;
    private final Predicate[] operands;

    private CompoundPredicate(Kind kind, Predicate[] operands) {
        boolean arityOk = kind == Kind.NOT ? operands.length == 1 : operands.length >= 2;
        if (!arityOk) {
            throw new IllegalArgumentException(kind + " cannot take " + operands.length + " operand(s)");
        }
        for (Predicate p : operands) Objects.requireNonNull(p, "null operand in " + kind);
        this.kind = kind;
        this.operands = operands;
    }

    public static CompoundPredicate and(Predicate... predicates) {
        return new CompoundPredicate(Kind.AND, predicates.clone());
    }

    public static CompoundPredicate or(Predicate... predicates) {
        return new CompoundPredicate(Kind.OR, predicates.clone());
    }

    public static CompoundPredicate not(Predicate predicate) {
        return new CompoundPredicate(Kind.NOT, new Predicate[] {predicate});
    }

    /**
     * Conjunction of any number of conditions, as collected from a WHERE or HAVING clause:
     * no condition accepts every row and a single condition is returned as is.
     */
    public static Predicate allOf(List<? extends Predicate> predicates) {
        if (predicates.isEmpty()) return ALWAYS;
        if (predicates.size() == 1) return predicates.get(0);
        return new CompoundPredicate(Kind.AND, predicates.toArray(new Predicate[0]));
    }

    public Kind kind() { return kind; }

    @Override
    public boolean test(Row row) {
        if (kind == Kind.NOT) return !operands[0].test(row);
        boolean decisive = kind == Kind.OR;
        for (Predicate p : operands) {
            if (p.test(row) == decisive) return decisive;
        }
        return !decisive;
    }

    @Override
    public String toString() {
        if (kind == Kind.NOT) return "NOT(" + operands[0] + ")";
        return Arrays.stream(operands).map(String::valueOf).collect(Collectors.joining(" " + kind + " ", "(", ")"));
    }
}
