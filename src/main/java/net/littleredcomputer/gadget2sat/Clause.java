package net.littleredcomputer.gadget2sat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

public final class Clause {
    private static final Joiner orJoiner = Joiner.on(" ∨ ");
    private final ClauseKind kind;
    private final ImmutableList<Literal> literals;

    public Clause(ClauseKind kind, List<Literal> literals) {
        if (literals.size() != kind.arity()) throw new MalformedClauseException(kind, literals.size());
        this.kind = kind;
        this.literals = ImmutableList.copyOf(literals);
    }

    public static Clause of(Literal... literals) {
        switch (literals.length) {
            case 2: return new Clause(ClauseKind.TWO, Arrays.asList(literals));
            case 3: return new Clause(ClauseKind.THREE, Arrays.asList(literals));
            default: throw new MalformedClauseException(ClauseKind.THREE, literals.length);
        }
    }

    /**
     * Builds a clause from signed, 1-based DIMACS literal numbers.
     */
    public static Clause ofDimacs(int... literals) {
        return of(Arrays.stream(literals).mapToObj(Literal::fromDimacs).toArray(Literal[]::new));
    }

    public ClauseKind kind() { return kind; }
    public ImmutableList<Literal> literals() { return literals; }
    public Literal get(int i) { return literals.get(i); }

    public boolean isSatisfiedBy(Assignment a) {
        for (Literal l : literals) {
            // One true literal in the clause is enough to make the whole clause true.
            if (l.isTrueUnder(a)) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clause)) return false;
        Clause c = (Clause) o;
        return kind == c.kind && literals.equals(c.literals);
    }

    @Override
    public int hashCode() { return 31 * kind.hashCode() + literals.hashCode(); }

    @Override
    public String toString() { return "(" + orJoiner.join(literals) + ")"; }
}
