package net.littleredcomputer.gadget2sat;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A CNF formula in which every clause belongs to one {@link ClauseKind}.
 */
public class Formula {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(CharMatcher.whitespace()).trimResults().omitEmptyStrings();
    private final int nVariables;
    private final ClauseKind kind;
    private final ImmutableList<Clause> clauses;

    public Formula(int nVariables, ClauseKind kind, List<Clause> clauses) {
        if (nVariables < 1) throw new IllegalArgumentException("Must have at least one variable");
        for (Clause c : clauses) {
            if (c.kind() != kind) throw new MalformedClauseException(kind, c.literals().size());
            for (Literal l : c.literals()) {
                if (l.variable() >= nVariables) {
                    throw new IllegalArgumentException("literal " + l + " out of declared bounds " + nVariables);
                }
            }
        }
        this.nVariables = nVariables;
        this.kind = kind;
        this.clauses = ImmutableList.copyOf(clauses);
    }

    public int nVariables() { return nVariables; }
    public int nClauses() { return clauses.size(); }
    public ClauseKind kind() { return kind; }
    public ImmutableList<Clause> clauses() { return clauses; }
    public Clause getClause(int i) { return clauses.get(i); }

    /**
     * Evaluate the boolean function represented by the formula's clauses at the specified point
     * @param a assignment covering at least this formula's variables
     * @return the truth value of this formula at a
     */
    public boolean evaluate(Assignment a) {
        if (a.size() < nVariables) throw new IllegalArgumentException("assignment too short for formula");
        for (Clause c : clauses) {
            if (!c.isSatisfiedBy(a)) return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;
    }

    public static Formula parseFrom(String s, ClauseKind kind) {
        return parseFrom(new StringReader(s), kind);
    }

    /**
     * Read a DIMACS CNF instance. When a p line is present, the clause count it declares must
     * agree with the clauses present and literals must lie within its variable count; without
     * one, the number of variables is the largest variable mentioned. Every clause must have
     * the arity of the given kind.
     */
    public static Formula parseFrom(Reader r, ClauseKind kind) {
        List<Integer> literals = new ArrayList<>();
        List<Clause> clauses = new ArrayList<>();
        PeekingIterator<String> ls = Iterators.peekingIterator(new BufferedReader(r).lines()
                .map(String::trim)
                .filter(s -> !s.isEmpty() && !s.startsWith("c") && !s.startsWith("%"))
                .iterator());
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing SAT instance data");
        int nVar = -1;
        int nClause = -1;
        if (ls.peek().startsWith("p")) {
            Matcher m = pLineRe.matcher(ls.next());
            if (!m.matches()) throw new IllegalArgumentException("invalid p line");
            nVar = Integer.parseInt(m.group(1));
            nClause = Integer.parseInt(m.group(2));
        }
        int maxVariable = 0;
        while (ls.hasNext()) {
            for (String token : splitter.split(ls.next())) {
                int l = Integer.parseInt(token);
                if (l == 0) {
                    if (literals.isEmpty()) throw new IllegalArgumentException("Empty clause, so problem is trivially unsatisfiable");
                    clauses.add(clauseOf(kind, literals));
                    literals.clear();
                } else {
                    if (nVar >= 0 && (l > nVar || l < -nVar)) throw new IllegalArgumentException("literal out of declared bounds");
                    maxVariable = Math.max(maxVariable, Math.abs(l));
                    literals.add(l);
                }
            }
        }
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (nClause >= 0 && clauses.size() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return new Formula(nVar >= 0 ? nVar : maxVariable, kind, clauses);
    }

    public static Formula parseSimple(String s) { return parseSimple(new StringReader(s)); }

    /**
     * Read the plain 3-CNF format: three signed 1-based literals per line, '#' comments.
     * The number of variables is the largest variable mentioned.
     */
    public static Formula parseSimple(Reader r) {
        List<Clause> clauses = new ArrayList<>();
        int maxVariable = 0;
        for (String line : new BufferedReader(r).lines().map(String::trim).collect(Collectors.toList())) {
            if (line.isEmpty() || line.startsWith("#")) continue;
            List<Integer> literals = splitter.splitToStream(line).map(Integer::parseInt).collect(Collectors.toList());
            if (literals.size() != ClauseKind.THREE.arity()) throw new MalformedClauseException(ClauseKind.THREE, literals.size());
            for (int l : literals) maxVariable = Math.max(maxVariable, Math.abs(l));
            clauses.add(clauseOf(ClauseKind.THREE, literals));
        }
        return new Formula(maxVariable, ClauseKind.THREE, clauses);
    }

    /**
     * Guess the format of a 3-CNF text: DIMACS if the first significant line is a p line
     * or contains a terminating 0, otherwise the simple format.
     */
    public static Formula parse3CNF(String s) {
        for (String line : Splitter.on('\n').trimResults().split(s)) {
            if (line.isEmpty() || line.startsWith("c") || line.startsWith("#")) continue;
            if (line.startsWith("p") || line.endsWith(" 0") || line.contains(" 0 ")) return parseFrom(s, ClauseKind.THREE);
            return parseSimple(s);
        }
        throw new IllegalArgumentException("Empty or invalid input");
    }

    private static Clause clauseOf(ClauseKind kind, List<Integer> dimacs) {
        List<Literal> ls = dimacs.stream().map(Literal::fromDimacs).collect(Collectors.toList());
        return new Clause(kind, ls);
    }

    /** @return the formula in DIMACS CNF form, preceded by the given comment lines */
    public String toDimacs(String... comments) {
        StringBuilder sb = new StringBuilder();
        for (String c : comments) sb.append("c ").append(c).append('\n');
        sb.append("p cnf ").append(nVariables).append(' ').append(clauses.size()).append('\n');
        for (Clause c : clauses) {
            for (Literal l : c.literals()) sb.append(l.toDimacs()).append(' ');
            sb.append("0\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return clauses.stream().map(Clause::toString).collect(Collectors.joining(" ∧ "));
    }
}
