package net.littleredcomputer.gadget2sat;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The result of rewriting a 3-CNF formula Φ into a 2-CNF formula Ψ: both formulas,
 * the clause → auxiliary variable map, and one spurious pattern per clause of Φ.
 */
public final class Transformation {
    private final Formula original;
    private final Formula transformed;
    private final AuxiliaryMap auxiliaryMap;
    private final ImmutableList<SpuriousPattern> patterns;

    Transformation(Formula original, Formula transformed, AuxiliaryMap auxiliaryMap) {
        if (original.kind() != ClauseKind.THREE) throw new IllegalArgumentException("original formula must be 3-CNF");
        if (transformed.kind() != ClauseKind.TWO) throw new IllegalArgumentException("transformed formula must be 2-CNF");
        if (auxiliaryMap.size() != original.nClauses()) {
            throw new IllegalArgumentException("one auxiliary variable per original clause is required");
        }
        this.original = original;
        this.transformed = transformed;
        this.auxiliaryMap = auxiliaryMap;
        ImmutableList.Builder<SpuriousPattern> b = ImmutableList.builder();
        for (int i = 0; i < original.nClauses(); ++i) {
            b.add(new SpuriousPattern(i, original.getClause(i), auxiliaryMap.auxiliaryOf(i)));
        }
        this.patterns = b.build();
    }

    /**
     * @return a transformation whose 2-CNF side carries the given extra clauses as well
     */
    Transformation withExtraClauses(List<Clause> extra) {
        return new Transformation(original, new Formula(transformed.nVariables(), ClauseKind.TWO,
                ImmutableList.<Clause>builder().addAll(transformed.clauses()).addAll(extra).build()), auxiliaryMap);
    }

    public Formula original() { return original; }
    public Formula transformed() { return transformed; }
    public AuxiliaryMap auxiliaryMap() { return auxiliaryMap; }
    public ImmutableList<SpuriousPattern> patterns() { return patterns; }

    /**
     * @return true if no clause gadget is in its spurious state under a
     */
    public boolean invariantHolds(Assignment a) {
        for (SpuriousPattern p : patterns) {
            if (p.matchedBy(a)) return false;
        }
        return true;
    }
}
