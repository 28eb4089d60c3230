package net.littleredcomputer.gadget2sat;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class ClauseTransformerTest {

    @Test
    public void singleClause() {
        Formula phi = TestFormulas.threeCNF(3, new int[]{1, 2, 3});
        Transformation t = ClauseTransformer.transform(phi);
        Literal a = Literal.positive(3);
        assertThat(t.auxiliaryMap().auxiliaryOf(0), is(3));
        assertThat(t.transformed().nVariables(), is(4));
        assertThat(t.transformed().clauses(), contains(
                Clause.of(Literal.negative(0), a),
                Clause.of(Literal.negative(1), a),
                Clause.of(a, Literal.positive(2))));
        assertThat(TwoSATDecider.decide(t.transformed()).isSatisfiable(), is(true));
    }

    @Test
    public void sizes() {
        Formula phi = TestFormulas.random(ClauseKind.THREE, 7, 19, new Random(1));
        Transformation t = ClauseTransformer.transform(phi);
        assertThat(t.transformed().nVariables(), is(7 + 19));
        assertThat(t.transformed().nClauses(), is(3 * 19));
        assertThat(t.transformed().kind(), is(ClauseKind.TWO));
        assertThat(t.auxiliaryMap().size(), is(19));
        assertThat(t.patterns(), hasSize(19));
        for (int i = 0; i < 19; ++i) assertThat(t.auxiliaryMap().auxiliaryOf(i), is(7 + i));
        assertThat(t.auxiliaryMap().isAuxiliary(6), is(false));
        assertThat(t.auxiliaryMap().isAuxiliary(7), is(true));
    }

    @Test
    public void explicitGeneratorState() {
        Formula phi = TestFormulas.threeCNF(3, new int[]{1, 2, 3}, new int[]{-1, -2, -3});
        VariableGenerator g = VariableGenerator.startingAt(3);
        ClauseTransformer.transform(phi, g);
        assertThat(g.peek(), is(5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void auxiliariesMayNotOverlapOriginals() {
        ClauseTransformer.transform(TestFormulas.threeCNF(3, new int[]{1, 2, 3}), VariableGenerator.startingAt(2));
    }

    @Test
    public void transformIsDeterministicUpToAuxiliaryNames() {
        Formula phi = TestFormulas.random(ClauseKind.THREE, 6, 12, new Random(7));
        Transformation t1 = ClauseTransformer.transform(phi, VariableGenerator.startingAt(6));
        Transformation t2 = ClauseTransformer.transform(phi, VariableGenerator.startingAt(40));
        Map<Integer, Integer> renaming = new HashMap<>();
        for (int i = 0; i < phi.nClauses(); ++i) {
            renaming.put(t2.auxiliaryMap().auxiliaryOf(i), t1.auxiliaryMap().auxiliaryOf(i));
        }
        assertThat(t2.transformed().nClauses(), is(t1.transformed().nClauses()));
        for (int j = 0; j < t1.transformed().nClauses(); ++j) {
            Clause c1 = t1.transformed().getClause(j);
            Clause c2 = t2.transformed().getClause(j);
            for (int k = 0; k < 2; ++k) {
                Literal l = c2.get(k);
                Literal renamed = Literal.of(renaming.getOrDefault(l.variable(), l.variable()), l.isNegated());
                assertThat(renamed, is(c1.get(k)));
            }
        }
    }

    @Test
    public void patternMatchesOnlyTheSpuriousState() {
        Transformation t = ClauseTransformer.transform(TestFormulas.threeCNF(3, new int[]{1, -2, 3}));
        SpuriousPattern p = t.patterns().get(0);
        assertThat(p.auxiliary(), is(3));
        // x0 false, x1 true, a true
        assertThat(p.matchedBy(Assignment.of(false, true, false, true)), is(true));
        assertThat(p.matchedBy(Assignment.of(false, true, true, true)), is(true));
        assertThat(p.matchedBy(Assignment.of(false, true, true, false)), is(false));
        assertThat(p.matchedBy(Assignment.of(true, true, false, true)), is(false));
        assertThat(p.matchedBy(Assignment.of(false, false, false, true)), is(false));
    }

    /**
     * A model of the original formula extends to the transformed one by making each auxiliary
     * the disjunction of its clause's first two literals.
     */
    @Test
    public void modelsExtend() {
        Random r = new Random(11);
        for (int trial = 0; trial < 40; ++trial) {
            Formula phi = TestFormulas.random(ClauseKind.THREE, 6, 1 + r.nextInt(25), r);
            Transformation t = ClauseTransformer.transform(phi);
            for (Assignment m : TestFormulas.models(phi)) {
                boolean[] bs = new boolean[t.transformed().nVariables()];
                for (int v = 0; v < phi.nVariables(); ++v) bs[v] = m.get(v);
                for (int i = 0; i < phi.nClauses(); ++i) {
                    Clause c = phi.getClause(i);
                    bs[t.auxiliaryMap().auxiliaryOf(i)] = m.value(c.get(0)) || m.value(c.get(1));
                }
                Assignment extended = Assignment.of(bs);
                assertThat(t.transformed().evaluate(extended), is(true));
                assertThat(t.invariantHolds(extended), is(true));
            }
        }
    }
}
