package net.littleredcomputer.gadget2sat;

import org.junit.Test;

import java.util.Random;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class TwoSATDeciderTest {

    @Test
    public void single() {
        DecisionResult d = TwoSATDecider.decide(TestFormulas.twoCNF(2, new int[]{1, 2}));
        assertThat(d.isSatisfiable(), is(true));
        assertThat(d.assignment(), isPresentAndIs(Assignment.of(true, true)));
        assertThat(d.conflictVariable().isPresent(), is(false));
    }

    @Test
    public void chain() {
        // x0 → x1 → x2, and x0 must hold
        DecisionResult d = TwoSATDecider.decide(TestFormulas.twoCNF(3,
                new int[]{-1, 2}, new int[]{-2, 3}, new int[]{1, 1}));
        assertThat(d.assignment(), isPresentAndIs(Assignment.of(true, true, true)));
    }

    @Test
    public void unsat() {
        DecisionResult d = TwoSATDecider.decide(TestFormulas.twoCNF(2,
                new int[]{1, 2}, new int[]{1, -2}, new int[]{-1, 2}, new int[]{-1, -2}));
        assertThat(d.isSatisfiable(), is(false));
        assertThat(d.assignment(), isEmpty());
        assertThat(d.conflictVariable().getAsInt(), is(0));
    }

    @Test
    public void unsatSecondVariable() {
        // x0 is free; x1 ≡ ~x1
        DecisionResult d = TwoSATDecider.decide(TestFormulas.twoCNF(3,
                new int[]{1, 3}, new int[]{2, 2}, new int[]{-2, -2}));
        assertThat(d.conflictVariable().getAsInt(), is(1));
    }

    @Test
    public void fixture() {
        Formula psi = TestFormulas.fromResource("chain16.cnf", ClauseKind.TWO);
        DecisionResult d = TwoSATDecider.decide(psi);
        assertThat(d.isSatisfiable(), is(TestFormulas.bruteForce(psi).isPresent()));
        d.assignment().ifPresent(a -> assertThat(psi.evaluate(a), is(true)));
    }

    @Test
    public void agreesWithBruteForce() {
        Random r = new Random(2);
        for (int trial = 0; trial < 300; ++trial) {
            final int n = 1 + r.nextInt(12);
            Formula psi = TestFormulas.random(ClauseKind.TWO, n, 1 + r.nextInt(3 * n), r);
            DecisionResult d = TwoSATDecider.decide(psi);
            assertThat(psi.toString(), d.isSatisfiable(), is(TestFormulas.bruteForce(psi).isPresent()));
            if (d.isSatisfiable()) {
                assertThat(psi.toString(), psi.evaluate(d.assignment().get()), is(true));
            } else {
                int v = d.conflictVariable().getAsInt();
                assertThat(d.condensation().component(2 * v), is(d.condensation().component(2 * v + 1)));
            }
        }
    }

    @Test
    public void deterministic() {
        Formula psi = TestFormulas.random(ClauseKind.TWO, 10, 12, new Random(9));
        assertThat(TwoSATDecider.decide(psi).assignment(), is(TwoSATDecider.decide(psi).assignment()));
    }
}
