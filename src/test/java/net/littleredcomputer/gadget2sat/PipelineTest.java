package net.littleredcomputer.gadget2sat;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class PipelineTest {

    @Test
    public void stages() {
        Pipeline p = new Pipeline(TestFormulas.fromResource("example_3sat.cnf", ClauseKind.THREE));
        assertThat(p.state(), is(Pipeline.State.BUILT));
        assertThat(p.transformation(), isEmpty());
        Transformation t = p.transform();
        assertThat(p.state(), is(Pipeline.State.TRANSFORMED));
        assertThat(t.transformed().nClauses(), is(6));
        assertThat(p.decide().isSatisfiable(), is(true));
        assertThat(p.state(), is(Pipeline.State.DECIDED));
        assertThat(p.filter().outcome(), is(FilterResult.Outcome.FOUND));
        assertThat(p.state(), is(Pipeline.State.FILTERED));
        assertThat(p.freeChoices(), isPresent());
        assertThat(p.result(), isEmpty());
        PipelineResult r = p.project();
        assertThat(p.state(), is(Pipeline.State.DONE));
        assertThat(p.state().isTerminal(), is(true));
        assertThat(r.outcome(), is(PipelineResult.Outcome.SATISFIABLE));
        assertThat(p.run(), sameInstance(r));
    }

    @Test(expected = IllegalStateException.class)
    public void decideBeforeTransform() {
        new Pipeline(TestFormulas.allSigns3()).decide();
    }

    @Test(expected = IllegalStateException.class)
    public void filterTwice() {
        Pipeline p = new Pipeline(TestFormulas.allSigns3());
        p.transform();
        p.decide();
        FilterResult ignored = p.filter();
        p.filter();
    }

    @Test(expected = IllegalStateException.class)
    public void survivorsNeedADecision() {
        new Pipeline(TestFormulas.allSigns3()).survivors(1);
    }

    @Test(expected = MalformedClauseException.class)
    public void onlyThreeCNF() {
        new Pipeline(TestFormulas.twoCNF(2, new int[]{1, 2}));
    }

    @Test
    public void satisfiable() {
        Formula phi = TestFormulas.fromResource("example_3sat.cnf", ClauseKind.THREE);
        PipelineResult r = new Pipeline(phi).run();
        assertThat(r.isSatisfiable(), is(true));
        assertThat(r.model(), isPresent());
        assertThat(r.model().get().keySet(), contains(0, 1, 2));
        assertThat(phi.evaluate(r.assignment().get()), is(true));
        assertThat(r.statistics(), isPresent());
    }

    @Test
    public void everyRelaxedModelSpurious() {
        Pipeline p = new Pipeline(TestFormulas.fromResource("all_signs_3.cnf", ClauseKind.THREE));
        PipelineResult r = p.run();
        assertThat(r.decision().isSatisfiable(), is(true));
        assertThat(r.outcome(), is(PipelineResult.Outcome.FILTER_EXHAUSTED));
        assertThat(r.isSatisfiable(), is(false));
        assertThat(r.model(), isEmpty());
        assertThat(p.state(), is(Pipeline.State.DONE));
    }

    @Test
    public void budgetExceeded() {
        PipelineResult r = new Pipeline(TestFormulas.allSigns3())
                .setBudget(SearchBudget.unlimited().withMaxSubsets(1))
                .run();
        assertThat(r.outcome(), is(PipelineResult.Outcome.BUDGET_EXCEEDED));
        assertThat(r.model(), isEmpty());
    }

    @Test
    public void durationBudgetCoversTheAnalysis() {
        final Duration limit = Duration.ofMillis(200);
        Pipeline p = new Pipeline(TestFormulas.unsatisfiable(1500, 6000, new Random(3)))
                .setBudget(SearchBudget.unlimited().withMaxDuration(limit));
        p.transform();
        p.decide();
        Stopwatch sw = Stopwatch.createStarted();
        FilterResult f = p.filter();
        assertThat(sw.elapsed(), lessThan(limit.plusSeconds(2)));
        assertThat(f.outcome(), is(FilterResult.Outcome.BUDGET_EXCEEDED));
        assertThat(f.statistics().elapsed(), greaterThanOrEqualTo(limit));
        assertThat(p.project().outcome(), is(PipelineResult.Outcome.BUDGET_EXCEEDED));
    }

    @Test
    public void unsatisfiableRelaxation() {
        // Pin the auxiliary variable both ways.
        Pipeline p = new Pipeline(TestFormulas.threeCNF(3, new int[]{1, 2, 3}),
                phi -> ClauseTransformer.transform(phi).withExtraClauses(
                        ImmutableList.of(Clause.ofDimacs(4, 4), Clause.ofDimacs(-4, -4))));
        PipelineResult r = p.run();
        assertThat(r.outcome(), is(PipelineResult.Outcome.UNSAT_EARLY));
        assertThat(p.state(), is(Pipeline.State.UNSAT_EARLY));
        assertThat(r.decision().conflictVariable().getAsInt(), is(3));
        assertThat(r.filterResult(), isEmpty());
        assertThat(r.statistics(), isEmpty());
        assertThat(p.freeChoices(), isEmpty());
    }

    @Test
    public void survivors() {
        Formula phi = TestFormulas.fromResource("example_3sat.cnf", ClauseKind.THREE);
        Pipeline p = new Pipeline(phi);
        p.run();
        List<Assignment> models = p.survivors(10);
        assertThat(models, hasSize(6));
        for (Assignment m : models) assertThat(phi.evaluate(m), is(true));
    }

    @Test
    public void soundAndComplete() {
        Random r = new Random(21);
        for (int trial = 0; trial < 100; ++trial) {
            Formula phi = TestFormulas.random(ClauseKind.THREE, 6, 1 + r.nextInt(30), r);
            PipelineResult result = new Pipeline(phi).setThreads(1 + r.nextInt(3)).run();
            boolean sat = TestFormulas.bruteForce(phi).isPresent();
            assertThat(phi.toString(), result.outcome(),
                    is(sat ? PipelineResult.Outcome.SATISFIABLE : PipelineResult.Outcome.FILTER_EXHAUSTED));
            result.assignment().ifPresent(a -> assertThat(phi.evaluate(a), is(true)));
        }
    }
}
