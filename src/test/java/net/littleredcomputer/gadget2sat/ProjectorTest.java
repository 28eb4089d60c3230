package net.littleredcomputer.gadget2sat;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class ProjectorTest {
    private final Transformation t = ClauseTransformer.transform(
            TestFormulas.threeCNF(3, new int[]{1, 2, 3}, new int[]{-1, 2, -3}));

    @Test
    public void dropsAuxiliaries() {
        Assignment a = Assignment.of(true, false, true, true, false);
        assertThat(Projector.project(a, t.auxiliaryMap()), is(ImmutableMap.of(0, true, 1, false, 2, true)));
        assertThat(Projector.project(a, t.auxiliaryMap()).keySet(), contains(0, 1, 2));
        assertThat(Projector.projectToAssignment(a, t.auxiliaryMap()), is(Assignment.of(true, false, true)));
    }

    @Test
    public void auxiliaryValuesDoNotMatter() {
        assertThat(Projector.projectToAssignment(Assignment.of(false, true, false, false, false), t.auxiliaryMap()),
                is(Projector.projectToAssignment(Assignment.of(false, true, false, true, true), t.auxiliaryMap())));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooShort() {
        Projector.project(Assignment.of(true, true), t.auxiliaryMap());
    }
}
