/**
 *
 */
package org.signalq.network;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for the component and neighborhood filters.
 *
 */
public class ModelFilterTest {

    /**
     * Simple parameter object for building filters.
     */
    protected static class Parms implements ModelFilter.IParms {

        private int threshold;
        private List<String> upstream;
        private List<String> downstream;

        public Parms(int threshold, List<String> upstream, List<String> downstream) {
            this.threshold = threshold;
            this.upstream = upstream;
            this.downstream = downstream;
        }

        @Override
        public int getThreshold() {
            return this.threshold;
        }

        @Override
        public List<String> getUpstream() {
            return this.upstream;
        }

        @Override
        public List<String> getDownstream() {
            return this.downstream;
        }

    }

    /**
     * Add a simple link from one species to another.
     *
     * @param model		model containing the species
     * @param source	ID of the influencing species
     * @param target	ID of the influenced species
     */
    private static void link(SignalModel model, String source, String target) {
        model.getSpecies(target).addTransition(new Transition(Transition.STATE_TRANSITION, List.of(source),
                Collections.emptyList()));
    }

    /**
     * @return a model with components {A,B,C,D,E} and {X,Y,Z}
     */
    private static SignalModel twoComponents() {
        SignalModel retVal = new SignalModel(100.0, 100.0);
        for (String id : List.of("A", "B", "C", "D", "E", "X", "Y", "Z"))
            retVal.addSpecies(new Species(id, id, Species.PROTEIN));
        link(retVal, "A", "B");
        link(retVal, "B", "C");
        link(retVal, "C", "D");
        link(retVal, "E", "B");
        link(retVal, "X", "Y");
        link(retVal, "Y", "Z");
        return retVal;
    }

    @Test
    public void testComponents() {
        SignalModel model = twoComponents();
        List<java.util.Set<String>> components = model.getComponents();
        assertThat(components.size(), equalTo(2));
        assertThat(components.get(0), containsInAnyOrder("A", "B", "C", "D", "E"));
        assertThat(components.get(1), containsInAnyOrder("X", "Y", "Z"));
        // Keep only the largest.
        ModelFilter filter = ModelFilter.Type.COMPONENTS.create(new Parms(-1, List.of(), List.of()));
        assertThat(filter.apply(model), equalTo(3));
        assertThat(model.getIds(), contains("A", "B", "C", "D", "E"));
        // A small threshold removes nothing.
        model = twoComponents();
        filter = ModelFilter.Type.COMPONENTS.create(new Parms(2, List.of(), List.of()));
        assertThat(filter.apply(model), equalTo(0));
        assertThat(model.size(), equalTo(8));
        // An explicit threshold.
        filter = ModelFilter.Type.COMPONENTS.create(new Parms(3, List.of(), List.of()));
        assertThat(filter.apply(model), equalTo(3));
        assertThat(model.contains("X"), equalTo(false));
    }

    @Test
    public void testUpstream() {
        SignalModel model = twoComponents();
        List<String> before = new ArrayList<String>(model.getIds());
        ModelFilter filter = ModelFilter.Type.NEIGHBORHOOD.create(new Parms(0, List.of("C"), List.of()));
        filter.apply(model);
        assertThat(model.getIds(), contains("A", "B", "C", "E"));
        assertThat(before, hasItems(model.getIds().toArray(new String[0])));
    }

    @Test
    public void testDownstream() {
        SignalModel model = twoComponents();
        ModelFilter filter = ModelFilter.Type.NEIGHBORHOOD.create(new Parms(0, List.of(), List.of("B")));
        assertThat(filter.apply(model), equalTo(5));
        assertThat(model.getIds(), contains("B", "C", "D"));
        // The link from A to B is now dangling and has been purged.
        assertThat(model.getSpecies("B").getTransitions().get(0).getReactants(), empty());
    }

    @Test
    public void testBothDirections() {
        SignalModel model = twoComponents();
        ModelFilter filter = ModelFilter.Type.NEIGHBORHOOD.create(new Parms(0, List.of("Y"), List.of("D")));
        filter.apply(model);
        assertThat(model.getIds(), contains("D", "X", "Y"));
    }

    @Test
    public void testMissingSeeds() {
        SignalModel model = twoComponents();
        ModelFilter filter = ModelFilter.Type.NEIGHBORHOOD.create(new Parms(0, List.of("Q"), List.of("R")));
        assertThat(filter.apply(model), equalTo(0));
        assertThat(model.size(), equalTo(8));
        // Seed names must match exactly, so a similar name is not used in place of a missing one.
        model.addSpecies(new Species("IL6", "IL6", Species.PROTEIN));
        link(model, "IL6", "A");
        filter = ModelFilter.Type.NEIGHBORHOOD.create(new Parms(0, List.of(), List.of("IL-6", "Q")));
        assertThat(filter.apply(model), equalTo(0));
        assertThat(model.size(), equalTo(9));
        filter = ModelFilter.Type.NEIGHBORHOOD.create(new Parms(0, List.of(), List.of("IL-6", "IL6")));
        filter.apply(model);
        assertThat(model.getIds(), containsInAnyOrder("IL6", "A", "B", "C", "D"));
    }

}
