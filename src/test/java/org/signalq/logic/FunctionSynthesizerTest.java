/**
 *
 */
package org.signalq.logic;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;
import org.signalq.io.ModelFormat;
import org.signalq.io.SpeciesCsvWriter;
import org.signalq.network.ModelSimplifier;
import org.signalq.network.FixedLevels;
import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.signalq.network.Transition;

/**
 * Tests for the computation of logical functions.
 *
 */
public class FunctionSynthesizerTest {

    /** default simplification parameters */
    private static final ModelSimplifier.IParms DEFAULTS = new ModelSimplifier.IParms() {

        @Override
        public int getThreshold() {
            return 0;
        }

        @Override
        public List<String> getUpstream() {
            return Collections.emptyList();
        }

        @Override
        public List<String> getDownstream() {
            return Collections.emptyList();
        }

        @Override
        public boolean isNamesAsIds() {
            return false;
        }

        @Override
        public FixedLevels getFixedLevels() {
            return new FixedLevels();
        }
    };

    /**
     * @return a model containing protein species with the specified IDs (which are also the names)
     */
    private static SignalModel build(String... ids) {
        SignalModel retVal = new SignalModel(100.0, 100.0);
        for (String id : ids)
            retVal.addSpecies(new Species(id, id, Species.PROTEIN));
        return retVal;
    }

    /**
     * @return a modifier of the specified kind
     */
    private static Transition.Modifier mod(String kind, String... ids) {
        return new Transition.Modifier(kind, List.of(ids));
    }

    /**
     * Add a transition to a species.
     */
    private static void add(SignalModel model, String target, String type, List<String> reactants,
            Transition.Modifier... modifiers) {
        model.getSpecies(target).addTransition(new Transition(type, reactants, List.of(modifiers)));
    }

    @Test
    public void testOrOfTransitions() {
        SignalModel model = build("A", "B", "C", "D");
        add(model, "D", Transition.STATE_TRANSITION, List.of("A"));
        add(model, "D", Transition.STATE_TRANSITION, List.of("B"), mod(Transition.INHIBITION, "C"));
        LogicalModel logical = FunctionSynthesizer.create(1, false).synthesize(model);
        assertThat(model.getSpecies("D").getFunction(), equalTo("(A | (B & !C))"));
        // Inputs keep their names as functions.
        assertThat(model.getSpecies("A").getFunction(), equalTo("A"));
        assertThat(logical.isInput(model.getSpecies("A")), equalTo(true));
        assertThat(logical.isInput(model.getSpecies("D")), equalTo(false));
        assertThat(logical.getExpression("A"), nullValue());
        assertThat(logical.getExpression("D").getSpeciesIds(), contains("A", "B", "C"));
        assertThat(logical.getGranularity(), equalTo(1));
    }

    @Test
    public void testSingleTransition() {
        SignalModel model = build("B", "C", "D", "E");
        add(model, "D", Transition.STATE_TRANSITION, List.of("B"), mod(Transition.INHIBITION, "C"));
        add(model, "E", Transition.STATE_TRANSITION, List.of("B"));
        FunctionSynthesizer.create(1, false).synthesize(model);
        assertThat(model.getSpecies("D").getFunction(), equalTo("(B & !C)"));
        assertThat(model.getSpecies("E").getFunction(), equalTo("B"));
    }

    @Test
    public void testActivators() {
        SignalModel model = build("R", "X", "Y", "Z", "T", "U");
        add(model, "T", Transition.STATE_TRANSITION, List.of("R"), mod(Transition.CATALYSIS, "X"),
                mod("UNKNOWN_CATALYSIS", "Y"), mod(Transition.INHIBITION, "Z"));
        add(model, "U", Transition.STATE_TRANSITION, Collections.emptyList(), mod(Transition.CATALYSIS, "X"));
        FunctionSynthesizer.create(1, false).synthesize(model);
        assertThat(model.getSpecies("T").getFunction(), equalTo("(R & !Z & (X | Y))"));
        assertThat(model.getSpecies("U").getFunction(), equalTo("X"));
    }

    @Test
    public void testAndGate() {
        SignalModel model = build("P", "Q", "S", "T");
        add(model, "T", Transition.STATE_TRANSITION, Collections.emptyList(), mod(Transition.AND_GATE, "P", "Q"),
                mod(Transition.UNKNOWN_INHIBITION, "S"));
        FunctionSynthesizer.create(1, false).synthesize(model);
        assertThat(model.getSpecies("T").getFunction(), equalTo("(P & Q & !S)"));
    }

    @Test
    public void testSelfLoops() {
        SignalModel model = build("A", "T");
        add(model, "T", Transition.STATE_TRANSITION, List.of("A"), mod(Transition.CATALYSIS, "T"));
        FunctionSynthesizer.create(1, false).synthesize(model);
        assertThat(model.getSpecies("T").getFunction(), equalTo("(A & T)"));
        FunctionSynthesizer.create(1, true).synthesize(model);
        assertThat(model.getSpecies("T").getFunction(), equalTo("A"));
        // A transition with nothing but the self-reference leaves the species an input.
        SignalModel model2 = build("T");
        add(model2, "T", Transition.STATE_TRANSITION, List.of("T"));
        LogicalModel logical = FunctionSynthesizer.create(1, true).synthesize(model2);
        assertThat(model2.getSpecies("T").getFunction(), equalTo("T"));
        assertThat(logical.isInput(model2.getSpecies("T")), equalTo(true));
    }

    @Test
    public void testPhenotypeSwap() {
        SignalModel model = build("A", "B");
        Species pheno = new Species("P", "Death", Species.PHENOTYPE);
        model.addSpecies(pheno);
        add(model, "P", Transition.NEGATIVE_INFLUENCE, List.of("A"), mod(Transition.INHIBITION, "B"));
        FunctionSynthesizer.create(1, false).synthesize(model);
        assertThat(pheno.getFunction(), equalTo("(B & !A)"));
        // A non-phenotype target is not swapped.
        SignalModel model2 = build("A", "B", "C");
        add(model2, "C", Transition.NEGATIVE_INFLUENCE, List.of("A"), mod(Transition.INHIBITION, "B"));
        FunctionSynthesizer.create(1, false).synthesize(model2);
        assertThat(model2.getSpecies("C").getFunction(), equalTo("(A & !B)"));
    }

    @Test
    public void testMissingReferences() {
        SignalModel model = build("A", "T");
        add(model, "T", Transition.STATE_TRANSITION, List.of("A", "gone"), mod(Transition.INHIBITION, "lost"));
        FunctionSynthesizer.create(1, false).synthesize(model);
        assertThat(model.getSpecies("T").getFunction(), equalTo("A"));
    }

    @Test
    public void testFixedSpecies() {
        SignalModel model = build("A", "T");
        add(model, "T", Transition.STATE_TRANSITION, List.of("A"));
        model.getSpecies("T").fix(0);
        LogicalModel logical = FunctionSynthesizer.create(1, false).synthesize(model);
        assertThat(logical.getExpression("T"), nullValue());
        assertThat(model.getSpecies("T").getFunction(), equalTo("0"));
        assertThat(logical.isInput(model.getSpecies("T")), equalTo(false));
    }

    @Test
    public void testMultiValued() {
        SignalModel model = build("A", "B");
        add(model, "B", Transition.STATE_TRANSITION, List.of("A"));
        FunctionSynthesizer synthesizer = FunctionSynthesizer.create(3, false);
        assertThat(synthesizer, instanceOf(MultiValuedSynthesizer.class));
        LogicalModel logical = synthesizer.synthesize(model);
        assertThat(logical.getGranularity(), equalTo(3));
        assertThat(model.getSpecies("B").getFunction(), equalTo(""));
        assertThat(model.getSpecies("A").getFunction(), equalTo("A"));
        assertThat(logical.isInput(model.getSpecies("A")), equalTo(true));
        assertThat(logical.isInput(model.getSpecies("B")), equalTo(false));
    }

    @Test
    public void testDiagram() throws IOException {
        SignalModel model = ModelFormat.CD.read(new File("data", "simple_cd.xml"));
        new ModelSimplifier(DEFAULTS).simplify(model);
        FunctionSynthesizer.create(1, false).synthesize(model);
        assertThat(model.getSpecies("sa4").getFunction(), equalTo("(A | (B & !C))"));
        assertThat(model.getSpecies("csa1").getFunction(), equalTo("(C & C1_complex)"));
        assertThat(model.getSpecies("sa7").getFunction(), equalTo("X"));
        FunctionSynthesizer.create(1, true).synthesize(model);
        assertThat(model.getSpecies("csa1").getFunction(), equalTo("C"));
    }

    @Test
    public void testWellFormedFunctions() throws IOException {
        for (ModelFormat format : ModelFormat.values()) {
            String fileName = (format == ModelFormat.CD ? "simple_cd.xml" : "simple_sbgn.xml");
            SignalModel model = format.read(new File("data", fileName));
            new ModelSimplifier(DEFAULTS).simplify(model);
            FunctionSynthesizer.create(1, false).synthesize(model);
            Set<String> names = new HashSet<String>();
            for (Species species : model.getAllSpecies())
                names.add(species.getName());
            StringWriter buffer = new StringWriter();
            new SpeciesCsvWriter().writeBnet(model, buffer);
            String[] lines = StringUtils.split(buffer.toString(), "\r\n");
            assertThat(lines[0], equalTo(SpeciesCsvWriter.BNET_HEADER));
            assertThat(lines.length, equalTo(model.size() + 1));
            for (int i = 1; i < lines.length; i++) {
                String name = StringUtils.substringBefore(lines[i], ", ");
                String function = StringUtils.substringAfter(lines[i], ", ");
                assertThat(lines[i], name, in(names));
                int depth = 0;
                for (char c : function.toCharArray()) {
                    if (c == '(')
                        depth++;
                    else if (c == ')')
                        depth--;
                    assertThat(lines[i], depth, greaterThanOrEqualTo(0));
                }
                assertThat(lines[i], depth, equalTo(0));
                for (String token : StringUtils.split(function, "()&|! "))
                    assertThat(lines[i], token, in(names));
            }
        }
    }

}
