/**
 *
 */
package org.signalq.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.signalq.network.Transition;

/**
 * Tests for reading CellDesigner diagrams.
 *
 */
public class CellDesignerReaderTest {

    @Test
    public void testRead() throws IOException {
        SignalModel model = new CellDesignerReader().read(new File("data", "simple_cd.xml"));
        assertThat(model.getWidth(), closeTo(1200.0, 0.001));
        assertThat(model.getHeight(), closeTo(800.0, 0.001));
        // The degraded species and the complex member are not present.
        assertThat(model.getIds(), contains("csa1", "sa1", "sa2", "sa3", "sa4", "sa5", "sa6", "sa7"));
        Species a = model.getSpecies("sa1");
        assertThat(a.getName(), equalTo("A"));
        assertThat(a.getType(), equalTo(Species.PROTEIN));
        assertThat(a.getReferenceId(), equalTo("s1"));
        assertThat(a.getCompartment(), equalTo("cytoplasm"));
        assertThat(a.getActivity(), equalTo(Species.INACTIVE));
        assertThat(a.isReceptor(), equalTo(false));
        assertThat(a.getX(), closeTo(50.0, 0.001));
        assertThat(a.getH(), closeTo(40.0, 0.001));
        assertThat(a.getAnnotations().getResources("bqbiol:is"), contains("urn:miriam:uniprot:P00001"));
        assertThat(model.getSpecies("sa5").getReferenceId(), equalTo("s1"));
        assertThat(model.getSpecies("sa6").getCompartment(), equalTo(Species.DEFAULT_COMPARTMENT));
        Species complex = model.getSpecies("csa1");
        assertThat(complex.getType(), equalTo(Species.COMPLEX));
        assertThat(complex.getName(), equalTo("C1_complex"));
        assertThat(complex.getAnnotations().getResources("bqbiol:hasPart"), contains("urn:miriam:uniprot:P00010"));
        assertThat(model.getGroupings().get("A"), contains("sa1", "sa5"));
    }

    @Test
    public void testReactions() throws IOException {
        SignalModel model = new CellDesignerReader().read(new File("data", "simple_cd.xml"));
        Species d = model.getSpecies("sa4");
        assertThat(d.getName(), equalTo("D_phosphorylated"));
        List<Transition> transitions = d.getTransitions();
        assertThat(transitions.size(), equalTo(2));
        Transition t1 = transitions.get(0);
        assertThat(t1.getType(), equalTo(Transition.STATE_TRANSITION));
        assertThat(t1.getReactants(), contains("sa5"));
        assertThat(t1.getModifiers(), empty());
        assertThat(t1.getAnnotations().getResources("bqbiol:isDescribedBy"), contains("urn:miriam:pubmed:123456"));
        Transition t2 = transitions.get(1);
        assertThat(t2.getReactants(), contains("sa2"));
        assertThat(t2.getNotes(), equalTo("B is blocked by C"));
        assertThat(t2.getModifiers().size(), equalTo(1));
        assertThat(t2.getModifiers().get(0).getKind(), equalTo(Transition.INHIBITION));
        assertThat(t2.getModifiers().get(0).getSpecies(), contains("sa3"));
        // The complex member used as a modifier is replaced by its complex.
        Transition t3 = model.getSpecies("csa1").getTransitions().get(0);
        assertThat(t3.getReactants(), contains("sa3"));
        assertThat(t3.getModifiers().get(0).getSpecies(), contains("csa1"));
        // The reaction into the degraded species is lost.
        assertThat(model.getSpecies("sa7").getTransitions().size(), equalTo(1));
        assertThat(model.getSpecies("sa3").hasTransitions(), equalTo(false));
    }

    @Test
    public void testPreciseNames() {
        assertThat(CellDesignerReader.makeNamePrecise("IL_sub_6_endsub", Species.PROTEIN, List.of()), equalTo("IL_6"));
        assertThat(CellDesignerReader.makeNamePrecise("A_underscore_B", Species.PROTEIN, List.of()), equalTo("A_B"));
        assertThat(CellDesignerReader.makeNamePrecise("cAMP", "SIMPLE_MOLECULE", List.of()),
                equalTo("cAMP_simple_molecule"));
        assertThat(CellDesignerReader.makeNamePrecise("STAT3", Species.PROTEIN, List.of("phosphorylated", "acetylated")),
                equalTo("STAT3_phosphorylated_acetylated"));
    }

    @Test
    public void testWrongFormat() {
        assertThrows(IOException.class, () -> new CellDesignerReader().read(new File("data", "simple_sbgn.xml")));
        assertThrows(IOException.class, () -> ModelFormat.CD.read(new File("data", "fixed.csv")));
    }

}
