/**
 *
 */
package org.signalq.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.signalq.network.Transition;

/**
 * Tests for reading SBGN-ML diagrams.
 *
 */
public class SbgnReaderTest {

    @Test
    public void testRead() throws IOException {
        SignalModel model = ModelFormat.SBGN.read(new File("data", "simple_sbgn.xml"));
        assertThat(model.getWidth(), closeTo(1000.0, 0.001));
        assertThat(model.getIds(), contains("m1", "m2", "m3", "m4", "ph1"));
        Species tnf = model.getSpecies("m1");
        assertThat(tnf.getName(), equalTo("TNFalpha"));
        assertThat(tnf.getCompartment(), equalTo("cell"));
        assertThat(tnf.getReferenceId(), equalTo("TNFalpha__cell__inactive"));
        assertThat(tnf.getAnnotations().getResources("bqbiol:is"), contains("urn:miriam:uniprot:P01375"));
        Species raf = model.getSpecies("m3");
        assertThat(raf.getActivity(), equalTo(Species.ACTIVE));
        assertThat(raf.getReferenceId(), equalTo("RAF__cell__active"));
        assertThat(model.getSpecies("m4").getCompartment(), equalTo("cell_nucleus"));
        Species pheno = model.getSpecies("ph1");
        assertThat(pheno.getType(), equalTo(Species.PHENOTYPE));
        assertThat(pheno.getName(), equalTo("Apoptosis_phenotype"));
        assertThat(model.getGroupings().get("RAF"), contains("m2", "m3"));
    }

    @Test
    public void testProcesses() throws IOException {
        SignalModel model = ModelFormat.SBGN.read(new File("data", "simple_sbgn.xml"));
        Transition t1 = model.getSpecies("m3").getTransitions().get(0);
        assertThat(t1.getType(), equalTo(Transition.STATE_TRANSITION));
        assertThat(t1.getReactants(), contains("m2"));
        assertThat(t1.getModifiers().size(), equalTo(1));
        assertThat(t1.getModifiers().get(0).getKind(), equalTo("STIMULATION"));
        assertThat(t1.getModifiers().get(0).getSpecies(), contains("m1"));
        // The AND gate becomes a single modifier.
        Transition t2 = model.getSpecies("m4").getTransitions().get(0);
        assertThat(t2.getReactants(), empty());
        assertThat(t2.getModifiers().size(), equalTo(1));
        assertThat(t2.getModifiers().get(0).getKind(), equalTo(Transition.AND_GATE));
        assertThat(t2.getModifiers().get(0).getSpecies(), contains("m1", "m3"));
        // The arc pointing straight at the phenotype becomes a transition.
        Transition t3 = model.getSpecies("ph1").getTransitions().get(0);
        assertThat(t3.getType(), equalTo(Transition.INHIBITION));
        assertThat(t3.getReactants(), contains("m4"));
        assertThat(model.getSpecies("m1").hasTransitions(), equalTo(false));
    }

    @Test
    public void testNames() {
        assertThat(SbgnReader.greeksToNames("NF-κB"), equalTo("NF-kappaB"));
        assertThat(SbgnReader.greeksToNames("Ω-3"), equalTo("Omega-3"));
        assertThat(SbgnReader.greeksToNames("plain"), equalTo("plain"));
        assertThat(SbgnReader.classToType("complex"), equalTo(Species.COMPLEX));
        assertThat(SbgnReader.classToType("nucleic acid feature"), equalTo("NUCLEIC_ACID_FEATURE"));
        assertThat(SbgnReader.classToType("simple chemical"), equalTo(Species.PROTEIN));
    }

    @Test
    public void testWrongFormat() {
        assertThrows(IOException.class, () -> new SbgnReader().read(new File("data", "simple_cd.xml")));
    }

}
