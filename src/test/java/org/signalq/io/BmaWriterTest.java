/**
 *
 */
package org.signalq.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.signalq.logic.FunctionSynthesizer;
import org.signalq.logic.LogicalModel;
import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.signalq.network.Transition;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * Tests for the BioModelAnalyzer renderer.
 *
 */
public class BmaWriterTest {

    /**
     * @return a small signalling model:  D = (A | (B & !C)), E = !D, with A, B, C in the cytoplasm
     */
    protected static SignalModel buildModel() {
        SignalModel retVal = new SignalModel(500.0, 400.0);
        for (String id : List.of("A", "B", "C", "D", "E")) {
            Species species = new Species(id, id, Species.PROTEIN);
            species.setBounds(10.0 * retVal.size(), 20.0, 80.0, 40.0);
            retVal.addSpecies(species);
        }
        for (String id : List.of("A", "B", "C"))
            retVal.getSpecies(id).setCompartment("cytoplasm");
        retVal.getSpecies("D").setCompartment("nucleus");
        Species d = retVal.getSpecies("D");
        d.addTransition(new Transition(Transition.STATE_TRANSITION, List.of("A"), List.of()));
        d.addTransition(new Transition(Transition.STATE_TRANSITION, List.of("B"),
                List.of(new Transition.Modifier(Transition.INHIBITION, "C"))));
        retVal.getSpecies("E").addTransition(new Transition(Transition.STATE_TRANSITION, List.of(),
                List.of(new Transition.Modifier(Transition.INHIBITION, "D"))));
        return retVal;
    }

    @Test
    public void testBuild() {
        LogicalModel logical = FunctionSynthesizer.create(1, false).synthesize(buildModel());
        JsonObject universe = new BmaWriter(null, true).build(logical);
        JsonObject model = (JsonObject) universe.get("Model");
        assertThat(model.get("Name"), equalTo(BmaWriter.MODEL_NAME));
        JsonArray vars = (JsonArray) model.get("Variables");
        assertThat(vars.size(), equalTo(5));
        JsonObject varA = (JsonObject) vars.get(0);
        assertThat(varA.get("Id"), equalTo(1));
        assertThat(varA.get("Name"), equalTo("A"));
        assertThat(varA.get("RangeTo"), equalTo(1));
        assertThat(varA.get("Formula"), equalTo("1"));
        JsonObject varD = (JsonObject) vars.get(3);
        assertThat(varD.get("Formula"), equalTo("max(var(1),min(var(2),(1-var(3))))"));
        JsonObject varE = (JsonObject) vars.get(4);
        assertThat(varE.get("Formula"), equalTo("(1-var(4))"));
        JsonArray rels = (JsonArray) model.get("Relationships");
        assertThat(rels.size(), equalTo(4));
        JsonObject rel = (JsonObject) rels.get(2);
        assertThat(rel.get("Id"), equalTo(8));
        assertThat(rel.get("FromVariable"), equalTo(3));
        assertThat(rel.get("ToVariable"), equalTo(4));
        assertThat(rel.get("Type"), equalTo("Inhibitor"));
        // Check the layout colors.
        JsonObject layout = (JsonObject) universe.get("Layout");
        JsonArray layoutVars = (JsonArray) layout.get("Variables");
        assertThat(((JsonObject) layoutVars.get(0)).get("Fill"), equalTo("BMA_Green"));
        assertThat(((JsonObject) layoutVars.get(3)).get("Fill"), equalTo("BMA_Orange"));
        assertThat(((JsonObject) layoutVars.get(4)).get("Fill"), equalTo("BMA_Purple"));
        assertThat(((JsonObject) layoutVars.get(1)).get("PositionX"), equalTo(10.0));
        assertThat(universe.get("ltl"), instanceOf(JsonObject.class));
    }

    @Test
    public void testOptions() {
        LogicalModel logical = FunctionSynthesizer.create(1, false).synthesize(buildModel());
        JsonObject universe = new BmaWriter(0, false).build(logical);
        JsonArray vars = (JsonArray) ((JsonObject) universe.get("Model")).get("Variables");
        assertThat(((JsonObject) vars.get(0)).get("Formula"), equalTo("0"));
        JsonArray layoutVars = (JsonArray) ((JsonObject) universe.get("Layout")).get("Variables");
        assertThat(((JsonObject) layoutVars.get(0)).containsKey("Fill"), equalTo(false));
        // Multi-valued models leave the formulas to BMA.
        logical = FunctionSynthesizer.create(2, false).synthesize(buildModel());
        universe = new BmaWriter(null, false).build(logical);
        vars = (JsonArray) ((JsonObject) universe.get("Model")).get("Variables");
        assertThat(((JsonObject) vars.get(0)).get("Formula"), equalTo("2"));
        assertThat(((JsonObject) vars.get(0)).get("RangeTo"), equalTo(2));
        assertThat(((JsonObject) vars.get(3)).get("Formula"), equalTo(""));
    }

    @Test
    public void testCleanName() {
        assertThat(BmaWriter.cleanName("IL-6 (p), x+y:z/w"), equalTo("IL_6_p__xyzw"));
        assertThat(BmaWriter.cleanName("plain_name"), equalTo("plain_name"));
    }

    @Test
    public void testWrite(@TempDir File tempDir) throws IOException, JsonException {
        LogicalModel logical = FunctionSynthesizer.create(1, false).synthesize(buildModel());
        File outFile = new File(tempDir, "model.json");
        new BmaWriter(null, true).write(logical, outFile);
        String text = FileUtils.readFileToString(outFile, StandardCharsets.UTF_8);
        JsonObject universe = (JsonObject) Jsoner.deserialize(text);
        JsonArray vars = (JsonArray) ((JsonObject) universe.get("Model")).get("Variables");
        assertThat(vars.size(), equalTo(5));
        assertThat(((JsonObject) vars.get(3)).get("Name"), equalTo("D"));
    }

}
