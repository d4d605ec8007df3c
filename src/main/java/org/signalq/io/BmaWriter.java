/**
 *
 */
package org.signalq.io;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.signalq.logic.IdCounter;
import org.signalq.logic.LogicalModel;
import org.signalq.logic.Relationship;
import org.signalq.network.Species;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object renders a logical model in the JSON format of the BioModelAnalyzer tool.  The variables are
 * numbered from 1 in model order, and the relationships are numbered from the same counter.  The formula of
 * each variable is the min/max form of its logical function.  Input variables are set to the configured
 * input level, which defaults to the granularity.
 *
 * The layout section gives each variable the position of its species, and fills the variables in the four
 * most populated compartments with distinct colors.
 *
 */
public class BmaWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BmaWriter.class);
    /** level for input variables, or NULL to use the granularity */
    private Integer inputLevel;
    /** TRUE if the variables should be colored by compartment */
    private boolean colorByCompartment;

    /** model name */
    public static final String MODEL_NAME = "CaSQ-BMA";
    /** fill colors for the most populated compartments */
    private static final String[] COLORS = new String[] { "BMA_Green", "BMA_Orange", "BMA_Purple", "BMA_Mint" };
    /** characters removed from names */
    private static final String REMOVED = "()+:/\\";
    /** characters converted to underscores in names */
    private static final String UNDERSCORED = " ,-";

    /**
     * Create a BMA writer.
     *
     * @param inputLevel			level for input variables, or NULL to use the granularity
     * @param colorByCompartment	TRUE to color the variables by compartment
     */
    public BmaWriter(Integer inputLevel, boolean colorByCompartment) {
        this.inputLevel = inputLevel;
        this.colorByCompartment = colorByCompartment;
    }

    /**
     * Build the JSON object for a logical model.
     *
     * @param logical	logical model to render
     *
     * @return the JSON object
     */
    public JsonObject build(LogicalModel logical) {
        final int granularity = logical.getGranularity();
        final int inputValue = (this.inputLevel == null ? granularity : this.inputLevel);
        Map<String, String> colors = (this.colorByCompartment ? this.computeColors(logical) : new HashMap<String, String>());
        IdCounter counter = new IdCounter(1);
        Map<String, Integer> ids = logical.assignIds(counter);
        List<Relationship> relationships = logical.getRelationships(ids, counter);
        JsonArray modelVars = new JsonArray();
        JsonArray layoutVars = new JsonArray();
        for (Species species : logical.getModel().getAllSpecies()) {
            int vid = ids.get(species.getId());
            String name = cleanName(species.getName());
            JsonObject modelVar = new JsonObject();
            modelVar.put("Name", name);
            modelVar.put("Id", vid);
            modelVar.put("RangeFrom", 0);
            modelVar.put("RangeTo", granularity);
            modelVar.put("Formula", logical.getMinMaxFormula(species, ids, inputValue));
            modelVars.add(modelVar);
            JsonObject layoutVar = new JsonObject();
            layoutVar.put("Id", vid);
            layoutVar.put("Name", name);
            layoutVar.put("Type", "Constant");
            layoutVar.put("ContainerId", 0);
            layoutVar.put("PositionX", species.getX());
            layoutVar.put("PositionY", species.getY());
            layoutVar.put("CellX", 0);
            layoutVar.put("CellY", 0);
            layoutVar.put("Angle", 0);
            layoutVar.put("Description", "");
            String fill = colors.get(species.getCompartment());
            if (fill != null)
                layoutVar.put("Fill", fill);
            layoutVars.add(layoutVar);
        }
        JsonArray rels = new JsonArray();
        for (Relationship relationship : relationships) {
            JsonObject rel = new JsonObject();
            rel.put("Id", relationship.getId());
            rel.put("FromVariable", relationship.getFrom());
            rel.put("ToVariable", relationship.getTo());
            rel.put("Type", relationship.getType().getLabel());
            rels.add(rel);
        }
        JsonObject model = new JsonObject();
        model.put("Name", MODEL_NAME);
        model.put("Variables", modelVars);
        model.put("Relationships", rels);
        JsonObject layout = new JsonObject();
        layout.put("Variables", layoutVars);
        layout.put("Containers", new JsonArray());
        layout.put("Description", "");
        JsonObject ltl = new JsonObject();
        ltl.put("states", new JsonArray());
        ltl.put("operations", new JsonArray());
        JsonObject retVal = new JsonObject();
        retVal.put("Model", model);
        retVal.put("Layout", layout);
        retVal.put("ltl", ltl);
        log.info("BMA model has {} variables and {} relationships.", modelVars.size(), rels.size());
        return retVal;
    }

    /**
     * Assign colors to the most populated compartments.  Ties are broken by order of first appearance.
     *
     * @param logical	logical model being rendered
     *
     * @return a map from compartment names to fill colors
     */
    private Map<String, String> computeColors(LogicalModel logical) {
        Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
        for (Species species : logical.getModel().getAllSpecies())
            counts.merge(species.getCompartment(), 1, Integer::sum);
        List<Map.Entry<String, Integer>> sorted = new ArrayList<Map.Entry<String, Integer>>(counts.entrySet());
        sorted.sort((a, b) -> b.getValue() - a.getValue());
        Map<String, String> retVal = new HashMap<String, String>();
        for (int i = 0; i < sorted.size() && i < COLORS.length; i++)
            retVal.put(sorted.get(i).getKey(), COLORS[i]);
        return retVal;
    }

    /**
     * @return a name with the characters BMA cannot handle removed or converted to underscores
     *
     * @param name	name to clean
     */
    public static String cleanName(String name) {
        StringBuilder retVal = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (UNDERSCORED.indexOf(c) >= 0)
                retVal.append('_');
            else if (REMOVED.indexOf(c) < 0)
                retVal.append(c);
        }
        return retVal.toString();
    }

    /**
     * Write a logical model to a BMA JSON file.
     *
     * @param logical	logical model to render
     * @param outFile	output file
     *
     * @throws IOException
     */
    public void write(LogicalModel logical, File outFile) throws IOException {
        JsonObject universe = this.build(logical);
        FileUtils.writeStringToFile(outFile, Jsoner.prettyPrint(universe.toJson()), StandardCharsets.UTF_8);
        log.info("BMA model written to {}.", outFile);
    }

}
