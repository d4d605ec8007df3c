/**
 *
 */
package org.signalq.io;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.stream.XMLStreamException;

import org.apache.commons.lang3.StringUtils;
import org.sbml.jsbml.CVTerm;
import org.sbml.jsbml.Compartment;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.SBMLWriter;
import org.sbml.jsbml.ext.layout.BoundingBox;
import org.sbml.jsbml.ext.layout.GeneralGlyph;
import org.sbml.jsbml.ext.layout.Layout;
import org.sbml.jsbml.ext.layout.LayoutConstants;
import org.sbml.jsbml.ext.layout.LayoutModelPlugin;
import org.sbml.jsbml.ext.qual.FunctionTerm;
import org.sbml.jsbml.ext.qual.InputTransitionEffect;
import org.sbml.jsbml.ext.qual.OutputTransitionEffect;
import org.sbml.jsbml.ext.qual.QualConstants;
import org.sbml.jsbml.ext.qual.QualModelPlugin;
import org.sbml.jsbml.ext.qual.QualitativeSpecies;
import org.sbml.jsbml.ext.qual.Sign;
import org.sbml.jsbml.ext.qual.Transition;
import org.signalq.logic.LogicExpression;
import org.signalq.logic.LogicalModel;
import org.signalq.network.AnnotationSet;
import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object renders a logical model as an SBML Level 3 document using the qualitative-models package.
 * Each species becomes a qualitative species with a maximum level of 1.  Each species with a logical
 * function gets a transition whose inputs are the species in its function and whose single function term
 * sets the level to 1 when the function is true.  The default term sets the level to 0.
 *
 * The diagram geometry is kept in an optional layout:  the layout has the dimensions of the canvas, and
 * each qualitative species has a general glyph with the bounding box of its species.
 *
 */
public class QualWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(QualWriter.class);
    /** ID of the model */
    private String modelId;
    /** ID of the diagram layout */
    public static final String LAYOUT_ID = "layout1";

    /**
     * Create a qual writer.
     *
     * @param modelId	ID to give to the SBML model
     */
    public QualWriter(String modelId) {
        this.modelId = modelId;
    }

    /**
     * Build the SBML document for a logical model.
     *
     * @param logical	logical model to render
     *
     * @return the SBML document
     */
    public SBMLDocument build(LogicalModel logical) {
        SignalModel signals = logical.getModel();
        SBMLDocument retVal = new SBMLDocument(3, 1);
        retVal.enablePackage(QualConstants.shortLabel);
        retVal.setPackageRequired(QualConstants.shortLabel, true);
        retVal.enablePackage(LayoutConstants.shortLabel);
        retVal.setPackageRequired(LayoutConstants.shortLabel, false);
        Model model = retVal.createModel(this.modelId);
        QualModelPlugin qualModel = (QualModelPlugin) model.getPlugin(QualConstants.shortLabel);
        LayoutModelPlugin layoutModel = (LayoutModelPlugin) model.getPlugin(LayoutConstants.shortLabel);
        Layout layout = layoutModel.createLayout(LAYOUT_ID);
        layout.createDimensions(signals.getWidth(), signals.getHeight(), 0.0);
        // Create the compartments.
        Map<String, String> compartments = new LinkedHashMap<String, String>();
        for (Species species : signals.getAllSpecies()) {
            String name = species.getCompartment();
            if (! compartments.containsKey(name)) {
                String cid = "comp" + (compartments.size() + 1);
                Compartment compartment = model.createCompartment(cid);
                compartment.setName(name);
                compartment.setConstant(true);
                compartments.put(name, cid);
            }
        }
        // Create the species.
        for (Species species : signals.getAllSpecies()) {
            QualitativeSpecies qSpecies = qualModel.createQualitativeSpecies(species.getId());
            qSpecies.setName(species.getName());
            qSpecies.setCompartment(compartments.get(species.getCompartment()));
            qSpecies.setMaxLevel(1);
            qSpecies.setConstant(logical.isInput(species) && ! species.hasTransitions());
            if (species.getFixedLevel() != null) {
                qSpecies.setInitialLevel(species.getFixedLevel());
                qSpecies.setConstant(true);
            }
            this.addAnnotations(qSpecies, species);
            this.addGlyph(layout, species);
        }
        // Create the transitions.
        int count = 0;
        for (Species species : signals.getAllSpecies()) {
            LogicExpression expression = logical.getExpression(species.getId());
            if (expression != null) {
                this.addTransition(qualModel, species, expression, logical.getInfluences(species));
                count++;
            }
        }
        log.info("SBML-qual model has {} species and {} transitions.", signals.size(), count);
        return retVal;
    }

    /**
     * Add the transition for a species.
     *
     * @param qualModel		qualitative model plugin
     * @param species		species produced by the transition
     * @param expression	logical function of the species
     * @param influences	signed influences on the species
     */
    private void addTransition(QualModelPlugin qualModel, Species species, LogicExpression expression,
            List<LogicExpression.Literal> influences) {
        String id = species.getId();
        Transition transition = qualModel.createTransition("tr_" + id);
        // Combine the signs for each input species.
        Map<String, Sign> signs = new LinkedHashMap<String, Sign>();
        for (LogicExpression.Literal literal : influences) {
            Sign sign = (literal.isPositive() ? Sign.positive : Sign.negative);
            signs.merge(literal.getId(), sign, (x, y) -> (x == y ? x : Sign.dual));
        }
        int n = 0;
        for (Map.Entry<String, Sign> input : signs.entrySet()) {
            n++;
            transition.createInput("tr_" + id + "_in_" + n, input.getKey(), InputTransitionEffect.none)
                    .setSign(input.getValue());
        }
        transition.createOutput("tr_" + id + "_out", id, OutputTransitionEffect.assignmentLevel);
        FunctionTerm defaultTerm = new FunctionTerm();
        defaultTerm.setDefaultTerm(true);
        defaultTerm.setResultLevel(0);
        transition.addFunctionTerm(defaultTerm);
        FunctionTerm term = new FunctionTerm();
        term.setResultLevel(1);
        term.setMath(expression.toMath());
        transition.addFunctionTerm(term);
    }

    /**
     * Add the layout glyph for a species.
     *
     * @param layout	diagram layout
     * @param species	species to position
     */
    private void addGlyph(Layout layout, Species species) {
        GeneralGlyph glyph = layout.createGeneralGlyph("glyph_" + species.getId());
        glyph.setReference(species.getId());
        BoundingBox box = glyph.createBoundingBox();
        box.createPosition(species.getX(), species.getY(), 0.0);
        box.createDimensions(species.getW(), species.getH(), 0.0);
    }

    /**
     * Copy the annotations of a species to the qualitative species as controlled-vocabulary terms.
     *
     * @param qSpecies	qualitative species to update
     * @param species	source species
     */
    private void addAnnotations(QualitativeSpecies qSpecies, Species species) {
        AnnotationSet annotations = species.getAnnotations();
        if (! annotations.isEmpty()) {
            qSpecies.setMetaId("meta_" + species.getId());
            for (String qualifier : annotations.getQualifiers()) {
                CVTerm.Qualifier type = qualifierOf(qualifier);
                if (type == null)
                    log.debug("Unsupported annotation qualifier {} for {}.", qualifier, species.getId());
                else {
                    CVTerm term = new CVTerm(type);
                    for (String resource : annotations.getResources(qualifier))
                        term.addResource(resource);
                    qSpecies.addCVTerm(term);
                }
            }
        }
    }

    /**
     * Convert an annotation qualifier to a JSBML qualifier.
     *
     * @param qualifier		qualifier name, such as "bqbiol:isDescribedBy"
     *
     * @return the corresponding JSBML qualifier, or NULL if there is none
     */
    public static CVTerm.Qualifier qualifierOf(String qualifier) {
        CVTerm.Qualifier retVal = null;
        String prefix = StringUtils.substringBefore(qualifier, ":");
        String base = StringUtils.substringAfter(qualifier, ":");
        String tag = null;
        if (prefix.equals("bqbiol"))
            tag = "BQB_";
        else if (prefix.equals("bqmodel"))
            tag = "BQM_";
        if (tag != null && ! base.isEmpty()) {
            String[] words = StringUtils.splitByCharacterTypeCamelCase(base);
            try {
                retVal = CVTerm.Qualifier.valueOf(tag + StringUtils.join(words, '_').toUpperCase());
            } catch (IllegalArgumentException e) {
                retVal = null;
            }
        }
        return retVal;
    }

    /**
     * Write a logical model to an SBML-qual file.
     *
     * @param logical	logical model to render
     * @param outFile	output file
     *
     * @throws IOException
     */
    public void write(LogicalModel logical, File outFile) throws IOException {
        SBMLDocument doc = this.build(logical);
        try {
            new SBMLWriter().write(doc, outFile);
        } catch (XMLStreamException e) {
            throw new IOException("Error writing SBML to " + outFile + ": " + e.getMessage(), e);
        }
        log.info("SBML-qual model written to {}.", outFile);
    }

}
