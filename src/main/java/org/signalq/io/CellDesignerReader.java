/**
 *
 */
package org.signalq.io;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.signalq.network.AnnotationSet;
import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.signalq.network.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * This object reads a CellDesigner diagram into a signalling model.  CellDesigner files are SBML Level 2
 * Version 4 with a CellDesigner extension in the model annotation.  Each top-level species alias or complex
 * alias with display bounds becomes a species.  Aliases nested inside a complex are represented by the
 * complex, and degraded species are skipped.  Each reaction becomes a transition on every product.
 *
 * The species name is made precise by removing the subscript markers and the characters that have meaning
 * in logical formulas, then appending the class (for non-proteins) and the modifications.
 *
 */
public class CellDesignerReader {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CellDesignerReader.class);
    /** XPath helper */
    private XmlHelper xml;
    /** map of species alias IDs to the IDs of the complex aliases containing them */
    private Map<String, String> complexOfAlias;
    /** map of SBML species IDs to the IDs of the complex aliases containing them */
    private Map<String, String> complexOfSpecies;
    /** map of compartment alias IDs to compartment names */
    private Map<String, String> compartmentNames;

    /** SBML namespace */
    public static final String SBML_NS = "http://www.sbml.org/sbml/level2/version4";
    /** CellDesigner namespace */
    public static final String CD_NS = "http://www.sbml.org/2001/ns/celldesigner";
    /** XHTML namespace */
    public static final String XHTML_NS = "http://www.w3.org/1999/xhtml";
    /** path to the CellDesigner extension */
    private static final String EXTENSION = "./sbml:annotation/cd:extension";
    /** name tokens to remove */
    private static final List<String> REMOVE_TOKENS = List.of("sub", "endsub");
    /** name tokens to blank out */
    private static final List<String> BLANK_TOKENS = List.of("&", "|", "!", "underscore");
    /** class type for degraded species */
    private static final String DEGRADED = "DEGRADED";

    /**
     * Create a CellDesigner reader.
     */
    public CellDesignerReader() {
        this.xml = new XmlHelper(Map.of("sbml", SBML_NS, "cd", CD_NS, "xhtml", XHTML_NS));
    }

    /**
     * Read a signalling model from a CellDesigner file.
     *
     * @param inFile	CellDesigner file to read
     *
     * @return the signalling model
     *
     * @throws IOException
     */
    public SignalModel read(File inFile) throws IOException {
        log.info("Reading CellDesigner model from {}.", inFile);
        Document doc = XmlHelper.parse(inFile);
        Element root = doc.getDocumentElement();
        if (! SBML_NS.equals(root.getNamespaceURI()) || ! "sbml".equals(root.getLocalName()))
            throw new IOException(inFile + " is not SBML Level 2 Version 4.");
        Element model = this.xml.first(root, "./sbml:model");
        if (model == null)
            throw new IOException("Could not find SBML model element in " + inFile + ".");
        Element display = this.xml.first(model, EXTENSION + "/cd:modelDisplay");
        if (display == null)
            throw new IOException("Could not find CellDesigner modelDisplay element in " + inFile + ".");
        SignalModel retVal = new SignalModel(XmlHelper.number(display, "sizeX"), XmlHelper.number(display, "sizeY"));
        this.indexAliases(model);
        this.readSpecies(model, retVal);
        this.readIncludedSpecies(model, retVal);
        int count = this.readTransitions(model, retVal);
        log.info("{} species and {} reactions read from {}.", retVal.size(), count, inFile);
        return retVal;
    }

    /**
     * Build the maps of nested aliases and compartment names.
     *
     * @param model		SBML model element
     */
    private void indexAliases(Element model) {
        this.complexOfAlias = new HashMap<String, String>();
        this.complexOfSpecies = new HashMap<String, String>();
        for (Element alias : this.xml.select(model, EXTENSION + "/cd:listOfSpeciesAliases/cd:speciesAlias")) {
            String complex = XmlHelper.attr(alias, "complexSpeciesAlias");
            if (complex != null) {
                this.complexOfAlias.put(alias.getAttribute("id"), complex);
                this.complexOfSpecies.put(alias.getAttribute("species"), complex);
            }
        }
        Map<String, String> sbmlCompartments = new HashMap<String, String>();
        for (Element compartment : this.xml.select(model, "./sbml:listOfCompartments/sbml:compartment")) {
            String id = compartment.getAttribute("id");
            sbmlCompartments.put(id, StringUtils.defaultIfEmpty(compartment.getAttribute("name"), id));
        }
        this.compartmentNames = new HashMap<String, String>();
        for (Element alias : this.xml.select(model, EXTENSION + "/cd:listOfCompartmentAliases/cd:compartmentAlias")) {
            String name = sbmlCompartments.get(alias.getAttribute("compartment"));
            if (name != null)
                this.compartmentNames.put(alias.getAttribute("id"), name);
        }
    }

    /**
     * Read the species aliases into the model.
     *
     * @param model		SBML model element
     * @param retVal	signalling model to update
     */
    private void readSpecies(Element model, SignalModel retVal) {
        // Index the SBML species and the protein types.
        Map<String, Element> sbmlSpecies = new HashMap<String, Element>();
        for (Element species : this.xml.select(model, "./sbml:listOfSpecies/sbml:species"))
            sbmlSpecies.put(species.getAttribute("id"), species);
        Map<String, String> proteinTypes = new HashMap<String, String>();
        for (Element protein : this.xml.select(model, EXTENSION + "/cd:listOfProteins/cd:protein"))
            proteinTypes.put(protein.getAttribute("id"), protein.getAttribute("type"));
        // Now process the complex aliases followed by the simple aliases.
        List<Element> aliases = this.xml.select(model, EXTENSION + "/cd:listOfComplexSpeciesAliases/cd:complexSpeciesAlias");
        aliases.addAll(this.xml.select(model, EXTENSION + "/cd:listOfSpeciesAliases/cd:speciesAlias"));
        for (Element alias : aliases) {
            Element bounds = this.xml.first(alias, ".//cd:bounds");
            if (bounds == null || alias.hasAttribute("complexSpeciesAlias"))
                continue;
            String ref = alias.getAttribute("species");
            log.debug("Parsing reference species {}.", ref);
            Element sbml = sbmlSpecies.get(ref);
            if (sbml == null)
                continue;
            Element annot = this.xml.first(sbml, "./sbml:annotation");
            if (annot == null)
                continue;
            String classType = this.xml.text(annot, ".//cd:class", Species.PROTEIN);
            if (DEGRADED.equals(classType))
                continue;
            boolean receptor = false;
            if (Species.PROTEIN.equals(classType)) {
                String proteinRef = this.xml.text(annot, ".//cd:proteinReference", "");
                receptor = "RECEPTOR".equals(proteinTypes.get(proteinRef));
            }
            List<String> mods = new ArrayList<String>();
            for (Element mod : this.xml.select(annot, ".//cd:listOfModifications/cd:modification"))
                mods.add(mod.getAttribute("state"));
            Element state = this.xml.first(annot, ".//cd:structuralState");
            String activity = (state == null ? Species.INACTIVE : state.getAttribute("structuralState"));
            String sbmlName = sbml.getAttribute("name");
            String id = alias.getAttribute("id");
            Species species = new Species(id, makeNamePrecise(sbmlName, classType, mods), classType);
            species.setReferenceId(ref);
            species.setActivity(activity);
            species.setReceptor(receptor);
            species.setCompartment(this.compartmentNames.getOrDefault(XmlHelper.attr(alias, "compartmentAlias"),
                    Species.DEFAULT_COMPARTMENT));
            species.setBounds(XmlHelper.number(bounds, "x"), XmlHelper.number(bounds, "y"),
                    XmlHelper.number(bounds, "w"), XmlHelper.number(bounds, "h"));
            this.xml.readAnnotations(this.xml.first(annot, ".//rdf:RDF"), species.getAnnotations());
            retVal.addSpecies(species);
            retVal.addGroupMember(sbmlName, id);
        }
    }

    /**
     * Add the annotations of species that only appear inside complexes to their complexes.
     *
     * @param model		SBML model element
     * @param retVal	signalling model to update
     */
    private void readIncludedSpecies(Element model, SignalModel retVal) {
        for (Element included : this.xml.select(model, EXTENSION + "/cd:listOfIncludedSpecies/cd:species")) {
            Element rdf = this.xml.first(included, "./cd:notes/xhtml:html/xhtml:body/rdf:RDF");
            if (rdf != null) {
                String id = included.getAttribute("id");
                String complex = this.complexOfSpecies.getOrDefault(id, id);
                Species target = retVal.getSpecies(complex);
                if (target != null) {
                    log.debug("Adding annotations of {} to {}.", id, complex);
                    this.xml.readAnnotations(rdf, target.getAnnotations());
                }
            }
        }
    }

    /**
     * Read the reactions into the model.
     *
     * @param model		SBML model element
     * @param retVal	signalling model to update
     *
     * @return the number of reactions read
     */
    private int readTransitions(Element model, SignalModel retVal) {
        int count = 0;
        for (Element reaction : this.xml.select(model, "./sbml:listOfReactions/sbml:reaction")) {
            log.debug("Parsing reaction {}.", reaction.getAttribute("id"));
            Element annot = this.xml.first(reaction, EXTENSION);
            if (annot == null)
                continue;
            String type = this.xml.text(annot, "./cd:reactionType", null);
            List<String> reactants = this.aliasList(annot, "./cd:baseReactants/cd:baseReactant",
                    "./cd:listOfReactantLinks/cd:reactantLink", retVal);
            List<String> products = this.aliasList(annot, "./cd:baseProducts/cd:baseProduct",
                    "./cd:listOfProductLinks/cd:productLink", retVal);
            Element body = this.xml.first(reaction, "./sbml:notes//xhtml:body");
            String notes = (body == null ? null : body.getTextContent().trim());
            Element rdf = this.xml.first(reaction, "./sbml:annotation/rdf:RDF");
            // Each product gets its own copy of the transition.
            for (String product : products) {
                List<Transition.Modifier> modifiers = new ArrayList<Transition.Modifier>();
                for (Element mod : this.xml.select(annot, "./cd:listOfModification/cd:modification")) {
                    List<String> ids = new ArrayList<String>();
                    for (String alias : StringUtils.split(mod.getAttribute("aliases"), ','))
                        ids.add(this.decomplexify(alias.trim()));
                    if (! ids.isEmpty())
                        modifiers.add(new Transition.Modifier(mod.getAttribute("type"), ids));
                }
                AnnotationSet annotations = new AnnotationSet();
                this.xml.readAnnotations(rdf, annotations);
                retVal.getSpecies(product).addTransition(new Transition(type, reactants, modifiers, notes, annotations));
            }
            count++;
        }
        return count;
    }

    /**
     * Get the decomplexified aliases for the reactants or products of a reaction.  Aliases not in the
     * model (which includes degraded species) are removed.
     *
     * @param annot		reaction extension element
     * @param basePath	path to the base elements
     * @param linkPath	path to the link elements
     * @param model		signalling model being built
     *
     * @return the list of species IDs
     */
    private List<String> aliasList(Element annot, String basePath, String linkPath, SignalModel model) {
        List<String> retVal = new ArrayList<String>();
        List<Element> elements = this.xml.select(annot, basePath);
        elements.addAll(this.xml.select(annot, linkPath));
        for (Element element : elements) {
            String id = this.decomplexify(element.getAttribute("alias"));
            if (model.contains(id))
                retVal.add(id);
        }
        return retVal;
    }

    /**
     * @return the ID of the complex containing an alias, or the alias itself if it is not in a complex
     *
     * @param alias		ID of the alias of interest
     */
    private String decomplexify(String alias) {
        return this.complexOfAlias.getOrDefault(alias, alias);
    }

    /**
     * Compute the precise name of a species.
     *
     * @param name		SBML species name
     * @param type		species class
     * @param mods		list of modification states
     *
     * @return the cleaned-up name with the class and modifications appended
     */
    public static String makeNamePrecise(String name, String type, List<String> mods) {
        List<String> tokens = new ArrayList<String>();
        for (String token : StringUtils.splitPreserveAllTokens(name, '_')) {
            if (BLANK_TOKENS.contains(token))
                tokens.add("");
            else if (! REMOVE_TOKENS.contains(token))
                tokens.add(token);
        }
        List<String> basis = new ArrayList<String>();
        basis.add(StringUtils.replace(StringUtils.join(tokens, '_'), "__", "_"));
        if (! Species.PROTEIN.equals(type))
            basis.add(type.toLowerCase());
        basis.addAll(mods);
        return StringUtils.join(basis, '_');
    }

}
