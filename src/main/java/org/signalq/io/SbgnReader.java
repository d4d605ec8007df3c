/**
 *
 */
package org.signalq.io;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

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
 * This object reads an SBGN-ML process diagram into a signalling model.  Each top-level entity glyph becomes
 * a species, placed in the smallest compartment glyph containing its center.  Each process glyph becomes a
 * transition on every one of its products.  Consumption arcs supply the reactants and the other arcs
 * supply the modifiers.  An AND gate feeding a process becomes a single AND-gate modifier.  A modifier arc
 * pointing directly at an entity becomes a transition with that entity's source as its only reactant.
 *
 */
public class SbgnReader {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SbgnReader.class);
    /** XPath helper */
    private XmlHelper xml;

    /** prefix of the SBGN-ML namespaces */
    public static final String SBGN_NS_PREFIX = "http://sbgn.org/libsbgn/";
    /** XHTML namespace */
    public static final String XHTML_NS = "http://www.w3.org/1999/xhtml";
    /** entity glyph classes that become species */
    private static final Set<String> ENTITY_CLASSES = Set.of("macromolecule", "simple chemical",
            "unspecified entity", "complex", "nucleic acid feature", "phenotype", "macromolecule multimer");
    /** entity glyph classes that keep their own names as types */
    private static final Set<String> NAMED_TYPES = Set.of("COMPLEX", "PHENOTYPE", "UNSPECIFIED_ENTITY",
            "NUCLEIC_ACID_FEATURE");
    /** map of process glyph classes to transition types */
    private static final Map<String, String> PROCESS_TYPES = Map.of("process", Transition.STATE_TRANSITION,
            "association", Transition.HETERODIMER_ASSOCIATION, "dissociation", "DISSOCIATION",
            "omitted process", "UNKNOWN_TRANSITION", "uncertain process", "UNKNOWN_TRANSITION");
    /** map of arc classes to modifier kinds */
    private static final Map<String, String> ARC_KINDS = Map.ofEntries(
            Map.entry("stimulation", "STIMULATION"),
            Map.entry("positive influence", "POSITIVE_INFLUENCE"),
            Map.entry("absolute stimulation", "STIMULATION"),
            Map.entry("inhibition", Transition.INHIBITION),
            Map.entry("negative influence", Transition.NEGATIVE_INFLUENCE),
            Map.entry("absolute inhibition", Transition.INHIBITION),
            Map.entry("modulation", "MODULATION"),
            Map.entry("catalysis", Transition.CATALYSIS),
            Map.entry("necessary stimulation", "NECESSARY_STIMULATION"),
            Map.entry("assignment", "ASSIGNMENT"),
            Map.entry("unknown influence", "UNKNOWN_INFLUENCE"));
    /** default canvas size */
    private static final double DEFAULT_SIZE = 1000.0;

    /**
     * This class holds the data for a process while the arcs are being read.
     */
    private static class Process {

        /** transition type */
        private String type;
        /** IDs of the reactants */
        private List<String> inputs;
        /** IDs of the products */
        private List<String> outputs;
        /** modifiers */
        private List<Transition.Modifier> modifiers;
        /** notes text, or NULL */
        private String notes;
        /** RDF annotation element, or NULL */
        private Element rdf;

        public Process(String type, String notes, Element rdf) {
            this.type = type;
            this.inputs = new ArrayList<String>();
            this.outputs = new ArrayList<String>();
            this.modifiers = new ArrayList<Transition.Modifier>();
            this.notes = notes;
            this.rdf = rdf;
        }

    }

    /**
     * This class describes a compartment glyph.
     */
    private static class Compartment {

        /** compartment name */
        private String name;
        /** bounding box */
        private double x, y, w, h;

        public Compartment(String name, Element bbox) {
            this.name = StringUtils.replaceChars(name, ' ', '_');
            this.x = XmlHelper.number(bbox, "x");
            this.y = XmlHelper.number(bbox, "y");
            this.w = XmlHelper.number(bbox, "w");
            this.h = XmlHelper.number(bbox, "h");
        }

        /**
         * @return TRUE if this compartment contains the specified point
         *
         * @param px	x-coordinate of the point
         * @param py	y-coordinate of the point
         */
        public boolean contains(double px, double py) {
            return this.x <= px && px <= this.x + this.w && this.y <= py && py <= this.y + this.h;
        }

        /**
         * @return the area of this compartment
         */
        public double area() {
            return this.w * this.h;
        }

    }

    /**
     * Read a signalling model from an SBGN-ML file.
     *
     * @param inFile	SBGN-ML file to read
     *
     * @return the signalling model
     *
     * @throws IOException
     */
    public SignalModel read(File inFile) throws IOException {
        log.info("Reading SBGN-ML model from {}.", inFile);
        Document doc = XmlHelper.parse(inFile);
        Element root = doc.getDocumentElement();
        String ns = root.getNamespaceURI();
        if (ns == null || ! ns.startsWith(SBGN_NS_PREFIX) || ! "sbgn".equals(root.getLocalName()))
            throw new IOException(inFile + " does not have an sbgn root element.");
        this.xml = new XmlHelper(Map.of("sbgn", ns, "xhtml", XHTML_NS));
        Element map = this.xml.first(root, ".//sbgn:map");
        if (map == null)
            throw new IOException("Could not find sbgn map element in " + inFile + ".");
        double width = XmlHelper.number(map, "width");
        double height = XmlHelper.number(map, "height");
        Element mapBox = this.xml.first(map, "./sbgn:bbox");
        if (width <= 0.0)
            width = (mapBox == null ? DEFAULT_SIZE : XmlHelper.number(mapBox, "w"));
        if (height <= 0.0)
            height = (mapBox == null ? DEFAULT_SIZE : XmlHelper.number(mapBox, "h"));
        SignalModel retVal = new SignalModel(width, height);
        this.readSpecies(map, retVal);
        int count = this.readTransitions(map, retVal);
        log.info("{} species and {} processes read from {}.", retVal.size(), count, inFile);
        return retVal;
    }

    /**
     * Read the entity glyphs into the model.
     *
     * @param map		SBGN map element
     * @param retVal	signalling model to update
     */
    private void readSpecies(Element map, SignalModel retVal) {
        List<Compartment> compartments = new ArrayList<Compartment>();
        for (Element glyph : this.xml.select(map, "./sbgn:glyph[@class='compartment']")) {
            Element bbox = this.xml.first(glyph, "./sbgn:bbox");
            if (bbox != null)
                compartments.add(new Compartment(this.label(glyph), bbox));
        }
        for (Element glyph : this.xml.select(map, "./sbgn:glyph")) {
            String cls = glyph.getAttribute("class");
            String id = glyph.getAttribute("id");
            if (! ENTITY_CLASSES.contains(cls)) {
                if (! "compartment".equals(cls) && ! PROCESS_TYPES.containsKey(cls) && ! "and".equals(cls))
                    log.warn("Skipping glyph {} with unsupported class \"{}\".", id, cls);
                continue;
            }
            Element bbox = this.xml.first(glyph, "./sbgn:bbox");
            double x = 0.0, y = 0.0, w = 0.0, h = 0.0;
            if (bbox != null) {
                x = XmlHelper.number(bbox, "x");
                y = XmlHelper.number(bbox, "y");
                w = XmlHelper.number(bbox, "w");
                h = XmlHelper.number(bbox, "h");
            }
            // Find the smallest compartment containing the center.
            String compartment = Species.DEFAULT_COMPARTMENT;
            double minArea = Double.POSITIVE_INFINITY;
            for (Compartment comp : compartments) {
                if (comp.contains(x + w / 2, y + h / 2) && comp.area() < minArea) {
                    minArea = comp.area();
                    compartment = comp.name;
                }
            }
            String type = classToType(cls);
            String activity = Species.INACTIVE;
            for (Element state : this.xml.select(glyph, "./sbgn:glyph[@class='state variable']/sbgn:state")) {
                String value = state.getAttribute("value");
                if (! value.isEmpty()) {
                    activity = value;
                    break;
                }
            }
            String name = CellDesignerReader.makeNamePrecise(greeksToNames(this.label(glyph)), type,
                    new ArrayList<String>());
            log.debug("Adding entity {} of type {} named {}.", id, type, name);
            Species species = new Species(id, name, type);
            species.setReferenceId(name + "__" + compartment + "__" + activity);
            species.setActivity(activity);
            species.setCompartment(compartment);
            species.setBounds(x, y, w, h);
            this.xml.readAnnotations(this.xml.first(glyph, "./sbgn:extension//rdf:RDF"), species.getAnnotations());
            this.xml.readAnnotations(this.xml.first(glyph, "./sbgn:annotation//rdf:RDF"), species.getAnnotations());
            // Fold in the annotations of the sub-components.
            for (Element child : this.xml.select(glyph, ".//sbgn:glyph"))
                this.xml.readAnnotations(this.xml.first(child, "./sbgn:annotation//rdf:RDF"), species.getAnnotations());
            retVal.addSpecies(species);
            retVal.addGroupMember(StringUtils.substringBeforeLast(name, "_"), id);
        }
    }

    /**
     * Read the processes and arcs into the model.
     *
     * @param map		SBGN map element
     * @param retVal	signalling model to update
     *
     * @return the number of processes read
     */
    private int readTransitions(Element map, SignalModel retVal) {
        // Index the AND gates.
        Map<String, String> portToGate = new HashMap<String, String>();
        Map<String, List<String>> gateInputs = new LinkedHashMap<String, List<String>>();
        Map<String, String> gateOutputs = new HashMap<String, String>();
        for (Element gate : this.xml.select(map, "./sbgn:glyph[@class='and']")) {
            String gid = gate.getAttribute("id");
            for (Element port : this.xml.select(gate, "./sbgn:port"))
                portToGate.put(port.getAttribute("id"), gid);
            gateInputs.put(gid, new ArrayList<String>());
        }
        // Index the processes.
        Map<String, String> portToProcess = new HashMap<String, String>();
        Map<String, Process> processes = new LinkedHashMap<String, Process>();
        for (Element glyph : this.xml.select(map, "./sbgn:glyph")) {
            String type = PROCESS_TYPES.get(glyph.getAttribute("class"));
            if (type != null) {
                String pid = glyph.getAttribute("id");
                for (Element port : this.xml.select(glyph, "./sbgn:port"))
                    portToProcess.put(port.getAttribute("id"), pid);
                Element body = this.xml.first(glyph, "./sbgn:notes//xhtml:body");
                String notes = (body == null ? null : body.getTextContent().trim());
                Element rdf = this.xml.first(glyph, ".//rdf:RDF");
                processes.put(pid, new Process(type, notes, rdf));
            }
        }
        // Run through the arcs.
        for (Element arc : this.xml.select(map, "./sbgn:arc")) {
            String source = arc.getAttribute("source");
            String target = arc.getAttribute("target");
            String cls = arc.getAttribute("class");
            log.debug("Parsing arc of class {} from {} to {}.", cls, source, target);
            String sourceGate = portToGate.getOrDefault(source, source);
            String targetGate = portToGate.getOrDefault(target, target);
            String sourceProcess = portToProcess.get(source);
            String targetProcess = portToProcess.getOrDefault(target, (processes.containsKey(target) ? target : null));
            if (gateInputs.containsKey(targetGate))
                gateInputs.get(targetGate).add(source);
            else if (gateInputs.containsKey(sourceGate))
                gateOutputs.put(sourceGate, portToProcess.getOrDefault(target, target));
            else if (sourceProcess != null) {
                if ("production".equals(cls))
                    processes.get(sourceProcess).outputs.add(target);
            } else if (processes.containsKey(source)) {
                if ("production".equals(cls))
                    processes.get(source).outputs.add(target);
            } else if (targetProcess != null) {
                Process process = processes.get(targetProcess);
                if ("consumption".equals(cls))
                    process.inputs.add(source);
                else {
                    String kind = ARC_KINDS.get(cls);
                    if (kind == null)
                        log.warn("Unknown modifier arc class \"{}\".", cls);
                    else
                        process.modifiers.add(new Transition.Modifier(kind, source));
                }
            } else if (retVal.contains(target)) {
                String kind = ARC_KINDS.get(cls);
                if (kind != null) {
                    log.debug("Creating implicit transition for {} arc from {} to {}.", cls, source, target);
                    retVal.getSpecies(target).addTransition(new Transition(kind, List.of(source), List.of()));
                }
            }
        }
        // Attach the AND gates to their processes.
        for (Map.Entry<String, List<String>> gate : gateInputs.entrySet()) {
            Process process = processes.get(gateOutputs.get(gate.getKey()));
            if (process != null && ! gate.getValue().isEmpty())
                process.modifiers.add(new Transition.Modifier(Transition.AND_GATE, gate.getValue()));
        }
        // Create the transitions.
        for (Process process : processes.values()) {
            for (String output : process.outputs) {
                Species product = retVal.getSpecies(output);
                if (product != null) {
                    AnnotationSet annotations = new AnnotationSet();
                    this.xml.readAnnotations(process.rdf, annotations);
                    product.addTransition(new Transition(process.type, process.inputs, process.modifiers,
                            process.notes, annotations));
                }
            }
        }
        return processes.size();
    }

    /**
     * @return the label text of a glyph, or its ID if it has none
     *
     * @param glyph		glyph of interest
     */
    private String label(Element glyph) {
        Element label = this.xml.first(glyph, "./sbgn:label");
        String retVal = (label == null ? null : XmlHelper.attr(label, "text"));
        if (retVal == null)
            retVal = glyph.getAttribute("id");
        return retVal;
    }

    /**
     * @return the species type for an SBGN glyph class
     *
     * @param cls	glyph class
     */
    public static String classToType(String cls) {
        String retVal = StringUtils.replaceChars(cls, ' ', '_').toUpperCase();
        if (! NAMED_TYPES.contains(retVal))
            retVal = Species.PROTEIN;
        return retVal;
    }

    /**
     * Convert the Greek letters in a name to their spelled-out names.  A capital letter is spelled with an
     * initial capital.
     *
     * @param name	name to convert
     *
     * @return the converted name
     */
    public static String greeksToNames(String name) {
        StringBuilder retVal = new StringBuilder(name.length() * 2);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            String[] words = StringUtils.split(StringUtils.defaultString(Character.getName(c)), ' ');
            if (words.length >= 4 && words[0].equals("GREEK") && words[2].equals("LETTER")) {
                String letter = words[3].toLowerCase();
                retVal.append(words[1].equals("SMALL") ? letter : StringUtils.capitalize(letter));
            } else
                retVal.append(c);
        }
        return retVal.toString();
    }

}
