/**
 *
 */
package org.signalq.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.apache.commons.lang3.StringUtils;

/**
 * This object represents a reaction or influence that produces a species.  It contains the reaction type,
 * the list of species that must be present (the reactants), and a list of modifiers.  Each modifier has a kind
 * (inhibition, catalysis, and so forth) and a list of species.  For most modifiers the list has a single
 * member; for an AND gate, all the members must be present.
 *
 * The shape of a transition is fixed once it is built.  The species IDs inside it are only changed by
 * a rewrite operation, which is used when species are merged or deleted.
 *
 */
public class Transition {

    // FIELDS
    /** reaction type */
    private String type;
    /** IDs of reactant species, in order, without duplicates */
    private List<String> reactants;
    /** modifiers of the reaction */
    private List<Modifier> modifiers;
    /** notes text (or NULL) */
    private String notes;
    /** cross-reference annotations */
    private AnnotationSet annotations;

    /** state transition reaction type */
    public static final String STATE_TRANSITION = "STATE_TRANSITION";
    /** heterodimer association reaction type */
    public static final String HETERODIMER_ASSOCIATION = "HETERODIMER_ASSOCIATION";
    /** transport reaction type */
    public static final String TRANSPORT = "TRANSPORT";
    /** negative influence reaction type */
    public static final String NEGATIVE_INFLUENCE = "NEGATIVE_INFLUENCE";
    /** inhibition modifier kind */
    public static final String INHIBITION = "INHIBITION";
    /** unknown inhibition modifier kind */
    public static final String UNKNOWN_INHIBITION = "UNKNOWN_INHIBITION";
    /** catalysis modifier kind */
    public static final String CATALYSIS = "CATALYSIS";
    /** AND-gate modifier kind */
    public static final String AND_GATE = "BOOLEAN_LOGIC_GATE_AND";
    /** reaction types that denote a negative influence */
    private static final Set<String> NEGATIVE_TYPES = Set.of(NEGATIVE_INFLUENCE, "UNKNOWN_NEGATIVE_INFLUENCE",
            INHIBITION, UNKNOWN_INHIBITION);

    /**
     * This object represents a modifier of a reaction.
     */
    public static class Modifier {

        /** modifier kind */
        private String kind;
        /** IDs of the modifying species */
        private List<String> species;

        /**
         * This enumeration describes the role a modifier plays in a logical function.
         */
        public static enum Role {
            /** species must be absent */
            INHIBITOR,
            /** all species must be present */
            AND_GATE,
            /** species stimulates the reaction */
            ACTIVATOR;
        }

        /**
         * Create a modifier for one or more species.
         *
         * @param kind		modifier kind
         * @param species	IDs of the modifying species
         */
        public Modifier(String kind, Collection<String> species) {
            this.kind = kind;
            this.species = new ArrayList<String>(new LinkedHashSet<String>(species));
        }

        /**
         * Create a modifier for a single species.
         *
         * @param kind		modifier kind
         * @param speciesId	ID of the modifying species
         */
        public Modifier(String kind, String speciesId) {
            this(kind, Collections.singletonList(speciesId));
        }

        /**
         * Create a modifier from a comma-delimited species list.
         *
         * @param kind		modifier kind
         * @param payload	comma-delimited list of species IDs
         *
         * @return the modifier created
         */
        public static Modifier parse(String kind, String payload) {
            List<String> ids = new ArrayList<String>();
            for (String id : StringUtils.split(payload, ','))
                ids.add(id.trim());
            return new Modifier(kind, ids);
        }

        /**
         * @return the modifier kind
         */
        public String getKind() {
            return this.kind;
        }

        /**
         * @return the IDs of the modifying species
         */
        public List<String> getSpecies() {
            return Collections.unmodifiableList(this.species);
        }

        /**
         * @return the comma-delimited list of modifying species
         */
        public String getPayload() {
            return StringUtils.join(this.species, ',');
        }

        /**
         * @return the logical role of this modifier
         */
        public Role getRole() {
            Role retVal;
            switch (this.kind) {
            case INHIBITION :
            case UNKNOWN_INHIBITION :
                retVal = Role.INHIBITOR;
                break;
            case AND_GATE :
                retVal = Role.AND_GATE;
                break;
            default :
                retVal = Role.ACTIVATOR;
            }
            return retVal;
        }

        /**
         * Rewrite the species IDs in this modifier.
         *
         * @param mapper	function returning the new ID for each old ID, or NULL to drop the ID
         *
         * @return TRUE if anything changed
         */
        protected boolean rewrite(UnaryOperator<String> mapper) {
            List<String> newList = rewriteList(this.species, mapper);
            boolean retVal = ! newList.equals(this.species);
            this.species = newList;
            return retVal;
        }

        @Override
        public String toString() {
            return "(" + this.kind + ", " + this.getPayload() + ")";
        }

    }

    /**
     * Create a new transition.
     *
     * @param type			reaction type
     * @param reactants		IDs of the reactant species
     * @param modifiers		modifiers of the reaction
     * @param notes			notes text (or NULL)
     * @param annotations	annotations (or NULL)
     */
    public Transition(String type, Collection<String> reactants, Collection<Modifier> modifiers,
            String notes, AnnotationSet annotations) {
        this.type = type;
        this.reactants = new ArrayList<String>(new LinkedHashSet<String>(reactants));
        this.modifiers = new ArrayList<Modifier>(modifiers);
        this.notes = notes;
        this.annotations = (annotations == null ? new AnnotationSet() : annotations);
    }

    /**
     * Create a new transition with no notes or annotations.
     *
     * @param type			reaction type
     * @param reactants		IDs of the reactant species
     * @param modifiers		modifiers of the reaction
     */
    public Transition(String type, Collection<String> reactants, Collection<Modifier> modifiers) {
        this(type, reactants, modifiers, null, null);
    }

    /**
     * @return the reaction type
     */
    public String getType() {
        return this.type;
    }

    /**
     * @return the reactant species IDs
     */
    public List<String> getReactants() {
        return Collections.unmodifiableList(this.reactants);
    }

    /**
     * @return the modifiers
     */
    public List<Modifier> getModifiers() {
        return Collections.unmodifiableList(this.modifiers);
    }

    /**
     * @return the notes text, or NULL if there are none
     */
    public String getNotes() {
        return this.notes;
    }

    /**
     * @return the annotations
     */
    public AnnotationSet getAnnotations() {
        return this.annotations;
    }

    /**
     * @return TRUE if this reaction type denotes a negative influence
     */
    public boolean isNegative() {
        return NEGATIVE_TYPES.contains(this.type);
    }

    /**
     * @return TRUE if this is a pure transport of the specified species with no modifiers
     *
     * @param speciesId		ID of the species that should be transported
     */
    public boolean isPureTransportOf(String speciesId) {
        return TRANSPORT.equals(this.type) && this.modifiers.isEmpty()
                && this.reactants.size() == 1 && this.reactants.get(0).equals(speciesId);
    }

    /**
     * @return the IDs of all the species referenced by this transition, reactants first
     */
    public Set<String> getReferences() {
        Set<String> retVal = new LinkedHashSet<String>(this.reactants);
        for (Modifier modifier : this.modifiers)
            retVal.addAll(modifier.species);
        return retVal;
    }

    /**
     * @return TRUE if the specified species is a reactant or modifier of this transition
     *
     * @param speciesId		ID of the species of interest
     */
    public boolean mentions(String speciesId) {
        boolean retVal = this.reactants.contains(speciesId);
        for (int i = 0; ! retVal && i < this.modifiers.size(); i++)
            retVal = this.modifiers.get(i).species.contains(speciesId);
        return retVal;
    }

    /**
     * Rewrite the species IDs in this transition.  Positions are preserved; an ID that maps to one
     * already present in the same list is dropped, and modifiers left empty are removed.
     *
     * @param mapper	function returning the new ID for each old ID, or NULL to drop the ID
     *
     * @return TRUE if anything changed
     */
    public boolean rewrite(UnaryOperator<String> mapper) {
        List<String> newReactants = rewriteList(this.reactants, mapper);
        boolean retVal = ! newReactants.equals(this.reactants);
        this.reactants = newReactants;
        List<Modifier> newModifiers = new ArrayList<Modifier>(this.modifiers.size());
        for (Modifier modifier : this.modifiers) {
            if (modifier.rewrite(mapper))
                retVal = true;
            if (modifier.species.isEmpty())
                retVal = true;
            else
                newModifiers.add(modifier);
        }
        this.modifiers = newModifiers;
        return retVal;
    }

    /**
     * Map a list of species IDs, removing dropped and duplicate IDs.
     *
     * @param ids		list of IDs to map
     * @param mapper	function returning the new ID for each old ID, or NULL to drop the ID
     *
     * @return the mapped list
     */
    private static List<String> rewriteList(List<String> ids, UnaryOperator<String> mapper) {
        Set<String> retVal = new LinkedHashSet<String>(ids.size() * 4 / 3 + 1);
        for (String id : ids) {
            String newId = mapper.apply(id);
            if (newId != null)
                retVal.add(newId);
        }
        return new ArrayList<String>(retVal);
    }

    @Override
    public String toString() {
        return "Transition(" + this.type + ", " + this.reactants + ", " + this.modifiers + ")";
    }

}
