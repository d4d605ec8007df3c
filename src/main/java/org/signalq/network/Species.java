/**
 *
 */
package org.signalq.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * This object represents a species node in a signalling model.  A species is an instance of an underlying
 * molecule (identified by the reference ID) in a particular compartment and state.  It has a list of
 * the transitions that produce it, and a logical function describing when it is present.  The order of the
 * transitions is significant:  it determines the order of the terms in the logical function.
 *
 */
public class Species {

    // FIELDS
    /** species ID */
    private String id;
    /** display name */
    private String name;
    /** logical function text */
    private String function;
    /** ID of the underlying molecule */
    private String referenceId;
    /** species type */
    private String type;
    /** name of the containing compartment */
    private String compartment;
    /** activity state */
    private String activity;
    /** TRUE if this species is a receptor */
    private boolean receptor;
    /** transitions that produce this species */
    private List<Transition> transitions;
    /** cross-reference annotations */
    private AnnotationSet annotations;
    /** display location */
    private double x;
    private double y;
    /** display size */
    private double w;
    private double h;
    /** fixed level, or NULL if the species is not fixed */
    private Integer fixedLevel;

    /** protein species type */
    public static final String PROTEIN = "PROTEIN";
    /** complex species type */
    public static final String COMPLEX = "COMPLEX";
    /** phenotype species type */
    public static final String PHENOTYPE = "PHENOTYPE";
    /** active state */
    public static final String ACTIVE = "active";
    /** inactive state */
    public static final String INACTIVE = "inactive";
    /** default compartment name */
    public static final String DEFAULT_COMPARTMENT = "default_compartment";

    /**
     * Create a new species.  The reference ID defaults to the species ID, and the function to the name.
     *
     * @param id		ID of the species
     * @param name		display name
     * @param type		species type
     */
    public Species(String id, String name, String type) {
        this.id = id;
        this.name = name;
        this.function = name;
        this.referenceId = id;
        this.type = type;
        this.compartment = DEFAULT_COMPARTMENT;
        this.activity = INACTIVE;
        this.receptor = false;
        this.transitions = new ArrayList<Transition>();
        this.annotations = new AnnotationSet();
        this.fixedLevel = null;
    }

    /**
     * @return the species ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * Change the ID of this species.  This should only be done by the owning model.
     *
     * @param id 	the new ID
     */
    protected void setId(String id) {
        this.id = id;
    }

    /**
     * @return the display name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @param name 	the new display name
     */
    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return the logical function text
     */
    public String getFunction() {
        return this.function;
    }

    /**
     * @param function 	the new logical function text
     */
    public void setFunction(String function) {
        this.function = function;
    }

    /**
     * @return the ID of the underlying molecule
     */
    public String getReferenceId() {
        return this.referenceId;
    }

    /**
     * @param referenceId 	the ID of the underlying molecule
     */
    public void setReferenceId(String referenceId) {
        this.referenceId = referenceId;
    }

    /**
     * @return the species type
     */
    public String getType() {
        return this.type;
    }

    /**
     * @return TRUE if this species has the specified type
     *
     * @param type	type to check
     */
    public boolean isType(String type) {
        return type.equals(this.type);
    }

    /**
     * @return the compartment name
     */
    public String getCompartment() {
        return this.compartment;
    }

    /**
     * @param compartment 	the new compartment name
     */
    public void setCompartment(String compartment) {
        this.compartment = compartment;
    }

    /**
     * @return the activity state
     */
    public String getActivity() {
        return this.activity;
    }

    /**
     * @return TRUE if this species is in the active state
     */
    public boolean isActive() {
        return ACTIVE.equals(this.activity);
    }

    /**
     * @param activity 	the new activity state
     */
    public void setActivity(String activity) {
        this.activity = activity;
    }

    /**
     * @return TRUE if this species is a receptor
     */
    public boolean isReceptor() {
        return this.receptor;
    }

    /**
     * @param receptor 	TRUE if this species is a receptor
     */
    public void setReceptor(boolean receptor) {
        this.receptor = receptor;
    }

    /**
     * @return the transitions that produce this species
     */
    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(this.transitions);
    }

    /**
     * @return TRUE if this species is produced by at least one transition
     */
    public boolean hasTransitions() {
        return ! this.transitions.isEmpty();
    }

    /**
     * Add a transition that produces this species.
     *
     * @param transition	transition to add
     */
    public void addTransition(Transition transition) {
        this.transitions.add(transition);
    }

    /**
     * Add a list of transitions that produce this species.
     *
     * @param newTransitions	transitions to add, in order
     */
    public void addTransitions(Collection<Transition> newTransitions) {
        this.transitions.addAll(newTransitions);
    }

    /**
     * Replace all the transitions that produce this species.
     *
     * @param newTransitions	new transition list
     */
    public void setTransitions(Collection<Transition> newTransitions) {
        this.transitions = new ArrayList<Transition>(newTransitions);
    }

    /**
     * @return the annotations
     */
    public AnnotationSet getAnnotations() {
        return this.annotations;
    }

    /**
     * Specify the display geometry.
     *
     * @param x		left edge
     * @param y		top edge
     * @param w		width
     * @param h		height
     */
    public void setBounds(double x, double y, double w, double h) {
        this.x = x;
        this.y = y;
        this.w = w;
        this.h = h;
    }

    /**
     * @return the left edge
     */
    public double getX() {
        return this.x;
    }

    /**
     * @return the top edge
     */
    public double getY() {
        return this.y;
    }

    /**
     * @return the width
     */
    public double getW() {
        return this.w;
    }

    /**
     * @return the height
     */
    public double getH() {
        return this.h;
    }

    /**
     * @return the fixed level, or NULL if this species is not fixed
     */
    public Integer getFixedLevel() {
        return this.fixedLevel;
    }

    /**
     * Fix this species at a constant level.  The transitions are discarded.
     *
     * @param level		level at which to fix the species
     */
    public void fix(int level) {
        this.fixedLevel = level;
        this.transitions.clear();
        this.function = Integer.toString(level);
    }

    @Override
    public String toString() {
        return this.id + " (" + this.name + ")";
    }

}
