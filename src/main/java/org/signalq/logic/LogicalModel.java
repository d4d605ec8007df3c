/**
 *
 */
package org.signalq.logic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.signalq.network.Transition;

/**
 * This object is the result of function synthesis:  a simplified signalling model together with the
 * activation expression of each species.  It is handed to the renderers, which use it to number the
 * species, list the signed influences between them, and encode the expressions.
 *
 */
public class LogicalModel {

    // FIELDS
    /** simplified signalling model */
    private SignalModel model;
    /** map of species IDs to expressions (NULL for inputs and fixed species) */
    private Map<String, LogicExpression> expressions;
    /** maximum level of a species */
    private int granularity;
    /** TRUE if references from a species to itself are ignored */
    private boolean ignoreSelfLoops;

    /**
     * Create a logical model.
     *
     * @param model				simplified signalling model
     * @param expressions		map of species IDs to expressions
     * @param granularity		maximum level of a species
     * @param ignoreSelfLoops	TRUE if references from a species to itself are ignored
     */
    public LogicalModel(SignalModel model, Map<String, LogicExpression> expressions, int granularity,
            boolean ignoreSelfLoops) {
        this.model = model;
        this.expressions = expressions;
        this.granularity = granularity;
        this.ignoreSelfLoops = ignoreSelfLoops;
    }

    /**
     * @return the simplified signalling model
     */
    public SignalModel getModel() {
        return this.model;
    }

    /**
     * @return the expression for a species, or NULL if it has none
     *
     * @param id	ID of the species of interest
     */
    public LogicExpression getExpression(String id) {
        return this.expressions.get(id);
    }

    /**
     * @return the maximum level of a species
     */
    public int getGranularity() {
        return this.granularity;
    }

    /**
     * @return TRUE if the specified species is an input with no logical function
     *
     * @param species	species of interest
     */
    public boolean isInput(Species species) {
        return species.getFixedLevel() == null && this.expressions.get(species.getId()) == null
                && (this.granularity <= 1 || ! species.hasTransitions());
    }

    /**
     * Compute the distinct signed influences on a species.  A positive literal is an activation and a
     * negative literal an inhibition.
     *
     * @param species	species of interest
     *
     * @return the distinct literals from all the transitions of the species, in order
     */
    public List<LogicExpression.Literal> getInfluences(Species species) {
        Set<LogicExpression.Literal> retVal = new LinkedHashSet<LogicExpression.Literal>();
        for (Transition transition : species.getTransitions()) {
            TransitionTerms terms = new TransitionTerms(species, transition, this.model, this.ignoreSelfLoops);
            retVal.addAll(terms.getLiterals());
        }
        return new ArrayList<LogicExpression.Literal>(retVal);
    }

    /**
     * Assign sequential numbers to the species, in model order.
     *
     * @param counter	counter for assigning the numbers
     *
     * @return a map from species IDs to numbers
     */
    public Map<String, Integer> assignIds(IdCounter counter) {
        Map<String, Integer> retVal = new LinkedHashMap<String, Integer>(this.model.size() * 4 / 3 + 1);
        for (String id : this.model.getIds())
            retVal.put(id, counter.next());
        return retVal;
    }

    /**
     * Compute the relationship list.  There is one relationship for each distinct influence on each
     * species.
     *
     * @param ids		map of species IDs to numbers
     * @param counter	counter for assigning relationship numbers
     *
     * @return the list of relationships, in model order
     */
    public List<Relationship> getRelationships(Map<String, Integer> ids, IdCounter counter) {
        List<Relationship> retVal = new ArrayList<Relationship>();
        for (Species species : this.model.getAllSpecies()) {
            int to = ids.get(species.getId());
            for (LogicExpression.Literal literal : this.getInfluences(species)) {
                Relationship.Type type = (literal.isPositive() ? Relationship.Type.ACTIVATOR
                        : Relationship.Type.INHIBITOR);
                retVal.add(new Relationship(counter.next(), ids.get(literal.getId()), to, type));
            }
        }
        return retVal;
    }

    /**
     * Compute the min/max formula for a species.
     *
     * @param species		species of interest
     * @param ids			map of species IDs to numbers
     * @param inputLevel	level to use for input species
     *
     * @return the formula text
     */
    public String getMinMaxFormula(Species species, Map<String, Integer> ids, int inputLevel) {
        String retVal;
        LogicExpression expression = this.expressions.get(species.getId());
        if (species.getFixedLevel() != null)
            retVal = species.getFixedLevel().toString();
        else if (expression != null)
            retVal = expression.toMinMax(ids);
        else if (this.isInput(species))
            retVal = Integer.toString(inputLevel);
        else
            retVal = "";
        return retVal;
    }

}
