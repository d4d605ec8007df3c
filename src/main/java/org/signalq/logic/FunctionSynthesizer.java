/**
 *
 */
package org.signalq.logic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.signalq.network.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is the base class for the objects that build the logical function of each species in a simplified
 * model.  The subclass determines the expression built for a species with transitions and the function text
 * stored in the species.  A species with no transitions is an input, and its function is its own name.  A
 * species fixed at a constant level keeps the level as its function.
 *
 */
public abstract class FunctionSynthesizer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(FunctionSynthesizer.class);
    /** TRUE if references from a species to itself should be ignored */
    private boolean ignoreSelfLoops;

    /**
     * Construct a function synthesizer.
     *
     * @param ignoreSelfLoops	TRUE if references from a species to itself should be ignored
     */
    protected FunctionSynthesizer(boolean ignoreSelfLoops) {
        this.ignoreSelfLoops = ignoreSelfLoops;
    }

    /**
     * Create a function synthesizer for the specified granularity.
     *
     * @param granularity		maximum level of a species
     * @param ignoreSelfLoops	TRUE if references from a species to itself should be ignored
     *
     * @return a Boolean synthesizer for granularity 1, otherwise a multi-valued synthesizer
     */
    public static FunctionSynthesizer create(int granularity, boolean ignoreSelfLoops) {
        FunctionSynthesizer retVal;
        if (granularity <= 1)
            retVal = new BooleanSynthesizer(ignoreSelfLoops);
        else
            retVal = new MultiValuedSynthesizer(granularity, ignoreSelfLoops);
        return retVal;
    }

    /**
     * Compute the logical functions for all the species in a model.  The function text is stored in each
     * species with transitions.
     *
     * @param model		simplified model to process
     *
     * @return the logical model for the renderers
     */
    public LogicalModel synthesize(SignalModel model) {
        Map<String, LogicExpression> expressions = new LinkedHashMap<String, LogicExpression>(model.size() * 4 / 3 + 1);
        int count = 0;
        for (Species species : model.getAllSpecies()) {
            LogicExpression expression = null;
            if (species.getFixedLevel() == null && species.hasTransitions()) {
                expression = this.synthesize(species, model);
                species.setFunction(this.render(species, expression, model));
                count++;
            }
            expressions.put(species.getId(), expression);
        }
        log.info("Functions computed for {} of {} species.", count, model.size());
        return new LogicalModel(model, expressions, this.getGranularity(), this.ignoreSelfLoops);
    }

    /**
     * @return the transition terms of a species
     *
     * @param species	species of interest
     * @param model		model containing the species
     */
    protected List<TransitionTerms> getTerms(Species species, SignalModel model) {
        List<TransitionTerms> retVal = new ArrayList<TransitionTerms>(species.getTransitions().size());
        for (Transition transition : species.getTransitions())
            retVal.add(new TransitionTerms(species, transition, model, this.ignoreSelfLoops));
        return retVal;
    }

    /**
     * @return TRUE if references from a species to itself are ignored
     */
    public boolean isIgnoreSelfLoops() {
        return this.ignoreSelfLoops;
    }

    /**
     * Compute the activation expression for a species with transitions.
     *
     * @param species	species whose expression is desired
     * @param model		model containing the species
     *
     * @return the expression, or NULL if there is none
     */
    protected abstract LogicExpression synthesize(Species species, SignalModel model);

    /**
     * Compute the function text for a species with transitions.
     *
     * @param species		species whose function is desired
     * @param expression	expression computed for the species, or NULL if there is none
     * @param model			model containing the species
     *
     * @return the function text
     */
    protected abstract String render(Species species, LogicExpression expression, SignalModel model);

    /**
     * @return the maximum level of a species
     */
    public abstract int getGranularity();

}
