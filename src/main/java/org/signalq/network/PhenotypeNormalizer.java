/**
 *
 */
package org.signalq.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object restructures the transitions producing each phenotype.  A phenotype is a read-out of the
 * diagram, so each of its single-reactant causes becomes a modifier of one synthetic state transition
 * with no reactants.  A cause from a negative reaction becomes an inhibition, and any other cause becomes
 * a catalysis.  Transitions with more than one reactant are kept as they are, ahead of the synthetic one.
 *
 */
public class PhenotypeNormalizer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(PhenotypeNormalizer.class);

    /**
     * Normalize all the phenotypes in a model.
     *
     * @param model		model to normalize
     *
     * @return the number of phenotypes restructured
     */
    public int normalize(SignalModel model) {
        int retVal = 0;
        for (Species species : model.getAllSpecies()) {
            if (species.isType(Species.PHENOTYPE) && this.normalize(species))
                retVal++;
        }
        log.info("{} phenotypes restructured.", retVal);
        return retVal;
    }

    /**
     * Normalize a single phenotype species.
     *
     * @param species	phenotype to restructure
     *
     * @return TRUE if the transitions were changed, else FALSE
     */
    protected boolean normalize(Species species) {
        List<Transition.Modifier> modifiers = new ArrayList<Transition.Modifier>();
        List<Transition> kept = new ArrayList<Transition>();
        for (Transition transition : species.getTransitions()) {
            List<String> reactants = transition.getReactants();
            if (reactants.size() != 1) {
                log.debug("Ignoring non-unary reaction to phenotype {}.", species.getName());
                kept.add(transition);
            } else {
                String kind = (transition.isNegative() ? Transition.INHIBITION : Transition.CATALYSIS);
                modifiers.add(new Transition.Modifier(kind, reactants.get(0)));
            }
        }
        boolean retVal = ! modifiers.isEmpty();
        if (retVal) {
            kept.add(new Transition(Transition.STATE_TRANSITION, Collections.emptyList(), modifiers));
            species.setTransitions(kept);
            log.debug("Phenotype {} now has {} causes in a single transition.", species.getName(), modifiers.size());
        }
        return retVal;
    }

}
