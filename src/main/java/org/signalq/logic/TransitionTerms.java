/**
 *
 */
package org.signalq.logic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.signalq.network.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object partitions the species referenced by one transition into the roles they play in the
 * activation of the transition's target.  The required species must all be present:  these are the
 * reactants and the members of AND gates.  The inhibitors must all be absent.  The activators are the
 * remaining modifiers, and at least one of them must be present.
 *
 * For a negative transition into a phenotype, the reactants and inhibitors swap roles.  References to
 * species not in the model are ignored, and so are references to the target itself if self-loops are
 * being suppressed.
 *
 */
public class TransitionTerms {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TransitionTerms.class);
    /** IDs of the species that must be present */
    private Set<String> required;
    /** IDs of the species that must be absent */
    private Set<String> inhibitors;
    /** IDs of the species that activate the transition */
    private Set<String> activators;

    /**
     * Partition the references in a transition.
     *
     * @param target			species produced by the transition
     * @param transition		transition to partition
     * @param model				model containing the species
     * @param ignoreSelfLoops	TRUE if references to the target should be skipped
     */
    public TransitionTerms(Species target, Transition transition, SignalModel model, boolean ignoreSelfLoops) {
        this.required = new LinkedHashSet<String>();
        this.inhibitors = new LinkedHashSet<String>();
        this.activators = new LinkedHashSet<String>();
        final String self = (ignoreSelfLoops ? target.getId() : null);
        boolean swap = target.isType(Species.PHENOTYPE) && transition.isNegative();
        if (swap)
            log.debug("Swapping reactants and inhibitors for negative transition into {}.", target.getName());
        this.addAll(swap ? this.inhibitors : this.required, transition.getReactants(), model, self);
        for (Transition.Modifier modifier : transition.getModifiers()) {
            switch (modifier.getRole()) {
            case INHIBITOR :
                this.addAll(swap ? this.required : this.inhibitors, modifier.getSpecies(), model, self);
                break;
            case AND_GATE :
                this.addAll(this.required, modifier.getSpecies(), model, self);
                break;
            default :
                this.addAll(this.activators, modifier.getSpecies(), model, self);
            }
        }
    }

    /**
     * Add the valid species IDs from a list to a term set.
     *
     * @param terms		term set to update
     * @param ids		species IDs to add
     * @param model		model containing the species
     * @param self		ID to skip, or NULL if none should be skipped
     */
    private void addAll(Set<String> terms, Collection<String> ids, SignalModel model, String self) {
        for (String id : ids) {
            if (model.contains(id) && ! id.equals(self))
                terms.add(id);
        }
    }

    /**
     * @return the IDs of the species that must be present
     */
    public Set<String> getRequired() {
        return Collections.unmodifiableSet(this.required);
    }

    /**
     * @return the IDs of the species that must be absent
     */
    public Set<String> getInhibitors() {
        return Collections.unmodifiableSet(this.inhibitors);
    }

    /**
     * @return the IDs of the activating species
     */
    public Set<String> getActivators() {
        return Collections.unmodifiableSet(this.activators);
    }

    /**
     * @return TRUE if no species survived the partitioning
     */
    public boolean isEmpty() {
        return this.required.isEmpty() && this.inhibitors.isEmpty() && this.activators.isEmpty();
    }

    /**
     * @return all the literals of this transition, in term order
     */
    public List<LogicExpression.Literal> getLiterals() {
        List<LogicExpression.Literal> retVal = new ArrayList<LogicExpression.Literal>();
        for (String id : this.required)
            retVal.add(new LogicExpression.Literal(id, 1));
        for (String id : this.activators)
            retVal.add(new LogicExpression.Literal(id, 1));
        for (String id : this.inhibitors)
            retVal.add(new LogicExpression.Literal(id, 0));
        return retVal;
    }

    /**
     * Build the activation expression for this transition.  A single activator is treated as required.
     * Multiple activators form an OR nested inside the AND of the other terms.
     *
     * @return the expression, or NULL if there are no terms
     */
    public LogicExpression toExpression() {
        List<LogicExpression> parts = new ArrayList<LogicExpression>();
        for (String id : this.required)
            parts.add(new LogicExpression.Literal(id, 1));
        if (this.activators.size() == 1)
            parts.add(new LogicExpression.Literal(this.activators.iterator().next(), 1));
        for (String id : this.inhibitors)
            parts.add(new LogicExpression.Literal(id, 0));
        if (this.activators.size() > 1) {
            List<LogicExpression> options = new ArrayList<LogicExpression>(this.activators.size());
            for (String id : this.activators)
                options.add(new LogicExpression.Literal(id, 1));
            parts.add(new LogicExpression.Or(options));
        }
        LogicExpression retVal;
        switch (parts.size()) {
        case 0 :
            retVal = null;
            break;
        case 1 :
            retVal = parts.get(0);
            break;
        default :
            retVal = new LogicExpression.And(parts);
        }
        return retVal;
    }

}
