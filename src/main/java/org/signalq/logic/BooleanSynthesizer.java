/**
 *
 */
package org.signalq.logic;

import java.util.ArrayList;
import java.util.List;

import org.signalq.network.SignalModel;
import org.signalq.network.Species;

/**
 * This synthesizer builds Boolean activation expressions.  The expression for a species is an OR of the
 * expressions for its transitions, in transition order.  A transition with no surviving terms contributes
 * nothing, and if no transition contributes the species is treated as an input.
 *
 */
public class BooleanSynthesizer extends FunctionSynthesizer {

    /**
     * Construct a Boolean synthesizer.
     *
     * @param ignoreSelfLoops	TRUE if references from a species to itself should be ignored
     */
    public BooleanSynthesizer(boolean ignoreSelfLoops) {
        super(ignoreSelfLoops);
    }

    @Override
    protected LogicExpression synthesize(Species species, SignalModel model) {
        List<LogicExpression> options = new ArrayList<LogicExpression>();
        for (TransitionTerms terms : this.getTerms(species, model)) {
            LogicExpression option = terms.toExpression();
            if (option != null)
                options.add(option);
        }
        LogicExpression retVal;
        switch (options.size()) {
        case 0 :
            log.debug("No usable transitions for {}.", species);
            retVal = null;
            break;
        case 1 :
            retVal = options.get(0);
            break;
        default :
            retVal = new LogicExpression.Or(options);
        }
        return retVal;
    }

    @Override
    protected String render(Species species, LogicExpression expression, SignalModel model) {
        String retVal;
        if (expression == null)
            retVal = species.getName();
        else
            retVal = expression.toInfix(x -> model.getSpecies(x).getName());
        return retVal;
    }

    @Override
    public int getGranularity() {
        return 1;
    }

}
