/**
 *
 */
package org.signalq.logic;

import org.signalq.network.SignalModel;
import org.signalq.network.Species;

/**
 * This synthesizer is used for multi-valued models.  It builds no expressions, and the function of every
 * species with transitions is empty, so that the renderer applies its own default aggregation over the
 * species levels.
 *
 */
public class MultiValuedSynthesizer extends FunctionSynthesizer {

    // FIELDS
    /** maximum level of a species */
    private int granularity;

    /**
     * Construct a multi-valued synthesizer.
     *
     * @param granularity		maximum level of a species
     * @param ignoreSelfLoops	TRUE if references from a species to itself should be ignored
     */
    public MultiValuedSynthesizer(int granularity, boolean ignoreSelfLoops) {
        super(ignoreSelfLoops);
        this.granularity = granularity;
    }

    @Override
    protected LogicExpression synthesize(Species species, SignalModel model) {
        return null;
    }

    @Override
    protected String render(Species species, LogicExpression expression, SignalModel model) {
        return "";
    }

    @Override
    public int getGranularity() {
        return this.granularity;
    }

}
