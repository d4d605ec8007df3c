/**
 *
 */
package org.signalq.network;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object drives the simplification of a signalling model.  The model is structurally reduced, the
 * names are resolved, the phenotypes are normalized, and then the model is filtered down to the region of
 * interest.  Finally, the fixed levels are applied and any remaining references to deleted species are
 * removed.  The model is modified in place.
 *
 */
public class ModelSimplifier {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelSimplifier.class);
    /** TRUE if the names should become the IDs */
    private boolean namesAsIds;
    /** filters to apply, in order */
    private List<ModelFilter> filters;
    /** fixed levels to apply */
    private FixedLevels fixedLevels;

    /**
     * This interface represents the methods a client must support to configure the simplifier.
     */
    public interface IParms extends ModelFilter.IParms {

        /**
         * @return TRUE if the species IDs should be replaced by their names
         */
        public boolean isNamesAsIds();

        /**
         * @return the fixed levels to apply (never NULL)
         */
        public FixedLevels getFixedLevels();

    }

    /**
     * Construct a model simplifier.
     *
     * @param processor		controlling command processor
     */
    public ModelSimplifier(IParms processor) {
        this.namesAsIds = processor.isNamesAsIds();
        this.fixedLevels = processor.getFixedLevels();
        this.filters = new ArrayList<ModelFilter>(2);
        if (! processor.getUpstream().isEmpty() || ! processor.getDownstream().isEmpty())
            this.filters.add(ModelFilter.Type.NEIGHBORHOOD.create(processor));
        if (processor.getThreshold() != 0)
            this.filters.add(ModelFilter.Type.COMPONENTS.create(processor));
    }

    /**
     * Simplify a model.
     *
     * @param model		model to simplify
     */
    public void simplify(SignalModel model) {
        log.info("Simplifying model with {} species.", model.size());
        new StructuralReducer(model).reduce();
        NameResolver resolver = new NameResolver();
        resolver.resolve(model);
        if (this.namesAsIds)
            resolver.useNamesAsIds(model);
        new PhenotypeNormalizer().normalize(model);
        for (ModelFilter filter : this.filters) {
            int removed = filter.apply(model);
            log.info("{} removed {} species.", filter.getClass().getSimpleName(), removed);
        }
        if (! this.fixedLevels.isEmpty()) {
            int fixed = this.fixedLevels.apply(model);
            log.info("{} species fixed.", fixed);
        }
        model.purgeDangling();
        log.info("{} species remain after simplification.", model.size());
    }

}
