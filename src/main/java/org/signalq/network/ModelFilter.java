/**
 *
 */
package org.signalq.network;

import java.util.Collection;
import java.util.List;

/**
 * A model filter restricts a signalling model to a region of interest.  Each filter computes the set of
 * species to delete, and the base class deletes them and purges the references left dangling.
 *
 */
public abstract class ModelFilter {

    /**
     * This interface represents the methods a client must support to build a filter.
     */
    public interface IParms {

        /**
         * @return the component size threshold (0 for none, negative to keep only the largest components)
         */
        public int getThreshold();

        /**
         * @return the names of the species whose ancestors should be kept
         */
        public List<String> getUpstream();

        /**
         * @return the names of the species whose descendants should be kept
         */
        public List<String> getDownstream();

    }

    /**
     * This enumeration indicates the types of filters.
     */
    public static enum Type {
        /** remove small connected components */
        COMPONENTS {
            @Override
            public ModelFilter create(IParms processor) {
                return new ComponentFilter(processor);
            }
        },
        /** keep only the upstream and downstream neighborhoods of specified species */
        NEIGHBORHOOD {
            @Override
            public ModelFilter create(IParms processor) {
                return new NeighborhoodFilter(processor);
            }
        };

        /**
         * @return a model filter of this type
         *
         * @param processor		controlling command processor
         */
        public abstract ModelFilter create(IParms processor);
    }

    /**
     * Apply this filter to a model.
     *
     * @param model		model to filter
     *
     * @return the number of species deleted
     */
    public int apply(SignalModel model) {
        Collection<String> doomed = this.findDeletions(model);
        int retVal = model.deleteAll(doomed);
        if (retVal > 0)
            model.purgeDangling();
        return retVal;
    }

    /**
     * Compute the species this filter removes from a model.
     *
     * @param model		model to filter
     *
     * @return the IDs of the species to delete
     */
    protected abstract Collection<String> findDeletions(SignalModel model);

}
