/**
 *
 */
package org.signalq.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This filter removes the connected components of the influence graph whose size is at or below a
 * threshold.  A negative threshold means that only the largest components are kept.
 *
 */
public class ComponentFilter extends ModelFilter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ComponentFilter.class);
    /** size threshold */
    private int threshold;

    /**
     * Construct a component filter.
     *
     * @param processor		controlling command processor
     */
    public ComponentFilter(IParms processor) {
        this.threshold = processor.getThreshold();
    }

    @Override
    protected Collection<String> findDeletions(SignalModel model) {
        List<String> retVal = new ArrayList<String>();
        List<Set<String>> components = model.getComponents();
        if (! components.isEmpty()) {
            int limit = this.threshold;
            // The components are sorted largest first.
            if (limit < 0) {
                limit = components.get(0).size() - 1;
                log.info("Keeping only components of size {}.", limit + 1);
            }
            int removed = 0;
            for (Set<String> component : components) {
                if (component.size() <= limit) {
                    log.debug("Removing component of size {} containing {}.", component.size(),
                            component.iterator().next());
                    retVal.addAll(component);
                    removed++;
                }
            }
            log.info("{} of {} components are too small.  {} species removed.", removed,
                    components.size(), retVal.size());
        }
        return retVal;
    }

}
