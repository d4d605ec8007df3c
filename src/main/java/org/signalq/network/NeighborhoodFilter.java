/**
 *
 */
package org.signalq.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This filter keeps only the species that are upstream or downstream of specified seed species.  The seeds
 * are specified by name.  A downstream seed keeps everything it influences, directly or indirectly, and an
 * upstream seed keeps everything that influences it.  A seed name that is not found is reported and
 * skipped.  If no seed is found, the model is left alone.
 *
 */
public class NeighborhoodFilter extends ModelFilter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NeighborhoodFilter.class);
    /** names of upstream seeds */
    private List<String> upstream;
    /** names of downstream seeds */
    private List<String> downstream;

    /**
     * Construct a neighborhood filter.
     *
     * @param processor		controlling command processor
     */
    public NeighborhoodFilter(IParms processor) {
        this.upstream = processor.getUpstream();
        this.downstream = processor.getDownstream();
    }

    @Override
    protected Collection<String> findDeletions(SignalModel model) {
        List<String> retVal = new ArrayList<String>();
        Map<String, String> nameMap = model.getNameMap();
        Set<String> keep = new HashSet<String>();
        boolean found = false;
        // Process the downstream seeds.
        if (! this.downstream.isEmpty()) {
            Map<String, Set<String>> successors = model.getSuccessorMap();
            found |= this.keepReachable(model, this.downstream, nameMap, successors, keep);
        }
        // Process the upstream seeds.
        if (! this.upstream.isEmpty()) {
            Map<String, Set<String>> predecessors = model.getPredecessorMap();
            found |= this.keepReachable(model, this.upstream, nameMap, predecessors, keep);
        }
        if (! found)
            log.warn("No seed species found.  Neighborhood filter not applied.");
        else {
            for (String id : model.getIds()) {
                if (! keep.contains(id))
                    retVal.add(id);
            }
            log.info("{} species kept in neighborhood, {} removed.", keep.size(), retVal.size());
        }
        return retVal;
    }

    /**
     * Add the species reachable from a set of seeds to the keep set.
     *
     * @param model		model being filtered
     * @param seeds		names of the seed species
     * @param nameMap	map of names to species IDs
     * @param graph		graph to traverse
     * @param keep		set of species IDs to keep
     *
     * @return TRUE if at least one seed was found
     */
    private boolean keepReachable(SignalModel model, List<String> seeds, Map<String, String> nameMap,
            Map<String, Set<String>> graph, Set<String> keep) {
        boolean retVal = false;
        for (String name : seeds) {
            String id = nameMap.get(name);
            if (id == null)
                log.error("{} was not found.  It may be ambiguous.", name);
            else {
                Set<String> reached = model.traverse(id, graph);
                log.debug("{} species reachable from {}.", reached.size(), name);
                keep.addAll(reached);
                retVal = true;
            }
        }
        return retVal;
    }

}
