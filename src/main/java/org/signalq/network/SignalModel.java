/**
 *
 */
package org.signalq.network;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object represents a signalling model read from a pathway diagram.  The model consists of species
 * and the transitions that produce them.  Each transition is stored with the species it produces.  The
 * species are kept in the order they were read, and this order is preserved by all the operations that
 * simplify the model.
 *
 * The model also contains a grouping table that lists, for each molecule name, the species that are
 * instances of it.  The groupings are only used during structural reduction.
 *
 */
public class SignalModel {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SignalModel.class);
    /** map of species IDs to species, in input order */
    private Map<String, Species> speciesMap;
    /** map of grouping names to member species IDs */
    private Map<String, List<String>> groupings;
    /** canvas width */
    private double width;
    /** canvas height */
    private double height;

    /**
     * This class sorts a list of components from largest to smallest.  Components of the same size
     * stay in discovery order, since the sort is stable.
     */
    public static class ComponentSorter implements Comparator<Set<String>> {

        @Override
        public int compare(Set<String> o1, Set<String> o2) {
            return o2.size() - o1.size();
        }

    }

    /**
     * Create an empty signalling model.
     *
     * @param width		canvas width
     * @param height	canvas height
     */
    public SignalModel(double width, double height) {
        this.speciesMap = new LinkedHashMap<String, Species>();
        this.groupings = new LinkedHashMap<String, List<String>>();
        this.width = width;
        this.height = height;
    }

    /**
     * Add a species to this model.  A species with the same ID will be replaced.
     *
     * @param species	species to add
     */
    public void addSpecies(Species species) {
        this.speciesMap.put(species.getId(), species);
    }

    /**
     * @return the species with the specified ID, or NULL if it is not in the model
     *
     * @param id	ID of the desired species
     */
    public Species getSpecies(String id) {
        return this.speciesMap.get(id);
    }

    /**
     * @return TRUE if the specified species is in this model
     *
     * @param id	ID of the species to check
     */
    public boolean contains(String id) {
        return this.speciesMap.containsKey(id);
    }

    /**
     * @return the species in this model, in order
     */
    public Collection<Species> getAllSpecies() {
        return Collections.unmodifiableCollection(this.speciesMap.values());
    }

    /**
     * @return a copy of the species ID list, in order
     */
    public List<String> getIds() {
        return new ArrayList<String>(this.speciesMap.keySet());
    }

    /**
     * @return the number of species in this model
     */
    public int size() {
        return this.speciesMap.size();
    }

    /**
     * Delete a species from this model.  The transitions that produce it go with it.
     *
     * @param id	ID of the species to delete
     *
     * @return the species deleted, or NULL if it was not present
     */
    public Species delete(String id) {
        return this.speciesMap.remove(id);
    }

    /**
     * Delete all the species in a collection.
     *
     * @param ids	IDs of the species to delete
     *
     * @return the number of species deleted
     */
    public int deleteAll(Collection<String> ids) {
        int retVal = 0;
        for (String id : ids) {
            if (this.speciesMap.remove(id) != null)
                retVal++;
        }
        return retVal;
    }

    /**
     * Record a species as a member of a grouping.
     *
     * @param group		name of the grouping (generally the molecule name)
     * @param id		ID of the member species
     */
    public void addGroupMember(String group, String id) {
        List<String> members = this.groupings.computeIfAbsent(group, x -> new ArrayList<String>());
        if (! members.contains(id))
            members.add(id);
    }

    /**
     * @return the grouping table
     */
    public Map<String, List<String>> getGroupings() {
        return Collections.unmodifiableMap(this.groupings);
    }

    /**
     * Remove the grouping table from the model.
     *
     * @return the grouping table removed
     */
    public Map<String, List<String>> removeGroupings() {
        Map<String, List<String>> retVal = this.groupings;
        this.groupings = new LinkedHashMap<String, List<String>>();
        return retVal;
    }

    /**
     * @return the canvas width
     */
    public double getWidth() {
        return this.width;
    }

    /**
     * @return the canvas height
     */
    public double getHeight() {
        return this.height;
    }

    /**
     * @return the ID of the species with the specified name, or NULL if there is none
     *
     * @param name	name of the desired species
     */
    public String findByName(String name) {
        String retVal = null;
        for (Species species : this.speciesMap.values()) {
            if (species.getName().equals(name))
                retVal = species.getId();
        }
        return retVal;
    }

    /**
     * Remove references to species that are no longer in the model from every transition.
     *
     * @return the number of transitions changed
     */
    public int purgeDangling() {
        int retVal = 0;
        for (Species species : this.speciesMap.values()) {
            for (Transition transition : species.getTransitions()) {
                if (transition.rewrite(x -> (this.speciesMap.containsKey(x) ? x : null)))
                    retVal++;
            }
        }
        if (retVal > 0)
            log.debug("{} transitions had references to missing species.", retVal);
        return retVal;
    }

    /**
     * Replace text in every function.  Each old string is replaced by the new string in the same
     * map entry.
     *
     * @param replacements		map of old strings to new strings
     */
    public void replaceInFunctions(Map<String, String> replacements) {
        for (Species species : this.speciesMap.values()) {
            String function = species.getFunction();
            for (Map.Entry<String, String> replacement : replacements.entrySet())
                function = StringUtils.replace(function, replacement.getKey(), replacement.getValue());
            species.setFunction(function);
        }
    }

    /**
     * Change the IDs of species in this model.  The species order is preserved, and every transition
     * is updated to use the new IDs.
     *
     * @param newIds	map of old IDs to new IDs; species not in the map keep their IDs
     */
    public void rekey(Map<String, String> newIds) {
        Map<String, Species> newMap = new LinkedHashMap<String, Species>(this.speciesMap.size() * 4 / 3 + 1);
        for (Species species : this.speciesMap.values()) {
            String newId = newIds.getOrDefault(species.getId(), species.getId());
            species.setId(newId);
            newMap.put(newId, species);
        }
        this.speciesMap = newMap;
        for (Species species : this.speciesMap.values()) {
            for (Transition transition : species.getTransitions())
                transition.rewrite(x -> newIds.getOrDefault(x, x));
        }
    }

    /**
     * Compute the directed influence graph of this model.  Each species is connected to the species
     * whose transitions reference it.  Only species in the model are included.
     *
     * @return a map from each species ID to the IDs of the species it influences
     */
    public Map<String, Set<String>> getSuccessorMap() {
        Map<String, Set<String>> retVal = this.emptyGraph();
        for (Species species : this.speciesMap.values()) {
            for (String source : this.getInfluences(species))
                retVal.get(source).add(species.getId());
        }
        return retVal;
    }

    /**
     * Compute the reverse of the directed influence graph of this model.  Each species is connected to
     * the species referenced by its transitions.
     *
     * @return a map from each species ID to the IDs of the species that influence it
     */
    public Map<String, Set<String>> getPredecessorMap() {
        Map<String, Set<String>> retVal = this.emptyGraph();
        for (Species species : this.speciesMap.values())
            retVal.get(species.getId()).addAll(this.getInfluences(species));
        return retVal;
    }

    /**
     * @return a map with an empty neighbor set for each species, in model order
     */
    private Map<String, Set<String>> emptyGraph() {
        Map<String, Set<String>> retVal = new LinkedHashMap<String, Set<String>>(this.speciesMap.size() * 4 / 3 + 1);
        for (String id : this.speciesMap.keySet())
            retVal.put(id, new LinkedHashSet<String>());
        return retVal;
    }

    /**
     * @return the IDs of the model species referenced by the transitions of a species
     *
     * @param species	species whose influences are desired
     */
    public Set<String> getInfluences(Species species) {
        Set<String> retVal = new LinkedHashSet<String>();
        for (Transition transition : species.getTransitions()) {
            for (String id : transition.getReferences()) {
                if (this.speciesMap.containsKey(id))
                    retVal.add(id);
            }
        }
        return retVal;
    }

    /**
     * Compute the connected components of the undirected influence graph.  Every species belongs to
     * exactly one component; a species with no connections forms a component by itself.
     *
     * @return a list of the components, largest first
     */
    public List<Set<String>> getComponents() {
        // Build the undirected graph.
        Map<String, Set<String>> neighbors = this.emptyGraph();
        for (Species species : this.speciesMap.values()) {
            String target = species.getId();
            for (String source : this.getInfluences(species)) {
                neighbors.get(source).add(target);
                neighbors.get(target).add(source);
            }
        }
        // Now paint the components.
        List<Set<String>> retVal = new ArrayList<Set<String>>();
        Set<String> seen = new HashSet<String>(this.speciesMap.size() * 4 / 3 + 1);
        for (String start : neighbors.keySet()) {
            if (! seen.contains(start)) {
                Set<String> component = this.traverse(start, neighbors);
                seen.addAll(component);
                retVal.add(component);
            }
        }
        Collections.sort(retVal, new ComponentSorter());
        return retVal;
    }

    /**
     * Compute the set of species reachable from a starting species.
     *
     * @param start		ID of the starting species
     * @param graph		map of species IDs to neighbor IDs
     *
     * @return the set of reachable species IDs, including the starting species
     */
    public Set<String> traverse(String start, Map<String, Set<String>> graph) {
        Set<String> retVal = new LinkedHashSet<String>();
        Deque<String> stack = new ArrayDeque<String>();
        stack.push(start);
        retVal.add(start);
        while (! stack.isEmpty()) {
            String current = stack.pop();
            for (String next : graph.getOrDefault(current, Collections.emptySet())) {
                if (retVal.add(next))
                    stack.push(next);
            }
        }
        return retVal;
    }

    /**
     * @return a map of names to species IDs, for use in finding species by name
     */
    public Map<String, String> getNameMap() {
        Map<String, String> retVal = new HashMap<String, String>(this.speciesMap.size() * 4 / 3 + 1);
        for (Species species : this.speciesMap.values())
            retVal.put(species.getName(), species.getId());
        return retVal;
    }

}
