/**
 *
 */
package org.signalq.network;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * This object holds the cross-reference annotations of a species or transition.  Each
 * annotation is a qualifier (such as "bqbiol:is") mapped to a set of resource URIs.  The
 * annotations are carried through the simplification and merged when species are merged,
 * but are never interpreted.
 *
 */
public class AnnotationSet {

    // FIELDS
    /** map of qualifiers to resource URIs, in order of arrival */
    private Map<String, Set<String>> resources;

    /**
     * Create an empty annotation set.
     */
    public AnnotationSet() {
        this.resources = new LinkedHashMap<String, Set<String>>();
    }

    /**
     * Add a resource URI for a qualifier.
     *
     * @param qualifier		qualifier name (prefix and local name)
     * @param uri			resource URI
     */
    public void add(String qualifier, String uri) {
        Set<String> uris = this.resources.computeIfAbsent(qualifier, x -> new LinkedHashSet<String>());
        uris.add(uri);
    }

    /**
     * Merge another annotation set into this one.
     *
     * @param other		annotation set to merge (may be NULL)
     */
    public void merge(AnnotationSet other) {
        if (other != null && other != this) {
            for (Map.Entry<String, Set<String>> entry : other.resources.entrySet()) {
                for (String uri : entry.getValue())
                    this.add(entry.getKey(), uri);
            }
        }
    }

    /**
     * @return the qualifiers in this set
     */
    public Set<String> getQualifiers() {
        return Collections.unmodifiableSet(this.resources.keySet());
    }

    /**
     * @return the resources for the specified qualifier (may be empty)
     *
     * @param qualifier		qualifier of interest
     */
    public Set<String> getResources(String qualifier) {
        Set<String> retVal = this.resources.get(qualifier);
        if (retVal == null)
            retVal = Collections.emptySet();
        return Collections.unmodifiableSet(retVal);
    }

    /**
     * @return TRUE if there are no annotations
     */
    public boolean isEmpty() {
        return this.resources.isEmpty();
    }

    /**
     * @return the total number of resource URIs
     */
    public int size() {
        return this.resources.values().stream().mapToInt(x -> x.size()).sum();
    }

    @Override
    public String toString() {
        return this.resources.toString();
    }

}
