/**
 *
 */
package org.signalq.network;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object tracks, for each species ID, the other species whose transitions reference it.  It is used
 * to find the "active form" of a species:  the single other species it contributes to.  If a species
 * contributes to more than one other species, it has no unique active form and cannot be simplified
 * away.
 *
 * The index is built once from the model and then kept current as the structural reducer moves
 * transitions between species and deletes species.  References are recorded by raw ID, so a
 * reference to a species that has been merged away is counted under the old ID until the merge
 * redirects it.
 *
 */
public class ActiveFormIndex {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ActiveFormIndex.class);
    /** map of species IDs to the IDs of the species that reference them */
    private Map<String, Set<String>> referrers;
    /** map of species IDs to the IDs of the species they reference */
    private Map<String, Set<String>> references;

    /**
     * Build the index for a model.
     *
     * @param model		model to index
     */
    public ActiveFormIndex(SignalModel model) {
        final int hashSize = model.size() * 4 / 3 + 1;
        this.referrers = new HashMap<String, Set<String>>(hashSize);
        this.references = new HashMap<String, Set<String>>(hashSize);
        for (Species species : model.getAllSpecies()) {
            String referrer = species.getId();
            for (Transition transition : species.getTransitions()) {
                for (String referenced : transition.getReferences())
                    this.connect(referrer, referenced);
            }
        }
    }

    /**
     * Record that one species references another.  Self-references are ignored.
     *
     * @param referrer		ID of the species whose transition contains the reference
     * @param referenced	ID of the species referenced
     */
    private void connect(String referrer, String referenced) {
        if (! referrer.equals(referenced)) {
            this.referrers.computeIfAbsent(referenced, x -> new LinkedHashSet<String>()).add(referrer);
            this.references.computeIfAbsent(referrer, x -> new LinkedHashSet<String>()).add(referenced);
        }
    }

    /**
     * Find the active form of a species.
     *
     * @param id	ID of the species whose active form is desired
     *
     * @return the ID of the one other species that references this one, or NULL if there is none
     * 		   or the active form is ambiguous
     */
    public String getActive(String id) {
        String retVal = null;
        Set<String> found = this.referrers.get(id);
        if (found != null) {
            if (found.size() == 1) {
                retVal = found.iterator().next();
                log.debug("{} activates {}.", id, retVal);
            } else if (found.size() > 1)
                log.debug("{} activates {} species, so it has no unique active form.", id, found.size());
        }
        return retVal;
    }

    /**
     * @return the IDs of the species that reference the specified species
     *
     * @param id	ID of the species of interest
     */
    public Set<String> getReferrers(String id) {
        Set<String> retVal = this.referrers.get(id);
        if (retVal == null)
            retVal = Collections.emptySet();
        return Collections.unmodifiableSet(retVal);
    }

    /**
     * Denote that a species has been deleted.  It no longer references anything.
     *
     * @param id	ID of the deleted species
     */
    public void remove(String id) {
        Set<String> referenced = this.references.remove(id);
        if (referenced != null) {
            for (String other : referenced) {
                Set<String> others = this.referrers.get(other);
                if (others != null)
                    others.remove(id);
            }
        }
    }

    /**
     * Denote that the transitions of one species have been appended to those of another.  Everything the
     * source species referenced is now also referenced by the target.
     *
     * @param from	ID of the species whose transitions were moved
     * @param into	ID of the species receiving the transitions
     */
    public void transferTransitions(String from, String into) {
        Set<String> referenced = this.references.get(from);
        if (referenced != null) {
            for (String other : Set.copyOf(referenced))
                this.connect(into, other);
        }
        this.remove(from);
    }

    /**
     * Denote that the transitions of a target species have been replaced by those of another species.
     *
     * @param from	ID of the species whose transitions were moved
     * @param into	ID of the species whose transitions were replaced
     */
    public void replaceTransitions(String from, String into) {
        this.remove(into);
        this.transferTransitions(from, into);
    }

    /**
     * Denote that a species has been merged into another.  Its transitions move to the target, and all
     * references to it will be rewritten as references to the target.
     *
     * @param from	ID of the species merged away
     * @param into	ID of the surviving species
     */
    public void redirect(String from, String into) {
        this.transferTransitions(from, into);
        Set<String> referring = this.referrers.remove(from);
        if (referring != null) {
            for (String other : referring) {
                Set<String> referenced = this.references.get(other);
                if (referenced != null)
                    referenced.remove(from);
                this.connect(other, into);
            }
        }
    }

}
