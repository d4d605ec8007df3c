/**
 *
 */
package org.signalq.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object removes the structural detail of a signalling model that adds no regulatory information.
 * It makes a single pass over the species in model order, doing the following.
 *
 * 1.	The grouping table is removed from the model.  Groupings with more than one member are kept as
 * 		multispecies for the final step.
 * 2.	A species whose reference ID has already been seen is merged into the first species with that
 * 		reference ID.
 * 3.	A receptor with no transitions is deleted if its unique active form is produced by a heterodimer
 * 		association involving the receptor.
 * 4.	A complex formed from two species whose only role is to form that complex absorbs both of them.
 * 5.	A multispecies member that only serves to activate another member is deleted, and a member
 * 		that is merely transported into another member gives its transitions to that member.
 *
 * Every merge and deletion is recorded in a replacement map, and at the end the references in all the
 * surviving transitions are rewritten.  References to an absorbed species from its absorber are
 * dropped rather than turned into self-references.
 *
 * No step ever fails:  a missing species is simply not applicable to the rule being checked.
 *
 */
public class StructuralReducer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(StructuralReducer.class);
    /** model being reduced */
    private SignalModel model;
    /** active-form index for the model */
    private ActiveFormIndex index;
    /** map of reference IDs to representative species IDs */
    private Map<String, String> representatives;
    /** map of merged species IDs to the IDs of the species they were merged into */
    private Map<String, String> replacements;
    /** map of absorbed species IDs to the IDs of the species that absorbed them */
    private Map<String, String> absorptions;
    /** multispecies groupings */
    private Map<String, List<String>> multispecies;
    /** number of duplicates merged */
    private int mergeCount;
    /** number of receptors deleted */
    private int receptorCount;
    /** number of complex partners absorbed */
    private int partnerCount;
    /** number of multispecies members removed */
    private int memberCount;

    /**
     * Construct a structural reducer for a model.
     *
     * @param model		model to reduce
     */
    public StructuralReducer(SignalModel model) {
        this.model = model;
        this.representatives = new HashMap<String, String>(model.size() * 4 / 3 + 1);
        this.replacements = new LinkedHashMap<String, String>();
        this.absorptions = new LinkedHashMap<String, String>();
        this.multispecies = new LinkedHashMap<String, List<String>>();
    }

    /**
     * Reduce the model.
     */
    public void reduce() {
        // Remove the groupings, keeping the multispecies.
        Map<String, List<String>> groupings = this.model.removeGroupings();
        for (Map.Entry<String, List<String>> grouping : groupings.entrySet()) {
            List<String> members = grouping.getValue();
            log.debug("Removing grouping {} with members {}.", grouping.getKey(), members);
            if (members.size() > 1)
                this.multispecies.put(grouping.getKey(), members);
        }
        // Index the model.
        this.index = new ActiveFormIndex(this.model);
        // Now run through a snapshot of the species list.
        for (String id : this.model.getIds()) {
            Species species = this.model.getSpecies(id);
            // Skip species already deleted during this pass.
            if (species == null)
                continue;
            String ref = species.getReferenceId();
            String rep = this.representatives.get(ref);
            if (rep != null && this.model.contains(rep))
                this.merge(species, rep);
            else {
                boolean kept = true;
                if (species.isReceptor() && ! species.hasTransitions())
                    kept = ! this.deleteReceptor(species);
                else if (species.isType(Species.COMPLEX))
                    this.absorbPartners(species);
                if (kept && (rep == null || ! this.model.contains(rep)))
                    this.representatives.put(ref, id);
            }
        }
        // Reconcile the multispecies.
        for (Map.Entry<String, List<String>> group : this.multispecies.entrySet())
            this.reconcile(group.getKey(), group.getValue());
        // Apply the replacements.
        this.applyReplacements();
        log.info("Structural reduction merged {} duplicates, removed {} receptors, {} complex partners, and {} multispecies members. {} species remain.",
                this.mergeCount, this.receptorCount, this.partnerCount, this.memberCount, this.model.size());
    }

    /**
     * Merge a species into the representative for its molecule.
     *
     * @param species	species to merge
     * @param into		ID of the representative species
     */
    private void merge(Species species, String into) {
        String id = species.getId();
        Species target = this.model.getSpecies(into);
        log.debug("Merging {} into {} for {} ({}).", id, into, species.getReferenceId(), species.getName());
        target.getAnnotations().merge(species.getAnnotations());
        target.addTransitions(species.getTransitions());
        this.replacements.put(id, into);
        this.index.redirect(id, into);
        this.model.delete(id);
        this.mergeCount++;
    }

    /**
     * Record that a species has been absorbed into another and delete it.
     *
     * @param id		ID of the absorbed species
     * @param into		ID of the absorbing species
     */
    private void absorb(String id, String into) {
        Species species = this.model.getSpecies(id);
        this.model.getSpecies(into).getAnnotations().merge(species.getAnnotations());
        this.absorptions.put(id, into);
        this.index.remove(id);
        this.model.delete(id);
    }

    /**
     * Delete an input receptor if it only serves to dimerize into its active form.
     *
     * @param species	receptor species to check
     *
     * @return TRUE if the receptor was deleted
     */
    private boolean deleteReceptor(Species species) {
        boolean retVal = false;
        String id = species.getId();
        log.debug("{} is a receptor and an input.", id);
        String active = this.index.getActive(id);
        if (active != null) {
            Species target = this.model.getSpecies(active);
            if (target != null && target.getTransitions().stream()
                    .anyMatch(x -> Transition.HETERODIMER_ASSOCIATION.equals(x.getType())
                            && x.getReactants().contains(id))) {
                log.debug("Deleting input receptor {} that dimerizes to form {}.", id, active);
                this.absorb(id, active);
                this.receptorCount++;
                retVal = true;
            }
        }
        return retVal;
    }

    /**
     * Absorb the partners of a complex that only exist to form the complex.
     *
     * @param complex	complex species to check
     */
    private void absorbPartners(Species complex) {
        String key = complex.getId();
        for (Transition transition : new ArrayList<Transition>(complex.getTransitions())) {
            if (! Transition.HETERODIMER_ASSOCIATION.equals(transition.getType()))
                continue;
            List<String> reactants = transition.getReactants();
            if (reactants.size() != 2) {
                log.debug("Skipping heterodimer association for {} with {} reactants.", key, reactants.size());
                continue;
            }
            Species reac1 = this.model.getSpecies(reactants.get(0));
            Species reac2 = this.model.getSpecies(reactants.get(1));
            if (reac1 == null || reac2 == null)
                continue;
            String active1 = this.index.getActive(reac1.getId());
            String active2 = this.index.getActive(reac2.getId());
            if (key.equals(active1) && key.equals(active2) && this.isBareComponent(reac1)
                    && this.isBareComponent(reac2)) {
                log.debug("Deleting {} and {} for complex {}.", reac1.getId(), reac2.getId(), key);
                for (Species reac : List.of(reac1, reac2)) {
                    complex.addTransitions(reac.getTransitions());
                    this.index.transferTransitions(reac.getId(), key);
                    this.representatives.computeIfPresent(reac.getReferenceId(), (k, v) -> key);
                    this.absorb(reac.getId(), key);
                    this.partnerCount++;
                }
            }
        }
    }

    /**
     * @return TRUE if the specified species is neither a receptor nor produced by anything
     *
     * @param species	species to check
     */
    private boolean isBareComponent(Species species) {
        return ! species.isReceptor() && ! species.hasTransitions();
    }

    /**
     * Remove the members of a multispecies that exist only to activate or feed another member.
     *
     * @param name		name of the multispecies
     * @param members	IDs of the members
     */
    private void reconcile(String name, List<String> members) {
        log.debug("Looking at multispecies {}.", name);
        for (String val : members) {
            String active = this.index.getActive(val);
            Species species = this.model.getSpecies(val);
            if (species == null || active == null || ! members.contains(active))
                continue;
            Species target = this.model.getSpecies(active);
            if (target == null)
                continue;
            if (! species.hasTransitions()) {
                log.debug("Deleting {} [{} is active for {}].", val, active, name);
                this.absorb(val, active);
                this.memberCount++;
            } else if (target.getTransitions().size() == 1
                    && target.getTransitions().get(0).isPureTransportOf(val)) {
                log.debug("Merging {} into {} in transport for {}.", val, active, name);
                target.setTransitions(species.getTransitions());
                this.index.replaceTransitions(val, active);
                this.absorb(val, active);
                this.memberCount++;
            }
        }
    }

    /**
     * Rewrite all the transitions and functions to reflect the merges and deletions.
     */
    private void applyReplacements() {
        for (Species species : this.model.getAllSpecies()) {
            String owner = species.getId();
            for (Transition transition : species.getTransitions())
                transition.rewrite(x -> this.resolve(x, owner));
        }
        Map<String, String> finals = new LinkedHashMap<String, String>();
        for (String old : this.replacements.keySet())
            finals.put(old, this.resolve(old, null));
        for (String old : this.absorptions.keySet())
            finals.put(old, this.resolve(old, null));
        this.model.replaceInFunctions(finals);
    }

    /**
     * Compute the final replacement for a species ID.
     *
     * @param id		ID of a referenced species
     * @param owner		ID of the species owning the reference (or NULL)
     *
     * @return the replacement ID, or NULL if the reference should be dropped
     */
    private String resolve(String id, String owner) {
        String retVal = id;
        boolean absorbed = false;
        Set<String> seen = new HashSet<String>();
        seen.add(id);
        String next = this.next(retVal);
        while (next != null && seen.add(next)) {
            if (this.absorptions.containsKey(retVal))
                absorbed = true;
            retVal = next;
            next = this.next(retVal);
        }
        if (absorbed && retVal.equals(owner))
            retVal = null;
        return retVal;
    }

    /**
     * @return the direct replacement for a species ID, or NULL if it has none
     *
     * @param id	ID of the species of interest
     */
    private String next(String id) {
        String retVal = this.replacements.get(id);
        if (retVal == null)
            retVal = this.absorptions.get(id);
        return retVal;
    }

    /**
     * @return the merge replacement map
     */
    public Map<String, String> getReplacements() {
        return Collections.unmodifiableMap(this.replacements);
    }

    /**
     * @return the absorption map
     */
    public Map<String, String> getAbsorptions() {
        return Collections.unmodifiableMap(this.absorptions);
    }

    /**
     * @return the multispecies groupings found
     */
    public Map<String, List<String>> getMultispecies() {
        return Collections.unmodifiableMap(this.multispecies);
    }

    /**
     * @return the number of species removed by this reducer
     */
    public int getRemovedCount() {
        return this.mergeCount + this.receptorCount + this.partnerCount + this.memberCount;
    }

}
