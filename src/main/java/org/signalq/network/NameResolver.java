/**
 *
 */
package org.signalq.network;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object computes a unique display name for every species in a model.  A name shared by more than one
 * species gets the compartment name appended.  If that still collides, the active copy of the species gets
 * an "_active" suffix, and failing that the smallest unused numeric tag is appended.  Finally, the special
 * character codes used in diagram names are converted back to the characters themselves.
 *
 * The resolved name is stored as both the name and the function of each species.  No two species will end up
 * with the same name.
 *
 * The resolver can also replace the species IDs with identifier-safe versions of the names.
 *
 */
public class NameResolver {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NameResolver.class);
    /** special-character codes to convert */
    private static final String[] CODES = new String[] { "_minus_", "_plus_", "_super", "_slash_" };
    /** characters for the special-character codes */
    private static final String[] CHARS = new String[] { "-", "+", "^", "/" };
    /** suffix for active-state names */
    public static final String ACTIVE_SUFFIX = "_" + Species.ACTIVE;

    /**
     * Resolve the names of all the species in a model.
     *
     * @param model		model whose names are to be resolved
     *
     * @return the number of species whose names changed
     */
    public int resolve(SignalModel model) {
        int retVal = 0;
        // Count the names.
        Map<String, Integer> counts = new HashMap<String, Integer>(model.size() * 4 / 3 + 1);
        for (Species species : model.getAllSpecies())
            counts.merge(species.getName(), 1, Integer::sum);
        // This maps each name assigned so far to the ID of its species.
        Map<String, String> used = new HashMap<String, String>(model.size() * 4 / 3 + 1);
        for (Species species : model.getAllSpecies()) {
            String oldName = species.getName();
            boolean ambiguous = counts.get(oldName) > 1;
            String name = fixName(oldName, ambiguous, species.getCompartment());
            if (used.containsKey(name)) {
                String activeName = name + ACTIVE_SUFFIX;
                Species other = model.getSpecies(used.get(name));
                if (species.isActive() && ! used.containsKey(activeName)) {
                    name = activeName;
                } else if (other.isActive() && ! used.containsKey(activeName)) {
                    log.debug("Renaming active species {} to {}.", other.getId(), activeName);
                    this.rename(other, activeName);
                    used.remove(name);
                    used.put(activeName, other.getId());
                } else {
                    String newName = name;
                    for (int tag = 1; used.containsKey(newName); tag++)
                        newName = name + "_" + tag;
                    name = newName;
                }
            }
            used.put(name, species.getId());
            if (! name.equals(oldName)) {
                log.debug("Species {} renamed from \"{}\" to \"{}\".", species.getId(), oldName, name);
                retVal++;
            }
            this.rename(species, name);
        }
        log.info("{} species names changed during resolution.", retVal);
        return retVal;
    }

    /**
     * Store a new name in a species.  The name becomes the function as well.
     *
     * @param species	species to rename
     * @param name		new name
     */
    private void rename(Species species, String name) {
        species.setName(name);
        species.setFunction(name);
    }

    /**
     * Compute the display version of a species name.
     *
     * @param name			original name
     * @param ambiguous		TRUE if the name is shared by other species
     * @param compartment	compartment containing the species
     *
     * @return the name with the compartment added (if ambiguous) and the special characters restored
     */
    public static String fixName(String name, boolean ambiguous, String compartment) {
        String retVal = (ambiguous ? name + "_" + compartment : name);
        return StringUtils.replaceEach(retVal, CODES, CHARS);
    }

    /**
     * Replace the ID of every species with a sanitized version of its name.  Spaces become underscores,
     * all other characters that are not letters or digits are removed, and a leading digit gets an
     * underscore in front of it.  If two names sanitize to the
     * same ID, the later one gets a numeric tag.
     *
     * @param model		model to re-key
     */
    public void useNamesAsIds(SignalModel model) {
        Map<String, String> newIds = new LinkedHashMap<String, String>(model.size() * 4 / 3 + 1);
        Map<String, String> used = new HashMap<String, String>(model.size() * 4 / 3 + 1);
        for (Species species : model.getAllSpecies()) {
            String oldName = species.getName();
            String base = sanitize(oldName);
            if (base.isEmpty())
                base = sanitize(species.getId());
            String newId = base;
            for (int tag = 1; used.containsKey(newId); tag++)
                newId = base + "_" + tag;
            used.put(newId, species.getId());
            newIds.put(species.getId(), newId);
            species.setName(newId);
            if (oldName.equals(species.getFunction()))
                species.setFunction(newId);
        }
        model.rekey(newIds);
        log.info("{} species re-keyed by name.", newIds.size());
    }

    /**
     * @return an identifier-safe version of a name
     *
     * @param name	name to convert
     */
    public static String sanitize(String name) {
        String spaced = StringUtils.replaceChars(name, ' ', '_');
        StringBuilder retVal = new StringBuilder(spaced.length());
        for (int i = 0; i < spaced.length(); i++) {
            char c = spaced.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_')
                retVal.append(c);
        }
        // An identifier cannot start with a digit.
        if (retVal.length() > 0 && Character.isDigit(retVal.charAt(0)))
            retVal.insert(0, '_');
        return retVal.toString();
    }

}
