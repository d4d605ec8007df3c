/**
 *
 */
package org.signalq.network;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.signalq.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object holds a set of species that should be fixed at constant levels, to model input values,
 * knock-ins, and knock-outs.  The levels are read from a CSV file with no headers.  The first column of
 * each line is a species name and the second is the level.
 *
 */
public class FixedLevels {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(FixedLevels.class);
    /** map of species names to levels */
    private Map<String, Integer> levels;

    /**
     * Create an empty set of fixed levels.
     */
    public FixedLevels() {
        this.levels = new LinkedHashMap<String, Integer>();
    }

    /**
     * Load a set of fixed levels from a file.
     *
     * @param inFile	CSV file containing names and levels
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    public FixedLevels(File inFile) throws IOException, ParseFailureException {
        this();
        try (Reader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8);
                CSVParser parser = CSVFormat.DEFAULT.withIgnoreEmptyLines(true).withTrim().parse(reader)) {
            for (CSVRecord record : parser) {
                if (record.size() < 2)
                    throw new ParseFailureException("Line " + record.getRecordNumber() + " of " + inFile
                            + " does not have a name and a level.");
                String name = record.get(0);
                try {
                    this.put(name, Integer.parseInt(record.get(1)));
                } catch (NumberFormatException e) {
                    throw new ParseFailureException("Invalid level \"" + record.get(1) + "\" for " + name
                            + " in " + inFile + ".", e);
                }
            }
        }
        log.info("{} fixed levels read from {}.", this.levels.size(), inFile);
    }

    /**
     * Specify a fixed level for a species.
     *
     * @param name		name of the species
     * @param level		level at which to fix it
     */
    public void put(String name, int level) {
        this.levels.put(name, level);
    }

    /**
     * @return the map of species names to levels
     */
    public Map<String, Integer> getLevels() {
        return Collections.unmodifiableMap(this.levels);
    }

    /**
     * @return TRUE if there are no fixed levels
     */
    public boolean isEmpty() {
        return this.levels.isEmpty();
    }

    /**
     * Fix the levels of the named species in a model.  Names that are not found are skipped.
     *
     * @param model		model to update
     *
     * @return the number of species fixed
     */
    public int apply(SignalModel model) {
        int retVal = 0;
        Map<String, String> nameMap = model.getNameMap();
        for (Map.Entry<String, Integer> entry : this.levels.entrySet()) {
            String id = nameMap.get(entry.getKey());
            if (id == null)
                log.warn("Fixed species {} was not found in the model.", entry.getKey());
            else {
                model.getSpecies(id).fix(entry.getValue());
                log.debug("{} fixed at level {}.", entry.getKey(), entry.getValue());
                retVal++;
            }
        }
        return retVal;
    }

}
