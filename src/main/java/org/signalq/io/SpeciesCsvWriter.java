/**
 *
 */
package org.signalq.io;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.io.FilenameUtils;
import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object writes the species of a simplified model as tables.  The CSV table has one row per species
 * describing its name, type, location, and function.  The BoolNet table has one row per species with the
 * name and the function.
 *
 */
public class SpeciesCsvWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SpeciesCsvWriter.class);

    /** CSV table headers */
    public static final String[] CSV_HEADERS = new String[] { "Species_id", "Name", "Type", "Compartment",
            "Activity", "Receptor", "X", "Y", "Function" };
    /** BoolNet table header */
    public static final String BNET_HEADER = "targets, factors";

    /**
     * Write the species table.
     *
     * @param model		model to write
     * @param writer	output writer
     *
     * @throws IOException
     */
    public void writeCsv(SignalModel model, Writer writer) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.withRecordSeparator('\n').withHeader(CSV_HEADERS));
        for (Species species : model.getAllSpecies()) {
            printer.printRecord(species.getId(), species.getName(), species.getType(), species.getCompartment(),
                    species.getActivity(), species.isReceptor(), species.getX(), species.getY(), species.getFunction());
        }
        printer.flush();
    }

    /**
     * Write the BoolNet table.
     *
     * @param model		model to write
     * @param writer	output writer
     *
     * @throws IOException
     */
    public void writeBnet(SignalModel model, Writer writer) throws IOException {
        PrintWriter printer = new PrintWriter(writer);
        printer.println(BNET_HEADER);
        for (Species species : model.getAllSpecies())
            printer.println(species.getName() + ", " + species.getFunction());
        printer.flush();
    }

    /**
     * Write both tables next to a model file.  The CSV table gets the extension ".csv" and the BoolNet table
     * gets the extension ".bnet".
     *
     * @param model		model to write
     * @param base		base output file, whose extension will be replaced
     *
     * @throws IOException
     */
    public void write(SignalModel model, File base) throws IOException {
        File csvFile = replaceExtension(base, ".csv");
        try (Writer writer = Files.newBufferedWriter(csvFile.toPath(), StandardCharsets.UTF_8)) {
            this.writeCsv(model, writer);
        }
        File bnetFile = replaceExtension(base, ".bnet");
        try (Writer writer = Files.newBufferedWriter(bnetFile.toPath(), StandardCharsets.UTF_8)) {
            this.writeBnet(model, writer);
        }
        log.info("Species tables written to {} and {}.", csvFile, bnetFile);
    }

    /**
     * @return a file with the extension replaced
     *
     * @param base			original file
     * @param extension		new extension, including the period
     */
    public static File replaceExtension(File base, String extension) {
        String path = base.getPath();
        String stripped = FilenameUtils.removeExtension(path);
        return new File(stripped + extension);
    }

}
