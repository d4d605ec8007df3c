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

import org.signalq.logic.LogicExpression;
import org.signalq.logic.LogicalModel;
import org.signalq.network.Species;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object writes the signed influences of a logical model in simple interaction format.  Each line
 * contains a source species ID, a sign ("POSITIVE" or "NEGATIVE"), and a target species ID, separated by tabs.
 *
 */
public class SifWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SifWriter.class);

    /**
     * Write the influence table.
     *
     * @param logical	logical model to write
     * @param writer	output writer
     *
     * @return the number of influences written
     */
    public int write(LogicalModel logical, Writer writer) {
        int retVal = 0;
        PrintWriter printer = new PrintWriter(writer);
        for (Species species : logical.getModel().getAllSpecies()) {
            for (LogicExpression.Literal literal : logical.getInfluences(species)) {
                String sign = (literal.isPositive() ? "POSITIVE" : "NEGATIVE");
                printer.println(literal.getId() + "\t" + sign + "\t" + species.getId());
                retVal++;
            }
        }
        printer.flush();
        return retVal;
    }

    /**
     * Write the influence table to a file.
     *
     * @param logical	logical model to write
     * @param outFile	output file
     *
     * @throws IOException
     */
    public void write(LogicalModel logical, File outFile) throws IOException {
        try (Writer writer = Files.newBufferedWriter(outFile.toPath(), StandardCharsets.UTF_8)) {
            int count = this.write(logical, writer);
            log.info("{} influences written to {}.", count, outFile);
        }
    }

}
