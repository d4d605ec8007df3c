/**
 *
 */
package org.signalq.cmd;

import java.io.File;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.signalq.io.BmaWriter;
import org.signalq.io.SpeciesCsvWriter;
import org.signalq.logic.LogicalModel;
import org.signalq.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command converts a pathway diagram into a BioModelAnalyzer JSON model.  Each species becomes a
 * BMA variable whose target function is written in the min/max language.
 *
 * The positional parameters are the name of the diagram file and the name of the output file.  If the
 * output file is omitted, it is put next to the diagram with an extension of ".json".
 *
 * The command-line options are those of the base model processor, plus
 *
 * -g	maximum level of a species (default 1)
 * -i	constant level for input species (default is the granularity)
 * -C	use a constant color instead of coloring the variables by compartment
 *
 */
public class BmaProcessor extends BaseModelProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BmaProcessor.class);

    // COMMAND-LINE OPTIONS

    /** maximum species level */
    @Option(name = "-g", aliases = { "--granularity" }, metaVar = "1", usage = "maximum level of a species")
    private int granularity;

    /** input species level */
    @Option(name = "-i", aliases = { "--input" }, metaVar = "1", usage = "constant level for input species")
    private Integer inputLevel;

    /** TRUE to use a constant color */
    @Option(name = "-C", aliases = { "--colourConstant" }, usage = "do not color the variables by compartment")
    private boolean colorConstant;

    /** output file */
    @Argument(index = 1, metaVar = "output.json", usage = "output BMA JSON file")
    private File outFile;

    @Override
    protected void setModelDefaults() {
        this.granularity = 1;
        this.inputLevel = null;
        this.colorConstant = false;
        this.outFile = null;
    }

    @Override
    protected void validateModelParms() throws IOException, ParseFailureException {
        if (this.granularity < 1)
            throw new ParseFailureException("Granularity must be at least 1.");
        if (this.inputLevel != null && (this.inputLevel < 0 || this.inputLevel > this.granularity))
            throw new ParseFailureException("Input level must be between 0 and the granularity.");
        if (this.outFile == null)
            this.outFile = SpeciesCsvWriter.replaceExtension(this.getInFile(), ".json");
        log.info("BMA output will be to {}.", this.outFile);
    }

    @Override
    protected void runCommand() throws Exception {
        LogicalModel logical = this.synthesize(this.granularity);
        new BmaWriter(this.inputLevel, ! this.colorConstant).write(logical, this.outFile);
    }

}
