/**
 *
 */
package org.signalq.cmd;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FilenameUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.signalq.io.QualWriter;
import org.signalq.io.SifWriter;
import org.signalq.io.SpeciesCsvWriter;
import org.signalq.logic.LogicalModel;
import org.signalq.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command converts a pathway diagram into an SBML-qual logical model.  Each remaining species
 * becomes a Boolean qualitative species whose transition function is computed from the reactions
 * that produce it.
 *
 * The positional parameters are the name of the diagram file and the name of the output file.  If the
 * output file is omitted, it is put next to the diagram with an extension of ".sbml".
 *
 * The command-line options are those of the base model processor, plus
 *
 * --csv	also write a CSV species table and a BoolNet rule file next to the output
 * --sif	also write a SIF interaction file next to the output
 *
 */
public class QualProcessor extends BaseModelProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(QualProcessor.class);

    // COMMAND-LINE OPTIONS

    /** TRUE to write the CSV and BNET files */
    @Option(name = "--csv", usage = "also write a species CSV table and a BoolNet rule file")
    private boolean csvFlag;

    /** TRUE to write the SIF file */
    @Option(name = "--sif", usage = "also write a SIF interaction file")
    private boolean sifFlag;

    /** output file */
    @Argument(index = 1, metaVar = "output.sbml", usage = "output SBML-qual file")
    private File outFile;

    @Override
    protected void setModelDefaults() {
        this.csvFlag = false;
        this.sifFlag = false;
        this.outFile = null;
    }

    @Override
    protected void validateModelParms() throws IOException, ParseFailureException {
        if (this.outFile == null)
            this.outFile = SpeciesCsvWriter.replaceExtension(this.getInFile(), ".sbml");
        log.info("SBML-qual output will be to {}.", this.outFile);
    }

    @Override
    protected void runCommand() throws Exception {
        LogicalModel logical = this.synthesize(1);
        String modelId = FilenameUtils.getBaseName(this.outFile.getName());
        new QualWriter(modelId).write(logical, this.outFile);
        if (this.csvFlag)
            new SpeciesCsvWriter().write(logical.getModel(), this.outFile);
        if (this.sifFlag)
            new SifWriter().write(logical, SpeciesCsvWriter.replaceExtension(this.outFile, ".sif"));
    }

}
