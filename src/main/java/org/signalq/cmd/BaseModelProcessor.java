/**
 *
 */
package org.signalq.cmd;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.signalq.io.ModelFormat;
import org.signalq.logic.FunctionSynthesizer;
import org.signalq.logic.LogicalModel;
import org.signalq.network.FixedLevels;
import org.signalq.network.ModelSimplifier;
import org.signalq.network.SignalModel;
import org.signalq.utils.BaseProcessor;
import org.signalq.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a base class for commands that read and simplify a pathway diagram.
 *
 * The positional parameter is the name of the diagram file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -r	remove connected components of this size or smaller; a negative value keeps only the largest
 * 		(default 0, meaning no removal)
 * -u	name of a species whose upstream neighborhood should be kept (multiple allowed)
 * -d	name of a species whose downstream neighborhood should be kept (multiple allowed)
 * -n	use the species names as IDs
 * -f	CSV file of species names and fixed levels
 *
 * --format			format of the diagram file (CD or SBGN, default CD)
 * --noSelfLoops	ignore references from a species to itself in the logical functions
 *
 */
public abstract class BaseModelProcessor extends BaseProcessor implements ModelSimplifier.IParms {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseModelProcessor.class);
    /** simplified signalling model */
    private SignalModel model;
    /** fixed levels to apply */
    private FixedLevels fixedLevels;

    // COMMAND-LINE OPTIONS

    /** diagram format */
    @Option(name = "--format", usage = "format of the input diagram")
    private ModelFormat format;

    /** component size threshold */
    @Option(name = "-r", aliases = { "--remove" }, metaVar = "S",
            usage = "delete connected components of size S or less (negative to keep only the largest)")
    private int threshold;

    /** upstream seed names */
    @Option(name = "-u", aliases = { "--upstream" }, metaVar = "name",
            usage = "only keep species upstream of this one (multiple allowed)")
    private List<String> upstream;

    /** downstream seed names */
    @Option(name = "-d", aliases = { "--downstream" }, metaVar = "name",
            usage = "only keep species downstream of this one (multiple allowed)")
    private List<String> downstream;

    /** TRUE to use names as IDs */
    @Option(name = "-n", aliases = { "--names" }, usage = "use the species names as IDs")
    private boolean namesAsIds;

    /** TRUE to ignore self-loops */
    @Option(name = "--noSelfLoops", usage = "ignore references from a species to itself")
    private boolean noSelfLoops;

    /** fixed-level file */
    @Option(name = "-f", aliases = { "--fixed" }, metaVar = "fixed.csv",
            usage = "CSV file of species names and the levels at which to fix them")
    private File fixedFile;

    /** input diagram file */
    @Argument(index = 0, metaVar = "diagram.xml", usage = "input pathway diagram file", required = true)
    private File inFile;

    @Override
    protected final void setDefaults() {
        this.format = ModelFormat.CD;
        this.threshold = 0;
        this.upstream = new ArrayList<String>();
        this.downstream = new ArrayList<String>();
        this.namesAsIds = false;
        this.noSelfLoops = false;
        this.fixedFile = null;
        this.setModelDefaults();
    }

    /**
     * Set the default options for the subclass.
     */
    protected abstract void setModelDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("Diagram file " + this.inFile + " is not found or unreadable.");
        if (this.fixedFile == null)
            this.fixedLevels = new FixedLevels();
        else if (! this.fixedFile.canRead())
            throw new FileNotFoundException("Fixed-level file " + this.fixedFile + " is not found or unreadable.");
        else
            this.fixedLevels = new FixedLevels(this.fixedFile);
        this.validateModelParms();
        // Load and simplify the model.
        this.model = this.format.read(this.inFile);
        new ModelSimplifier(this).simplify(this.model);
        return true;
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateModelParms() throws IOException, ParseFailureException;

    /**
     * Compute the logical functions of the simplified model.
     *
     * @param granularity	maximum level of a species
     *
     * @return the logical model
     */
    protected LogicalModel synthesize(int granularity) {
        return FunctionSynthesizer.create(granularity, this.noSelfLoops).synthesize(this.model);
    }

    /**
     * @return the simplified model
     */
    protected SignalModel getModel() {
        return this.model;
    }

    /**
     * @return the input diagram file
     */
    protected File getInFile() {
        return this.inFile;
    }

    @Override
    public int getThreshold() {
        return this.threshold;
    }

    @Override
    public List<String> getUpstream() {
        return this.upstream;
    }

    @Override
    public List<String> getDownstream() {
        return this.downstream;
    }

    @Override
    public boolean isNamesAsIds() {
        return this.namesAsIds;
    }

    @Override
    public FixedLevels getFixedLevels() {
        return this.fixedLevels;
    }

}
