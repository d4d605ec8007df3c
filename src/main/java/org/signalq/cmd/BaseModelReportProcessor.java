/**
 *
 */
package org.signalq.cmd;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.kohsuke.args4j.Option;
import org.signalq.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a base class for commands that write a text report about a simplified pathway model.  The
 * report goes to the standard output unless an output file is specified.
 *
 * The positional parameter is the name of the diagram file.
 *
 * The command-line options are those of the base model processor, plus
 *
 * -o	output file for report, if not STDOUT
 *
 */
public abstract class BaseModelReportProcessor extends BaseModelProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseModelReportProcessor.class);

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, usage = "output file for report (if not STDOUT)")
    private File outFile;

    @Override
    protected void setModelDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    /**
     * Set the option defaults for the subclass.
     */
    protected abstract void setReporterDefaults();

    @Override
    protected void validateModelParms() throws IOException, ParseFailureException {
        this.validateModelReportParms();
        if (this.outFile != null)
            log.info("Report will be written to {}.", this.outFile);
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateModelReportParms() throws IOException, ParseFailureException;

    @Override
    protected final void runCommand() throws Exception {
        // The output file is only created once the model has loaded.
        OutputStream outStream = (this.outFile == null ? System.out : new FileOutputStream(this.outFile));
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(outStream, StandardCharsets.UTF_8));
        try {
            this.runReporter(writer);
            writer.flush();
        } finally {
            // The standard output belongs to the caller.
            if (this.outFile != null)
                writer.close();
        }
    }

    /**
     * Execute the command and produce the report.
     *
     *  @param writer	print writer to receive the report
     *
     *  @throws Exception
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}
