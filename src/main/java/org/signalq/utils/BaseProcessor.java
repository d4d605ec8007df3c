/**
 *
 */
package org.signalq.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for all the command processors.  It handles the command-line parsing,
 * the help option, and the logging level.  The subclass fills in the option defaults, validates
 * the parameters, and then runs the command.
 *
 * The command-line options common to all commands are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command, in milliseconds */
    private long startTime;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command-line parameters and options.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, FALSE if it should be abandoned
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug) {
                    // Turn on the debug messages for the whole application.
                    org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
                    if (root instanceof ch.qos.logback.classic.Logger)
                        ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException | IOException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        }
        return retVal;
    }

    /**
     * Execute the command.  Any error is converted to an unchecked exception.
     */
    public void run() {
        this.startTime = System.currentTimeMillis();
        try {
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line parameters and options.
     *
     * @return TRUE if the command can proceed, FALSE if it should be abandoned
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Run the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
