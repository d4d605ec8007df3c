/**
 *
 */
package org.signalq.cmd;

import java.io.IOException;
import java.io.PrintWriter;

import org.signalq.logic.LogicalModel;
import org.signalq.network.Species;
import org.signalq.utils.ParseFailureException;

/**
 * This command lists the Boolean function computed for each species of a simplified model.
 *
 * The positional parameter is the name of the diagram file.
 *
 * The command-line options are those of the base model processor, plus
 *
 * -o	output file for report, if not STDOUT
 *
 */
public class FunctionsProcessor extends BaseModelReportProcessor {

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateModelReportParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        LogicalModel logical = this.synthesize(1);
        writer.println("species_id\tname\ttype\tfunction");
        for (Species species : logical.getModel().getAllSpecies()) {
            String function = species.getFunction();
            if (species.getFixedLevel() != null)
                function = species.getFixedLevel().toString();
            else if (logical.isInput(species))
                function = "(input)";
            writer.format("%s\t%s\t%s\t%s%n", species.getId(), species.getName(), species.getType(), function);
        }
    }

}
