/**
 *
 */
package org.signalq.cmd;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.signalq.network.SignalModel;
import org.signalq.network.Species;
import org.signalq.utils.ParseFailureException;

/**
 * This command lists the connected components of a simplified model, largest first.  It is useful for
 * choosing the size threshold of the component filter.
 *
 * The positional parameter is the name of the diagram file.
 *
 * The command-line options are those of the base model processor, plus
 *
 * -o	output file for report, if not STDOUT
 *
 */
public class ComponentsProcessor extends BaseModelReportProcessor {

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateModelReportParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        SignalModel model = this.getModel();
        List<Set<String>> components = model.getComponents();
        writer.println("component\tsize\tspecies");
        int num = 0;
        for (Set<String> component : components) {
            num++;
            // List the members in model order.
            List<String> names = new ArrayList<String>(component.size());
            for (Species species : model.getAllSpecies()) {
                if (component.contains(species.getId()))
                    names.add(species.getName());
            }
            writer.format("%d\t%d\t%s%n", num, component.size(), String.join(", ", names));
        }
        log.info("{} components found in {} species.", components.size(), model.size());
    }

}
