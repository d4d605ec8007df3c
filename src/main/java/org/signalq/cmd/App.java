package org.signalq.cmd;

import java.util.Arrays;

import org.signalq.utils.BaseProcessor;

/**
 * Commands for converting signalling pathway diagrams into logical models.
 *
 * qual			convert a diagram to an SBML-qual Boolean model
 * bma			convert a diagram to a BioModelAnalyzer JSON model
 * functions	list the Boolean function of each species in a simplified diagram
 * components	list the connected components of a simplified diagram
 */
public class App
{
    public static void main( String[] args )
    {
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "qual" :
            processor = new QualProcessor();
            break;
        case "bma" :
            processor = new BmaProcessor();
            break;
        case "functions" :
            processor = new FunctionsProcessor();
            break;
        case "components" :
            processor = new ComponentsProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
    }
}
