package org.theseed.flatfile;

import java.util.Arrays;

import org.theseed.flatfile.utils.BaseProcessor;

/**
 * Parse sequence flat files into typed records.
 *
 * parse		parse GenBank or FASTA files and save the records as JSON or FASTA
 * format		report the apparent format of sequence files
 * stats		report the base composition of the records in sequence files
 *
 */
public class App
{
    /** static array containing command names and comments */
    protected static final String[] COMMANDS = new String[] {
             "parse", "parse GenBank or FASTA files and save the records as JSON or FASTA",
             "format", "report the apparent format of sequence files",
             "stats", "report the base composition of the records in sequence files"
    };

    public static void main( String[] args ) {
        if (args.length < 1) {
            BaseProcessor.showCommands(COMMANDS);
            System.exit(1);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "parse" -> processor = new ParseProcessor();
        case "format" -> processor = new FormatProcessor();
        case "stats" -> processor = new StatsProcessor();
        case "-h", "--help" -> processor = null;
        default -> throw new RuntimeException("Invalid command " + command + ".");
        }
        if (processor == null)
            BaseProcessor.showCommands(COMMANDS);
        else if (processor.parseCommand(newArgs)) {
            processor.run();
            if (processor.isFailed())
                System.exit(1);
        }
    }
}
