/**
 *
 */
package org.theseed.flatfile.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for the command processors.  The subclass declares its options and positional
 * parameters with args4j annotations.  Processing happens in three phases:  {@link #setDefaults()} before
 * the command line is parsed, {@link #validateParms()} after it is parsed, and {@link #runCommand()} to do
 * the work.  Every processor supports "-h" to display the usage and "-v" to turn on debug logging.
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseProcessor implements Runnable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** TRUE if the command line was parsed and validated successfully */
    private boolean ready;
    /** start time of the run, in milliseconds */
    private long startTime;
    /** TRUE if the command failed */
    private boolean failed;

    // COMMAND-LINE OPTIONS

    /** help mode */
    @Option(name = "--help", aliases = { "-h" }, help = true, usage = "display command-line usage")
    private boolean helpMode;

    /** debug-message flag */
    @Option(name = "--verbose", aliases = { "-v", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command line.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the processor is ready to run, FALSE if the usage was displayed or the parameters
     * 		   were invalid
     */
    public boolean parseCommand(String[] args) {
        this.ready = false;
        this.helpMode = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.helpMode)
                parser.printUsage(System.err);
            else {
                if (this.debug)
                    setRootLevel(Level.DEBUG);
                this.ready = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException | IOException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        }
        return this.ready;
    }

    /**
     * Run the command, if the command line was valid.
     */
    @Override
    public void run() {
        this.failed = ! this.ready;
        if (this.ready) {
            this.startTime = System.currentTimeMillis();
            try {
                this.runCommand();
                log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
            } catch (Exception e) {
                log.error("Command failed.", e);
                this.failed = true;
            }
        }
    }

    /**
     * Set the root logging level.
     *
     * @param level		new logging level
     */
    private static void setRootLevel(Level level) {
        Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger)
            ((ch.qos.logback.classic.Logger) root).setLevel(level);
    }

    /**
     * Display the list of commands for a multi-command application.
     *
     * @param commands	array of command names alternating with descriptions
     */
    public static void showCommands(String[] commands) {
        for (int i = 0; i < commands.length; i += 2)
            System.err.format("%-20s %s%n", commands[i], commands[i+1]);
    }

    /**
     * @return TRUE if the command could not be run or ended with an error
     */
    public boolean isFailed() {
        return this.failed;
    }

    /**
     * Set the defaults for the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options after parsing.
     *
     * @return TRUE if processing should proceed
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Perform the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
