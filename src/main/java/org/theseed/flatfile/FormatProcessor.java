/**
 *
 */
package org.theseed.flatfile;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.theseed.flatfile.io.FileFormat;
import org.theseed.flatfile.utils.BaseProcessor;

/**
 * This command reports the apparent format of each input file.  The report is tab-delimited, with the file
 * name in the first column and the format in the second, and is written to the standard output.
 *
 * The positional parameters are the names of the files to examine.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * @author Bruce Parrello
 *
 */
public class FormatProcessor extends BaseProcessor {

    // COMMAND-LINE OPTIONS

    /** files to examine */
    @Argument(index = 0, metaVar = "file1 file2 ...", usage = "files to examine", required = true, multiValued = true)
    private List<File> inFiles;

    @Override
    protected void setDefaults() {
    }

    @Override
    protected boolean validateParms() throws IOException {
        for (File inFile : this.inFiles) {
            if (! inFile.isFile())
                throw new FileNotFoundException("Input file " + inFile + " not found or invalid.");
        }
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        System.out.println("file\tformat");
        for (File inFile : this.inFiles)
            System.out.format("%s\t%s%n", inFile, FileFormat.detect(inFile));
    }

}
