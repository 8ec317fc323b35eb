/**
 *
 */
package org.theseed.flatfile;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.io.FilenameUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.flatfile.io.FileFormat;
import org.theseed.flatfile.io.FileTarget;
import org.theseed.flatfile.io.SequenceFileService;
import org.theseed.flatfile.utils.BaseProcessor;
import org.theseed.flatfile.utils.ParseFailureException;

/**
 * This command parses GenBank and FASTA files and saves each record to an output target.  GenBank records
 * are saved as JSON and FASTA records as re-folded FASTA.  Each input file gets its own folder in the
 * target, named after the file (extension included, with a numeric suffix if the name is already taken),
 * and the records are numbered from 1 within the folder.
 *
 * The positional parameters are the names of the input files.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output directory or archive name (the default is a dated name in the current directory)
 *
 * --target		type of output target (DIR or ZIPSTREAM, default DIR)
 * --format		format of the input files (GENBANK or FASTA); the default is to detect it from each file
 * --clear		erase the output directory before processing
 *
 * @author Bruce Parrello
 *
 */
public class ParseProcessor extends BaseProcessor implements FileTarget.IParms {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ParseProcessor.class);
    /** file service for parsing and saving */
    private SequenceFileService service;

    // COMMAND-LINE OPTIONS

    /** output directory or archive */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "outDir", usage = "output directory or archive file")
    private File outFile;

    /** type of output target */
    @Option(name = "--target", usage = "type of output target")
    private FileTarget.Type targetType;

    /** input format override */
    @Option(name = "--format", usage = "format of the input files (if not detected)")
    private FileFormat format;

    /** erase the output before starting */
    @Option(name = "--clear", usage = "if specified, the output directory will be erased before processing")
    private boolean clearFlag;

    /** input files */
    @Argument(index = 0, metaVar = "file1 file2 ...", usage = "sequence files to parse", required = true, multiValued = true)
    private List<File> inFiles;

    @Override
    protected void setDefaults() {
        this.outFile = null;
        this.targetType = FileTarget.Type.DIR;
        this.format = null;
        this.clearFlag = false;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (this.format == FileFormat.UNKNOWN)
            throw new ParseFailureException("Input format must be GENBANK or FASTA.");
        for (File inFile : this.inFiles) {
            if (! inFile.canRead())
                throw new FileNotFoundException("Input file " + inFile + " not found or unreadable.");
        }
        log.info("{} input files will be parsed.", this.inFiles.size());
        this.service = new SequenceFileService();
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        try (FileTarget target = this.targetType.create(this, this.outFile)) {
            log.info("Records will be saved to {}.", target.getOutName());
            Set<String> folders = new HashSet<String>();
            for (File inFile : this.inFiles) {
                List<SequenceRecord> records = this.service.parseFile(inFile, this.format);
                String folder = folderName(inFile, folders);
                target.createDirectory(folder);
                int recordNum = 0;
                for (SequenceRecord record : records) {
                    recordNum++;
                    String path = this.service.save(record, target, folder + "/record_" + recordNum);
                    log.info("Record {} of {} ({}) saved to {}.", recordNum, inFile, record.getId(), path);
                }
            }
            log.info("{} files written.", target.getFileCount());
        }
    }

    /**
     * Compute the output folder name for an input file.  The name is the file name with its extension, and
     * a numeric suffix is added if an earlier file in the run already used it.
     *
     * @param inFile	input file
     * @param used		set of folder names already used; the new name is added to it
     *
     * @return a folder name unique within the run
     */
    protected static String folderName(File inFile, Set<String> used) {
        String base = FilenameUtils.getName(inFile.getPath());
        String retVal = base;
        for (int suffix = 2; used.contains(retVal); suffix++)
            retVal = base + "_" + suffix;
        used.add(retVal);
        return retVal;
    }

    @Override
    public boolean shouldErase() {
        return this.clearFlag;
    }

}
