/**
 *
 */
package org.theseed.flatfile;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.output.CloseShieldOutputStream;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.flatfile.io.FileFormat;
import org.theseed.flatfile.io.SequenceFileService;
import org.theseed.flatfile.stats.SequenceStats;
import org.theseed.flatfile.utils.BaseProcessor;
import org.theseed.flatfile.utils.ParseFailureException;

/**
 * This command produces a base-composition report for every record in a set of sequence files.  The
 * report is tab-delimited with headers.  Each record produces one line containing the file name, the
 * record ID, the sequence length, the G+C and N counts, and the G+C and N percentages.
 *
 * The positional parameters are the names of the input files.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for the report (if not STDOUT)
 *
 * --format		format of the input files (GENBANK or FASTA); the default is to detect it from each file
 *
 * @author Bruce Parrello
 *
 */
public class StatsProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(StatsProcessor.class);
    /** file service for parsing */
    private SequenceFileService service;

    // COMMAND-LINE OPTIONS

    /** output report file */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "report.tbl", usage = "output file (if not STDOUT)")
    private File outFile;

    /** input format override */
    @Option(name = "--format", usage = "format of the input files (if not detected)")
    private FileFormat format;

    /** input files */
    @Argument(index = 0, metaVar = "file1 file2 ...", usage = "sequence files to analyze", required = true, multiValued = true)
    private List<File> inFiles;

    @Override
    protected void setDefaults() {
        this.outFile = null;
        this.format = null;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (this.format == FileFormat.UNKNOWN)
            throw new ParseFailureException("Input format must be GENBANK or FASTA.");
        for (File inFile : this.inFiles) {
            if (! inFile.canRead())
                throw new FileNotFoundException("Input file " + inFile + " not found or unreadable.");
        }
        this.service = new SequenceFileService();
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        try (PrintWriter writer = this.openOutput()) {
            writer.println("file\trecord_id\tlength\tgc_count\tn_count\tgc_percent\tn_percent");
            int count = 0;
            for (File inFile : this.inFiles) {
                List<SequenceRecord> records = this.service.parseFile(inFile, this.format);
                for (SequenceRecord record : records) {
                    SequenceStats stats = SequenceStats.of(record.getSequence());
                    writer.format(Locale.ROOT, "%s\t%s\t%d\t%d\t%d\t%.2f\t%.2f%n", inFile.getName(), record.getId(),
                            stats.getLength(), stats.getGcCount(), stats.getNCount(), stats.getGcPercent(),
                            stats.getNPercent());
                    count++;
                }
            }
            log.info("{} records analyzed.", count);
        }
    }

    /**
     * @return a writer for the report
     *
     * @throws IOException
     */
    private PrintWriter openOutput() throws IOException {
        OutputStream outStream;
        if (this.outFile == null) {
            log.info("Report will be written to standard output.");
            outStream = CloseShieldOutputStream.wrap(System.out);
        } else {
            log.info("Report will be written to {}.", this.outFile);
            outStream = FileUtils.openOutputStream(this.outFile);
        }
        return new PrintWriter(new OutputStreamWriter(outStream, StandardCharsets.UTF_8));
    }

}
