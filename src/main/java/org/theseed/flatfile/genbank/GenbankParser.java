/**
 *
 */
package org.theseed.flatfile.genbank;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object parses GenBank flat files.  The file is read into memory and split into records on the
 * "//" terminator lines.  Each record is then fed line by line through a fresh {@link SectionDispatcher}.
 *
 * The parser holds no per-run state, so a single instance can be used for any number of files.  A record
 * with an unparseable LOCUS length causes the entire parse to fail.
 *
 * @author Bruce Parrello
 *
 */
public class GenbankParser {

    // FIELDS
    /** logging facility */
    private static final Logger log = LoggerFactory.getLogger(GenbankParser.class);
    /** record terminator line */
    private static final Pattern RECORD_END = Pattern.compile("^//\\r?\\n", Pattern.MULTILINE);
    /** line break */
    private static final Pattern LINE_END = Pattern.compile("\\r?\\n");

    /**
     * Parse all the records in a GenBank file.
     *
     * @param inFile	UTF-8 file to parse
     *
     * @return a list of the records in the file, in order
     *
     * @throws IOException
     * @throws RecordFormatException
     */
    public List<GenbankRecord> parseFile(File inFile) throws IOException, RecordFormatException {
        log.info("Reading GenBank file {}.", inFile);
        String content = FileUtils.readFileToString(inFile, StandardCharsets.UTF_8);
        List<GenbankRecord> retVal = this.parse(content);
        log.info("{} records found in {}.", retVal.size(), inFile);
        return retVal;
    }

    /**
     * Parse all the records in a string of GenBank text.
     *
     * @param content	text to parse
     *
     * @return a list of the records in the text, in order
     *
     * @throws RecordFormatException
     */
    public List<GenbankRecord> parse(String content) throws RecordFormatException {
        List<String> chunks = splitRecords(content);
        List<GenbankRecord> retVal = new ArrayList<GenbankRecord>(chunks.size());
        for (String chunk : chunks) {
            GenbankRecord record = this.parseRecord(chunk);
            log.debug("Parsed record {} with {} features.", record.getLocus(), record.getFeatures().size());
            retVal.add(record);
        }
        return retVal;
    }

    /**
     * Parse the text of a single GenBank record.
     *
     * @param chunk		text of the record
     *
     * @return the parsed record
     *
     * @throws RecordFormatException
     */
    public GenbankRecord parseRecord(String chunk) throws RecordFormatException {
        SectionDispatcher dispatcher = new SectionDispatcher();
        for (String line : LINE_END.split(chunk, -1))
            dispatcher.accept(line);
        return dispatcher.finish();
    }

    /**
     * Split GenBank text into record chunks.  Chunks that contain only whitespace are discarded.
     *
     * @param content	text to split
     *
     * @return a list of the non-blank record chunks
     */
    public static List<String> splitRecords(String content) {
        String[] chunks = RECORD_END.split(content, -1);
        List<String> retVal = new ArrayList<String>(chunks.length);
        for (String chunk : chunks) {
            if (! StringUtils.isBlank(chunk))
                retVal.add(chunk);
        }
        return retVal;
    }

}
