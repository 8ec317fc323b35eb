/**
 *
 */
package org.theseed.flatfile.fasta;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object scans FASTA text into records.  A header line starts with ">"; the header is split at the
 * first space into the identifier and the description.  All other non-blank lines are trimmed and added
 * to the sequence of the current record, so any line width is accepted.  Lines before the first header
 * are ignored, and a header with an empty identifier produces no record.
 *
 * @author Bruce Parrello
 *
 */
public class FastaParser {

    // FIELDS
    /** logging facility */
    private static final Logger log = LoggerFactory.getLogger(FastaParser.class);

    /**
     * Parse a FASTA file.
     *
     * @param inFile	UTF-8 file to parse
     *
     * @return the records in the file, in order
     *
     * @throws IOException
     */
    public List<FastaRecord> parseFile(File inFile) throws IOException {
        log.info("Reading FASTA file {}.", inFile);
        try (BufferedReader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8)) {
            List<FastaRecord> retVal = this.parse(reader);
            log.info("{} sequences found in {}.", retVal.size(), inFile);
            return retVal;
        }
    }

    /**
     * Parse a string of FASTA text.
     *
     * @param content	text to parse
     *
     * @return the records in the text, in order
     */
    public List<FastaRecord> parse(String content) {
        try {
            return this.parse(new StringReader(content));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parse FASTA text from a reader.
     *
     * @param input		reader containing the text
     *
     * @return the records read, in order
     *
     * @throws IOException
     */
    public List<FastaRecord> parse(Reader input) throws IOException {
        List<FastaRecord> retVal = new ArrayList<FastaRecord>();
        BufferedReader reader = (input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input));
        String id = null;
        String description = "";
        StringBuilder sequence = new StringBuilder();
        for (String line = reader.readLine(); line != null; line = reader.readLine()) {
            line = line.trim();
            if (line.startsWith(">")) {
                if (StringUtils.isNotEmpty(id))
                    retVal.add(new FastaRecord(id, description, sequence.toString()));
                String header = line.substring(1);
                int split = header.indexOf(' ');
                if (split < 0) {
                    id = header;
                    description = "";
                } else {
                    id = header.substring(0, split);
                    description = header.substring(split + 1);
                }
                sequence.setLength(0);
            } else if (! line.isEmpty()) {
                if (id == null)
                    log.debug("Sequence line before first header ignored.");
                else
                    sequence.append(line);
            }
        }
        if (StringUtils.isNotEmpty(id))
            retVal.add(new FastaRecord(id, description, sequence.toString()));
        return retVal;
    }

}
