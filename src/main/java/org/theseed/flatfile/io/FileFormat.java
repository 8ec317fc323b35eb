/**
 *
 */
package org.theseed.flatfile.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This enumeration describes the supported sequence file formats, and contains the logic for guessing the
 * format of a file from its content.
 *
 * @author Bruce Parrello
 *
 */
public enum FileFormat {
    GENBANK, FASTA, UNKNOWN;

    // FIELDS
    /** logging facility */
    private static final Logger log = LoggerFactory.getLogger(FileFormat.class);
    /** number of characters to examine in the first pass */
    private static final int SAMPLE_SIZE = 1024;
    /** number of lines to examine in the second pass */
    private static final int SAMPLE_LINES = 20;
    /** keywords that confirm a GenBank file */
    private static final String[] GENBANK_KEYWORDS = new String[] { "DEFINITION", "ACCESSION", "VERSION" };

    /**
     * Determine the format of a file.  An unreadable file is reported as UNKNOWN.
     *
     * @param inFile	file to examine
     *
     * @return the apparent format of the file
     */
    public static FileFormat detect(File inFile) {
        FileFormat retVal;
        try {
            String sample = readSample(inFile);
            retVal = detectSample(sample);
            if (retVal == UNKNOWN)
                retVal = detectLines(readLines(inFile));
        } catch (IOException e) {
            log.warn("Could not determine format of {}: {}", inFile, e.toString());
            retVal = UNKNOWN;
        }
        log.debug("{} has format {}.", inFile, retVal);
        return retVal;
    }

    /**
     * Guess the format from a sample of text from the start of a file.
     *
     * @param sample	text sample
     *
     * @return GENBANK or FASTA if the sample is conclusive, else UNKNOWN
     */
    protected static FileFormat detectSample(String sample) {
        FileFormat retVal = UNKNOWN;
        if (sample.contains(">") && hasSequenceLine(sample))
            retVal = FASTA;
        else if (sample.contains("LOCUS") && StringUtils.containsAny(sample, GENBANK_KEYWORDS))
            retVal = GENBANK;
        return retVal;
    }

    /**
     * @return TRUE if the text has a non-blank line that is not a FASTA header
     *
     * @param sample	text to check
     */
    private static boolean hasSequenceLine(String sample) {
        boolean retVal = false;
        for (String line : sample.split("\n")) {
            if (! StringUtils.isBlank(line) && ! line.startsWith(">")) {
                retVal = true;
                break;
            }
        }
        return retVal;
    }

    /**
     * Guess the format from the first lines of a file.
     *
     * @param lines		trimmed lines from the start of the file
     *
     * @return the apparent format
     */
    protected static FileFormat detectLines(List<String> lines) {
        FileFormat retVal = UNKNOWN;
        if (lines.stream().anyMatch(x -> x.startsWith(">")))
            retVal = FASTA;
        else if (lines.stream().anyMatch(x -> x.startsWith("LOCUS")))
            retVal = GENBANK;
        return retVal;
    }

    /**
     * @return the first characters of a file
     *
     * @param inFile	file to read
     *
     * @throws IOException
     */
    private static String readSample(File inFile) throws IOException {
        char[] buffer = new char[SAMPLE_SIZE];
        int len = 0;
        try (BufferedReader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8)) {
            for (int n = reader.read(buffer, 0, SAMPLE_SIZE); n > 0 && len < SAMPLE_SIZE;
                    n = reader.read(buffer, len, SAMPLE_SIZE - len))
                len += n;
        }
        return new String(buffer, 0, len);
    }

    /**
     * @return the first lines of a file, trimmed
     *
     * @param inFile	file to read
     *
     * @throws IOException
     */
    private static List<String> readLines(File inFile) throws IOException {
        List<String> retVal = new ArrayList<String>(SAMPLE_LINES);
        try (BufferedReader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8)) {
            for (String line = reader.readLine(); line != null && retVal.size() < SAMPLE_LINES; line = reader.readLine())
                retVal.add(line.trim());
        }
        return retVal;
    }

}
