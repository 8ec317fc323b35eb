/**
 *
 */
package org.theseed.flatfile.io;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.flatfile.SequenceRecord;
import org.theseed.flatfile.fasta.FastaParser;
import org.theseed.flatfile.fasta.FastaRecord;
import org.theseed.flatfile.fasta.FastaWriter;
import org.theseed.flatfile.genbank.GenbankParser;
import org.theseed.flatfile.genbank.GenbankRecord;
import org.theseed.flatfile.genbank.RecordFormatException;

import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object reads sequence files of either supported format and saves individual records to a
 * {@link FileTarget}.  GenBank records are saved as pretty-printed JSON and FASTA records as FASTA.
 *
 * @author Bruce Parrello
 *
 */
public class SequenceFileService {

    // FIELDS
    /** logging facility */
    private static final Logger log = LoggerFactory.getLogger(SequenceFileService.class);
    /** JSON indentation string */
    private static final String JSON_INDENT = "  ";
    /** GenBank parser */
    private final GenbankParser genbankParser;
    /** FASTA parser */
    private final FastaParser fastaParser;

    /**
     * Create a new sequence file service.
     */
    public SequenceFileService() {
        this.genbankParser = new GenbankParser();
        this.fastaParser = new FastaParser();
    }

    /**
     * Parse a sequence file.
     *
     * @param inFile	file to parse
     * @param hint		format of the file, or NULL to detect it from the content
     *
     * @return the records in the file
     *
     * @throws IOException
     * @throws RecordFormatException
     */
    public List<SequenceRecord> parseFile(File inFile, FileFormat hint) throws IOException, RecordFormatException {
        FileFormat format = hint;
        if (format == null) {
            format = FileFormat.detect(inFile);
            log.info("{} appears to be in {} format.", inFile, format);
        }
        List<SequenceRecord> retVal;
        switch (format) {
        case GENBANK -> retVal = new ArrayList<SequenceRecord>(this.readGenbank(inFile));
        case FASTA -> retVal = new ArrayList<SequenceRecord>(this.readFasta(inFile));
        default -> throw new UnsupportedFormatException(inFile);
        }
        return retVal;
    }

    /**
     * @return the records in a GenBank file
     *
     * @param inFile	file to parse
     *
     * @throws IOException
     * @throws RecordFormatException
     */
    public List<GenbankRecord> readGenbank(File inFile) throws IOException, RecordFormatException {
        return this.genbankParser.parseFile(inFile);
    }

    /**
     * @return the records in a FASTA file
     *
     * @param inFile	file to parse
     *
     * @throws IOException
     */
    public List<FastaRecord> readFasta(File inFile) throws IOException {
        return this.fastaParser.parseFile(inFile);
    }

    /**
     * Save a record to a file target.  The file name extension is chosen from the record type.
     *
     * @param record	record to save
     * @param target	output target
     * @param baseName	path of the output file relative to the target, without the extension
     *
     * @return the path of the file written
     *
     * @throws IOException
     */
    public String save(SequenceRecord record, FileTarget target, String baseName) throws IOException {
        String path;
        String content;
        if (record instanceof GenbankRecord) {
            path = baseName + ".json";
            content = toJsonText((GenbankRecord) record);
        } else if (record instanceof FastaRecord) {
            path = baseName + ".fasta";
            content = FastaWriter.format((FastaRecord) record);
        } else
            throw new UnsupportedRecordException(record.getClass());
        target.writeFile(path, content);
        log.debug("Record {} saved to {}.", record.getId(), path);
        return path;
    }

    /**
     * @return the pretty-printed JSON text for a GenBank record, with all non-ASCII characters escaped
     *
     * @param record	record to convert
     */
    public static String toJsonText(GenbankRecord record) {
        StringWriter buffer = new StringWriter();
        try {
            Jsoner.prettyPrint(new StringReader(record.toJson()), buffer, JSON_INDENT, "\n");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (JsonException e) {
            throw new IllegalStateException("Invalid JSON generated for record " + record.getLocus() + ".", e);
        }
        return escapeNonAscii(buffer.toString()) + "\n";
    }

    /**
     * @return the text with every character above 0x7F replaced by a JSON unicode escape
     *
     * @param text	text to convert
     */
    protected static String escapeNonAscii(String text) {
        StringBuilder retVal = new StringBuilder(text.length());
        final int n = text.length();
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            if (c > 0x7F)
                retVal.append(String.format("\\u%04x", (int) c));
            else
                retVal.append(c);
        }
        return retVal.toString();
    }

}
