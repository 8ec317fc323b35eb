/**
 *
 */
package org.theseed.flatfile.fasta;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collection;

/**
 * This object writes FASTA records.  Each record is written as a header line followed by the sequence
 * folded into lines of fixed width.
 *
 * @author Bruce Parrello
 *
 */
public class FastaWriter implements AutoCloseable {

    // FIELDS
    /** default sequence line width */
    public static final int DEFAULT_WIDTH = 60;
    /** output writer */
    private final PrintWriter writer;
    /** sequence line width */
    private final int width;

    /**
     * Open a FASTA writer on a file.
     *
     * @param outFile	output file
     *
     * @throws IOException
     */
    public FastaWriter(File outFile) throws IOException {
        this(Files.newBufferedWriter(outFile.toPath(), StandardCharsets.UTF_8), DEFAULT_WIDTH);
    }

    /**
     * Open a FASTA writer on an output stream.
     *
     * @param outStream		output stream
     */
    public FastaWriter(OutputStream outStream) {
        this(new OutputStreamWriter(outStream, StandardCharsets.UTF_8), DEFAULT_WIDTH);
    }

    /**
     * Open a FASTA writer on a character writer.
     *
     * @param output	target writer
     * @param width		sequence line width
     */
    public FastaWriter(Writer output, int width) {
        if (width < 1)
            throw new IllegalArgumentException("FASTA line width must be at least 1.");
        this.writer = new PrintWriter(output);
        this.width = width;
    }

    /**
     * Write a single record.
     *
     * @param record	record to write
     */
    public void write(FastaRecord record) {
        this.writer.print('>');
        this.writer.print(record.getHeader());
        this.writer.print('\n');
        String sequence = record.getSequence();
        final int n = sequence.length();
        for (int i = 0; i < n; i += this.width) {
            this.writer.print(sequence.substring(i, Math.min(n, i + this.width)));
            this.writer.print('\n');
        }
    }

    /**
     * Write a collection of records.
     *
     * @param records	records to write
     */
    public void write(Collection<FastaRecord> records) {
        for (FastaRecord record : records)
            this.write(record);
    }

    /**
     * @return the FASTA text for a single record, using the default line width
     *
     * @param record	record to format
     */
    public static String format(FastaRecord record) {
        StringWriter buffer = new StringWriter();
        try (FastaWriter fastaWriter = new FastaWriter(buffer, DEFAULT_WIDTH)) {
            fastaWriter.write(record);
        }
        return buffer.toString();
    }

    @Override
    public void close() {
        this.writer.close();
    }

}
