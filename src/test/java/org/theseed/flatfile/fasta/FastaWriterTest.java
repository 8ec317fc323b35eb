/**
 *
 */
package org.theseed.flatfile.fasta;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

/**
 * @author Bruce Parrello
 *
 */
public class FastaWriterTest {

    @Test
    public void testFolding() {
        String sequence = StringUtils.repeat("ACGT", 40);
        FastaRecord record = new FastaRecord("seq1", "long one", sequence);
        String text = FastaWriter.format(record);
        String[] lines = StringUtils.split(text, '\n');
        assertThat(lines.length, equalTo(4));
        assertThat(lines[0], equalTo(">seq1 long one"));
        assertThat(lines[1].length(), equalTo(60));
        assertThat(lines[2].length(), equalTo(60));
        assertThat(lines[3].length(), equalTo(40));
        assertThat(text, endsWith("\n"));
        assertThat(FastaWriter.format(new FastaRecord("e", "", "")), equalTo(">e\n"));
        assertThat(FastaWriter.format(new FastaRecord("s", "", "ACGT")), equalTo(">s\nACGT\n"));
    }

    @Test
    public void testWidth() {
        StringWriter buffer = new StringWriter();
        try (FastaWriter writer = new FastaWriter(buffer, 4)) {
            writer.write(List.of(new FastaRecord("a", "x", "ACGTAC"), new FastaRecord("b", null, "GG")));
        }
        assertThat(buffer.toString(), equalTo(">a x\nACGT\nAC\n>b\nGG\n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadWidth() {
        new FastaWriter(new StringWriter(), 0);
    }

    @Test
    public void testRoundTrip() throws IOException {
        FastaParser parser = new FastaParser();
        List<FastaRecord> records = parser.parseFile(new File("data", "sample.fasta"));
        File tempDir = new File("data", "temp");
        FileUtils.forceMkdir(tempDir);
        File outFile = new File(tempDir, "round.fasta");
        try (FastaWriter writer = new FastaWriter(outFile)) {
            writer.write(records);
        }
        List<FastaRecord> reread = parser.parseFile(outFile);
        assertThat(reread, equalTo(records));
        // Writing the parsed output again produces the same text.
        String text1 = FileUtils.readFileToString(outFile, "UTF-8");
        StringWriter buffer = new StringWriter();
        try (FastaWriter writer = new FastaWriter(buffer, FastaWriter.DEFAULT_WIDTH)) {
            writer.write(reread);
        }
        assertThat(buffer.toString(), equalTo(text1));
    }

}
