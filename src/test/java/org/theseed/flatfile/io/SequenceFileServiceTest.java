/**
 *
 */
package org.theseed.flatfile.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Test;
import org.theseed.flatfile.SequenceRecord;
import org.theseed.flatfile.fasta.FastaRecord;
import org.theseed.flatfile.genbank.GenbankParser;
import org.theseed.flatfile.genbank.GenbankRecord;
import org.theseed.flatfile.genbank.RecordFormatException;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * @author Bruce Parrello
 *
 */
public class SequenceFileServiceTest implements FileTarget.IParms {

    private static final String[] FIELD_ORDER = new String[] { "locus", "size", "molecule_type", "genbank_division",
            "modification_date", "definition", "accession", "version", "keywords", "source", "organism", "taxonomy",
            "references", "features", "sequence", "comment", "primary" };

    @Test
    public void testParseFile() throws IOException, RecordFormatException {
        SequenceFileService service = new SequenceFileService();
        List<SequenceRecord> records = service.parseFile(new File("data", "sample.gb"), null);
        assertThat(records, hasSize(2));
        assertThat(records.get(0), instanceOf(GenbankRecord.class));
        assertThat(records.get(1).getId(), equalTo("TEST0002"));
        records = service.parseFile(new File("data", "sample.fasta"), null);
        assertThat(records, hasSize(2));
        assertThat(records.get(0), instanceOf(FastaRecord.class));
        assertThat(records.get(1).getSequence(), equalTo("TTTT"));
        // A forced format overrides detection.
        records = service.parseFile(new File("data", "sample.fasta"), FileFormat.GENBANK);
        assertThat(records, hasSize(1));
        assertThat(records.get(0).getId(), equalTo(""));
    }

    @Test
    public void testUnknownFormat() throws RecordFormatException {
        SequenceFileService service = new SequenceFileService();
        File inFile = new File("data", "unknown.txt");
        try {
            service.parseFile(inFile, null);
            fail("Unknown file format was accepted.");
        } catch (UnsupportedFormatException e) {
            assertThat(e.getFile(), equalTo(inFile));
            assertThat(e.getMessage(), containsString("unknown.txt"));
        } catch (IOException e) {
            fail("Wrong exception: " + e);
        }
    }

    @Test
    public void testJsonText() throws IOException, RecordFormatException, JsonException {
        SequenceFileService service = new SequenceFileService();
        GenbankRecord record = service.readGenbank(new File("data", "sample.gb")).get(0);
        String text = SequenceFileService.toJsonText(record);
        assertThat(text, endsWith("\n"));
        // The fields are in the fixed order.
        int last = -1;
        for (String key : FIELD_ORDER) {
            int pos = text.indexOf("\"" + key + "\"");
            assertThat(key, pos, greaterThan(last));
            last = pos;
        }
        JsonObject json = (JsonObject) Jsoner.deserialize(text);
        assertThat(json.size(), equalTo(FIELD_ORDER.length));
        assertThat(json.get("locus"), equalTo("NG_009073"));
        assertThat(((Number) json.get("size")).intValue(), equalTo(128315));
        assertThat(json.get("comment"), equalTo(record.getComment()));
        JsonArray keywords = (JsonArray) json.get("keywords");
        assertThat(keywords.size(), equalTo(2));
        assertThat(keywords.get(0), equalTo("RefSeq"));
        assertThat(keywords.get(1), equalTo("RefSeqGene"));
        JsonArray refs = (JsonArray) json.get("references");
        assertThat(refs.size(), equalTo(2));
        JsonObject ref = (JsonObject) refs.get(0);
        assertThat(ref.get("pubmed"), equalTo("9054934"));
        assertThat(ref.get("citation"), equalTo("1  (bases 1 to 128315)"));
        JsonObject ref2 = (JsonObject) refs.get(1);
        assertThat(ref2.containsKey("pubmed"), equalTo(false));
        JsonArray feats = (JsonArray) json.get("features");
        assertThat(feats.size(), equalTo(3));
        JsonObject cds = (JsonObject) feats.get(2);
        assertThat(cds.get("feature_type"), equalTo("CDS"));
        JsonObject quals = (JsonObject) cds.get("qualifiers");
        JsonArray pseudo = (JsonArray) quals.get("pseudo");
        assertThat(pseudo.size(), equalTo(1));
        assertThat(pseudo.get(0), equalTo(""));
        assertThat(((JsonArray) quals.get("translation")).size(), equalTo(2));
    }

    @Test
    public void testNonAscii() throws RecordFormatException, JsonException {
        GenbankRecord record = new GenbankParser().parseRecord(
                "LOCUS       X1  4 bp    DNA     linear   SYN 01-JAN-2000\n"
                + "DEFINITION  Café sample.\n");
        String text = SequenceFileService.toJsonText(record);
        assertThat(text, containsString("Caf\\u00e9"));
        assertThat(text.chars().allMatch(c -> c < 0x80), equalTo(true));
        JsonObject json = (JsonObject) Jsoner.deserialize(text);
        assertThat(json.get("definition"), equalTo("Café sample."));
        assertThat(SequenceFileService.escapeNonAscii("añb"), equalTo("a\\u00f1b"));
        assertThat(SequenceFileService.escapeNonAscii("plain"), equalTo("plain"));
    }

    @Test
    public void testSave() throws IOException, RecordFormatException {
        SequenceFileService service = new SequenceFileService();
        File outDir = new File("data", "temp/saveTest");
        List<SequenceRecord> gbRecords = service.parseFile(new File("data", "sample.gb"), FileFormat.GENBANK);
        List<SequenceRecord> faRecords = service.parseFile(new File("data", "sample.fasta"), FileFormat.FASTA);
        try (FileTarget target = FileTarget.Type.DIR.create(this, outDir)) {
            String path = service.save(gbRecords.get(1), target, "sample/record_2");
            assertThat(path, equalTo("sample/record_2.json"));
            path = service.save(faRecords.get(0), target, "sample/record_1");
            assertThat(path, equalTo("sample/record_1.fasta"));
            assertThat(target.getFileCount(), equalTo(2));
        }
        String json = FileUtils.readFileToString(new File(outDir, "sample/record_2.json"), StandardCharsets.UTF_8);
        assertThat(json, equalTo(SequenceFileService.toJsonText((GenbankRecord) gbRecords.get(1))));
        String fasta = FileUtils.readFileToString(new File(outDir, "sample/record_1.fasta"), StandardCharsets.UTF_8);
        assertThat(fasta, equalTo(">id1 first test sequence\nACGTACGTACGGCCTTAA\n"));
    }

    @Test
    public void testBadRecordType() throws IOException {
        SequenceFileService service = new SequenceFileService();
        SequenceRecord odd = new SequenceRecord() {
            @Override
            public String getId() {
                return "odd";
            }

            @Override
            public String getSequence() {
                return "";
            }
        };
        try (FileTarget target = FileTarget.Type.DIR.create(this, new File("data", "temp/badType"))) {
            service.save(odd, target, "odd");
            fail("Unsupported record was saved.");
        } catch (UnsupportedRecordException e) {
            assertThat(e.getRecordType(), equalTo(odd.getClass()));
        }
    }

    @Override
    public boolean shouldErase() {
        return true;
    }

}
