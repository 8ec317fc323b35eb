/**
 *
 */
package org.theseed.flatfile.genbank;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.junit.Test;

/**
 * @author Bruce Parrello
 *
 */
public class GenbankParserTest {

    private static final String TAXONOMY = "Eukaryota; Metazoa; Chordata; Craniata; Vertebrata; Euteleostomi; "
            + "Mammalia; Eutheria; Euarchontoglires; Primates; Haplorrhini; Catarrhini; Hominidae; Homo.";

    @Test
    public void testSampleFile() throws IOException, RecordFormatException {
        GenbankParser parser = new GenbankParser();
        List<GenbankRecord> records = parser.parseFile(new File("data", "sample.gb"));
        assertThat(records, hasSize(2));
        GenbankRecord record = records.get(0);
        assertThat(record.getLocus(), equalTo("NG_009073"));
        assertThat(record.getId(), equalTo("NG_009073"));
        assertThat(record.getSize(), equalTo(128315L));
        assertThat(record.getMoleculeType(), equalTo("DNA"));
        assertThat(record.getGenbankDivision(), equalTo("PRI"));
        assertThat(record.getModificationDate(), equalTo("03-OCT-2024"));
        assertThat(record.getDefinition(), equalTo("Homo sapiens ATP binding cassette subfamily A member 4 (ABCA4), "
                + "RefSeqGene (LRG_94) on chromosome 1."));
        assertThat(record.getAccession(), equalTo("NG_009073"));
        assertThat(record.getVersion(), equalTo("NG_009073.1"));
        assertThat(record.getKeywords(), contains("RefSeq", "RefSeqGene"));
        assertThat(record.getSource(), equalTo("Homo sapiens (human)"));
        assertThat(record.getTaxonomy(), equalTo(TAXONOMY));
        assertThat(record.getOrganism(), equalTo("Homo sapiens [" + TAXONOMY + "]"));
        assertThat(record.getComment(), equalTo("REVIEWED REFSEQ: This record has been curated by NCBI staff. "
                + "The reference sequence was derived from AL109924."));
        assertThat(record.getPrimary(), startsWith("REFSEQ_SPAN         PRIMARY_IDENTIFIER"));
        assertThat(record.getPrimary(), endsWith("COMP 1-128315            AL109924.11        1-128315"));
        assertThat(record.getSequence(), equalTo("ggacacagcgttagaccccacactgcgttagacgtgcaagggactatgttacgtcagtca"));
        // References.
        List<GenbankReference> refs = record.getReferences();
        assertThat(refs, hasSize(2));
        GenbankReference ref = refs.get(0);
        assertThat(ref.getCitation(), equalTo("1  (bases 1 to 128315)"));
        assertThat(ref.get(GenbankReference.Field.AUTHORS), equalTo("Allikmets R, Singh N, Sun H."));
        assertThat(ref.get(GenbankReference.Field.TITLE),
                equalTo("A photoreceptor cell-specific ATP-binding transporter gene (ABCR) is"));
        assertThat(ref.get(GenbankReference.Field.JOURNAL), equalTo("Nat Genet 15 (3), 236-246 (1997)"));
        assertThat(ref.get(GenbankReference.Field.PUBMED), equalTo("9054934"));
        ref = refs.get(1);
        assertThat(ref.getCitation(), equalTo("2  (bases 1 to 128315)"));
        assertThat(ref.get(GenbankReference.Field.AUTHORS), equalTo("Smith J."));
        assertThat(ref.get(GenbankReference.Field.TITLE), equalTo("Direct Submission"));
        assertThat(ref.has(GenbankReference.Field.PUBMED), equalTo(false));
        // Features.
        List<GenbankFeature> features = record.getFeatures();
        assertThat(features, hasSize(3));
        GenbankFeature feat = features.get(0);
        assertThat(feat.getFeatureType(), equalTo("source"));
        assertThat(feat.getLocation(), equalTo("1..128315"));
        assertThat(feat.getQualifiers().keySet(), contains("organism", "mol_type", "db_xref", "chromosome"));
        assertThat(feat.getFragments("db_xref"), contains("taxon:9606"));
        feat = features.get(1);
        assertThat(feat.getFeatureType(), equalTo("gene"));
        assertThat(feat.getFragments("gene"), contains("ABCA4"));
        assertThat(feat.getFragments("note"), contains("ATP binding cassette subfamily A member 4; Derived",
                "by automated computational analysis"));
        assertThat(feat.getQualifier("note", " "), equalTo("ATP binding cassette subfamily A member 4; Derived "
                + "by automated computational analysis"));
        feat = features.get(2);
        assertThat(feat.getFeatureType(), equalTo("CDS"));
        assertThat(feat.getLocation(), equalTo("join(101..200,301..400)"));
        assertThat(feat.getFragments("pseudo"), contains(""));
        assertThat(feat.getFragments("translation"), hasSize(2));
        assertThat(feat.getQualifier("translation", ""), equalTo("MGFVRQIQLLLWKNWTLRKRQKIRFVVELVWPLSLFLVLIWLRN"
                + "ANPLYSHHECHFPNKAMPSAGMLPWLQGIFCNVNNPCFQSPTPGESPGIVSNYNNSIL"));
        assertThat(feat.getQualifier("product", ""), nullValue());
        // Second record.
        record = records.get(1);
        assertThat(record.getLocus(), equalTo("TEST0002"));
        assertThat(record.getSize(), equalTo(24L));
        assertThat(record.getGenbankDivision(), equalTo("BCT"));
        assertThat(record.getKeywords(), empty());
        assertThat(record.getOrganism(), equalTo("synthetic construct"));
        assertThat(record.getTaxonomy(), equalTo(""));
        assertThat(record.getReferences(), empty());
        assertThat(record.getComment(), equalTo(""));
        assertThat(record.getPrimary(), equalTo(""));
        assertThat(record.getFeatures(), hasSize(1));
        assertThat(record.getFeatures().get(0).getFragments("label"), contains("ori"));
        assertThat(record.getSequence(), equalTo("atgcatgcatgcnnatgcatgcat"));
    }

    @Test
    public void testBadLocusAbortsFile() throws IOException {
        GenbankParser parser = new GenbankParser();
        try {
            parser.parseFile(new File("data", "bad_locus.gb"));
            fail("Bad LOCUS length was accepted.");
        } catch (RecordFormatException e) {
            assertThat(e.getLine(), containsString("12x315"));
        }
    }

    @Test
    public void testShortLocus() throws RecordFormatException {
        GenbankRecord record = new GenbankParser().parseRecord("LOCUS       NG_009073  128315 bp    DNA\n"
                + "DEFINITION  Short locus.\n");
        assertThat(record.getLocus(), equalTo(""));
        assertThat(record.getSize(), equalTo(0L));
        assertThat(record.getMoleculeType(), equalTo(""));
        assertThat(record.getDefinition(), equalTo("Short locus."));
    }

    @Test
    public void testLocusScenario() throws RecordFormatException {
        GenbankRecord record = new GenbankParser().parseRecord("LOCUS       NG_009073  128315 bp    DNA     linear   PRI 03-OCT-2024");
        assertThat(record.getLocus(), equalTo("NG_009073"));
        assertThat(record.getSize(), equalTo(128315L));
        assertThat(record.getMoleculeType(), equalTo("DNA"));
        assertThat(record.getGenbankDivision(), equalTo("PRI"));
        assertThat(record.getModificationDate(), equalTo("03-OCT-2024"));
        // The unit and topology tokens are never stored.
        String json = record.toJson();
        assertThat(json, not(containsString("\"bp\"")));
        assertThat(json, not(containsString("linear")));
    }

    @Test
    public void testLargeLocus() throws RecordFormatException {
        GenbankRecord record = new GenbankParser().parseRecord("LOCUS       CHR1  3000000000 bp    DNA     linear   PLN 01-JAN-2000");
        assertThat(record.getLocus(), equalTo("CHR1"));
        assertThat(record.getSize(), equalTo(3000000000L));
        assertThat(record.toJson(), containsString("3000000000"));
    }

    @Test
    public void testSplitter() {
        String text = "LOCUS       A\n//\n\n  \n//\nLOCUS       B\r\n//\r\nLOCUS       C\n//";
        List<String> chunks = GenbankParser.splitRecords(text);
        assertThat(chunks, hasSize(3));
        assertThat(chunks.get(0), equalTo("LOCUS       A\n"));
        assertThat(chunks.get(1), equalTo("LOCUS       B\r\n"));
        assertThat(chunks.get(2), equalTo("LOCUS       C\n//"));
        // A "//" that is not alone on its line does not split.
        chunks = GenbankParser.splitRecords("COMMENT     see http://example.org//\nmore\n");
        assertThat(chunks, hasSize(1));
        assertThat(GenbankParser.splitRecords("  \n\n"), empty());
    }

    @Test
    public void testUnterminatedRecord() throws RecordFormatException {
        String text = "LOCUS       X1  8 bp    DNA     linear   SYN 01-JAN-2000\n"
                + "ORIGIN\n"
                + "        1 acgtacgt\n"
                + "//";
        List<GenbankRecord> records = new GenbankParser().parse(text);
        assertThat(records, hasSize(1));
        assertThat(records.get(0).getSequence(), equalTo("acgtacgt"));
    }

    @Test
    public void testIndependentRuns() throws RecordFormatException {
        GenbankParser parser = new GenbankParser();
        // This record ends inside the feature table.
        GenbankRecord first = parser.parseRecord("LOCUS       F1  10 bp    DNA     linear   SYN 01-JAN-2000\n"
                + "FEATURES             Location/Qualifiers\n"
                + "     gene            1..10\n"
                + "                     /gene=\"a\"\n");
        assertThat(first.getFeatures(), hasSize(1));
        GenbankRecord second = parser.parseRecord("LOCUS       F2  10 bp    DNA     linear   SYN 01-JAN-2000\n"
                + "VERSION     F2.1\n"
                + "     gene            1..10\n"
                + "                     /gene=\"b\"\n");
        assertThat(second.getFeatures(), empty());
        assertThat(second.getVersion(), equalTo("F2.1"));
        // The same holds for records in a single file.
        List<GenbankRecord> both = parser.parse("LOCUS       F1  10 bp    DNA     linear   SYN 01-JAN-2000\n"
                + "FEATURES             Location/Qualifiers\n"
                + "     gene            1..10\n"
                + "//\n"
                + "LOCUS       F2  10 bp    DNA     linear   SYN 01-JAN-2000\n"
                + "VERSION     F2.1\n"
                + "     gene            1..10\n"
                + "//\n");
        assertThat(both, hasSize(2));
        assertThat(both.get(0).getFeatures(), hasSize(1));
        assertThat(both.get(1).getFeatures(), empty());
    }

    @Test
    public void testImmutableOutput() throws RecordFormatException {
        GenbankRecord record = new GenbankParser().parseRecord("LOCUS       X1  8 bp    DNA     linear   SYN 01-JAN-2000\n"
                + "KEYWORDS    alpha; beta.\n");
        try {
            record.getKeywords().add("gamma");
            fail("Keyword list was modifiable.");
        } catch (UnsupportedOperationException e) {
            assertThat(record.getKeywords(), contains("alpha", "beta"));
        }
    }

}
