/**
 *
 */
package org.theseed.flatfile.genbank;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.Test;

/**
 * @author Bruce Parrello
 *
 */
public class RecordAccumulatorTest {

    @Test
    public void testDefaults() {
        RecordAccumulator acc = new RecordAccumulator();
        assertThat(acc.getCurrentSection(), nullValue());
        assertThat(acc.isInsideFeatures(), equalTo(false));
        assertThat(acc.isInSequence(), equalTo(false));
        GenbankRecord record = acc.finish();
        assertThat(acc.isFinished(), equalTo(true));
        assertThat(record.getLocus(), equalTo(""));
        assertThat(record.getSize(), equalTo(0L));
        assertThat(record.getDefinition(), equalTo(""));
        assertThat(record.getKeywords(), empty());
        assertThat(record.getOrganism(), equalTo(""));
        assertThat(record.getFeatures(), empty());
        assertThat(record.getReferences(), empty());
        assertThat(record.getSequence(), equalTo(""));
        assertThat(record.getComment(), equalTo(""));
        assertThat(record.getPrimary(), equalTo(""));
    }

    @Test(expected = IllegalStateException.class)
    public void testFinishTwice() {
        RecordAccumulator acc = new RecordAccumulator();
        acc.finish();
        acc.finish();
    }

    @Test
    public void testFinishFlushes() {
        RecordAccumulator acc = new RecordAccumulator();
        acc.setOrganism("Escherichia coli");
        acc.addTaxonomy("Bacteria; Pseudomonadota;");
        acc.addTaxonomy("Enterobacterales.");
        acc.startReference(new GenbankReference("1  (bases 1 to 4)"));
        acc.startReference(new GenbankReference("2  (bases 1 to 4)"));
        acc.startFeature(new GenbankFeature("gene", "1..4"));
        acc.addSequenceLine("acgt");
        acc.addSequenceLine("tt");
        assertThat(acc.getReferences(), hasSize(1));
        assertThat(acc.getFeatures(), empty());
        GenbankRecord record = acc.finish();
        assertThat(acc.getCurrentFeature(), nullValue());
        assertThat(acc.getCurrentReference(), nullValue());
        assertThat(record.getReferences(), hasSize(2));
        assertThat(record.getReferences().get(1).getCitation(), equalTo("2  (bases 1 to 4)"));
        assertThat(record.getFeatures(), hasSize(1));
        assertThat(record.getSequence(), equalTo("acgttt"));
        assertThat(record.getTaxonomy(), equalTo("Bacteria; Pseudomonadota; Enterobacterales."));
        assertThat(record.getOrganism(), equalTo("Escherichia coli [Bacteria; Pseudomonadota; Enterobacterales.]"));
    }

    @Test
    public void testFlushClears() {
        RecordAccumulator acc = new RecordAccumulator();
        acc.startFeature(new GenbankFeature("gene", "1..4"));
        acc.flushFeature();
        acc.flushFeature();
        assertThat(acc.getFeatures(), hasSize(1));
        acc.startReference(new GenbankReference("1"));
        acc.flushReference();
        acc.flushReference();
        assertThat(acc.getReferences(), hasSize(1));
    }

    @Test
    public void testExtend() {
        assertThat(RecordAccumulator.extend("first", "     second  "), equalTo("first second"));
        assertThat(RecordAccumulator.extend("", "text"), equalTo(" text"));
    }

}
