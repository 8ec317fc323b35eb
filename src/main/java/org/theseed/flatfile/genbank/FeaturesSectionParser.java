/**
 *
 */
package org.theseed.flatfile.genbank;

import java.util.EnumSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * Parser for the FEATURES table.  Feature lines have a 5-space indent and contain the feature type and
 * location.  Qualifier lines have a 21-space indent.  A qualifier line beginning with a slash starts a
 * new qualifier; any other qualifier line is a continuation of the most recently inserted qualifier and
 * is stored as a separate fragment.
 *
 * Quote state is not tracked across lines.  The opening quote is removed from the first line, and a
 * trailing quote is removed from any line that has one.  A first line that ends in a quote character
 * that is part of the text will therefore lose it.
 *
 * @author Bruce Parrello
 *
 */
public class FeaturesSectionParser extends SectionParser {

    /** sections whose keywords end the FEATURES table */
    private static final Set<GenbankSection> STOPPERS = EnumSet.of(GenbankSection.ORIGIN, GenbankSection.BASE,
            GenbankSection.CONTIG);

    public FeaturesSectionParser() {
        super(GenbankSection.FEATURES);
    }

    @Override
    public boolean canConsume(String line, RecordAccumulator acc) {
        return this.isHeader(line) || (acc.isInsideFeatures() && ! GenbankSection.startsAny(line, STOPPERS));
    }

    @Override
    public void consume(String line, RecordAccumulator acc) {
        if (this.isHeader(line)) {
            acc.setCurrentSection(GenbankSection.FEATURES);
            acc.setInsideFeatures(true);
        } else if (line.startsWith(GenbankIndent.QUALIFIER)) {
            if (acc.getCurrentFeature() != null)
                this.processQualifier(line.substring(GenbankIndent.QUALIFIER.length()).trim(), acc.getCurrentFeature());
        } else if (line.startsWith(GenbankIndent.FEATURE))
            this.processFeature(line.substring(GenbankIndent.FEATURE.length()).trim(), acc);
    }

    /**
     * Start a new feature.  The old feature is always flushed, but a new one is only started if both
     * the type and the location are present.
     *
     * @param text	feature line with the indent removed
     * @param acc	accumulator for the current record
     */
    private void processFeature(String text, RecordAccumulator acc) {
        acc.flushFeature();
        String[] parts = StringUtils.split(text, null, 2);
        if (parts.length >= 2)
            acc.startFeature(new GenbankFeature(parts[0], parts[1].trim()));
    }

    /**
     * Process a qualifier line.
     *
     * @param text		qualifier line with the indent removed
     * @param feature	feature being built
     */
    private void processQualifier(String text, GenbankFeature feature) {
        if (text.startsWith("/")) {
            int eq = text.indexOf('=');
            if (eq < 0)
                feature.putQualifier(text.substring(1), "");
            else {
                String key = text.substring(1, eq);
                String value = text.substring(eq + 1);
                if (value.startsWith("\"")) {
                    value = value.substring(1);
                    value = StringUtils.removeEnd(value, "\"");
                }
                feature.putQualifier(key, value);
            }
        } else
            feature.extendQualifier(StringUtils.removeEnd(text, "\""));
    }

}
