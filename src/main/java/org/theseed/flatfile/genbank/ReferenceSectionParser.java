/**
 *
 */
package org.theseed.flatfile.genbank;

import java.util.EnumSet;
import java.util.Set;

/**
 * Parser for REFERENCE blocks.  Each REFERENCE line starts a new reference (flushing the previous one)
 * whose citation is the rest of the line.  Inside the block, the AUTHORS, TITLE, JOURNAL, and PUBMED
 * lines set the matching field.  Wrapped field text and other sub-keywords are accepted but ignored.
 *
 * @author Bruce Parrello
 *
 */
public class ReferenceSectionParser extends SectionParser {

    /** sections whose keywords end a REFERENCE block */
    private static final Set<GenbankSection> STOPPERS = EnumSet.of(GenbankSection.FEATURES, GenbankSection.ORIGIN,
            GenbankSection.BASE, GenbankSection.CONTIG, GenbankSection.COMMENT, GenbankSection.PRIMARY);

    public ReferenceSectionParser() {
        super(GenbankSection.REFERENCE);
    }

    @Override
    public boolean canConsume(String line, RecordAccumulator acc) {
        return this.isHeader(line) || (this.isCurrent(acc) && ! GenbankSection.startsAny(line, STOPPERS));
    }

    @Override
    public void consume(String line, RecordAccumulator acc) {
        if (this.isHeader(line)) {
            acc.setCurrentSection(GenbankSection.REFERENCE);
            acc.startReference(new GenbankReference(GenbankSection.REFERENCE.remainder(line)));
        } else if (this.isCurrent(acc) && acc.getCurrentReference() != null) {
            for (GenbankReference.Field field : GenbankReference.Field.values()) {
                String label = field.getLabel();
                if (label != null && line.startsWith(label)) {
                    acc.getCurrentReference().put(field, line.substring(label.length()).trim());
                    break;
                }
            }
        }
    }

}
