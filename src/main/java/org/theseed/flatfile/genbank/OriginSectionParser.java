/**
 *
 */
package org.theseed.flatfile.genbank;

import org.apache.commons.lang3.StringUtils;

/**
 * Parser for the ORIGIN section.  Each data line begins with a position number followed by blocks of
 * sequence letters; the position is dropped and the blocks are concatenated into a single fragment.
 *
 * @author Bruce Parrello
 *
 */
public class OriginSectionParser extends SectionParser {

    public OriginSectionParser() {
        super(GenbankSection.ORIGIN);
    }

    @Override
    public boolean canConsume(String line, RecordAccumulator acc) {
        return this.isHeader(line) || this.isCurrent(acc);
    }

    @Override
    public void consume(String line, RecordAccumulator acc) {
        if (this.isHeader(line)) {
            acc.setCurrentSection(GenbankSection.ORIGIN);
            acc.setInSequence(true);
            acc.setInsideFeatures(false);
        } else if (acc.isInSequence() && ! GenbankSection.END.starts(line)) {
            String[] parts = StringUtils.split(line);
            if (parts.length > 1)
                acc.addSequenceLine(StringUtils.join(parts, "", 1, parts.length));
        }
    }

}
