/**
 *
 */
package org.theseed.flatfile.genbank;

import org.apache.commons.lang3.StringUtils;

/**
 * Parser for the LOCUS line.  The line has seven whitespace-delimited fields:  name, length, the "bp" unit,
 * molecule type, topology, division, and modification date.  The unit and the topology are not kept.  A
 * line with fewer fields is ignored, but a length that is not a number is a fatal error.
 *
 * @author Bruce Parrello
 *
 */
public class LocusSectionParser extends SectionParser {

    /** minimum number of fields in a usable LOCUS line */
    private static final int MIN_FIELDS = 7;

    public LocusSectionParser() {
        super(GenbankSection.LOCUS);
    }

    @Override
    public boolean canConsume(String line, RecordAccumulator acc) {
        return this.isHeader(line);
    }

    @Override
    public void consume(String line, RecordAccumulator acc) throws RecordFormatException {
        acc.setCurrentSection(GenbankSection.LOCUS);
        String[] parts = StringUtils.split(GenbankSection.LOCUS.remainder(line));
        if (parts.length >= MIN_FIELDS) {
            acc.setLocus(parts[0]);
            try {
                acc.setSize(Long.parseLong(parts[1]));
            } catch (NumberFormatException e) {
                throw new RecordFormatException("Invalid sequence length in LOCUS line", line, e);
            }
            acc.setMoleculeType(parts[3]);
            acc.setGenbankDivision(parts[5]);
            acc.setModificationDate(parts[6]);
        }
    }

}
