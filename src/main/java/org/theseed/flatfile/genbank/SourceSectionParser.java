/**
 *
 */
package org.theseed.flatfile.genbank;

import java.util.EnumSet;
import java.util.Set;

/**
 * Parser for the SOURCE section, which includes the ORGANISM sub-keyword and the taxonomic lineage lines
 * beneath it.  While the SOURCE section is current, this parser accepts every line that does not start
 * a later section; lines that are neither ORGANISM nor lineage lines are accepted but ignored.
 *
 * @author Bruce Parrello
 *
 */
public class SourceSectionParser extends SectionParser {

    /** ORGANISM sub-keyword with its indent */
    private static final String ORGANISM = GenbankIndent.SECTION + "ORGANISM";
    /** sections whose keywords end the SOURCE section */
    private static final Set<GenbankSection> STOPPERS = EnumSet.of(GenbankSection.REFERENCE, GenbankSection.COMMENT,
            GenbankSection.PRIMARY, GenbankSection.FEATURES, GenbankSection.ORIGIN, GenbankSection.BASE,
            GenbankSection.CONTIG);

    public SourceSectionParser() {
        super(GenbankSection.SOURCE);
    }

    @Override
    public boolean canConsume(String line, RecordAccumulator acc) {
        boolean retVal;
        if (this.isHeader(line) || line.startsWith(ORGANISM))
            retVal = true;
        else if (! this.isCurrent(acc))
            retVal = false;
        else
            retVal = line.startsWith(GenbankIndent.TAXONOMY) || ! GenbankSection.startsAny(line, STOPPERS);
        return retVal;
    }

    @Override
    public void consume(String line, RecordAccumulator acc) {
        if (this.isHeader(line)) {
            acc.setCurrentSection(GenbankSection.SOURCE);
            acc.setSource(GenbankSection.SOURCE.remainder(line));
        } else if (line.startsWith(ORGANISM))
            acc.setOrganism(line.substring(ORGANISM.length()).trim());
        else if (this.isCurrent(acc) && line.startsWith(GenbankIndent.TAXONOMY))
            acc.addTaxonomy(line.trim());
    }

}
