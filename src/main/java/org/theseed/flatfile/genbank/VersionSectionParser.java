/**
 *
 */
package org.theseed.flatfile.genbank;

/**
 * Parser for the VERSION line.  A later VERSION line replaces an earlier one.
 *
 * @author Bruce Parrello
 *
 */
public class VersionSectionParser extends SectionParser {

    public VersionSectionParser() {
        super(GenbankSection.VERSION);
    }

    @Override
    public boolean canConsume(String line, RecordAccumulator acc) {
        return this.isHeader(line);
    }

    @Override
    public void consume(String line, RecordAccumulator acc) {
        acc.setCurrentSection(GenbankSection.VERSION);
        acc.setVersion(GenbankSection.VERSION.remainder(line));
    }

}
