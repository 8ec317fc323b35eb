/**
 *
 */
package org.theseed.flatfile.genbank;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Parser for the KEYWORDS line.  The keywords are semicolon-delimited and the list ends with a period.
 * A KEYWORDS line with no keywords (usually just ".") leaves any keywords already found in place.
 *
 * @author Bruce Parrello
 *
 */
public class KeywordsSectionParser extends SectionParser {

    public KeywordsSectionParser() {
        super(GenbankSection.KEYWORDS);
    }

    @Override
    public boolean canConsume(String line, RecordAccumulator acc) {
        return this.isHeader(line);
    }

    @Override
    public void consume(String line, RecordAccumulator acc) {
        acc.setCurrentSection(GenbankSection.KEYWORDS);
        String text = StringUtils.stripEnd(GenbankSection.KEYWORDS.remainder(line), ".");
        List<String> keywords = new ArrayList<String>();
        for (String keyword : StringUtils.splitPreserveAllTokens(text, ';')) {
            String trimmed = keyword.trim();
            if (! trimmed.isEmpty())
                keywords.add(trimmed);
        }
        if (! keywords.isEmpty())
            acc.setKeywords(keywords);
    }

}
