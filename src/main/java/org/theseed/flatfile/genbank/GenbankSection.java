/**
 *
 */
package org.theseed.flatfile.genbank;

import java.util.EnumSet;
import java.util.Set;

/**
 * This enumeration describes the top-level section keywords of a GenBank flat file.  BASE and CONTIG
 * are never parsed, but they mark the end of the sections that precede them.  END is the record
 * terminator.
 *
 * @author Bruce Parrello
 *
 */
public enum GenbankSection {
    LOCUS("LOCUS"),
    DEFINITION("DEFINITION"),
    ACCESSION("ACCESSION"),
    VERSION("VERSION"),
    KEYWORDS("KEYWORDS"),
    SOURCE("SOURCE"),
    REFERENCE("REFERENCE"),
    COMMENT("COMMENT"),
    PRIMARY("PRIMARY"),
    FEATURES("FEATURES"),
    ORIGIN("ORIGIN"),
    BASE("BASE"),
    CONTIG("CONTIG"),
    END("//");

    /** sections whose keyword starts a new dispatch cycle */
    public static final Set<GenbankSection> DISPATCHED = EnumSet.range(LOCUS, ORIGIN);

    // FIELDS
    /** keyword at the start of the line */
    private final String keyword;

    private GenbankSection(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return the keyword that introduces this section
     */
    public String getKeyword() {
        return this.keyword;
    }

    /**
     * @return TRUE if the specified line begins with this section's keyword
     *
     * @param line	input line to check
     */
    public boolean starts(String line) {
        return line.startsWith(this.keyword);
    }

    /**
     * @return the text following this section's keyword, trimmed
     *
     * @param line	input line beginning with the keyword
     */
    public String remainder(String line) {
        return line.substring(this.keyword.length()).trim();
    }

    /**
     * @return TRUE if the line begins with the keyword of any of the specified sections
     *
     * @param line		input line to check
     * @param sections	sections whose keywords should be checked
     */
    public static boolean startsAny(String line, Set<GenbankSection> sections) {
        boolean retVal = false;
        for (GenbankSection section : sections) {
            if (section.starts(line)) {
                retVal = true;
                break;
            }
        }
        return retVal;
    }

}
