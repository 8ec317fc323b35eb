/**
 *
 */
package org.theseed.flatfile.genbank;

/**
 * Fixed-column indentation prefixes used by the GenBank flat-file layout.
 *
 * @author Bruce Parrello
 *
 */
public class GenbankIndent {

    /** sub-keyword indent (ORGANISM, AUTHORS, TITLE, JOURNAL) */
    public static final String SECTION = "  ";
    /** PUBMED sub-keyword indent */
    public static final String PUBMED = "   ";
    /** feature key indent */
    public static final String FEATURE = "     ";
    /** taxonomy lineage indent */
    public static final String TAXONOMY = "            ";
    /** qualifier indent */
    public static final String QUALIFIER = "                     ";

    private GenbankIndent() { }

}
