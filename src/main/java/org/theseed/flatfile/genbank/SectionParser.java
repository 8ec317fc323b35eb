/**
 *
 */
package org.theseed.flatfile.genbank;

/**
 * This is the base class for the GenBank section parsers.  Each parser can say whether it accepts a line
 * (given the state of the record so far) and then consume the line by updating the record accumulator.
 *
 * Section parsers hold no state of their own.  Everything that must be remembered between lines lives
 * in the {@link RecordAccumulator}, so a single parser instance can be shared by any number of parse runs.
 *
 * @author Bruce Parrello
 *
 */
public abstract class SectionParser {

    // FIELDS
    /** section handled by this parser */
    private final GenbankSection section;

    /**
     * Construct a section parser.
     *
     * @param section	section handled by this parser
     */
    protected SectionParser(GenbankSection section) {
        this.section = section;
    }

    /**
     * @return TRUE if this parser will accept the specified line
     *
     * @param line	input line
     * @param acc	accumulator for the current record
     */
    public abstract boolean canConsume(String line, RecordAccumulator acc);

    /**
     * Process an input line.
     *
     * @param line	input line that this parser has accepted
     * @param acc	accumulator for the current record
     *
     * @throws RecordFormatException
     */
    public abstract void consume(String line, RecordAccumulator acc) throws RecordFormatException;

    /**
     * @return the section handled by this parser
     */
    public GenbankSection getSection() {
        return this.section;
    }

    /**
     * @return TRUE if the line starts with this parser's section keyword
     *
     * @param line	input line
     */
    protected boolean isHeader(String line) {
        return this.section.starts(line);
    }

    /**
     * @return TRUE if the record is currently in this parser's section
     *
     * @param acc	accumulator for the current record
     */
    protected boolean isCurrent(RecordAccumulator acc) {
        return acc.getCurrentSection() == this.section;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }

}
