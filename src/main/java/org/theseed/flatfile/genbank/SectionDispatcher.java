/**
 *
 */
package org.theseed.flatfile.genbank;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object routes the lines of a single GenBank record to the section parsers.  A line that begins
 * with a section keyword goes to the first parser in the priority list that accepts it, and that parser
 * becomes the active one.  Any other line is offered to the active parser only; if it declines, the line
 * is dropped.
 *
 * A dispatcher owns the accumulator for its record, so a new dispatcher must be created for each record.
 *
 * @author Bruce Parrello
 *
 */
public class SectionDispatcher {

    // FIELDS
    /** logging facility */
    private static final Logger log = LoggerFactory.getLogger(SectionDispatcher.class);
    /** section parsers in priority order; the first parser that accepts a keyword line wins */
    public static final List<SectionParser> PARSERS = List.of(
            new LocusSectionParser(),
            new TextSectionParser(GenbankSection.DEFINITION, RecordAccumulator::getDefinition, RecordAccumulator::setDefinition),
            new TextSectionParser(GenbankSection.ACCESSION, RecordAccumulator::getAccession, RecordAccumulator::setAccession),
            new VersionSectionParser(),
            new KeywordsSectionParser(),
            new SourceSectionParser(),
            new ReferenceSectionParser(),
            new TextSectionParser(GenbankSection.COMMENT, RecordAccumulator::getComment, RecordAccumulator::setComment),
            new TextSectionParser(GenbankSection.PRIMARY, RecordAccumulator::getPrimary, RecordAccumulator::setPrimary),
            new FeaturesSectionParser(),
            new OriginSectionParser());
    /** accumulator for the record */
    private final RecordAccumulator acc;
    /** parser that handled the last keyword line, or NULL if none */
    private SectionParser activeParser;
    /** number of lines processed */
    private int lineCount;
    /** number of non-blank lines that no parser accepted */
    private int droppedCount;

    /**
     * Create a dispatcher for a new record.
     */
    public SectionDispatcher() {
        this.acc = new RecordAccumulator();
        this.activeParser = null;
        this.lineCount = 0;
        this.droppedCount = 0;
    }

    /**
     * Process a single line of the record.
     *
     * @param line	input line, without the line terminator
     *
     * @throws RecordFormatException
     */
    public void accept(String line) throws RecordFormatException {
        this.lineCount++;
        if (! StringUtils.isBlank(line)) {
            if (GenbankSection.startsAny(line, GenbankSection.DISPATCHED)) {
                SectionParser found = null;
                for (SectionParser parser : PARSERS) {
                    if (parser.canConsume(line, this.acc)) {
                        found = parser;
                        break;
                    }
                }
                if (found == null)
                    this.drop(line);
                else {
                    this.activeParser = found;
                    found.consume(line, this.acc);
                }
            } else if (this.activeParser != null && this.activeParser.canConsume(line, this.acc))
                this.activeParser.consume(line, this.acc);
            else
                this.drop(line);
        }
    }

    /**
     * Record that a line was not accepted by any parser.
     *
     * @param line	line being dropped
     */
    private void drop(String line) {
        this.droppedCount++;
        log.debug("Line {} ignored: {}", this.lineCount, line);
    }

    /**
     * Finalize the record.
     *
     * @return the completed record
     */
    public GenbankRecord finish() {
        if (this.droppedCount > 0)
            log.debug("{} of {} lines ignored in record {}.", this.droppedCount, this.lineCount, this.acc.getLocus());
        return this.acc.finish();
    }

    /**
     * @return the accumulator for this record
     */
    public RecordAccumulator getAccumulator() {
        return this.acc;
    }

    /**
     * @return the parser that is currently active, or NULL if none
     */
    public SectionParser getActiveParser() {
        return this.activeParser;
    }

    /**
     * @return the number of non-blank lines that were dropped
     */
    public int getDroppedCount() {
        return this.droppedCount;
    }

}
