/**
 *
 */
package org.theseed.flatfile.genbank;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Parser for a free-text section that may wrap onto indented continuation lines (DEFINITION, ACCESSION,
 * COMMENT, PRIMARY).  Each continuation line is trimmed and appended after a single space.
 *
 * @author Bruce Parrello
 *
 */
public class TextSectionParser extends SectionParser {

    // FIELDS
    /** function to get the current field value */
    private final Function<RecordAccumulator, String> getter;
    /** function to store a new field value */
    private final BiConsumer<RecordAccumulator, String> setter;

    /**
     * Construct a free-text section parser.
     *
     * @param section	section handled
     * @param getter	function to read the field from the accumulator
     * @param setter	function to store the field in the accumulator
     */
    public TextSectionParser(GenbankSection section, Function<RecordAccumulator, String> getter,
            BiConsumer<RecordAccumulator, String> setter) {
        super(section);
        this.getter = getter;
        this.setter = setter;
    }

    @Override
    public boolean canConsume(String line, RecordAccumulator acc) {
        return this.isHeader(line) || (this.isCurrent(acc) && line.startsWith(" "));
    }

    @Override
    public void consume(String line, RecordAccumulator acc) {
        if (this.isHeader(line)) {
            acc.setCurrentSection(this.getSection());
            this.setter.accept(acc, this.getSection().remainder(line));
        } else
            this.setter.accept(acc, RecordAccumulator.extend(this.getter.apply(acc), line));
    }

}
