/**
 *
 */
package org.theseed.flatfile.fasta;

import java.util.Objects;

import org.theseed.flatfile.SequenceRecord;

/**
 * This object represents a single FASTA record:  an identifier, an optional description, and a sequence.
 *
 * @author Bruce Parrello
 *
 */
public class FastaRecord implements SequenceRecord {

    // FIELDS
    /** sequence identifier */
    private final String id;
    /** free-text description (empty if none) */
    private final String description;
    /** sequence letters */
    private final String sequence;

    /**
     * Construct a FASTA record.
     *
     * @param id			sequence identifier
     * @param description	description, or NULL for none
     * @param sequence		sequence letters
     */
    public FastaRecord(String id, String description, String sequence) {
        this.id = id;
        this.description = (description == null ? "" : description);
        this.sequence = sequence;
    }

    @Override
    public String getId() {
        return this.id;
    }

    /**
     * @return the description, or an empty string if there is none
     */
    public String getDescription() {
        return this.description;
    }

    @Override
    public String getSequence() {
        return this.sequence;
    }

    /**
     * @return the header line for this record, without the leading marker
     */
    public String getHeader() {
        String retVal = this.id;
        if (! this.description.isEmpty())
            retVal += " " + this.description;
        return retVal;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.description, this.sequence);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof FastaRecord))
            return false;
        FastaRecord other = (FastaRecord) obj;
        return Objects.equals(this.id, other.id) && Objects.equals(this.description, other.description)
                && Objects.equals(this.sequence, other.sequence);
    }

    @Override
    public String toString() {
        return ">" + this.getHeader() + " (" + this.sequence.length() + " letters)";
    }

}
