/**
 *
 */
package org.theseed.flatfile.genbank;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.theseed.flatfile.SequenceRecord;

import com.github.cliftonlabs.json_simple.Jsonable;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object represents a single fully-parsed GenBank record.  It is immutable, and is built from a
 * finished {@link RecordAccumulator}.
 *
 * The JSON form lists the fields in the same order as the flat file presents them, followed by the
 * optional comment and primary fields.
 *
 * @author Bruce Parrello
 *
 */
public class GenbankRecord implements SequenceRecord, Jsonable {

    // FIELDS
    private final String locus;
    private final long size;
    private final String moleculeType;
    private final String genbankDivision;
    private final String modificationDate;
    private final String definition;
    private final String accession;
    private final String version;
    private final List<String> keywords;
    private final String source;
    private final String organism;
    private final String taxonomy;
    private final List<GenbankReference> references;
    private final List<GenbankFeature> features;
    private final String sequence;
    private final String comment;
    private final String primary;

    /**
     * Construct a record from a finished accumulator.
     *
     * @param acc		accumulator whose finalization has completed
     * @param sequence	joined sequence string
     */
    GenbankRecord(RecordAccumulator acc, String sequence) {
        this.locus = acc.getLocus();
        this.size = acc.getSize();
        this.moleculeType = acc.getMoleculeType();
        this.genbankDivision = acc.getGenbankDivision();
        this.modificationDate = acc.getModificationDate();
        this.definition = acc.getDefinition();
        this.accession = acc.getAccession();
        this.version = acc.getVersion();
        this.keywords = Collections.unmodifiableList(new ArrayList<String>(acc.getKeywords()));
        this.source = acc.getSource();
        this.organism = acc.getOrganism();
        this.taxonomy = acc.getTaxonomy();
        this.references = Collections.unmodifiableList(new ArrayList<GenbankReference>(acc.getReferences()));
        this.features = Collections.unmodifiableList(new ArrayList<GenbankFeature>(acc.getFeatures()));
        this.sequence = sequence;
        this.comment = acc.getComment();
        this.primary = acc.getPrimary();
    }

    @Override
    public String getId() {
        return this.locus;
    }

    /**
     * @return the locus name
     */
    public String getLocus() {
        return this.locus;
    }

    /**
     * @return the sequence length in base pairs, as declared on the LOCUS line
     */
    public long getSize() {
        return this.size;
    }

    /**
     * @return the molecule type (DNA, mRNA, ...)
     */
    public String getMoleculeType() {
        return this.moleculeType;
    }

    /**
     * @return the three-letter GenBank division code
     */
    public String getGenbankDivision() {
        return this.genbankDivision;
    }

    /**
     * @return the modification date string
     */
    public String getModificationDate() {
        return this.modificationDate;
    }

    /**
     * @return the definition line
     */
    public String getDefinition() {
        return this.definition;
    }

    /**
     * @return the accession number(s)
     */
    public String getAccession() {
        return this.accession;
    }

    /**
     * @return the versioned accession
     */
    public String getVersion() {
        return this.version;
    }

    /**
     * @return the keyword list
     */
    public List<String> getKeywords() {
        return this.keywords;
    }

    /**
     * @return the source description
     */
    public String getSource() {
        return this.source;
    }

    /**
     * @return the organism name, with the bracketed taxonomy appended if there was one
     */
    public String getOrganism() {
        return this.organism;
    }

    /**
     * @return the taxonomic lineage
     */
    public String getTaxonomy() {
        return this.taxonomy;
    }

    /**
     * @return the literature references
     */
    public List<GenbankReference> getReferences() {
        return this.references;
    }

    /**
     * @return the features
     */
    public List<GenbankFeature> getFeatures() {
        return this.features;
    }

    @Override
    public String getSequence() {
        return this.sequence;
    }

    /**
     * @return the comment text, or an empty string if there was none
     */
    public String getComment() {
        return this.comment;
    }

    /**
     * @return the primary-assembly text, or an empty string if there was none
     */
    public String getPrimary() {
        return this.primary;
    }

    @Override
    public String toJson() {
        final StringWriter writable = new StringWriter();
        try {
            this.toJson(writable);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        return writable.toString();
    }

    @Override
    public void toJson(Writer writable) throws IOException {
        writable.write('{');
        writeField(writable, "locus", this.locus, true);
        writeField(writable, "size", this.size, false);
        writeField(writable, "molecule_type", this.moleculeType, false);
        writeField(writable, "genbank_division", this.genbankDivision, false);
        writeField(writable, "modification_date", this.modificationDate, false);
        writeField(writable, "definition", this.definition, false);
        writeField(writable, "accession", this.accession, false);
        writeField(writable, "version", this.version, false);
        writeField(writable, "keywords", this.keywords, false);
        writeField(writable, "source", this.source, false);
        writeField(writable, "organism", this.organism, false);
        writeField(writable, "taxonomy", this.taxonomy, false);
        writeField(writable, "references", this.references, false);
        writeField(writable, "features", this.features, false);
        writeField(writable, "sequence", this.sequence, false);
        writeField(writable, "comment", this.comment, false);
        writeField(writable, "primary", this.primary, false);
        writable.write('}');
    }

    /**
     * Write a single JSON object member.
     *
     * @param writable	output writer
     * @param key		member name
     * @param value		member value
     * @param first		TRUE if this is the first member of the object
     *
     * @throws IOException
     */
    private static void writeField(Writer writable, String key, Object value, boolean first) throws IOException {
        if (! first)
            writable.write(',');
        writable.write(Jsoner.serialize(key));
        writable.write(':');
        writable.write(Jsoner.serialize(value));
    }

    @Override
    public String toString() {
        return this.locus + " (" + this.definition + ")";
    }

}
