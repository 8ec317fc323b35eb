/**
 *
 */
package org.theseed.flatfile.genbank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object holds the state of a single GenBank record while it is being parsed.  The section parsers
 * mutate it line by line, and {@link #finish()} converts it into an immutable {@link GenbankRecord}.
 *
 * An accumulator belongs to exactly one record.  All per-run parser state, including the flag that
 * tracks whether we are inside the FEATURES table, lives here, so that nothing leaks from one record
 * to the next.
 *
 * @author Bruce Parrello
 *
 */
public class RecordAccumulator {

    // FIELDS
    private String locus;
    private long size;
    private String moleculeType;
    private String genbankDivision;
    private String modificationDate;
    private String definition;
    private String accession;
    private String version;
    private List<String> keywords;
    private String source;
    private String organism;
    private String taxonomy;
    private List<GenbankReference> references;
    private List<GenbankFeature> features;
    private String comment;
    private String primary;
    /** section currently being parsed, or NULL if none */
    private GenbankSection currentSection;
    /** feature being built, or NULL if none */
    private GenbankFeature currentFeature;
    /** reference being built, or NULL if none */
    private GenbankReference currentReference;
    /** TRUE if the ORIGIN header has been seen */
    private boolean inSequence;
    /** TRUE between the FEATURES header and the ORIGIN header */
    private boolean insideFeatures;
    /** raw sequence fragments, one per ORIGIN data line */
    private List<String> sequenceLines;
    /** TRUE once the record has been finished */
    private boolean finished;

    /**
     * Create a new, empty accumulator.
     */
    public RecordAccumulator() {
        this.locus = "";
        this.size = 0;
        this.moleculeType = "";
        this.genbankDivision = "";
        this.modificationDate = "";
        this.definition = "";
        this.accession = "";
        this.version = "";
        this.keywords = new ArrayList<String>();
        this.source = "";
        this.organism = "";
        this.taxonomy = "";
        this.references = new ArrayList<GenbankReference>();
        this.features = new ArrayList<GenbankFeature>();
        this.comment = "";
        this.primary = "";
        this.currentSection = null;
        this.currentFeature = null;
        this.currentReference = null;
        this.inSequence = false;
        this.insideFeatures = false;
        this.sequenceLines = new ArrayList<String>();
        this.finished = false;
    }

    /**
     * Flush any pending feature and reference, join the sequence, fold the taxonomy into the organism
     * name, and return the completed record.  This can only be done once.
     *
     * @return the immutable record built from this accumulator
     */
    public GenbankRecord finish() {
        if (this.finished)
            throw new IllegalStateException("GenBank record " + this.locus + " has already been finished.");
        this.finished = true;
        this.flushFeature();
        this.flushReference();
        String sequence = String.join("", this.sequenceLines);
        if (! this.taxonomy.isEmpty())
            this.organism = this.organism + " [" + this.taxonomy + "]";
        return new GenbankRecord(this, sequence);
    }

    /**
     * Move the in-progress feature (if any) to the feature list.
     */
    protected void flushFeature() {
        if (this.currentFeature != null) {
            this.features.add(this.currentFeature);
            this.currentFeature = null;
        }
    }

    /**
     * Move the in-progress reference (if any) to the reference list.
     */
    protected void flushReference() {
        if (this.currentReference != null) {
            this.references.add(this.currentReference);
            this.currentReference = null;
        }
    }

    /**
     * Start a new feature, flushing the old one.
     *
     * @param feature	new in-progress feature
     */
    protected void startFeature(GenbankFeature feature) {
        this.flushFeature();
        this.currentFeature = feature;
    }

    /**
     * Start a new reference, flushing the old one.
     *
     * @param reference	new in-progress reference
     */
    protected void startReference(GenbankReference reference) {
        this.flushReference();
        this.currentReference = reference;
    }

    /**
     * Add a fragment of sequence data.
     *
     * @param fragment	sequence letters from one ORIGIN line
     */
    protected void addSequenceLine(String fragment) {
        this.sequenceLines.add(fragment);
    }

    /**
     * Add a line of taxonomic lineage.
     *
     * @param lineage	lineage text to add
     */
    protected void addTaxonomy(String lineage) {
        if (this.taxonomy.isEmpty())
            this.taxonomy = lineage;
        else
            this.taxonomy = this.taxonomy + " " + lineage;
    }

    /**
     * @return the text with a continuation line appended, separated by a space
     *
     * @param text	original text
     * @param line	continuation line
     */
    protected static String extend(String text, String line) {
        return text + " " + line.trim();
    }

    public String getLocus() {
        return this.locus;
    }

    protected void setLocus(String locus) {
        this.locus = locus;
    }

    public long getSize() {
        return this.size;
    }

    protected void setSize(long size) {
        this.size = size;
    }

    public String getMoleculeType() {
        return this.moleculeType;
    }

    protected void setMoleculeType(String moleculeType) {
        this.moleculeType = moleculeType;
    }

    public String getGenbankDivision() {
        return this.genbankDivision;
    }

    protected void setGenbankDivision(String genbankDivision) {
        this.genbankDivision = genbankDivision;
    }

    public String getModificationDate() {
        return this.modificationDate;
    }

    protected void setModificationDate(String modificationDate) {
        this.modificationDate = modificationDate;
    }

    public String getDefinition() {
        return this.definition;
    }

    protected void setDefinition(String definition) {
        this.definition = definition;
    }

    public String getAccession() {
        return this.accession;
    }

    protected void setAccession(String accession) {
        this.accession = accession;
    }

    public String getVersion() {
        return this.version;
    }

    protected void setVersion(String version) {
        this.version = version;
    }

    public List<String> getKeywords() {
        return Collections.unmodifiableList(this.keywords);
    }

    protected void setKeywords(List<String> keywords) {
        this.keywords = new ArrayList<String>(keywords);
    }

    public String getSource() {
        return this.source;
    }

    protected void setSource(String source) {
        this.source = source;
    }

    public String getOrganism() {
        return this.organism;
    }

    protected void setOrganism(String organism) {
        this.organism = organism;
    }

    public String getTaxonomy() {
        return this.taxonomy;
    }

    public List<GenbankReference> getReferences() {
        return Collections.unmodifiableList(this.references);
    }

    public List<GenbankFeature> getFeatures() {
        return Collections.unmodifiableList(this.features);
    }

    public String getComment() {
        return this.comment;
    }

    protected void setComment(String comment) {
        this.comment = comment;
    }

    public String getPrimary() {
        return this.primary;
    }

    protected void setPrimary(String primary) {
        this.primary = primary;
    }

    /**
     * @return the section currently being parsed, or NULL if none
     */
    public GenbankSection getCurrentSection() {
        return this.currentSection;
    }

    protected void setCurrentSection(GenbankSection currentSection) {
        this.currentSection = currentSection;
    }

    /**
     * @return the in-progress feature, or NULL if none
     */
    public GenbankFeature getCurrentFeature() {
        return this.currentFeature;
    }

    /**
     * @return the in-progress reference, or NULL if none
     */
    public GenbankReference getCurrentReference() {
        return this.currentReference;
    }

    /**
     * @return TRUE if the ORIGIN header has been seen
     */
    public boolean isInSequence() {
        return this.inSequence;
    }

    protected void setInSequence(boolean inSequence) {
        this.inSequence = inSequence;
    }

    /**
     * @return TRUE if we are inside the FEATURES table
     */
    public boolean isInsideFeatures() {
        return this.insideFeatures;
    }

    protected void setInsideFeatures(boolean insideFeatures) {
        this.insideFeatures = insideFeatures;
    }

    /**
     * @return the raw sequence fragments collected so far
     */
    public List<String> getSequenceLines() {
        return Collections.unmodifiableList(this.sequenceLines);
    }

    /**
     * @return TRUE if this accumulator has been finished
     */
    public boolean isFinished() {
        return this.finished;
    }

}
