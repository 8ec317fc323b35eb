/**
 *
 */
package org.theseed.flatfile.genbank;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.cliftonlabs.json_simple.Jsonable;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object represents a literature reference in a GenBank record.  Each field holds at most one
 * value.  Only the first line of a field is kept; wrapped continuation text is not part of the value.
 *
 * @author Bruce Parrello
 *
 */
public class GenbankReference implements Jsonable {

    /**
     * This enumeration describes the reference fields.  Output order is the citation first, then the fields in the
     * order they were read.
     */
    public static enum Field {
        CITATION("citation", null),
        AUTHORS("authors", GenbankIndent.SECTION + "AUTHORS"),
        TITLE("title", GenbankIndent.SECTION + "TITLE"),
        JOURNAL("journal", GenbankIndent.SECTION + "JOURNAL"),
        PUBMED("pubmed", GenbankIndent.PUBMED + "PUBMED");

        /** name of the field in output */
        private final String key;
        /** label (with indent) that introduces the field in a REFERENCE block */
        private final String label;

        private Field(String key, String label) {
            this.key = key;
            this.label = label;
        }

        /**
         * @return the output key for this field
         */
        public String getKey() {
            return this.key;
        }

        /**
         * @return the indented line label for this field, or NULL if it has none
         */
        public String getLabel() {
            return this.label;
        }

    }

    // FIELDS
    /** field values */
    private final Map<Field, String> values;

    /**
     * Create a new reference with the specified citation.
     *
     * @param citation	reference number and base range
     */
    public GenbankReference(String citation) {
        this.values = new LinkedHashMap<Field, String>();
        this.values.put(Field.CITATION, citation);
    }

    /**
     * Store a field value, replacing any previous one.
     *
     * @param field		field to set
     * @param value		new value
     */
    protected void put(Field field, String value) {
        this.values.put(field, value);
    }

    /**
     * @return the value of a field, or NULL if it is not present
     *
     * @param field		field of interest
     */
    public String get(Field field) {
        return this.values.get(field);
    }

    /**
     * @return TRUE if the specified field is present
     *
     * @param field		field of interest
     */
    public boolean has(Field field) {
        return this.values.containsKey(field);
    }

    /**
     * @return the citation string
     */
    public String getCitation() {
        return this.values.get(Field.CITATION);
    }

    /**
     * @return the reference as a map from output key to value
     */
    public Map<String, String> toMap() {
        Map<String, String> retVal = new LinkedHashMap<String, String>();
        for (Map.Entry<Field, String> entry : this.values.entrySet())
            retVal.put(entry.getKey().getKey(), entry.getValue());
        return Collections.unmodifiableMap(retVal);
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
        writable.write(Jsoner.serialize(this.toMap()));
    }

    @Override
    public String toString() {
        return "REFERENCE " + this.getCitation();
    }

}
