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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.cliftonlabs.json_simple.Jsonable;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object represents a feature from the FEATURES table of a GenBank record.  A feature has a type,
 * a location expression (kept as raw text), and a set of qualifiers.  Each qualifier maps to a list of
 * text fragments:  the first fragment comes from the "/key=value" line, and each continuation line adds
 * another.  The fragments are never joined by the parser, because the correct separator depends on the
 * qualifier (none for a translation, a space for a note).
 *
 * @author Bruce Parrello
 *
 */
public class GenbankFeature implements Jsonable {

    // FIELDS
    /** feature type (gene, CDS, mRNA, ...) */
    private final String featureType;
    /** location expression */
    private final String location;
    /** qualifier fragment lists, in order of first insertion */
    private final Map<String, List<String>> qualifiers;
    /** most recently inserted qualifier key, or NULL if none */
    private String lastKey;

    /**
     * Construct a new, empty feature.
     *
     * @param featureType	type of feature
     * @param location		location expression
     */
    public GenbankFeature(String featureType, String location) {
        this.featureType = featureType;
        this.location = location;
        this.qualifiers = new LinkedHashMap<String, List<String>>();
        this.lastKey = null;
    }

    /**
     * Store a qualifier value.  Any previous fragments for the key are replaced, but a key that is
     * already present keeps its original position.
     *
     * @param key		qualifier key
     * @param value		first fragment of the value
     */
    protected void putQualifier(String key, String value) {
        List<String> fragments = new ArrayList<String>(2);
        fragments.add(value);
        if (this.qualifiers.put(key, fragments) == null)
            this.lastKey = key;
    }

    /**
     * Add a continuation fragment to the most recently inserted qualifier.
     *
     * @param fragment	text to add
     *
     * @return FALSE if there is no qualifier to extend, else TRUE
     */
    protected boolean extendQualifier(String fragment) {
        boolean retVal = (this.lastKey != null);
        if (retVal)
            this.qualifiers.get(this.lastKey).add(fragment);
        return retVal;
    }

    /**
     * @return the feature type
     */
    public String getFeatureType() {
        return this.featureType;
    }

    /**
     * @return the location expression
     */
    public String getLocation() {
        return this.location;
    }

    /**
     * @return an unmodifiable view of the qualifier map
     */
    public Map<String, List<String>> getQualifiers() {
        Map<String, List<String>> retVal = new LinkedHashMap<String, List<String>>(this.qualifiers.size() * 4 / 3 + 1);
        for (Map.Entry<String, List<String>> entry : this.qualifiers.entrySet())
            retVal.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
        return Collections.unmodifiableMap(retVal);
    }

    /**
     * @return the fragments for a qualifier, or an empty list if the qualifier is absent
     *
     * @param key	qualifier key
     */
    public List<String> getFragments(String key) {
        List<String> retVal = this.qualifiers.get(key);
        if (retVal == null)
            retVal = Collections.emptyList();
        else
            retVal = Collections.unmodifiableList(retVal);
        return retVal;
    }

    /**
     * @return the value of a qualifier with its fragments joined by the specified separator, or NULL
     * 		   if the qualifier is absent
     *
     * @param key		qualifier key
     * @param separator	separator to put between fragments
     */
    public String getQualifier(String key, String separator) {
        String retVal = null;
        List<String> fragments = this.qualifiers.get(key);
        if (fragments != null)
            retVal = String.join(separator, fragments);
        return retVal;
    }

    /**
     * @return TRUE if this feature has the specified qualifier
     *
     * @param key	qualifier key
     */
    public boolean hasQualifier(String key) {
        return this.qualifiers.containsKey(key);
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
        writable.write("{\"feature_type\":");
        writable.write(Jsoner.serialize(this.featureType));
        writable.write(",\"location\":");
        writable.write(Jsoner.serialize(this.location));
        writable.write(",\"qualifiers\":");
        writable.write(Jsoner.serialize(this.qualifiers));
        writable.write("}");
    }

    @Override
    public String toString() {
        return this.featureType + " " + this.location;
    }

}
