/**
 *
 */
package org.theseed.flatfile.io;

/**
 * This exception is thrown when a record of an unknown type is passed to a save operation.
 *
 * @author Bruce Parrello
 *
 */
public class UnsupportedRecordException extends IllegalArgumentException {

    /** serialization ID */
    private static final long serialVersionUID = 6183960251043417750L;
    /** offending record type */
    private final Class<?> recordType;

    /**
     * Construct an exception for an unsupported record type.
     *
     * @param recordType	type of the record that could not be saved
     */
    public UnsupportedRecordException(Class<?> recordType) {
        super("Unsupported record type: " + recordType.getName());
        this.recordType = recordType;
    }

    /**
     * @return the type of the record that could not be saved
     */
    public Class<?> getRecordType() {
        return this.recordType;
    }

}
