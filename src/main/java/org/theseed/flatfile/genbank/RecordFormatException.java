/**
 *
 */
package org.theseed.flatfile.genbank;

/**
 * This exception is thrown when a GenBank record contains a value that cannot be converted to the
 * required type.  It aborts the parse of the whole file.
 *
 * @author Bruce Parrello
 *
 */
public class RecordFormatException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = 4581316285290471634L;
    /** input line that could not be parsed */
    private final String line;

    /**
     * Construct a new record-format exception.
     *
     * @param message	description of the error
     * @param line		offending input line
     * @param cause		underlying conversion error
     */
    public RecordFormatException(String message, String line, Throwable cause) {
        super(message + ": \"" + line + "\"", cause);
        this.line = line;
    }

    /**
     * @return the offending input line
     */
    public String getLine() {
        return this.line;
    }

}
