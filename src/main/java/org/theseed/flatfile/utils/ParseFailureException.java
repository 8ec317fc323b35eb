/**
 *
 */
package org.theseed.flatfile.utils;

/**
 * This exception is thrown when the command-line parameters of a processor are invalid.
 *
 * @author Bruce Parrello
 *
 */
public class ParseFailureException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = -6311047290367420178L;

    public ParseFailureException(String message) {
        super(message);
    }

}
