/**
 *
 */
package org.theseed.flatfile.io;

import java.io.File;
import java.io.IOException;

/**
 * This exception is thrown when an input file is not in a supported sequence format.
 *
 * @author Bruce Parrello
 *
 */
public class UnsupportedFormatException extends IOException {

    /** serialization ID */
    private static final long serialVersionUID = -2270561541457963371L;
    /** offending file */
    private final File file;

    /**
     * Construct an exception for an unsupported input file.
     *
     * @param file	file whose format could not be handled
     */
    public UnsupportedFormatException(File file) {
        super("Unsupported file format: " + file);
        this.file = file;
    }

    /**
     * @return the file whose format could not be handled
     */
    public File getFile() {
        return this.file;
    }

}
