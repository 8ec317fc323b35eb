/**
 *
 */
package org.theseed.flatfile.io;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object represents a destination for saved record files, organized in folders.  It can either be
 * the file system or an archive stream.
 *
 * @author Bruce Parrello
 *
 */
public abstract class FileTarget implements AutoCloseable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(FileTarget.class);
    /** name of the output file or directory */
    private File outName;
    /** prefix for the default output name */
    private static final String DEFAULT_PREFIX = "records";
    /** file counter */
    private int fileCount;

    /**
     * This interface describes the parameters required for any controlling command processor
     * that uses a file target.
     */
    public interface IParms {

        /**
         * @return TRUE if the output directory should be erased before processing
         */
        public boolean shouldErase();

    }

    /**
     * This enum describes the different types of file targets.
     */
    public static enum Type {
        /** ZIP file containing all the files and folders */
        ZIPSTREAM {
            @Override
            public FileTarget create(IParms processor, File outFileName) throws IOException {
                return new ZipStreamFileTarget(processor, outFileName);
            }
        },
        /** file-system directory */
        DIR {
            @Override
            public FileTarget create(IParms processor, File outFileName) throws IOException {
                return new DirFileTarget(processor, outFileName);
            }
        };

        /**
         * @return a file target handler of this type for the specified command processor
         *
         * @param processor		controlling command processor
         * @param outFileName	output file name, or NULL to use the default
         *
         * @throws IOException
         */
        public abstract FileTarget create(IParms processor, File outFileName) throws IOException;

    }

    /**
     * Construct a new file destination object.
     *
     * @param outFileName	name of the output file or directory, or NULL to use the default
     */
    public FileTarget(File outFileName) {
        if (outFileName != null)
            this.outName = outFileName;
        else {
            // The default target goes in the working directory, with today's date in the name.
            String stamp = new SimpleDateFormat("yyyy-MM-dd").format(new Date());
            this.outName = this.defaultFileName(new File(System.getProperty("user.dir")), DEFAULT_PREFIX + stamp);
        }
        this.fileCount = 0;
    }

    /**
     * Compute the default file name for this type.
     *
     * @param dir		target directory
     * @param baseName	base name of file
     *
     * @return the full file name
     */
    protected abstract File defaultFileName(File dir, String baseName);

    /**
     * Start a new directory with the specified name.
     *
     * @param dirName	name for the new directory
     *
     * @throws IOException
     */
    public abstract void createDirectory(String dirName) throws IOException;

    /**
     * Write a text file to the target.  The text is encoded as UTF-8.
     *
     * @param path		path of the file relative to the target root, using "/" as the separator
     * @param content	text to write
     *
     * @throws IOException
     */
    public void writeFile(String path, String content) throws IOException {
        this.storeFile(path, content.getBytes(StandardCharsets.UTF_8));
        this.fileCount++;
    }

    /**
     * Store the bytes of a file in the target.
     *
     * @param path		path of the file relative to the target root, using "/" as the separator
     * @param data		bytes to store
     *
     * @throws IOException
     */
    protected abstract void storeFile(String path, byte[] data) throws IOException;

    @Override
    public abstract void close();

    /**
     * @return the number of files written
     */
    public int getFileCount() {
        return this.fileCount;
    }

    /**
     * @return the output file/directory name
     */
    public File getOutName() {
        return this.outName;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.outName);
    }

    @Override
    public boolean equals(Object obj) {
        boolean retVal = (this == obj);
        if (! retVal && obj instanceof FileTarget)
            retVal = Objects.equals(this.outName, ((FileTarget) obj).outName);
        return retVal;
    }

}
