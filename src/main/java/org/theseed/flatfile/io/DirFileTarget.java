/**
 *
 */
package org.theseed.flatfile.io;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;

/**
 * This represents a file target stored directly in the file system, rather than in an archive.
 *
 * @author Bruce Parrello
 *
 */
public class DirFileTarget extends FileTarget {

    public DirFileTarget(IParms processor, File outFileName) throws IOException {
        super(outFileName);
        // If the output file name is NULL, this gets us the default name; otherwise, it
        // returns the caller-supplied name.
        File outFile = this.getOutName();
        if (! outFile.isDirectory()) {
            log.info("Creating output directory {}.", outFile);
            FileUtils.forceMkdir(outFile);
        } else if (processor.shouldErase()) {
            log.info("Erasing output directory {}.", outFile);
            FileUtils.cleanDirectory(outFile);
        }
    }

    @Override
    protected File defaultFileName(File dir, String baseName) {
        return new File(dir, baseName);
    }

    @Override
    public void createDirectory(String dirName) throws IOException {
        File dir = this.resolve(dirName);
        if (! dir.isDirectory())
            FileUtils.forceMkdir(dir);
    }

    /**
     * @return the file-system location for a path relative to the target root
     *
     * @param path	relative path, using "/" as the separator
     */
    private File resolve(String path) {
        return new File(this.getOutName(), path.replace('/', File.separatorChar));
    }

    @Override
    protected void storeFile(String path, byte[] data) throws IOException {
        // This creates any missing parent directories.
        FileUtils.writeByteArrayToFile(this.resolve(path), data);
    }

    @Override
    public void close() {
    }

}
