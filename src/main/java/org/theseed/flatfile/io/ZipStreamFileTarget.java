/**
 *
 */
package org.theseed.flatfile.io;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * This is a file target implemented as a zip file.
 *
 * @author Bruce Parrello
 *
 */
public class ZipStreamFileTarget extends FileTarget {

    // FIELDS
    /** zip file output stream */
    private ZipOutputStream zipStream;
    /** target file output stream */
    private OutputStream outStream;

    public ZipStreamFileTarget(FileTarget.IParms processor, File outFileName) throws IOException {
        super(outFileName);
        // Open the zip output stream.  An existing archive is always replaced.
        log.info("Writing archive {}.", this.getOutName());
        this.outStream = new FileOutputStream(this.getOutName());
        this.zipStream = new ZipOutputStream(this.outStream);
    }

    @Override
    protected File defaultFileName(File dir, String baseName) {
        return new File(dir, baseName + ".zip");
    }

    @Override
    public void createDirectory(String dirName) throws IOException {
        String entryName = (dirName.endsWith("/") ? dirName : dirName + "/");
        this.zipStream.putNextEntry(new ZipEntry(entryName));
        this.zipStream.closeEntry();
    }

    @Override
    protected void storeFile(String path, byte[] data) throws IOException {
        this.zipStream.putNextEntry(new ZipEntry(path));
        this.zipStream.write(data);
        this.zipStream.closeEntry();
    }

    @Override
    public void close() {
        try {
            if (this.zipStream != null)
                this.zipStream.close();
            if (this.outStream != null)
                this.outStream.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
