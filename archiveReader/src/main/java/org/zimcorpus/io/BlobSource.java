package org.zimcorpus.io;

import java.io.IOException;
import java.io.InputStream;

/**
 * Read-only access to the files an archive is made of: its manifest and one blob per entry.
 * Paths are relative to the archive root and use {@code /} as separator.
 */
public interface BlobSource {

    /**
     * Open a blob for reading. The caller closes the stream.
     *
     * @throws IOException if the blob is missing, is not a regular file or lies outside the archive
     */
    InputStream getBlob(String path) throws IOException;

    /** True if {@code path} names a readable blob inside the archive. */
    boolean exists(String path);

    /**
     * @return the size of the blob in bytes, checked before a payload is loaded into memory
     * @throws IOException if the blob is missing
     */
    long getBlobSize(String path) throws IOException;
}
