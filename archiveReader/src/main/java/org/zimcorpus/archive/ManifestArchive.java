package org.zimcorpus.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.zimcorpus.io.BlobSource;
import org.zimcorpus.io.FileBlobSource;
import org.zimcorpus.sharding.pipeline.source.RecordSource;
import org.zimcorpus.sharding.pipeline.source.RecordSourceFactory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * An archive laid out as a directory with a {@value #MANIFEST_NAME} file describing every entry in
 * index order, and one blob per entry holding its payload. Opens independent
 * {@link ManifestRecordSource} handles, one per thread.
 */
@Slf4j
public class ManifestArchive implements RecordSourceFactory {

    public static final String MANIFEST_NAME = "manifest.jsonl";

    @Getter
    private final BlobSource blobSource;

    public ManifestArchive(BlobSource blobSource) {
        this.blobSource = blobSource;
    }

    /**
     * Validate that the directory holds an archive.
     *
     * @throws IOException if the directory or its manifest is missing
     */
    public static ManifestArchive open(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Archive directory does not exist: " + directory);
        }
        var blobSource = new FileBlobSource(directory);
        if (!blobSource.exists(MANIFEST_NAME)) {
            throw new IOException("No " + MANIFEST_NAME + " in archive " + directory);
        }
        log.info("Opened archive {} ({} byte manifest)", directory, blobSource.getBlobSize(MANIFEST_NAME));
        return new ManifestArchive(blobSource);
    }

    @Override
    public RecordSource open() {
        return new ManifestRecordSource(blobSource);
    }
}
