package org.zimcorpus.archive;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import org.zimcorpus.io.BlobSource;
import org.zimcorpus.sharding.pipeline.ir.RecordEntry;
import org.zimcorpus.sharding.pipeline.source.RecordSource;

import lombok.extern.slf4j.Slf4j;

/**
 * A single-threaded handle onto a manifest archive.
 *
 * <p>{@link #entries()} streams the manifest line by line. {@link #resolve(long)} loads an index
 * to blob table from the manifest on first use, so a handle that only resolves never has to be
 * scanned first.
 */
@Slf4j
public class ManifestRecordSource implements RecordSource {
    private static final ObjectReader ENTRY_READER = new ObjectMapper().readerFor(ManifestEntry.class);

    /** Payloads larger than this cannot be held in one array. */
    static final long MAX_PAYLOAD_BYTES = Integer.MAX_VALUE - 8L;

    private final BlobSource blobSource;
    private Map<Long, String> blobsByIndex;
    private BufferedReader openReader;

    public ManifestRecordSource(BlobSource blobSource) {
        this.blobSource = blobSource;
    }

    @Override
    public Stream<RecordEntry> entries() throws IOException {
        if (openReader != null) {
            throw new IllegalStateException("Entries of this handle were already streamed");
        }
        openReader = openManifest();
        var ordering = new AscendingIndexCheck();
        return manifestLines(openReader)
            .map(ManifestRecordSource::parse)
            .peek(ordering::check)
            .map(ManifestEntry::toRecordEntry);
    }

    @Override
    public byte[] resolve(long index) throws IOException {
        String blob = blobTable().get(index);
        if (blob == null) {
            throw new IOException("No entry with index " + index + " in the manifest");
        }
        long size = blobSource.getBlobSize(blob);
        if (size > MAX_PAYLOAD_BYTES) {
            throw new IOException("Payload of entry " + index + " is too large: " + size + " bytes");
        }
        try (InputStream in = blobSource.getBlob(blob)) {
            return in.readAllBytes();
        }
    }

    @Override
    public void close() throws IOException {
        if (openReader != null) {
            openReader.close();
        }
    }

    private Map<Long, String> blobTable() throws IOException {
        if (blobsByIndex == null) {
            var table = new HashMap<Long, String>();
            try (BufferedReader reader = openManifest()) {
                manifestLines(reader)
                    .map(ManifestRecordSource::parse)
                    .forEach(entry -> table.put(entry.index(), entry.blobPath()));
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            log.debug("Loaded blob table with {} entries", table.size());
            blobsByIndex = table;
        }
        return blobsByIndex;
    }

    private BufferedReader openManifest() throws IOException {
        return new BufferedReader(new InputStreamReader(
            blobSource.getBlob(ManifestArchive.MANIFEST_NAME), StandardCharsets.UTF_8));
    }

    private static Stream<String> manifestLines(BufferedReader reader) {
        return reader.lines().filter(line -> !line.isBlank());
    }

    private static ManifestEntry parse(String line) {
        ManifestEntry entry;
        try {
            entry = ENTRY_READER.readValue(line);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed manifest line: " + abbreviate(line), e);
        }
        if (entry == null) {
            throw new UncheckedIOException(new IOException("Manifest line holds no entry: " + abbreviate(line)));
        }
        return entry;
    }

    private static String abbreviate(String line) {
        return line.length() > 200 ? line.substring(0, 200) + "..." : line;
    }

    /** Indices must be strictly ascending, the order the scanner relies on. */
    private static class AscendingIndexCheck {
        private Long previous;

        void check(ManifestEntry entry) {
            if (previous != null && entry.index() <= previous) {
                throw new UncheckedIOException(new IOException(
                    "Manifest indices are not ascending: " + entry.index() + " follows " + previous));
            }
            previous = entry.index();
        }
    }
}
