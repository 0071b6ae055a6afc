package org.zimcorpus.archive;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes small manifest archives for tests.
 */
public class ArchiveFixture {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Path directory;
    private final List<String> lines = new ArrayList<>();

    public ArchiveFixture(Path directory) {
        this.directory = directory;
    }

    public static String html(long index, String title) {
        return "<html><title>" + title + "</title><body>" + index + "</body></html>";
    }

    public ArchiveFixture article(long index, String title) throws IOException {
        return entry(index, title, "A", false, false);
    }

    public ArchiveFixture entry(long index, String title, String namespace, boolean redirect, boolean deleted)
        throws IOException {
        var entry = new ManifestEntry(index, title, namespace, redirect, deleted, null);
        Path blob = directory.resolve(entry.blobPath());
        Files.createDirectories(blob.getParent());
        Files.writeString(blob, html(index, title), StandardCharsets.UTF_8);
        lines.add(objectMapper.writeValueAsString(entry));
        return this;
    }

    public ArchiveFixture rawLine(String line) {
        lines.add(line);
        return this;
    }

    public Path write() throws IOException {
        Files.createDirectories(directory);
        Files.write(directory.resolve(ManifestArchive.MANIFEST_NAME), lines, StandardCharsets.UTF_8);
        return directory;
    }
}
