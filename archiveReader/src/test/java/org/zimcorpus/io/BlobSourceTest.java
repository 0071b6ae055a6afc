package org.zimcorpus.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class BlobSourceTest {

    @TempDir
    Path tempDir;
    
    private FileBlobSource fileBlobSource;
    
    @BeforeEach
    void setUp() throws IOException {
        Path manifest = tempDir.resolve("manifest.jsonl");
        Path blob = tempDir.resolve("blobs/7");
        
        Files.createDirectories(blob.getParent());
        Files.writeString(manifest, "{\"index\":7,\"namespace\":\"A\"}\n");
        Files.writeString(blob, "<html>seven</html>");
        
        fileBlobSource = new FileBlobSource(tempDir.toString());
    }
    
    @Test
    void readsBlobFromSubdirectory() throws IOException {
        try (InputStream stream = fileBlobSource.getBlob("blobs/7")) {
            assertEquals("<html>seven</html>", new String(stream.readAllBytes()));
        }
    }
    
    @Test
    void existsOnlyForRegularFiles() {
        assertTrue(fileBlobSource.exists("manifest.jsonl"));
        assertTrue(fileBlobSource.exists("blobs/7"));
        assertFalse(fileBlobSource.exists("blobs"));
        assertFalse(fileBlobSource.exists("blobs/8"));
    }
    
    @Test
    void reportsBlobSize() throws IOException {
        assertEquals("<html>seven</html>".length(), fileBlobSource.getBlobSize("blobs/7"));
    }
    
    @Test
    void missingBlobIsAnIoError() {
        assertThrows(IOException.class, () -> fileBlobSource.getBlob("blobs/8"));
        assertThrows(IOException.class, () -> fileBlobSource.getBlobSize("blobs/8"));
    }

    @Test
    void directoryIsNotABlob() {
        assertThrows(IOException.class, () -> fileBlobSource.getBlob("blobs"));
    }

    @Test
    void pathsCannotEscapeTheRoot() throws IOException {
        Path root = tempDir.resolve("archive");
        Files.createDirectories(root);
        Files.writeString(tempDir.resolve("outside.txt"), "secret");
        var confined = new FileBlobSource(root);

        assertFalse(confined.exists("../outside.txt"));
        assertThrows(IOException.class, () -> confined.getBlob("../outside.txt"));
        assertThrows(IOException.class, () -> confined.getBlobSize("../manifest.jsonl"));
    }
}
