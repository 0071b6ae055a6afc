package org.zimcorpus.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * BlobSource implementation for an archive unpacked on the local filesystem
 */
@RequiredArgsConstructor
@Slf4j
public class FileBlobSource implements BlobSource {
    
    @Getter
    private final Path rootPath;
    
    /**
     * Create a FileBlobSource with the given root directory
     * @param rootPath the root directory path
     */
    public FileBlobSource(String rootPath) {
        this(Paths.get(rootPath));
    }
    
    @Override
    public InputStream getBlob(String path) throws IOException {
        Path fullPath = resolveInsideRoot(path);
        log.trace("Reading blob from: {}", fullPath);
        
        if (!Files.exists(fullPath)) {
            throw new IOException("File does not exist: " + fullPath);
        }
        
        if (!Files.isRegularFile(fullPath)) {
            throw new IOException("Path is not a regular file: " + fullPath);
        }
        
        return Files.newInputStream(fullPath);
    }
    
    @Override
    public boolean exists(String path) {
        try {
            Path fullPath = resolveInsideRoot(path);
            return Files.exists(fullPath) && Files.isRegularFile(fullPath);
        } catch (IOException e) {
            return false;
        }
    }
    
    @Override
    public long getBlobSize(String path) throws IOException {
        Path fullPath = resolveInsideRoot(path);
        
        if (!Files.exists(fullPath)) {
            throw new IOException("File does not exist: " + fullPath);
        }
        
        return Files.size(fullPath);
    }

    private Path resolveInsideRoot(String path) throws IOException {
        Path fullPath = rootPath.resolve(path).normalize();
        if (!fullPath.startsWith(rootPath.normalize())) {
            throw new IOException("Blob path escapes the archive root: " + path);
        }
        return fullPath;
    }
}
