package com.example.groupstats.blob;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Serves blobs from files below a root directory.
 */
public class FileSystemBlobStore implements BlobStore {

    private final Path root;

    public FileSystemBlobStore(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    /**
     * Opens the file {@code root/key}.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws IllegalArgumentException if the key escapes the root directory
     */
    @Override
    public InputStream open(String key) throws IOException {
        Path file = root.resolve(key).normalize();
        if (!file.startsWith(root)) {
            throw new IllegalArgumentException("Blob key escapes store root: " + key);
        }
        return new BufferedInputStream(Files.newInputStream(file));
    }

    public Path getRoot() {
        return root;
    }
}
