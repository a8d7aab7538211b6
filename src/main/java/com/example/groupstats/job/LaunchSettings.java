package com.example.groupstats.job;

import com.example.groupstats.blob.BlobStore;
import com.example.groupstats.blob.FileSystemBlobStore;
import com.example.groupstats.blob.HttpBlobStore;

import java.nio.file.Path;
import java.util.Map;

/**
 * Where a job reads from and writes to, taken from environment variables.
 *
 * @param blobSource directory path or http(s) URL holding the input blobs
 * @param fileName key of the input blob
 * @param table destination table name
 * @param outputDirectory directory holding the destination tables
 */
public record LaunchSettings(
        String blobSource,
        String fileName,
        String table,
        Path outputDirectory
) {

    /**
     * Reads {@code BLOB_SOURCE}, {@code FILE_NAME}, {@code DB_TABLE} and {@code OUTPUT_DIR}.
     *
     * @throws IllegalArgumentException if a variable is missing or empty
     */
    public static LaunchSettings fromEnvironment(Map<String, String> env) {
        return new LaunchSettings(
                required(env, "BLOB_SOURCE"),
                required(env, "FILE_NAME"),
                required(env, "DB_TABLE"),
                Path.of(required(env, "OUTPUT_DIR"))
        );
    }

    /**
     * Creates the blob store named by {@link #blobSource()}.
     */
    public BlobStore blobStore() {
        if (blobSource.startsWith("http://") || blobSource.startsWith("https://")) {
            return new HttpBlobStore(blobSource);
        }
        return new FileSystemBlobStore(Path.of(blobSource));
    }

    private static String required(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " environment variable is invalid or missing.");
        }
        return value.trim();
    }
}
