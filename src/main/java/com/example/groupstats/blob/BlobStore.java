package com.example.groupstats.blob;

import java.io.IOException;
import java.io.InputStream;

/**
 * Read access to named blobs holding raw input bytes.
 */
public interface BlobStore {

    /**
     * Opens a blob for sequential reading. The caller closes the stream.
     *
     * @param key the blob name
     * @return a stream over the blob's bytes
     * @throws IOException if the blob does not exist or cannot be read
     */
    InputStream open(String key) throws IOException;
}
