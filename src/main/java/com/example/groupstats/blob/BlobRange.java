package com.example.groupstats.blob;

/**
 * One byte range of a blob as returned by a ranged read.
 *
 * @param body the bytes of the range
 * @param start offset of the first byte
 * @param end offset of the last byte, inclusive
 * @param totalLength total size of the blob
 */
public record BlobRange(
        byte[] body,
        long start,
        long end,
        long totalLength
) {
    /**
     * The range returned for a blob with no content.
     */
    public static BlobRange empty() {
        return new BlobRange(new byte[0], 0, -1, 0);
    }

    /**
     * Checks if this range reaches the end of the blob.
     */
    public boolean isLast() {
        return end >= totalLength - 1;
    }

    /**
     * Parses a {@code Content-Range} header of the form {@code bytes start-end/length}.
     *
     * @param contentRange the header value
     * @param body the bytes that came with the header
     * @return the parsed range
     * @throws IllegalArgumentException if the header is malformed or the length is unknown
     */
    public static BlobRange parse(String contentRange, byte[] body) {
        String value = contentRange.trim();
        if (!value.startsWith("bytes ")) {
            throw new IllegalArgumentException("Unsupported Content-Range: " + contentRange);
        }
        String[] rangeAndLength = value.substring("bytes ".length()).split("/");
        if (rangeAndLength.length != 2 || "*".equals(rangeAndLength[1])) {
            throw new IllegalArgumentException("Unsupported Content-Range: " + contentRange);
        }
        String[] bounds = rangeAndLength[0].split("-");
        if (bounds.length != 2) {
            throw new IllegalArgumentException("Unsupported Content-Range: " + contentRange);
        }
        try {
            return new BlobRange(
                    body,
                    Long.parseLong(bounds[0].trim()),
                    Long.parseLong(bounds[1].trim()),
                    Long.parseLong(rangeAndLength[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported Content-Range: " + contentRange, e);
        }
    }
}
