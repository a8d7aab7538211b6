package com.example.groupstats.blob;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RangedBlobInputStream and BlobRange.
 */
class RangedBlobInputStreamTest {

    private static RangedBlobInputStream.RangeFetcher fetcherFor(byte[] blob, List<String> requests) {
        return (start, end) -> {
            requests.add(start + "-" + end);
            int last = (int) Math.min(end, blob.length - 1L);
            return new BlobRange(Arrays.copyOfRange(blob, (int) start, last + 1), start, last, blob.length);
        };
    }

    @Test
    @DisplayName("Should stitch ranges together and fetch each range only when needed")
    void shouldStitchRanges() throws IOException {
        // Given
        byte[] blob = "line one\nline two\nline three\n".getBytes(StandardCharsets.UTF_8);
        List<String> requests = new ArrayList<>();

        // When
        try (InputStream input = new RangedBlobInputStream(fetcherFor(blob, requests), 8)) {
            assertThat(input.read()).isEqualTo('l');
            assertThat(requests).containsExactly("0-7");

            byte[] rest = input.readAllBytes();

            // Then
            assertThat(new String(rest, StandardCharsets.UTF_8)).isEqualTo("ine one\nline two\nline three\n");
        }
        assertThat(requests).containsExactly("0-7", "8-15", "16-23", "24-31");
    }

    @Test
    @DisplayName("Should fail when reading after close")
    void shouldFailAfterClose() throws IOException {
        InputStream input = new RangedBlobInputStream(fetcherFor(new byte[]{1, 2}, new ArrayList<>()), 8);
        input.close();

        assertThatThrownBy(input::read).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should reject an empty range that is not the last one")
    void shouldRejectStalledRange() {
        InputStream input = new RangedBlobInputStream((start, end) -> new BlobRange(new byte[0], start, start - 1, 100), 8);

        assertThatThrownBy(input::read)
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Empty range");
    }

    @Test
    @DisplayName("Should parse Content-Range headers")
    void shouldParseContentRange() {
        BlobRange range = BlobRange.parse("bytes 0-9/25", new byte[10]);

        assertThat(range.start()).isZero();
        assertThat(range.end()).isEqualTo(9);
        assertThat(range.totalLength()).isEqualTo(25);
        assertThat(range.isLast()).isFalse();
        assertThat(BlobRange.parse("bytes 20-24/25", new byte[5]).isLast()).isTrue();
    }

    @Test
    @DisplayName("Should reject Content-Range headers with an unknown length")
    void shouldRejectUnknownLength() {
        assertThatThrownBy(() -> BlobRange.parse("bytes 0-9/*", new byte[10]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BlobRange.parse("items 0-9/10", new byte[10]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
