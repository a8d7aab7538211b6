package com.example.groupstats.job;

import com.example.groupstats.blob.FileSystemBlobStore;
import com.example.groupstats.blob.HttpBlobStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LaunchSettingsTest {

    private static Map<String, String> environment() {
        Map<String, String> env = new HashMap<>();
        env.put("BLOB_SOURCE", "./data");
        env.put("FILE_NAME", "rows_1000_medical_records.csv");
        env.put("DB_TABLE", "hospital-averages");
        env.put("OUTPUT_DIR", "./out");
        return env;
    }

    @Test
    @DisplayName("Should read all launch variables")
    void shouldReadVariables() {
        LaunchSettings settings = LaunchSettings.fromEnvironment(environment());

        assertThat(settings.fileName()).isEqualTo("rows_1000_medical_records.csv");
        assertThat(settings.table()).isEqualTo("hospital-averages");
        assertThat(settings.outputDirectory()).isEqualTo(Path.of("./out"));
        assertThat(settings.blobStore()).isInstanceOf(FileSystemBlobStore.class);
    }

    @Test
    @DisplayName("Should use the HTTP blob store for URL sources")
    void shouldUseHttpStoreForUrls() {
        Map<String, String> env = environment();
        env.put("BLOB_SOURCE", "https://blobs.example.com/bucket");

        assertThat(LaunchSettings.fromEnvironment(env).blobStore()).isInstanceOf(HttpBlobStore.class);
    }

    @Test
    @DisplayName("Should name the missing variable")
    void shouldRejectMissingVariable() {
        Map<String, String> env = environment();
        env.put("DB_TABLE", " ");

        assertThatThrownBy(() -> LaunchSettings.fromEnvironment(env))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("DB_TABLE environment variable is invalid or missing.");
    }
}
