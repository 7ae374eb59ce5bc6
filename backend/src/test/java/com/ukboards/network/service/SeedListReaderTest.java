package com.ukboards.network.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeedListReaderTest {
    private final SeedListReader reader = new SeedListReader();

    @TempDir
    Path tempDir;

    @Test
    void commaSeparatedSeedsAreTrimmedAndDeduplicated() {
        assertThat(reader.parseSeeds(" 04547069, 09390947 ,,04547069"))
            .containsExactly("04547069", "09390947");
        assertThat(reader.parseSeeds("  ")).isEmpty();
        assertThat(reader.parseSeeds(null)).isEmpty();
    }

    @Test
    void columnIsMatchedIgnoringCase() throws Exception {
        Path csv = Files.writeString(tempDir.resolve("seeds.csv"), """
            Company_Number,name
            04547069,PUNCHDRUNK
            ,NO NUMBER
            09390947, BARBICAN THEATRE PRODUCTIONS LIMITED
            04547069,PUNCHDRUNK AGAIN
            """);

        assertThat(reader.readColumn(csv, "company_number")).containsExactly("04547069", "09390947");
    }

    @Test
    void missingColumnIsRejected() throws Exception {
        Path csv = Files.writeString(tempDir.resolve("seeds.csv"), "name\nPUNCHDRUNK\n");

        assertThatThrownBy(() -> reader.readColumn(csv, "company_number"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("company_number");
    }

    @Test
    void unreadableFileIsUnchecked() {
        assertThatThrownBy(() -> reader.readColumn(tempDir.resolve("missing.csv"), "company_number"))
            .isInstanceOf(UncheckedIOException.class);
    }
}
