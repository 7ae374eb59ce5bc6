package com.ukboards.network.service;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads seed identifiers from a comma separated list or from one column of a CSV file. Blank
 * values are dropped and duplicates keep their first position.
 */
@Component
public class SeedListReader {
    private static final Logger log = LoggerFactory.getLogger(SeedListReader.class);

    public List<String> parseSeeds(String seeds) {
        if (seeds == null || seeds.isBlank()) {
            return List.of();
        }
        return dedupe(Arrays.stream(seeds.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList());
    }

    public List<String> readColumn(Path csvPath, String column) {
        List<String> values = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            String header = matchHeader(parser.getHeaderNames(), column);
            if (header == null) {
                throw new IllegalArgumentException("Column " + column + " not found in " + csvPath);
            }
            for (CSVRecord record : parser) {
                if (!record.isSet(header)) {
                    log.warn("Seed csv row {} has no {} value", record.getRecordNumber(), column);
                    continue;
                }
                String value = record.get(header).trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seeds from " + csvPath, e);
        }
        List<String> seeds = dedupe(values);
        log.info("Read {} seeds from column {} of {}", seeds.size(), column, csvPath);
        return seeds;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String matchHeader(List<String> headers, String column) {
        for (String header : headers) {
            if (header != null && header.trim().equalsIgnoreCase(column)) {
                return header;
            }
        }
        return null;
    }

    private List<String> dedupe(List<String> values) {
        Set<String> unique = new LinkedHashSet<>(values);
        return List.copyOf(unique);
    }
}
