package com.delta.digest.tracker.service;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.model.DiscoveryTarget;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Service
public class TrackedSourceCatalog {
    private static final Logger log = LoggerFactory.getLogger(TrackedSourceCatalog.class);

    private final TrackerProperties properties;

    public TrackedSourceCatalog(TrackerProperties properties) {
        this.properties = properties;
    }

    public List<DiscoveryTarget> targets() {
        String sourcesFile = properties.getSourcesFile();
        if (sourcesFile != null && !sourcesFile.isBlank()) {
            return readCsv(Paths.get(sourcesFile.trim()));
        }
        List<DiscoveryTarget> targets = new ArrayList<>();
        for (TrackerProperties.Source source : properties.getSources()) {
            String name = normalize(source.getName());
            String url = normalize(source.getUrl());
            if (name == null || url == null) {
                log.warn("Skipping tracked source with missing name or url");
                continue;
            }
            targets.add(new DiscoveryTarget(name, url));
        }
        return targets;
    }

    private List<DiscoveryTarget> readCsv(Path path) {
        List<DiscoveryTarget> targets = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String name = normalize(record.isMapped("name") ? record.get("name") : null);
                String url = normalize(record.isMapped("url") ? record.get("url") : null);
                if (name == null || url == null) {
                    log.warn("Skipping sources row {} in {}: missing name or url", record.getRecordNumber(), path);
                    continue;
                }
                targets.add(new DiscoveryTarget(name, url));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tracked sources from " + path, e);
        }
        return targets;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setCommentMarker('#')
            .build();
        return format.parse(reader);
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
