package com.dnssentinel.service;

import com.dnssentinel.core.model.QueryRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads {@link QueryRecord}s from a JSON-lines file, one object per line.
 *
 * <p>
 * Blank lines are ignored. Malformed lines are logged at WARN and skipped so
 * a single bad record never loses a batch.
 * </p>
 *
 * <pre>
 * {"timestamp":"2024-05-01T10:00:00Z","client":"192.168.1.10","domain":"example.com","status":2}
 * </pre>
 *
 * @since 1.0.0
 */
public class QueryRecordReader {

    private static final Logger LOG = LoggerFactory.getLogger(QueryRecordReader.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * @return records in file order; empty if the file does not exist
     * @throws IllegalStateException if the file cannot be read
     */
    public List<QueryRecord> read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.exists(path)) {
            LOG.warn("Records file not found: {}", path);
            return List.of();
        }
        List<QueryRecord> records = new ArrayList<>();
        int skipped = 0;
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                QueryRecord record = parse(line, lineNumber);
                if (record != null) {
                    records.add(record);
                } else {
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read records file: " + path, e);
        }
        LOG.debug("Read {} record(s) from {} ({} skipped)", records.size(), path, skipped);
        return records;
    }

    /**
     * @return the record, or {@code null} if the line is malformed
     */
    QueryRecord parse(String line, int lineNumber) {
        try {
            return mapper.readValue(line, QueryRecord.class);
        } catch (IOException e) {
            LOG.warn("Malformed record on line {} - skipping: {}", lineNumber, e.getMessage());
            return null;
        }
    }
}
