package org.counterseries.datapipeline.resources.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.counterseries.datapipeline.api.contracts.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads snapshot records from JSON Lines files, one JSON object per line.
 * <p>
 * A directory is searched recursively for {@code *.jsonl} files. Files are read in ascending
 * order of their path relative to the input directory and lines in file order, so a record in
 * a later file (or later in the same file) takes precedence on dedup-key collisions.
 * <p>
 * Bad lines and unreadable files are logged and skipped; reading never aborts the batch.
 */
public class JsonLinesRecordReader implements IRecordReader {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesRecordReader.class);

    static final String FILE_SUFFIX = ".jsonl";
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ObjectMapper objectMapper;

    public JsonLinesRecordReader() {
        this(new ObjectMapper());
    }

    public JsonLinesRecordReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RawRecord> read(Path input) {
        final List<Path> files = discoverFiles(input);
        if (files.isEmpty()) {
            log.warn("No JSONL files found at {}", input);
            return List.of();
        }

        final List<RawRecord> records = new ArrayList<>();
        for (Path file : files) {
            readFile(file, records);
        }

        if (records.isEmpty()) {
            log.warn("No records loaded from {}", input);
        } else {
            log.info("Loaded {} records from {} file(s)", records.size(), files.size());
        }
        return records;
    }

    List<Path> discoverFiles(Path input) {
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        if (!Files.isDirectory(input)) {
            return List.of();
        }

        try (Stream<Path> paths = Files.walk(input)) {
            final List<Path> files = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(FILE_SUFFIX))
                    .sorted(Comparator.comparing(path -> input.relativize(path).toString()))
                    .collect(Collectors.toList());
            log.info("Found {} JSONL files in {}", files.size(), input);
            return files;
        } catch (IOException e) {
            log.error("Failed to scan input directory {}: {}", input, e.getMessage());
            return List.of();
        }
    }

    private void readFile(Path file, List<RawRecord> sink) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                    line = line.substring(1);
                }
                final String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                parseLine(trimmed, file, lineNumber, sink);
            }
        } catch (IOException e) {
            log.error("Failed to read JSONL file {}: {}", file, e.getMessage());
        }
    }

    private void parseLine(String line, Path file, int lineNumber, List<RawRecord> sink) {
        final JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unparsable JSON at {}:{}: {}", file, lineNumber, e.getOriginalMessage());
            return;
        }
        if (node instanceof ObjectNode object) {
            sink.add(RawRecord.fromJson(object));
        } else {
            log.warn("Skipping non-object JSON value at {}:{}", file, lineNumber);
        }
    }
}
