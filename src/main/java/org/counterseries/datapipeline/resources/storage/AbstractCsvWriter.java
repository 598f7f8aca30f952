package org.counterseries.datapipeline.resources.storage;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.utils.UniqueFileNames;
import org.counterseries.datapipeline.utils.ValueFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Base class for CSV outputs written as one file per source.
 * <p>
 * Files are UTF-8 with a byte order mark so spreadsheet tools detect the encoding. Subclasses
 * define the column layout and how a row is rendered; absent values are written as empty cells.
 *
 * @param <T> row type
 */
public abstract class AbstractCsvWriter<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractCsvWriter.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    protected final PipelineConfig config;
    // Quote only cells that contain a separator, quote or line break.
    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    protected AbstractCsvWriter(PipelineConfig config) {
        this.config = config;
    }

    /**
     * @return column names in output order
     */
    public abstract List<String> columns();

    /**
     * @return the rendered cells of one row keyed by column name
     */
    protected abstract Map<String, String> row(T value);

    protected abstract String source(T value);

    /**
     * @return file name suffix appended to the sanitized source name, e.g. {@code _summary.csv}
     */
    protected abstract String fileSuffix();

    /**
     * Writes one file per source into {@code outDir}, creating the directory if needed.
     *
     * @param rows   rows of any number of sources, written in the given order
     * @param outDir target directory
     * @return the files written, ordered by source; sources whose sanitized names coincide get a
     *         numeric suffix instead of overwriting each other
     * @throws IOException if a file cannot be written
     */
    public List<Path> write(List<T> rows, Path outDir) throws IOException {
        if (rows.isEmpty()) {
            log.warn("Nothing to write for {}, skipping CSV output", fileSuffix());
            return List.of();
        }

        final Map<String, List<T>> bySource = new TreeMap<>();
        for (T row : rows) {
            bySource.computeIfAbsent(source(row), key -> new ArrayList<>()).add(row);
        }

        Files.createDirectories(outDir);
        final CsvSchema.Builder schemaBuilder = CsvSchema.builder();
        for (String column : columns()) {
            schemaBuilder.addColumn(column);
        }
        final CsvSchema schema = schemaBuilder.build().withHeader();

        final Map<String, String> stems = UniqueFileNames.assign(bySource.keySet(), ValueFormat::fileNamePart);
        final List<Path> written = new ArrayList<>();
        for (Map.Entry<String, List<T>> entry : bySource.entrySet()) {
            final Path file = outDir.resolve(stems.get(entry.getKey()) + fileSuffix());
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writer.write(BYTE_ORDER_MARK);
                try (SequenceWriter sequence = csvMapper.writerFor(Map.class).with(schema).writeValues(writer)) {
                    for (T row : entry.getValue()) {
                        sequence.write(row(row));
                    }
                }
            }
            log.info("Wrote {} rows to {}", entry.getValue().size(), file);
            written.add(file);
        }
        return written;
    }
}
