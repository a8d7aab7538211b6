package com.example.groupstats.source;

import com.example.groupstats.job.JobConfig;
import com.example.groupstats.model.GroupKey;
import com.example.groupstats.model.Row;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes delimited text with a header row into typed rows, one chunk at a time.
 *
 * <p>Built on Jackson's streaming CSV parser: only the rows of the current chunk are
 * held in memory. The header must name the two group fields, the numeric field and
 * the categorical field configured in {@link JobConfig}; other columns are ignored.
 * Surrounding whitespace is trimmed and blank lines are skipped.
 *
 * <p>Example input:
 * <pre>
 * Hospital,Diagnosis,Treatment,Recovery Time
 * General Hospital,Asthma,Therapy A,12
 * </pre>
 */
public class CsvRecordSource implements RecordSource {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final Reader reader;
    private final JobConfig config;
    private CsvParser parser;
    private MappingIterator<Map<String, String>> rows;
    private boolean finished = false;

    /**
     * Creates a source reading UTF-8 text from the given stream.
     * The stream is closed when this source is closed.
     *
     * @param inputStream the delimited text
     * @param config field names and chunk size
     */
    public CsvRecordSource(InputStream inputStream, JobConfig config) {
        this.reader = new InputStreamReader(
                Objects.requireNonNull(inputStream, "inputStream must not be null"),
                StandardCharsets.UTF_8);
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public List<Row> nextChunk() throws IOException {
        if (finished) {
            return List.of();
        }
        if (rows == null) {
            rows = open();
            if (rows == null) {
                finished = true;
                return List.of();
            }
        }

        List<Row> chunk = new ArrayList<>(Math.min(config.chunkSize(), 1024));
        while (chunk.size() < config.chunkSize() && rows.hasNextValue()) {
            // Positioned at the start of the record until nextValue() consumes it
            long line = currentLine();
            Map<String, String> values = rows.nextValue();
            chunk.add(toRow(values, line));
        }
        if (chunk.isEmpty()) {
            finished = true;
        }
        return chunk;
    }

    @Override
    public void close() throws IOException {
        finished = true;
        if (rows != null) {
            rows.close();
        }
        if (parser != null) {
            parser.close();
        }
        reader.close();
    }

    /**
     * Reads and verifies the header line, then positions an iterator on the first row.
     *
     * @return the row iterator, or {@code null} if the input has no header line at all
     */
    private MappingIterator<Map<String, String>> open() throws IOException {
        parser = (CsvParser) CSV_MAPPER.getFactory().createParser(reader);
        parser.setSchema(CsvSchema.emptySchema().withHeader());

        // The first token forces the header line to be parsed, even without data rows
        parser.nextToken();
        CsvSchema header = (CsvSchema) parser.getSchema();
        if (header.size() == 0) {
            return null;
        }
        verifyHeader(header);

        return CSV_MAPPER.readerForMapOf(String.class).readValues(parser);
    }

    private void verifyHeader(CsvSchema header) throws MalformedRowException {
        List<String> required = List.of(
                config.groupFields().first(),
                config.groupFields().second(),
                config.categoricalField(),
                config.numericField());
        for (String field : required) {
            if (header.column(field) == null) {
                throw new MalformedRowException(1, "Header is missing required column '" + field
                        + "', found " + header.getColumnNames());
            }
        }
    }

    private Row toRow(Map<String, String> values, long line) throws MalformedRowException {
        GroupKey group = new GroupKey(
                required(values, config.groupFields().first(), line),
                required(values, config.groupFields().second(), line));
        String category = required(values, config.categoricalField(), line);
        String rawMeasure = required(values, config.numericField(), line);

        double measure;
        try {
            measure = Double.parseDouble(rawMeasure);
        } catch (NumberFormatException e) {
            throw new MalformedRowException(line,
                    "Invalid " + config.numericField() + ": '" + rawMeasure + "'", e);
        }
        if (!Double.isFinite(measure)) {
            throw new MalformedRowException(line,
                    config.numericField() + " must be finite: '" + rawMeasure + "'");
        }
        return new Row(group, measure, category);
    }

    private static String required(Map<String, String> values, String field, long line)
            throws MalformedRowException {
        String value = values.get(field);
        if (value == null || value.isEmpty()) {
            throw new MalformedRowException(line, "Missing value for '" + field + "'");
        }
        return value;
    }

    private long currentLine() {
        return parser.currentLocation().getLineNr();
    }
}
