package com.taxitelemetry.producer.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Streams a headered trip CSV as one column-name → raw-value map per row.
 * Short rows simply lack the trailing columns; blank lines are skipped.
 */
@Component
public class TripCsvReader {

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();

    private final CsvSchema schema = CsvSchema.emptySchema().withHeader();

    public MappingIterator<Map<String, String>> open(Path source) throws IOException {
        return csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(source.toFile());
    }
}
