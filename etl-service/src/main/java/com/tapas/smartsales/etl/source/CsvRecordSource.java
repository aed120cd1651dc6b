package com.tapas.smartsales.etl.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads a cleaned CSV table with a header row. Every row is first read as
 * text and then converted, so a single unparsable value rejects only its row.
 */
public class CsvRecordSource<T extends CleanedRecord> implements RecordSource<T> {

    private static final Logger log = LoggerFactory.getLogger(CsvRecordSource.class);

    private final String name;
    private final Resource resource;
    private final CsvMapper csvMapper;
    private final Function<CsvRow, T> rowMapper;

    public CsvRecordSource(String name, Resource resource, CsvMapper csvMapper, Function<CsvRow, T> rowMapper) {
        this.name = name;
        this.resource = resource;
        this.csvMapper = csvMapper;
        this.rowMapper = rowMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SourceBatch<T> read() {
        if (!resource.exists() || !resource.isReadable()) {
            throw new SourceUnavailableException(name, resource.getDescription(), null);
        }

        List<T> records = new ArrayList<>();
        List<Rejection> rejections = new ArrayList<>();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();

        try (InputStream in = resource.getInputStream();
             MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                     .with(schema)
                     .readValues(in)) {
            // header is line 1
            int line = 1;
            while (rows.hasNext()) {
                line++;
                CsvRow row = new CsvRow(line, rows.next());
                try {
                    records.add(rowMapper.apply(row));
                } catch (MalformedRecordException e) {
                    log.debug("Rejecting {} line {}: {}", name, line, e.getMessage());
                    rejections.add(new Rejection(name, "line " + line, e.getMessage()));
                }
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            log.error("Failed to read source {} from {}", name, resource.getDescription(), e);
            throw new SourceUnavailableException(name, resource.getDescription(), e);
        }

        log.info("Read {} records from {} ({} unparsable rows)", records.size(), name, rejections.size());
        return new SourceBatch<>(name, records, rejections);
    }
}
