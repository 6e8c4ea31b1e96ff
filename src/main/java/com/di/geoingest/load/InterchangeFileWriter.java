package com.di.geoingest.load;

import com.di.geoingest.source.Feature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a batch as a newline-delimited JSON file for a warehouse load job, one row per line,
 * geometry as WKT in the geography column. The caller deletes the file once the load is done.
 */
@Component
@RequiredArgsConstructor
public class InterchangeFileWriter {

    private final ObjectMapper objectMapper;
    private final RowValueConverter converter;

    public Path write(List<Feature> batch, LoadJobContext context) {
        try {
            Path file = Files.createTempFile("geoingest-" + context.getTable().table() + "-", ".ndjson");
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (Feature feature : batch) {
                    writer.write(objectMapper.writeValueAsString(
                            converter.toInterchangeRow(feature, context.getTargetColumns())));
                    writer.newLine();
                }
            }
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write interchange file for " + context.getTable(), e);
        }
    }
}
