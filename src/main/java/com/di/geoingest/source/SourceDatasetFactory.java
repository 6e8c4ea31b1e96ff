package com.di.geoingest.source;

import com.di.geoingest.config.DbConfigSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Opens the right {@link SourceDataset} for a file path or a database table.
 */
@Component
@RequiredArgsConstructor
public class SourceDatasetFactory {

    private final ObjectMapper objectMapper;

    public SourceDataset openFile(String path, String layerName) {
        SourceFormat format = SourceFormat.fromPath(path);
        switch (format) {
            case GEOJSON_SEQ:
                return GeoJsonSeqDataset.open(Path.of(path), objectMapper);
            case SHAPEFILE:
                return OgrDataset.open(path, format, null);
            case FILE_GEODATABASE:
                if (layerName == null || layerName.isBlank()) {
                    throw new IllegalArgumentException("A layer name is required for geodatabase " + path);
                }
                return OgrDataset.open(path, format, layerName);
            default:
                throw new IllegalArgumentException("Not a file format: " + format);
        }
    }

    public SourceDataset openTable(DbConfigSnapshot config, String table) {
        return PostgisTableDataset.open(config, table);
    }
}
