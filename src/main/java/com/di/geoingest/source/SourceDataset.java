package com.di.geoingest.source;

import com.di.geoingest.schema.SourceSchema;

import java.util.Iterator;

/**
 * An open source dataset, owned by a single load job and closed when the job ends.
 */
public interface SourceDataset extends AutoCloseable {

    /** Path or connection string identifying the source in the ledger. */
    String path();

    /** Layer or table name; {@code null} for single-layer files. */
    String layerName();

    SourceFormat format();

    SourceSchema schema();

    long featureCount();

    /**
     * Lazily reads features in source order, starting at row {@code startAt}. Rows before it are
     * passed over without being decoded, so a resume can get past a row that cannot be read.
     * Each call starts a fresh read.
     */
    Iterator<Feature> features(long startAt);

    default Iterator<Feature> features() {
        return features(0L);
    }

    @Override
    void close();
}
