package com.di.geoingest.source;

import com.di.geoingest.schema.SourceSchema;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * Source dataset over features generated on demand, so large counts cost no memory.
 */
public class ListSourceDataset implements SourceDataset {

    private final String path;
    private final String layerName;
    private final SourceFormat format;
    private final SourceSchema schema;
    private final int count;
    private final IntFunction<Feature> generator;

    /** Row index whose read throws; -1 for none. Rows skipped by {@code startAt} are never generated. */
    public int failAtRow = -1;
    public boolean closed;

    public ListSourceDataset(String path, SourceFormat format, SourceSchema schema,
                             int count, IntFunction<Feature> generator) {
        this(path, null, format, schema, count, generator);
    }

    public ListSourceDataset(String path, String layerName, SourceFormat format, SourceSchema schema,
                             int count, IntFunction<Feature> generator) {
        this.path = path;
        this.layerName = layerName;
        this.format = format;
        this.schema = schema;
        this.count = count;
        this.generator = generator;
    }

    public static ListSourceDataset of(String path, SourceFormat format, SourceSchema schema, List<Feature> features) {
        return new ListSourceDataset(path, format, schema, features.size(), features::get);
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public String layerName() {
        return layerName;
    }

    @Override
    public SourceFormat format() {
        return format;
    }

    @Override
    public SourceSchema schema() {
        return schema;
    }

    @Override
    public long featureCount() {
        return count;
    }

    @Override
    public Iterator<Feature> features(long startAt) {
        return new Iterator<>() {
            private int next = (int) Math.min(startAt, count);

            @Override
            public boolean hasNext() {
                return next < count;
            }

            @Override
            public Feature next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int row = next++;
                if (row == failAtRow) {
                    throw new IllegalStateException("Corrupt record at row " + row);
                }
                return generator.apply(row);
            }
        };
    }

    @Override
    public void close() {
        closed = true;
    }
}
