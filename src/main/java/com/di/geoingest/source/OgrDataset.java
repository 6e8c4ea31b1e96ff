package com.di.geoingest.source;

import com.di.geoingest.schema.SourceSchema;
import lombok.extern.slf4j.Slf4j;
import org.gdal.gdal.gdal;
import org.gdal.ogr.DataSource;
import org.gdal.ogr.FeatureDefn;
import org.gdal.ogr.FieldDefn;
import org.gdal.ogr.Layer;
import org.gdal.ogr.ogr;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Shapefiles and file geodatabase layers read through the GDAL/OGR bindings.
 *
 * <p>Field types are reported with the same descriptors the schema translator expects for vector
 * files ({@code int32}, {@code str}, {@code List[float]}, ...). Geometries cross over as WKB and are
 * parsed into JTS; a feature whose WKB does not parse comes back unreadable with its fid.
 */
@Slf4j
public class OgrDataset implements SourceDataset {

    private static final String FID = "fid";

    private static volatile boolean driversRegistered;

    private final String path;
    private final SourceFormat format;
    private final DataSource dataSource;
    private final Layer layer;
    private final String layerName;
    private final SourceSchema schema;
    private final int[] fieldTypes;
    private final int[] fieldSubTypes;
    private final String[] fieldNames;

    private OgrDataset(String path, SourceFormat format, DataSource dataSource, Layer layer) {
        this.path = path;
        this.format = format;
        this.dataSource = dataSource;
        this.layer = layer;
        this.layerName = layer.GetName();

        FeatureDefn defn = layer.GetLayerDefn();
        int count = defn.GetFieldCount();
        this.fieldTypes = new int[count];
        this.fieldSubTypes = new int[count];
        this.fieldNames = new String[count];
        Map<String, String> properties = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            FieldDefn field = defn.GetFieldDefn(i);
            fieldNames[i] = field.GetName();
            fieldTypes[i] = field.GetFieldType();
            fieldSubTypes[i] = field.GetSubType();
            properties.put(fieldNames[i], describe(fieldTypes[i], fieldSubTypes[i]));
        }
        int geomType = layer.GetGeomType();
        String geometryType = geomType == ogr.wkbNone ? null : ogr.GeometryTypeToName(geomType);
        this.schema = new SourceSchema(properties, geometryType);
    }

    /**
     * Opens a shapefile, or a named layer of a geodatabase (the first layer when {@code layerName} is blank).
     */
    public static OgrDataset open(String path, SourceFormat format, String layerName) {
        registerDrivers();
        DataSource dataSource = ogr.Open(path, 0);
        if (dataSource == null) {
            throw new SourceOpenException("Could not open " + path + ": " + gdal.GetLastErrorMsg());
        }
        Layer layer = layerName == null || layerName.isBlank()
                ? dataSource.GetLayer(0)
                : dataSource.GetLayerByName(layerName);
        if (layer == null) {
            dataSource.delete();
            throw new SourceOpenException("Layer '" + layerName + "' not found in " + path);
        }
        OgrDataset dataset = new OgrDataset(path, format, dataSource, layer);
        log.info("[SOURCE] Opened {} {} layer={} features={} geometry={}",
                format, path, dataset.layerName, dataset.featureCount(), dataset.schema.geometryType());
        return dataset;
    }

    private static void registerDrivers() {
        if (!driversRegistered) {
            synchronized (OgrDataset.class) {
                if (!driversRegistered) {
                    ogr.RegisterAll();
                    driversRegistered = true;
                }
            }
        }
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public String layerName() {
        return format == SourceFormat.FILE_GEODATABASE ? layerName : null;
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
        return layer.GetFeatureCount();
    }

    @Override
    public Iterator<Feature> features(long startAt) {
        layer.ResetReading();
        if (startAt > 0) {
            skipTo(startAt);
        }
        return new Iterator<>() {
            private org.gdal.ogr.Feature pending;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                if (pending == null && !exhausted) {
                    pending = layer.GetNextFeature();
                    exhausted = pending == null;
                }
                return pending != null;
            }

            @Override
            public Feature next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                org.gdal.ogr.Feature current = pending;
                pending = null;
                try {
                    return toFeature(current);
                } finally {
                    current.delete();
                }
            }
        };
    }

    /**
     * Positions the read cursor on row {@code startAt}. Drivers without random access are walked
     * feature by feature; geometries are never decoded on the way.
     */
    private void skipTo(long startAt) {
        if (layer.SetNextByIndex(startAt) == ogr.OGRERR_NONE) {
            log.info("[SOURCE] Seeked {} layer={} to row {}", path, layerName, startAt);
            return;
        }
        layer.ResetReading();
        long skipped = 0;
        org.gdal.ogr.Feature feature;
        while (skipped < startAt && (feature = layer.GetNextFeature()) != null) {
            feature.delete();
            skipped++;
        }
        log.info("[SOURCE] Skipped {} features of {} layer={} to reach row {}", skipped, path, layerName, startAt);
    }

    @Override
    public void close() {
        dataSource.delete();
    }

    private Feature toFeature(org.gdal.ogr.Feature source) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i < fieldNames.length; i++) {
            properties.put(fieldNames[i], readField(source, i, fieldTypes[i], fieldSubTypes[i]));
        }
        Geometry geometry = null;
        org.gdal.ogr.Geometry ref = source.GetGeometryRef();
        if (ref != null) {
            try {
                geometry = new WKBReader().read(ref.ExportToWkb());
            } catch (ParseException | RuntimeException e) {
                properties.put(FID, source.GetFID());
                return Feature.unreadable(properties,
                        "Unreadable geometry at fid " + source.GetFID() + ": " + e.getMessage());
            }
        }
        return new Feature(properties, geometry);
    }

    private static Object readField(org.gdal.ogr.Feature source, int i, int type, int subType) {
        if (!source.IsFieldSetAndNotNull(i)) {
            return null;
        }
        if (type == ogr.OFTInteger && subType == ogr.OFSTBoolean) {
            return source.GetFieldAsInteger(i) != 0;
        }
        if (type == ogr.OFTInteger) {
            return source.GetFieldAsInteger(i);
        }
        if (type == ogr.OFTInteger64) {
            return source.GetFieldAsInteger64(i);
        }
        if (type == ogr.OFTReal) {
            return source.GetFieldAsDouble(i);
        }
        if (type == ogr.OFTDate || type == ogr.OFTDateTime) {
            // OGR renders dates as yyyy/MM/dd
            return source.GetFieldAsString(i).replace('/', '-');
        }
        if (type == ogr.OFTIntegerList) {
            List<Integer> values = new ArrayList<>();
            for (int v : source.GetFieldAsIntegerList(i)) {
                values.add(v);
            }
            return values;
        }
        if (type == ogr.OFTInteger64List) {
            return parseListText(source.GetFieldAsString(i));
        }
        if (type == ogr.OFTRealList) {
            List<Double> values = new ArrayList<>();
            for (double v : source.GetFieldAsDoubleList(i)) {
                values.add(v);
            }
            return values;
        }
        if (type == ogr.OFTStringList) {
            return Arrays.asList(source.GetFieldAsStringList(i));
        }
        if (type == ogr.OFTBinary) {
            return source.GetFieldAsBinary(i);
        }
        return source.GetFieldAsString(i);
    }

    /** Parses OGR's {@code (3:1,2,3)} list rendering. */
    private static List<Long> parseListText(String text) {
        List<Long> values = new ArrayList<>();
        int colon = text.indexOf(':');
        int end = text.lastIndexOf(')');
        if (colon < 0 || end <= colon + 1) {
            return values;
        }
        for (String part : text.substring(colon + 1, end).split(",")) {
            if (!part.isBlank()) {
                values.add(Long.parseLong(part.trim()));
            }
        }
        return values;
    }

    static String describe(int fieldType, int subType) {
        if (fieldType == ogr.OFTInteger) {
            return subType == ogr.OFSTBoolean ? "bool" : "int32";
        }
        if (fieldType == ogr.OFTInteger64) {
            return "int64";
        }
        if (fieldType == ogr.OFTReal) {
            return "float";
        }
        if (fieldType == ogr.OFTDate) {
            return "date";
        }
        if (fieldType == ogr.OFTDateTime) {
            return "datetime";
        }
        if (fieldType == ogr.OFTTime) {
            return "time";
        }
        if (fieldType == ogr.OFTBinary) {
            return "blob";
        }
        if (fieldType == ogr.OFTIntegerList || fieldType == ogr.OFTInteger64List) {
            return "List[int]";
        }
        if (fieldType == ogr.OFTRealList) {
            return "List[float]";
        }
        if (fieldType == ogr.OFTStringList) {
            return "List[str]";
        }
        return "str";
    }
}
