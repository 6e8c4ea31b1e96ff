package com.di.geoingest.load;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKBWriter;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.nio.charset.StandardCharsets;

/**
 * Serialization used to estimate a row's size before admission.
 */
public enum GeometryEncoding {

    GEOJSON {
        @Override
        public long encodedSize(Geometry geometry) {
            GeoJsonWriter writer = new GeoJsonWriter();
            writer.setEncodeCRS(false);
            return writer.write(geometry).getBytes(StandardCharsets.UTF_8).length;
        }
    },

    WKB {
        @Override
        public long encodedSize(Geometry geometry) {
            return new WKBWriter().write(geometry).length;
        }
    };

    public abstract long encodedSize(Geometry geometry);
}
