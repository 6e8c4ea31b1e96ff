package com.di.geoingest.load;

import com.di.geoingest.config.GeoIngestProperties;
import com.di.geoingest.source.Feature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-row admission checks.
 *
 * <ul>
 *   <li>Size: spatial rows only. The encoded geometry must not exceed the row size ceiling.</li>
 *   <li>Schema: the feature's property keys must equal the declared property keys exactly.</li>
 * </ul>
 */
@Slf4j
@Component
public class FeatureValidator {

    private final long rowSizeLimitBytes;
    private final GeometryEncoding encoding;

    @Autowired
    public FeatureValidator(GeoIngestProperties properties) {
        this(properties.getValidation().getRowSizeLimitBytes(), properties.getValidation().getGeometryEncoding());
    }

    public FeatureValidator(long rowSizeLimitBytes, GeometryEncoding encoding) {
        this.rowSizeLimitBytes = rowSizeLimitBytes;
        this.encoding = encoding;
    }

    /**
     * @throws FeatureValidationException when the feature must not be loaded
     */
    public void validate(Feature feature, LoadJobContext context) {
        if (context.isSpatial() && feature.hasGeometry()) {
            long size = encoding.encodedSize(feature.geometry());
            if (size > rowSizeLimitBytes) {
                throw new FeatureValidationException(ValidationErrorType.ROW_EXCEEDS_SIZE_LIMIT,
                        encoding + " geometry is " + size + " bytes, limit " + rowSizeLimitBytes);
            }
        }

        Set<String> declared = context.getSourceSchema().propertyNames();
        Set<String> actual = feature.properties().keySet();
        if (!actual.equals(declared)) {
            Set<String> missing = new LinkedHashSet<>(declared);
            missing.removeAll(actual);
            Set<String> extra = new LinkedHashSet<>(actual);
            extra.removeAll(declared);
            log.debug("[VALIDATOR] Schema mismatch missing={} extra={}", missing, extra);
            throw new FeatureValidationException(ValidationErrorType.SCHEMAS_DONT_MATCH,
                    "missing " + missing + ", unexpected " + extra);
        }
    }
}
