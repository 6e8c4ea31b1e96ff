package com.di.geoingest.config;

import com.di.geoingest.load.GeometryEncoding;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds {@code geoingest.*} from application.yml.
 */
@Data
@ConfigurationProperties(prefix = "geoingest")
public class GeoIngestProperties {

    /** Warehouse project; blank falls back to the credentials' default project. */
    private String project = "";

    private Ledger ledger = new Ledger();
    private Quota quota = new Quota();
    private Validation validation = new Validation();
    private Streaming streaming = new Streaming();
    private Bulk bulk = new Bulk();
    private TableVisibility tableVisibility = new TableVisibility();

    @Data
    public static class Ledger {
        private String dataset = "public";
        private String jobsTable = "load_jobs";
        private String failuresTable = "load_failures";
        /** Create the ledger dataset and tables at startup when missing. */
        private boolean bootstrap = true;
    }

    @Data
    public static class Quota {
        private int jobsPerTablePerDay = 1500;
    }

    @Data
    public static class Validation {
        private long rowSizeLimitBytes = 104_857_600L;
        private GeometryEncoding geometryEncoding = GeometryEncoding.GEOJSON;
    }

    @Data
    public static class Streaming {
        private int chunkSize = 1000;
    }

    @Data
    public static class Bulk {
        private String geometryColumn = "geometry";
        /** When set, interchange files are staged here before the load job runs. */
        private String stagingBucket = "";
        private String stagingPrefix = "geoingest/staging";
        private Duration loadTimeout = Duration.ofHours(1);
    }

    @Data
    public static class TableVisibility {
        private Duration initialInterval = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(5);
        private Duration timeout = Duration.ofSeconds(60);
    }
}
