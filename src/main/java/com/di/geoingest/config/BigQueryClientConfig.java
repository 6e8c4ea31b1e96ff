package com.di.geoingest.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a BigQuery client bean backed by Application Default Credentials.
 * An explicit {@code geoingest.project} overrides the credentials' project.
 */
@Configuration
public class BigQueryClientConfig {

    @Bean
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient(GeoIngestProperties properties) {
        BigQueryOptions.Builder builder = BigQueryOptions.newBuilder();
        if (properties.getProject() != null && !properties.getProject().isBlank()) {
            builder.setProjectId(properties.getProject());
        }
        return builder.build().getService();
    }
}
