package com.di.geoingest.load;

import com.di.geoingest.load.metadata.LoadFailure;
import com.di.geoingest.load.metadata.LoadFailureRepository;
import com.di.geoingest.source.Feature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Runs the validator for a job and quarantines every rejected feature exactly once.
 * Rows the source could not decode are rejected even when validation is disabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureAdmission {

    private final FeatureValidator validator;
    private final LoadFailureRepository failureRepository;
    private final LoadMetrics metrics;

    /**
     * @return {@code true} if the feature may join a batch
     */
    public boolean admit(LoadJobContext context, long rowIndex, Feature feature) {
        if (feature.isUnreadable()) {
            reject(context, rowIndex, feature, ValidationErrorType.UNREADABLE_FEATURE,
                    ValidationErrorType.UNREADABLE_FEATURE.name() + ": " + feature.readError());
            return false;
        }
        if (!context.isValidateFeature()) {
            return true;
        }
        try {
            validator.validate(feature, context);
            return true;
        } catch (FeatureValidationException e) {
            reject(context, rowIndex, feature, e.getErrorType(), e.getMessage());
            return false;
        }
    }

    private void reject(LoadJobContext context, long rowIndex, Feature feature,
                        ValidationErrorType errorType, String reason) {
        log.warn("[VALIDATOR] Row {} of {} rejected: {}", rowIndex, context.getSourcePath(), reason);
        metrics.recordRejected(errorType);
        failureRepository.record(LoadFailure.builder()
                .jobId(context.getJobId())
                .sourcePath(context.getSourcePath())
                .layerName(context.getLayerName())
                .tableId(context.getTable().toString())
                .row(rowIndex)
                .props(feature.properties())
                .failTime(Instant.now())
                .failReason(reason)
                .build());
    }
}
