package com.di.geoingest.load;

/**
 * A feature failed admission. Caught by the loaders and turned into a failure record.
 */
public class FeatureValidationException extends RuntimeException {

    private final ValidationErrorType errorType;

    public FeatureValidationException(ValidationErrorType errorType, String detail) {
        super(errorType.name() + ": " + detail);
        this.errorType = errorType;
    }

    public ValidationErrorType getErrorType() {
        return errorType;
    }
}
