package com.di.geoingest.load;

/**
 * Reasons a feature is refused admission.
 */
public enum ValidationErrorType {
    ROW_EXCEEDS_SIZE_LIMIT("Row is likely to exceed the warehouse row size limit"),
    SCHEMAS_DONT_MATCH("Feature properties do not match the source schema"),
    UNREADABLE_FEATURE("Source row could not be decoded");

    private final String description;

    ValidationErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
