package com.di.geoingest.exception;

import com.di.geoingest.load.FeatureValidationException;
import com.di.geoingest.load.TableVisibilityTimeoutException;
import com.di.geoingest.source.SourceOpenException;
import com.di.geoingest.warehouse.WarehouseException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories reported in REST error bodies and in the error logs of load jobs.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>A new category needs its constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    SOURCE_ERROR("Source error", "Source file, layer or table could not be opened or read"),
    QUOTA_ERROR("Warehouse quota error", "Warehouse load-job quota or rate limit reached"),
    WAREHOUSE_ERROR("Warehouse error", "Warehouse request rejected or failed"),
    CONNECTION_ERROR("Source database connection error", "Could not reach or stay connected to the source database"),
    SQL_SYNTAX_ERROR("SQL error", "Source query referenced a missing relation or was malformed"),
    PERMISSION_ERROR("Permission denied", "Source database refused access to the table"),
    DATABASE_ERROR("Database error", "Source database failed while reading rows"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    VALIDATION_ERROR("Validation error", "Request parameters or feature contents are invalid"),
    RESOURCE_ERROR("Resource error", "Local disk, file or memory problem while staging data"),
    AUTHENTICATION_ERROR("Authentication error", "Credentials missing or rejected"),
    SERIALIZATION_ERROR("Serialization error", "JSON or geometry text could not be parsed or written"),
    TIMEOUT_ERROR("Timeout error", "Waited too long for the warehouse"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** First match wins, so quota sits ahead of the general warehouse matcher. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(t -> t instanceof SourceOpenException, SOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isQuotaError, QUOTA_ERROR);
        MATCHERS.put(t -> t instanceof WarehouseException, WAREHOUSE_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isAuthenticationError, AUTHENTICATION_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
    }

    /**
     * Spring's {@code DataAccessException} wraps the driver error, so the cause chain is searched
     * for a {@link SQLException} before the matchers run.
     */
    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (!(exception instanceof SourceOpenException)) {
            SQLException sqlException = findSqlException(exception);
            if (sqlException != null) {
                return categorizeSqlException(sqlException);
            }
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static SQLException findSqlException(Throwable exception) {
        Throwable current = exception;
        for (int depth = 0; current != null && depth < 8; depth++) {
            if (current instanceof SQLException) {
                return (SQLException) current;
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return null;
    }

    /** PostgreSQL SQLSTATE classes first, then the driver message. */
    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && sqlState.length() >= 2) {
            ErrorCategory byClass = SQL_STATE_CLASS.get(sqlState.substring(0, 2));
            if (byClass != null) {
                return byClass;
            }
        }
        String msg = lower(sqlEx.getMessage());
        if (containsAny(msg, "connection", "timeout", "refused", "closed")) return CONNECTION_ERROR;
        if (containsAny(msg, "permission", "access denied")) return PERMISSION_ERROR;
        if (containsAny(msg, "syntax", "does not exist")) return SQL_SYNTAX_ERROR;
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_CLASS = Map.of(
            "08", CONNECTION_ERROR,
            "28", AUTHENTICATION_ERROR,
            "42", SQL_SYNTAX_ERROR
    );

    // --- Matchers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof TableVisibilityTimeoutException
                || t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException;
    }

    /** BigQuery reports quota problems through the message of the failed job or request. */
    private static boolean isQuotaError(Throwable t) {
        return t instanceof WarehouseException
                && containsAny(lower(t.getMessage()), "quota", "ratelimitexceeded", "rate limit");
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof FeatureValidationException
                || t instanceof org.springframework.web.bind.MethodArgumentNotValidException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.FileSystemException
                || t instanceof java.io.UncheckedIOException;
    }

    private static boolean isAuthenticationError(Throwable t) {
        if (containsAny(lower(t.getMessage()), "unauthenticated", "unauthorized", "invalid credentials",
                "application default credentials")) {
            return true;
        }
        return t.getClass().getName().contains("Credentials");
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof org.locationtech.jts.io.ParseException;
    }

    private static String lower(String text) {
        return text != null ? text.toLowerCase(Locale.ROOT) : null;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
