package com.di.geoingest.schema;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed form of a source field-type descriptor such as {@code int:10}, {@code character varying},
 * {@code ARRAY[text]} or {@code List[str]}.
 *
 * @param descriptor  the descriptor as declared by the source
 * @param elementType the primitive type name, lower-cased; the element type for arrays
 * @param array       whether the descriptor denotes an array or list of {@code elementType}
 */
public record SourceFieldType(String descriptor, String elementType, boolean array) {

    private static final Pattern ARRAY_PATTERN =
            Pattern.compile("^(?:ARRAY|List)\\[(.+)]$", Pattern.CASE_INSENSITIVE);

    /** Names that mark a field as carrying geometry. */
    private static final String GEOMETRY = "geometry";
    private static final String USER_DEFINED = "user-defined";
    private static final String USER_DEFINED_TYPE = "user defined type";

    public static SourceFieldType parse(String descriptor) {
        String trimmed = descriptor == null ? "" : descriptor.trim();
        Matcher m = ARRAY_PATTERN.matcher(trimmed);
        if (m.matches()) {
            return new SourceFieldType(trimmed, m.group(1).trim().toLowerCase(Locale.ROOT), true);
        }
        return new SourceFieldType(trimmed, trimmed.toLowerCase(Locale.ROOT), false);
    }

    public boolean isSpatial() {
        return !array && (GEOMETRY.equals(elementType)
                || USER_DEFINED.equals(elementType)
                || USER_DEFINED_TYPE.equals(elementType));
    }
}
