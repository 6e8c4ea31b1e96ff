package com.di.geoingest.schema;

import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A single entry of the ordered type-mapping rule list: a predicate over the lower-cased
 * primitive type name and the column type it maps to.
 */
public record TypeMappingRule(String description, Predicate<String> predicate, ColumnType target) {

    public static TypeMappingRule prefix(String prefix, ColumnType target) {
        return new TypeMappingRule("prefix '" + prefix + "'", name -> name.startsWith(prefix), target);
    }

    public static TypeMappingRule exact(ColumnType target, String... names) {
        Set<String> accepted = Set.of(names);
        return new TypeMappingRule("one of " + accepted, accepted::contains, target);
    }

    public boolean matches(String typeName) {
        return typeName != null && predicate.test(typeName.toLowerCase(Locale.ROOT));
    }
}
