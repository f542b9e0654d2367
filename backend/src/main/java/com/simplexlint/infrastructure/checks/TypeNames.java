package com.simplexlint.infrastructure.checks;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Return-type normalisation for the DATA reference check.
 */
final class TypeNames {

    static final Set<String> BUILTINS = Set.of(
            "string", "int", "integer", "number",
            "bool", "boolean", "float", "double",
            "list", "array", "map", "dict",
            "any", "void", "none", "null",
            "result", "output", "sum", "filtered",
            "valid", "issues", "timestamp", "id"
    );

    // Collection prefixes, compared after spaces are removed
    private static final List<String> COLLECTION_PREFIXES = List.of("listof", "arrayof", "setof");

    private static final int MAX_BARE_NAME_LENGTH = 100;

    private TypeNames() {
    }

    /**
     * Lower-case, drop spaces and underscores, strip a leading "list of"/"array of"/"set of".
     * "List of Policy_Rule" → "policyrule".
     */
    static String normalize(String typeName) {
        StringBuilder sb = new StringBuilder(typeName.length());
        for (char ch : typeName.toLowerCase(Locale.ROOT).toCharArray()) {
            if (ch != ' ' && ch != '_') {
                sb.append(ch);
            }
        }

        String normalized = sb.toString();
        for (String prefix : COLLECTION_PREFIXES) {
            if (normalized.length() > prefix.length() && normalized.startsWith(prefix)) {
                return normalized.substring(prefix.length());
            }
        }
        return normalized;
    }

    /**
     * A DATA block's type name is its first whitespace-delimited token.
     * Returns an empty string when none can be found.
     */
    static String dataTypeName(String dataContent) {
        if (dataContent == null || dataContent.isEmpty()) {
            return "";
        }

        for (int i = 0; i < dataContent.length(); i++) {
            char ch = dataContent.charAt(i);
            if (ch == '\n' || ch == ' ' || ch == '\t') {
                return dataContent.substring(0, i);
            }
        }

        return dataContent.length() < MAX_BARE_NAME_LENGTH ? dataContent : "";
    }

    static boolean isBuiltin(String normalized) {
        return BUILTINS.contains(normalized);
    }
}
