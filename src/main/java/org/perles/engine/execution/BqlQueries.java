package org.perles.engine.execution;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Helpers for producing and recognizing BQL text.
 */
public final class BqlQueries {

    private static final List<String> INDICATORS = List.of(
            " = ", " != ", " < ", " > ", " <= ", " >= ", " ~ ", " !~ ",
            " and ", " or ", " in ", " not ", "order by", " expand ", " depth ");

    private BqlQueries() {
    }

    /**
     * Builds a query selecting the given ids: {@code id = "a"} for one id,
     * {@code id in ("a", "b")} for several, and an empty string for none.
     */
    public static String buildIdQuery(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return "";
        }
        if (ids.size() == 1) {
            return "id = " + quote(ids.get(0));
        }
        return ids.stream()
                .map(BqlQueries::quote)
                .collect(Collectors.joining(", ", "id in (", ")"));
    }

    /**
     * Guesses whether free text is meant as BQL rather than a plain search string.
     * True when it contains an operator or keyword surrounded by spaces, or starts with "expand ".
     */
    public static boolean isBqlQuery(String input) {
        if (input == null) {
            return false;
        }
        String lower = input.toLowerCase(Locale.ROOT);
        for (String indicator : INDICATORS) {
            if (lower.contains(indicator)) {
                return true;
            }
        }
        return lower.strip().startsWith("expand ");
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
