package com.github.yoep.popcorn.backend.media.providers.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient parsing of the numeric values returned by the provider APIs.
 */
public final class NumberParser {
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+)");

    private NumberParser() {
    }

    /**
     * Parse the release year of a catalog entry.
     * Year ranges such as {@code "2019–2021"} return their first year.
     *
     * @param node The raw year value.
     * @return Returns the year, or 0 when it couldn't be parsed.
     */
    public static int parseYear(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return 0;
        }
        if (node.isNumber()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            var matcher = LEADING_NUMBER.matcher(node.textValue());
            if (matcher.find()) {
                return parseInt(matcher.group(1)).orElse(0);
            }
        }

        return 0;
    }

    /**
     * Parse an optional integer which might be encoded as number, numeric string or floating point.
     *
     * @param node The raw value.
     * @return Returns the integer if present and valid, else {@link Optional#empty()}.
     */
    public static Optional<Integer> parseOptionalInt(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isIntegralNumber()) {
            return Optional.of(node.intValue());
        }
        if (node.isNumber()) {
            return Optional.of((int) node.doubleValue());
        }
        if (node.isTextual()) {
            return parseInt(StringUtils.trim(node.textValue()));
        }

        return Optional.empty();
    }

    private static Optional<Integer> parseInt(String value) {
        try {
            return Optional.of(Integer.parseInt(value));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
