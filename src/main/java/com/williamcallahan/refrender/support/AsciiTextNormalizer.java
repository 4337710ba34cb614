package com.williamcallahan.refrender.support;

/**
 * Provides locale-independent ASCII conversions for technical identifiers such as object type
 * names, CSS class suffixes, data attribute names and regex group names.
 *
 * Only ASCII letters are case-folded; every other character is left unchanged so the result never
 * depends on the default locale.
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';

    private AsciiTextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Converts a snake case identifier to dashed form, e.g. {@code merge_request -> merge-request}.
     *
     * @param identifier snake case identifier (may be null)
     * @return lowercased dashed identifier, or empty string if null
     */
    public static String toDashed(String identifier) {
        return toLowerAscii(identifier).replace('_', '-');
    }

    /**
     * Converts a snake or dashed identifier to lower camel case, e.g. {@code merge_request -> mergeRequest}.
     * The result is usable as a {@link java.util.regex.Pattern} group name, which may not contain
     * underscores.
     *
     * @param identifier snake case identifier (may be null)
     * @return camel case identifier, or empty string if null
     */
    public static String toCamelCase(String identifier) {
        String lowered = toLowerAscii(identifier);
        StringBuilder camel = new StringBuilder(lowered.length());
        boolean upperNext = false;
        for (int index = 0; index < lowered.length(); index++) {
            char current = lowered.charAt(index);
            if (current == '_' || current == '-') {
                upperNext = camel.length() > 0;
                continue;
            }
            if (upperNext && current >= 'a' && current <= 'z') {
                camel.append((char) (current - CASE_OFFSET));
            } else {
                camel.append(current);
            }
            upperNext = false;
        }
        return camel.toString();
    }
}
