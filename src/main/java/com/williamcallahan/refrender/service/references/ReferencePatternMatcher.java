package com.williamcallahan.refrender.service.references;

import com.williamcallahan.refrender.domain.references.ReferenceMatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans strings for occurrences of a reference grammar. Stateless; every call starts a fresh scan.
 */
public final class ReferencePatternMatcher {

    static final String PROJECT_GROUP = "project";
    static final String ANCHOR_GROUP = "anchor";
    static final String URL_GROUP = "url";

    // Group declarations in pattern source: (?<name>...
    private static final Pattern NAMED_GROUP_DECLARATION = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private ReferencePatternMatcher() {}

    /**
     * Finds all non-overlapping occurrences of {@code pattern} in {@code text}, left to right.
     * Occurrences whose id group is empty or not a number are skipped.
     *
     * @param text text to scan
     * @param pattern reference grammar
     * @param idGroup name of the group that captures the object number
     * @return matches in document order, possibly empty
     */
    public static List<ReferenceMatch> findMatches(String text, Pattern pattern, String idGroup) {
        if (text == null || text.isEmpty() || pattern == null) {
            return List.of();
        }
        Set<String> groupNames = declaredGroupNames(pattern);
        if (!groupNames.contains(idGroup)) {
            return List.of();
        }

        List<ReferenceMatch> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            Long objectId = parseId(matcher.group(idGroup));
            if (objectId == null) {
                continue;
            }
            Map<String, String> captures = new LinkedHashMap<>();
            for (String groupName : groupNames) {
                if (groupName.equals(idGroup) || isWellKnown(groupName)) {
                    continue;
                }
                String value = matcher.group(groupName);
                if (value != null) {
                    captures.put(groupName, value);
                }
            }
            matches.add(new ReferenceMatch(
                matcher.group(),
                matcher.start(),
                matcher.end(),
                objectId,
                optionalGroup(matcher, groupNames, PROJECT_GROUP),
                optionalGroup(matcher, groupNames, ANCHOR_GROUP),
                optionalGroup(matcher, groupNames, URL_GROUP),
                captures
            ));
        }
        return matches;
    }

    /**
     * @return true when the whole of {@code text} is one occurrence of {@code pattern}
     */
    public static boolean matchesEntirely(String text, Pattern pattern) {
        return text != null && pattern != null && pattern.matcher(text).matches();
    }

    /**
     * @return true when {@code text} begins with an occurrence of {@code pattern}
     */
    public static boolean matchesPrefix(String text, Pattern pattern) {
        return text != null && pattern != null && pattern.matcher(text).lookingAt();
    }

    /**
     * Lists the named groups a compiled grammar declares, in declaration order.
     *
     * @param pattern compiled grammar
     * @return group names
     */
    static Set<String> declaredGroupNames(Pattern pattern) {
        Set<String> names = new LinkedHashSet<>();
        Matcher declarations = NAMED_GROUP_DECLARATION.matcher(pattern.pattern());
        while (declarations.find()) {
            // an escaped "\(" is a literal paren, not a group
            if (!isEscaped(pattern.pattern(), declarations.start())) {
                names.add(declarations.group(1));
            }
        }
        return names;
    }

    private static boolean isEscaped(String source, int index) {
        int backslashes = 0;
        for (int cursor = index - 1; cursor >= 0 && source.charAt(cursor) == '\\'; cursor--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static boolean isWellKnown(String groupName) {
        return PROJECT_GROUP.equals(groupName) || ANCHOR_GROUP.equals(groupName) || URL_GROUP.equals(groupName);
    }

    private static String optionalGroup(Matcher matcher, Set<String> groupNames, String groupName) {
        return groupNames.contains(groupName) ? matcher.group(groupName) : null;
    }

    private static Long parseId(String rawId) {
        if (rawId == null || rawId.isEmpty()) {
            return null;
        }
        for (int index = 0; index < rawId.length(); index++) {
            if (!Character.isDigit(rawId.charAt(index))) {
                return null;
            }
        }
        try {
            return Long.parseLong(rawId);
        } catch (NumberFormatException overflow) {
            return null;
        }
    }
}
