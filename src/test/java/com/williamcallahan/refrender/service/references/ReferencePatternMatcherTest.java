package com.williamcallahan.refrender.service.references;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.refrender.domain.references.ReferenceMatch;
import com.williamcallahan.refrender.testsupport.InMemoryReferenceStore;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

/**
 * Verifies reference scanning and capture extraction.
 */
class ReferencePatternMatcherTest {

    @Test
    void findsMatchesLeftToRightWithSpans() {
        String text = "see !42 and group/app!7 later";

        List<ReferenceMatch> matches = ReferencePatternMatcher.findMatches(
            text, InMemoryReferenceStore.MERGE_REQUEST_SHORT, "mergeRequest");

        assertEquals(2, matches.size());
        ReferenceMatch first = matches.get(0);
        assertEquals("!42", first.text());
        assertEquals(42L, first.objectId());
        assertEquals(4, first.start());
        assertEquals(7, first.end());
        assertTrue(first.project().isEmpty(), "No project token means the ambient project");

        ReferenceMatch second = matches.get(1);
        assertEquals("group/app!7", second.text());
        assertEquals("group/app", second.projectToken());
        assertEquals(text.indexOf("group/app"), second.start());
    }

    @Test
    void capturesAnchorFragment() {
        List<ReferenceMatch> matches = ReferencePatternMatcher.findMatches(
            "#10#note_7", InMemoryReferenceStore.ISSUE_SHORT, "issue");

        assertEquals(1, matches.size());
        assertEquals(10L, matches.get(0).objectId());
        assertEquals("#note_7", matches.get(0).anchor());
    }

    @Test
    void exposesUrlAndUnknownGroupsWithoutInterpretingThem() {
        Pattern pattern = Pattern.compile("(?<url>https://h/(?<ref>[a-z]+)/(?<issue>\\d+)(?<path>/[a-z]+)?)");

        ReferenceMatch match = ReferencePatternMatcher.findMatches("https://h/main/3/diffs", pattern, "issue").get(0);

        assertEquals(3L, match.objectId());
        assertEquals("https://h/main/3/diffs", match.url());
        assertEquals(Map.of("ref", "main", "path", "/diffs"), match.captures());
        assertNull(match.projectToken());
    }

    @Test
    void returnsNothingWhenIdGroupIsMissingOrNotNumeric() {
        Pattern lettersAsId = Pattern.compile("@(?<issue>[a-z]+)");

        assertTrue(ReferencePatternMatcher.findMatches("@abc", lettersAsId, "issue").isEmpty());
        assertTrue(ReferencePatternMatcher.findMatches("#12", InMemoryReferenceStore.ISSUE_SHORT, "snippet").isEmpty());
        assertTrue(ReferencePatternMatcher.findMatches("", InMemoryReferenceStore.ISSUE_SHORT, "issue").isEmpty());
    }

    @Test
    void restartsEachScanFromTheBeginning() {
        String text = "!1 !2";

        List<ReferenceMatch> firstScan = ReferencePatternMatcher.findMatches(
            text, InMemoryReferenceStore.MERGE_REQUEST_SHORT, "mergeRequest");
        List<ReferenceMatch> secondScan = ReferencePatternMatcher.findMatches(
            text, InMemoryReferenceStore.MERGE_REQUEST_SHORT, "mergeRequest");

        assertEquals(firstScan, secondScan);
    }

    @Test
    void distinguishesWholeAndPrefixMatches() {
        Pattern link = InMemoryReferenceStore.ISSUE_LINK;

        assertTrue(ReferencePatternMatcher.matchesEntirely("https://git.example.com/g/p/issues/5", link));
        assertFalse(ReferencePatternMatcher.matchesEntirely("https://git.example.com/g/p/issues/5/edit", link));
        assertTrue(ReferencePatternMatcher.matchesPrefix("https://git.example.com/g/p/issues/5/edit", link));
        assertFalse(ReferencePatternMatcher.matchesPrefix("see https://git.example.com/g/p/issues/5", link));
        assertFalse(ReferencePatternMatcher.matchesEntirely("#5", null));
    }

    @Test
    void ignoresEscapedParenthesesWhenListingGroups() {
        Pattern pattern = Pattern.compile("\\(?<notAGroup>(?<issue>\\d+)");

        assertEquals(Set.of("issue"), ReferencePatternMatcher.declaredGroupNames(pattern));
    }
}
