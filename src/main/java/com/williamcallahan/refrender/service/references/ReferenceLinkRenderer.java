package com.williamcallahan.refrender.service.references;

import com.williamcallahan.refrender.domain.references.ReferenceMatch;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import com.williamcallahan.refrender.domain.references.RenderedLink;
import com.williamcallahan.refrender.domain.references.ResolvedProject;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the link that replaces a resolved reference.
 */
public class ReferenceLinkRenderer {

    /** Default fragment that points at a comment, e.g. {@code #note_7}. */
    public static final Pattern DEFAULT_NOTE_ANCHOR = Pattern.compile("#note_(\\d+)");

    static final String ORIGINAL_KEY = "original";
    static final String PROJECT_KEY = "project";
    static final String REFERENCE_TYPE_KEY = "reference-type";

    private final Pattern noteAnchorPattern;

    public ReferenceLinkRenderer() {
        this(DEFAULT_NOTE_ANCHOR);
    }

    /**
     * @param noteAnchorPattern fragment grammar with one numeric group; must match the whole anchor
     */
    public ReferenceLinkRenderer(Pattern noteAnchorPattern) {
        this.noteAnchorPattern = Objects.requireNonNull(noteAnchorPattern, "Note anchor pattern cannot be null");
    }

    /**
     * Renders a resolved reference.
     *
     * @param resolution resolved project and object
     * @param match the reference being replaced
     * @param overrideText text of the link being rewritten, or null to use the object's reference text
     * @param ambientProject project the document is rendered for
     * @param cache request cache for URL construction
     * @return the replacement link
     */
    public RenderedLink render(
        ReferenceResolver.Resolution resolution,
        ReferenceMatch match,
        String overrideText,
        ResolvedProject ambientProject,
        ReferenceCache cache
    ) {
        ReferenceType type = resolution.type();
        ResolvedProject project = resolution.project();

        String href = match.explicitUrl().orElseGet(() -> cache.urlFor(
            type,
            project.id(),
            resolution.object().id(),
            () -> type.source().urlFor(resolution.object(), project)
        ));
        String text = overrideText != null ? overrideText : linkText(resolution, match, ambientProject);

        Map<String, String> data = new LinkedHashMap<>();
        data.put(ORIGINAL_KEY, overrideText != null ? overrideText : match.text());
        data.put(PROJECT_KEY, Long.toString(project.id()));
        data.put(type.dataKey(), Long.toString(resolution.object().id()));
        data.put(REFERENCE_TYPE_KEY, type.objectName());

        return new RenderedLink(
            href,
            text,
            title(resolution),
            List.of(ReferenceType.REFERENCE_CLASS, type.cssClass()),
            data
        );
    }

    String title(ReferenceResolver.Resolution resolution) {
        return resolution.type().displayName() + ": " + resolution.object().title();
    }

    String linkText(ReferenceResolver.Resolution resolution, ReferenceMatch match, ResolvedProject ambientProject) {
        String text = resolution.type().source().displayText(resolution.object(), ambientProject);
        List<String> extras = linkTextExtras(match);
        if (!extras.isEmpty()) {
            text += " (" + String.join(", ", extras) + ")";
        }
        return text;
    }

    private List<String> linkTextExtras(ReferenceMatch match) {
        return match.anchorFragment()
            .map(noteAnchorPattern::matcher)
            .filter(Matcher::matches)
            .map(noteMatcher -> List.of("comment " + noteMatcher.group(1)))
            .orElse(List.of());
    }
}
