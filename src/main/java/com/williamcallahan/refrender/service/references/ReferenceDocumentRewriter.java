package com.williamcallahan.refrender.service.references;

import com.williamcallahan.refrender.domain.references.ReferenceMatch;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import com.williamcallahan.refrender.domain.references.ResolvedProject;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Replaces references of one object type in a parsed HTML document with rendered links.
 *
 * <p>Text nodes have each resolvable match replaced in place. Existing links are checked in this
 * order, and the first rule that applies wins:</p>
 * <ol>
 *   <li>href is entirely a short reference: re-render it, keeping the link text;</li>
 *   <li>the type has no link grammar: leave the link alone;</li>
 *   <li>href equals the link text and the text starts with a full reference URL: re-render the
 *       whole link, text included;</li>
 *   <li>href is entirely a full reference URL: re-render it, keeping the link text;</li>
 *   <li>otherwise leave the link alone.</li>
 * </ol>
 *
 * <p>Candidates are collected before anything is replaced, so inserted links are never scanned
 * again. Rendered links carry the {@code gfm} class and are skipped by later passes, which keeps
 * rewriting idempotent.</p>
 */
public class ReferenceDocumentRewriter {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceDocumentRewriter.class);

    private static final Set<String> IGNORED_TEXT_ANCESTORS = Set.of("a", "pre", "code", "style");

    private final ReferenceType type;
    private final ReferenceResolver resolver;
    private final ReferenceLinkRenderer renderer;

    public ReferenceDocumentRewriter(ReferenceType type, ReferenceResolver resolver, ReferenceLinkRenderer renderer) {
        this.type = Objects.requireNonNull(type, "Reference type cannot be null");
        this.resolver = Objects.requireNonNull(resolver, "Resolver cannot be null");
        this.renderer = Objects.requireNonNull(renderer, "Renderer cannot be null");
    }

    public ReferenceType type() {
        return type;
    }

    /**
     * Rewrites references in {@code document} in place.
     *
     * @param document parsed document
     * @param ambientProject project the document is rendered for; null leaves the document untouched
     * @param cache request cache shared by every rewriter of this request
     * @return the same document
     */
    public Document rewrite(Document document, ResolvedProject ambientProject, ReferenceCache cache) {
        if (document == null || ambientProject == null) {
            return document;
        }
        RewriteContext context = new RewriteContext(ambientProject, cache);
        int replaced = 0;

        for (Node candidate : collectCandidates(document)) {
            if (candidate.parent() == null) {
                continue;
            }
            if (candidate instanceof TextNode textNode) {
                if (type.shortPattern() != null && rewriteText(textNode, context)) {
                    replaced++;
                }
            } else if (candidate instanceof Element linkElement && rewriteLink(linkElement, context)) {
                replaced++;
            }
        }

        logger.debug("Rewrote {} node(s) with {} references", replaced, type.objectName());
        return document;
    }

    private List<Node> collectCandidates(Document document) {
        List<Node> candidates = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode && isEligibleText(textNode)) {
                candidates.add(node);
            } else if (node instanceof Element element && isEligibleLink(element)) {
                candidates.add(node);
            }
        }, document);
        return candidates;
    }

    private boolean rewriteText(TextNode textNode, RewriteContext context) {
        String text = textNode.getWholeText();
        if (!type.shortPattern().matcher(text).find()) {
            return false;
        }
        return substitute(text, type.shortPattern(), null, context)
            .map(replacement -> replaceNode(textNode, replacement))
            .orElse(false);
    }

    private boolean rewriteLink(Element linkElement, RewriteContext context) {
        String link = decodeHref(linkElement.attr("href"));
        String text = linkElement.text();
        Pattern shortPattern = type.shortPattern();
        Pattern linkPattern = type.linkPattern();

        if (ReferencePatternMatcher.matchesEntirely(link, shortPattern)) {
            return replaceLink(linkElement, substitute(link, shortPattern, text, context));
        }

        if (linkPattern == null) {
            return false;
        }

        if (link.equals(text) && ReferencePatternMatcher.matchesPrefix(text, linkPattern)) {
            return replaceLink(linkElement, substitute(text, linkPattern, null, context));
        }

        if (ReferencePatternMatcher.matchesEntirely(link, linkPattern)) {
            return replaceLink(linkElement, substitute(link, linkPattern, text, context));
        }

        return false;
    }

    /**
     * Builds the nodes that replace {@code text}: resolved matches become links and everything else
     * is kept as text.
     *
     * @return replacement nodes, or empty when no match resolved
     */
    private Optional<List<Node>> substitute(String text, Pattern pattern, String overrideText, RewriteContext context) {
        List<Node> replacement = new ArrayList<>();
        int cursor = 0;
        for (ReferenceMatch match : ReferencePatternMatcher.findMatches(text, pattern, type.idGroupName())) {
            Optional<ReferenceResolver.Resolution> resolution =
                resolver.resolve(match, type, context.ambientProject(), context.cache());
            if (resolution.isEmpty()) {
                continue;
            }
            if (match.start() > cursor) {
                replacement.add(new TextNode(text.substring(cursor, match.start())));
            }
            replacement.add(renderer
                .render(resolution.get(), match, overrideText, context.ambientProject(), context.cache())
                .toElement());
            cursor = match.end();
        }
        if (replacement.isEmpty()) {
            return Optional.empty();
        }
        if (cursor < text.length()) {
            replacement.add(new TextNode(text.substring(cursor)));
        }
        return Optional.of(replacement);
    }

    private boolean replaceLink(Element linkElement, Optional<List<Node>> replacement) {
        return replacement.map(nodes -> replaceNode(linkElement, nodes)).orElse(false);
    }

    private static boolean replaceNode(Node original, List<Node> replacement) {
        for (Node node : replacement) {
            original.before(node);
        }
        original.remove();
        return true;
    }

    private static boolean isEligibleText(TextNode textNode) {
        if (textNode.isBlank()) {
            return false;
        }
        for (Node ancestor = textNode.parent(); ancestor != null; ancestor = ancestor.parent()) {
            if (ancestor instanceof Element element && IGNORED_TEXT_ANCESTORS.contains(element.normalName())) {
                return false;
            }
        }
        return true;
    }

    private static boolean isEligibleLink(Element element) {
        if (!"a".equals(element.normalName())) {
            return false;
        }
        if (element.attr("href").isEmpty() || element.hasClass(ReferenceType.REFERENCE_CLASS)) {
            return false;
        }
        if (element.selectFirst("img") != null) {
            return false;
        }
        for (Element ancestor = element.parent(); ancestor != null; ancestor = ancestor.parent()) {
            if ("a".equals(ancestor.normalName()) && ancestor.hasClass(ReferenceType.REFERENCE_CLASS)) {
                return false;
            }
        }
        return true;
    }

    private static String decodeHref(String href) {
        try {
            return URLDecoder.decode(href, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException malformedEncoding) {
            logger.debug("Keeping undecodable href as-is: {}", href);
            return href;
        }
    }

    private record RewriteContext(ResolvedProject ambientProject, ReferenceCache cache) {}
}
