package com.williamcallahan.refrender.service.references;

import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.gfm.tasklist.TaskListExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.williamcallahan.refrender.config.AppProperties;
import com.williamcallahan.refrender.domain.references.LazyReference;
import com.williamcallahan.refrender.domain.references.ProjectDirectory;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import com.williamcallahan.refrender.domain.references.RenderedDocument;
import com.williamcallahan.refrender.domain.references.ResolvedProject;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Renders markdown to HTML and links every registered reference type in it.
 *
 * Each call gets its own {@link RequestReferenceCache}, shared by all types for that document
 * and discarded afterwards, so concurrent renders never share lookups.
 */
@Service
public class ReferenceRenderingService {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceRenderingService.class);

    private final Parser parser;
    private final HtmlRenderer renderer;
    private final List<ReferenceDocumentRewriter> rewriters;
    private final ReferencedObjectExtractor extractor;
    private final ProjectDirectory projectDirectory;
    private final AppProperties.References settings;

    public ReferenceRenderingService(
        ReferenceTypeRegistry referenceTypeRegistry,
        ReferenceResolver referenceResolver,
        ReferenceLinkRenderer referenceLinkRenderer,
        ReferencedObjectExtractor referencedObjectExtractor,
        ObjectProvider<ProjectDirectory> projectDirectory,
        AppProperties appProperties
    ) {
        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                StrikethroughExtension.create(),
                TaskListExtension.create(),
                AutolinkExtension.create()
            ))
            .set(Parser.BLANK_LINES_IN_AST, false)
            .set(Parser.HTML_BLOCK_DEEP_PARSER, false)
            .set(HtmlRenderer.ESCAPE_HTML, true)
            .set(HtmlRenderer.SOFT_BREAK, "\n")
            .set(HtmlRenderer.HARD_BREAK, "<br />\n")
            .set(HtmlRenderer.FENCED_CODE_LANGUAGE_CLASS_PREFIX, "language-");

        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();
        this.rewriters = referenceTypeRegistry.types().stream()
            .map(type -> new ReferenceDocumentRewriter(type, referenceResolver, referenceLinkRenderer))
            .toList();
        this.extractor = referencedObjectExtractor;
        this.projectDirectory = projectDirectory.getIfAvailable(() -> projectPath -> Optional.empty());
        this.settings = appProperties.getReferences();

        logger.info("ReferenceRenderingService initialized for {} reference type(s)", rewriters.size());
    }

    /**
     * Renders markdown and links references relative to {@code ambientProject}.
     *
     * @param markdown markdown source
     * @param ambientProject project the document belongs to; null renders without linking
     * @return rendered HTML and the references it contains
     */
    public RenderedDocument render(String markdown, ResolvedProject ambientProject) {
        if (markdown == null || markdown.isEmpty()) {
            return new RenderedDocument("", List.of(), 0L);
        }
        long startTime = System.currentTimeMillis();

        String source = markdown;
        if (source.length() > settings.getMaxInputLength()) {
            logger.warn("Markdown input exceeds maximum length: {} > {}", source.length(), settings.getMaxInputLength());
            source = source.substring(0, settings.getMaxInputLength());
        }

        String html = renderer.render(parser.parse(source));
        return renderHtml(html, ambientProject, startTime);
    }

    /**
     * Links references in already rendered HTML.
     *
     * @param html HTML body fragment
     * @param ambientProject project the document belongs to; null returns the HTML unlinked
     * @return linked HTML and the references it contains
     */
    public RenderedDocument renderHtml(String html, ResolvedProject ambientProject) {
        if (html == null || html.isEmpty()) {
            return new RenderedDocument("", List.of(), 0L);
        }
        return renderHtml(html, ambientProject, System.currentTimeMillis());
    }

    /**
     * Runs every registered rewriter over {@code document} with one cache.
     *
     * @param document parsed document, mutated in place
     * @param ambientProject project the document belongs to; null leaves the document untouched
     * @param cache cache for this request, or {@link ReferenceCache#disabled()}
     * @return the same document
     */
    public Document rewrite(Document document, ResolvedProject ambientProject, ReferenceCache cache) {
        if (ambientProject == null || !settings.isEnabled()) {
            return document;
        }
        for (ReferenceDocumentRewriter rewriter : rewriters) {
            rewriter.rewrite(document, ambientProject, cache);
        }
        return document;
    }

    /**
     * @param fullPath project path, e.g. {@code group/project}
     * @return the project, or empty when the directory does not know it
     */
    public Optional<ResolvedProject> findProject(String fullPath) {
        if (fullPath == null || fullPath.isBlank()) {
            return Optional.empty();
        }
        return projectDirectory.findByFullPath(fullPath.trim());
    }

    public List<ReferenceType> referenceTypes() {
        return rewriters.stream().map(ReferenceDocumentRewriter::type).toList();
    }

    private RenderedDocument renderHtml(String html, ResolvedProject ambientProject, long startTime) {
        Document document = Jsoup.parseBodyFragment(html);
        document.outputSettings().prettyPrint(false);

        try (RequestReferenceCache cache = new RequestReferenceCache()) {
            rewrite(document, ambientProject, cache);
            List<LazyReference> references = extractor.extract(document.body());
            long processingTime = System.currentTimeMillis() - startTime;
            logger.debug("Rendered document in {}ms: {} references, {} store lookups",
                processingTime, references.size(), cache.loads());
            return new RenderedDocument(document.body().html(), references, processingTime);
        }
    }
}
