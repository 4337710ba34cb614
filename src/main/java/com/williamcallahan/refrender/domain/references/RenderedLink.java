package com.williamcallahan.refrender.domain.references;

import org.jsoup.nodes.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Replacement markup for one resolved reference.
 *
 * @param href link destination
 * @param text visible link text
 * @param title tooltip title
 * @param cssClasses classes in output order
 * @param dataAttributes {@code data-*} attributes keyed without the prefix, in output order
 */
public record RenderedLink(
    String href,
    String text,
    String title,
    List<String> cssClasses,
    Map<String, String> dataAttributes
) {

    public RenderedLink {
        Objects.requireNonNull(href, "Link href cannot be null");
        Objects.requireNonNull(text, "Link text cannot be null");
        Objects.requireNonNull(title, "Link title cannot be null");
        cssClasses = List.copyOf(cssClasses);
        dataAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(dataAttributes));
    }

    /**
     * Builds the anchor element. Attribute values and text are escaped by jsoup on output.
     *
     * @return detached {@code <a>} element
     */
    public Element toElement() {
        Element anchor = new Element("a");
        anchor.attr("href", href);
        dataAttributes.forEach((key, value) -> anchor.attr("data-" + key, value));
        anchor.attr("title", title);
        anchor.attr("class", String.join(" ", cssClasses));
        anchor.text(text);
        return anchor;
    }
}
