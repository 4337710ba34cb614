package com.williamcallahan.refrender.config;

import com.williamcallahan.refrender.support.AsciiTextNormalizer;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private References references = new References();

    public References getReferences() {
        return references;
    }

    public void setReferences(References references) {
        this.references = references;
    }

    /**
     * Rejects settings the renderer cannot work with. Runs once the properties are bound.
     *
     * @throws IllegalArgumentException when a setting is out of range or a grammar is unusable
     */
    @PostConstruct
    public void validateConfiguration() {
        if (references.getMaxInputLength() <= 0) {
            throw new IllegalArgumentException("app.references.max-input-length must be positive");
        }
        Pattern noteAnchor = compile("app.references.note-anchor-pattern", references.getNoteAnchorPattern());
        if (noteAnchor == null || noteAnchor.matcher("").groupCount() < 1) {
            throw new IllegalArgumentException("app.references.note-anchor-pattern must capture the note number");
        }
        references.getTypes().forEach((objectName, type) -> type.validate(objectName));
    }

    static Pattern compile(String property, String regex) {
        if (regex == null || regex.isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException invalidRegex) {
            throw new IllegalArgumentException(property + " is not a valid pattern: " + invalidRegex.getDescription(),
                invalidRegex);
        }
    }

    public static class References {
        private boolean enabled = true;
        private int maxInputLength = 100_000;
        private String noteAnchorPattern = "#note_(\\d+)";
        private Map<String, TypeGrammar> types = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxInputLength() { return maxInputLength; }
        public void setMaxInputLength(int maxInputLength) { this.maxInputLength = maxInputLength; }

        public String getNoteAnchorPattern() { return noteAnchorPattern; }
        public void setNoteAnchorPattern(String noteAnchorPattern) { this.noteAnchorPattern = noteAnchorPattern; }

        public Map<String, TypeGrammar> getTypes() { return types; }
        public void setTypes(Map<String, TypeGrammar> types) { this.types = types; }
    }

    /**
     * Grammars and naming for one object type, keyed by its snake case object name.
     */
    public static class TypeGrammar {
        private String displayName;
        private String shortPattern;
        private String linkPattern;

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getShortPattern() { return shortPattern; }
        public void setShortPattern(String shortPattern) { this.shortPattern = shortPattern; }

        public String getLinkPattern() { return linkPattern; }
        public void setLinkPattern(String linkPattern) { this.linkPattern = linkPattern; }

        public Pattern compiledShortPattern(String objectName) {
            return compile(property(objectName, "short-pattern"), shortPattern);
        }

        public Pattern compiledLinkPattern(String objectName) {
            return compile(property(objectName, "link-pattern"), linkPattern);
        }

        void validate(String objectName) {
            String idGroup = "(?<" + AsciiTextNormalizer.toCamelCase(objectName) + ">";
            if (compiledShortPattern(objectName) != null && !shortPattern.contains(idGroup)) {
                throw new IllegalArgumentException(property(objectName, "short-pattern") + " must declare " + idGroup);
            }
            if (compiledLinkPattern(objectName) != null && !linkPattern.contains(idGroup)) {
                throw new IllegalArgumentException(property(objectName, "link-pattern") + " must declare " + idGroup);
            }
        }

        private static String property(String objectName, String key) {
            return "app.references.types." + objectName + "." + key;
        }
    }
}
