package com.williamcallahan.refrender.config;

import com.williamcallahan.refrender.domain.references.ProjectDirectory;
import com.williamcallahan.refrender.domain.references.ReferenceObjectSource;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import com.williamcallahan.refrender.service.references.ReferenceConfigurationException;
import com.williamcallahan.refrender.service.references.ReferenceLinkRenderer;
import com.williamcallahan.refrender.service.references.ReferenceResolver;
import com.williamcallahan.refrender.service.references.ReferenceTypeRegistry;
import com.williamcallahan.refrender.service.references.ReferencedObjectExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Assembles reference types from configured grammars and the object sources the host
 * application registers. A configured type without a source is skipped with a warning.
 */
@Configuration
public class ReferenceTypeConfig {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceTypeConfig.class);

    /**
     * Builds the registry of reference types in configuration order.
     *
     * @param appProperties bound application properties
     * @param sources object sources provided by the host application
     * @return type registry
     */
    @Bean
    public ReferenceTypeRegistry referenceTypeRegistry(
        AppProperties appProperties,
        ObjectProvider<ReferenceObjectSource> sources
    ) {
        Map<String, ReferenceObjectSource> sourcesByName = new LinkedHashMap<>();
        sources.orderedStream().forEach(source -> {
            if (sourcesByName.putIfAbsent(source.objectName(), source) != null) {
                throw new ReferenceConfigurationException(
                    "More than one object source registered for " + source.objectName());
            }
        });

        List<ReferenceType> types = new ArrayList<>();
        appProperties.getReferences().getTypes().forEach((objectName, grammar) -> {
            ReferenceObjectSource source = sourcesByName.get(objectName);
            if (source == null) {
                logger.warn("No object source registered for reference type '{}'; skipping it", objectName);
                return;
            }
            types.add(new ReferenceType(
                objectName,
                Optional.ofNullable(grammar.getDisplayName()).orElseGet(() -> titleize(objectName)),
                grammar.compiledShortPattern(objectName),
                grammar.compiledLinkPattern(objectName),
                source
            ));
        });

        logger.info("Registered {} reference type(s): {}", types.size(),
            types.stream().map(ReferenceType::objectName).toList());
        return new ReferenceTypeRegistry(types);
    }

    /**
     * Uses the host's project directory, or one that knows no projects so that only ambient
     * references resolve.
     *
     * @param projectDirectory directory provided by the host application, if any
     * @return reference resolver
     */
    @Bean
    public ReferenceResolver referenceResolver(ObjectProvider<ProjectDirectory> projectDirectory) {
        return new ReferenceResolver(projectDirectory.getIfAvailable(() -> projectToken -> Optional.empty()));
    }

    @Bean
    public ReferenceLinkRenderer referenceLinkRenderer(AppProperties appProperties) {
        return new ReferenceLinkRenderer(Pattern.compile(appProperties.getReferences().getNoteAnchorPattern()));
    }

    @Bean
    public ReferencedObjectExtractor referencedObjectExtractor(ReferenceTypeRegistry referenceTypeRegistry) {
        return new ReferencedObjectExtractor(referenceTypeRegistry);
    }

    static String titleize(String objectName) {
        StringBuilder title = new StringBuilder(objectName.length());
        boolean upperNext = true;
        for (int index = 0; index < objectName.length(); index++) {
            char current = objectName.charAt(index);
            if (current == '_' || current == '-') {
                title.append(' ');
                upperNext = true;
                continue;
            }
            title.append(upperNext ? Character.toUpperCase(current) : current);
            upperNext = false;
        }
        return title.toString();
    }
}
