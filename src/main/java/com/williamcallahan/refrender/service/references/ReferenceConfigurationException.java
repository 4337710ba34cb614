package com.williamcallahan.refrender.service.references;

/**
 * Signals reference types that cannot be assembled from the configured grammars and sources.
 */
public class ReferenceConfigurationException extends IllegalStateException {

    /**
     * @param message description of the inconsistency
     */
    public ReferenceConfigurationException(String message) {
        super(message);
    }
}
