package com.williamcallahan.refrender.domain.references;

/**
 * A domain object that can be the target of a rendered reference, such as an issue or merge request.
 * Instances are owned by the external store and looked up through a {@link ReferenceObjectSource}.
 */
public interface ReferableObject {

    /**
     * @return store-wide identifier of this object, written to the type's data attribute
     */
    long id();

    /**
     * @return human readable title used in the rendered link title
     */
    String title();
}
