package com.williamcallahan.refrender.web;

/**
 * Request body for reference rendering.
 *
 * @param content markdown to render
 * @param project full path of the project the markdown belongs to; blank renders without links
 */
public record ReferenceRenderRequest(String content, String project) {}
