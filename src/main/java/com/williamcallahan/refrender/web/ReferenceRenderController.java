package com.williamcallahan.refrender.web;

import com.williamcallahan.refrender.domain.references.RenderedDocument;
import com.williamcallahan.refrender.domain.references.ResolvedProject;
import com.williamcallahan.refrender.service.references.ReferenceRenderingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller that renders markdown with references linked.
 */
@RestController
@RequestMapping("/api/references")
public class ReferenceRenderController {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceRenderController.class);

    private final ReferenceRenderingService renderingService;
    private final ExceptionResponseBuilder exceptionBuilder;

    public ReferenceRenderController(ReferenceRenderingService renderingService, ExceptionResponseBuilder exceptionBuilder) {
        this.renderingService = renderingService;
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Renders markdown in the context of a project.
     *
     * @param request A JSON object with the markdown and the project path. Expected format:
     *                <pre>{@code
     *                  {
     *                    "content": "Fixed in !42",
     *                    "project": "group/project"
     *                  }
     *                }</pre>
     * @return rendered HTML and the references it links. An unknown or missing project renders
     *         the markdown without links.
     */
    @PostMapping(value = "/render",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReferenceRenderResponse> render(@RequestBody ReferenceRenderRequest request) {
        if (request == null || request.content() == null) {
            throw new IllegalArgumentException("content is required");
        }
        ResolvedProject ambientProject = renderingService.findProject(request.project()).orElse(null);
        if (ambientProject == null) {
            logger.debug("No project '{}'; rendering without reference links", request.project());
        }

        RenderedDocument rendered = renderingService.render(request.content(), ambientProject);
        return ResponseEntity.ok(ReferenceRenderResponse.from(rendered));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidRequest(IllegalArgumentException invalidRequest) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, invalidRequest.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException unreadableBody) {
        logger.debug("Rejecting unreadable render request", unreadableBody);
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Request body must be a JSON object");
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiErrorResponse> handleRenderFailure(RuntimeException renderFailure) {
        logger.error("Error rendering references", renderFailure);
        return exceptionBuilder.buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR, "Failed to render references", renderFailure);
    }
}
