package me.christianrobert.vbs2js.transformer.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.vbs2js.transformer.context.TranspilationResult;
import me.christianrobert.vbs2js.transformer.service.TranspilationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint for VBScript to JavaScript transpilation.
 *
 * <p>Usage:
 * <pre>
 * curl -X POST "http://localhost:8080/api/transpile" \
 *   -H "Content-Type: text/plain" \
 *   --data-binary @legacy.vbs
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "vbScript": "...",
 *   "javaScript": "...",
 *   "diagnostics": { "messages": [...], ... },
 *   "functionCatalog": [...],
 *   "containerCatalog": [...],
 *   "residualKeywords": [],
 *   "errorMessage": null
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * A parse failure is a valid business outcome, not an HTTP error.
 */
@Path("/api/transpile")
@Produces(MediaType.APPLICATION_JSON)
public class TranspilationResource {

    private static final Logger log = LoggerFactory.getLogger(TranspilationResource.class);

    @Inject
    TranspilationService transpilationService;

    /**
     * Transpiles a complete VBScript program.
     *
     * @param vbScript VBScript source (text/plain body)
     * @return TranspilationResult as JSON (always HTTP 200, check "success" field)
     */
    @POST
    @Consumes(MediaType.TEXT_PLAIN)
    public TranspilationResult transpile(String vbScript) {
        log.info("Transpilation request received via REST API");
        log.trace("VBScript: {}", vbScript);

        if (vbScript == null || vbScript.trim().isEmpty()) {
            log.warn("Empty VBScript received");
            return TranspilationResult.failure("", "VBScript source cannot be empty");
        }

        TranspilationResult result;
        try {
            result = transpilationService.transpile(vbScript);
        } catch (Exception e) {
            log.error("Transpilation failed", e);
            return TranspilationResult.failure(vbScript, "Transpilation error: " + e.getMessage());
        }

        if (result.isSuccess()) {
            log.info("Transpilation succeeded");
            log.debug("JavaScript: {}", result.getJavaScript());
        } else {
            log.warn("Transpilation failed: {}", result.getErrorMessage());
        }

        return result;
    }
}
