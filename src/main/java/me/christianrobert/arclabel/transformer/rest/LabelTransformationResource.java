package me.christianrobert.arclabel.transformer.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.arclabel.transformer.context.TransformationResult;
import me.christianrobert.arclabel.transformer.model.LabelDefinition;
import me.christianrobert.arclabel.transformer.service.LabelTransformationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * REST endpoint for label expression transformation (ArcGIS → QGIS).
 *
 * <p>Usage:
 * <pre>
 * # Transform a VBScript label function
 * curl -X POST "http://localhost:8080/api/labels/expression" \
 *   -H "Content-Type: text/plain" \
 *   --data-binary @FindLabel.vbs
 *
 * # Transform an Arcade expression
 * curl -X POST "http://localhost:8080/api/labels/expression?engine=Arcade" \
 *   -H "Content-Type: text/plain" \
 *   --data 'return $feature.NAME + " m"'
 *
 * # Coded-value domain lookup
 * curl -X POST "http://localhost:8080/api/labels/domain?field=TYPE" \
 *   -H "Content-Type: application/json" \
 *   --data '{"A": "Apple", "B": "Banana"}'
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "qgisExpression": "\"Feet\" || ' ft'",
 *   "expression": true,
 *   "inputKind": "EXPRESSION",
 *   "errorMessage": null
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200 for transformations. Check "success" field in response.
 * Transformation failure is a valid business outcome, not an HTTP error.
 */
@Path("/api/labels")
@Produces(MediaType.APPLICATION_JSON)
public class LabelTransformationResource {

    private static final Logger log = LoggerFactory.getLogger(LabelTransformationResource.class);

    @Inject
    LabelTransformationService labelTransformationService;

    /**
     * Transforms one label expression.
     *
     * @param engine Expression engine (VBScript when omitted)
     * @param labelText Expression text (text/plain body)
     */
    @POST
    @Path("/expression")
    @Consumes(MediaType.TEXT_PLAIN)
    public TransformationResult transformExpression(
            @QueryParam("engine") @DefaultValue("VBScript") String engine,
            String labelText
    ) {
        log.info("Label transformation request received via REST API (engine={})", engine);
        log.trace("Label text: {}", labelText);

        TransformationResult result = labelTransformationService.transform(new LabelDefinition(null, labelText, engine));

        if (result.isSuccess()) {
            log.info("Label transformation succeeded");
        } else {
            log.warn("Label transformation failed: {}", result.getErrorMessage());
        }
        return result;
    }

    /**
     * Transforms several label classes; each result reports its own success.
     */
    @POST
    @Path("/batch")
    @Consumes(MediaType.APPLICATION_JSON)
    public List<TransformationResult> transformBatch(List<LabelDefinition> definitions) {
        if (definitions == null) {
            return List.of();
        }
        log.info("Batch label transformation request with {} definitions", definitions.size());
        return labelTransformationService.transformAll(definitions);
    }

    /**
     * Builds the CASE lookup for a coded-value domain.
     *
     * @param field Field carrying the codes
     * @param codedValues Code → description
     */
    @POST
    @Path("/domain")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response transformDomain(@QueryParam("field") String field, Map<String, String> codedValues) {
        if (field == null || field.trim().isEmpty()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Query parameter 'field' is required"))
                    .build();
        }

        String expression = labelTransformationService.transformDomain(field, codedValues);
        if (expression == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Domain for field " + field + " has no coded values"))
                    .build();
        }
        return Response.ok(Map.of("field", field, "expression", expression)).build();
    }

    /**
     * Display expression for a layer's display field.
     */
    @GET
    @Path("/display-field/{field}")
    public Response displayField(@PathParam("field") String field) {
        String expression = labelTransformationService.displayFieldExpression(field);
        if (expression == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Display field name is required"))
                    .build();
        }
        return Response.ok(Map.of("field", field, "expression", expression)).build();
    }
}
