package me.christianrobert.arclabel.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.arclabel.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * REST endpoints for reading and changing transformer settings.
 *
 * <p>Invalid keys or values are answered with 400 and an {@code error} field.</p>
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting label configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return badRequest("Request body must contain at least one setting");
        }
        log.info("Saving label configuration with {} entries", config.size());

        try {
            configService.updateConfiguration(config);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected configuration update: {}", e.getMessage());
            return badRequest(e.getMessage());
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("configuration", configService.getAllConfiguration());
        return Response.ok(response).build();
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || !body.containsKey("value")) {
            return badRequest("Request body must contain 'value' field");
        }

        Object value = body.get("value");
        try {
            configService.setConfigValue(key, value);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected config value for {}: {}", key, e.getMessage());
            return badRequest(e.getMessage());
        }

        return Response.ok(Map.of("status", "success", "key", key, "value", value)).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        configService.resetToDefaults();
        return Response.ok(Map.of("status", "success", "configuration", configService.getAllConfiguration())).build();
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("error", message))
                .build();
    }
}
