package me.christianrobert.vbs2js.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.vbs2js.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads and changes the transpiler settings (indent, header, post-processing switches).
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigResource {

    private static final Logger log = LoggerFactory.getLogger(ConfigResource.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");

        Map<String, Object> config = configService.getAllConfiguration();
        return Response.ok(config).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", "Configuration body must not be empty"))
                    .build();
        }
        log.info("Saving configuration with {} entries", config.size());

        try {
            configService.updateConfiguration(config);

            Map<String, String> response = new HashMap<>();
            response.put("status", "success");
            response.put("message", "Configuration saved successfully");

            return Response.ok(response).build();
        } catch (Exception e) {
            log.error("Error saving configuration", e);

            Map<String, String> errorResponse = new HashMap<>();
            errorResponse.put("status", "error");
            errorResponse.put("message", "Failed to save configuration: " + e.getMessage());

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResponse)
                    .build();
        }
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

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");

        try {
            configService.resetToDefaults();

            Map<String, String> response = new HashMap<>();
            response.put("status", "success");
            response.put("message", "Configuration reset to defaults successfully");

            return Response.ok(response).build();
        } catch (Exception e) {
            log.error("Error resetting configuration", e);

            Map<String, String> errorResponse = new HashMap<>();
            errorResponse.put("status", "error");
            errorResponse.put("message", "Failed to reset configuration: " + e.getMessage());

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResponse)
                    .build();
        }
    }
}
