package com.libragraph.imagio.api;

import com.libragraph.imagio.core.storage.StorageNamespaces;
import com.libragraph.imagio.core.variant.VariantSettings;
import com.libragraph.imagio.types.Dimensions;
import com.libragraph.imagio.types.Variant;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness ping plus a snapshot of how this instance is wired: which backend
 * serves each storage namespace and how variants are rendered.
 */
@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    StorageNamespaces storage;

    @Inject
    VariantSettings variantSettings;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Imagio is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", appName);
        info.put("version", appVersion);
        info.put("java", System.getProperty("java.version"));
        info.put("profile", profile);
        info.put("storage", Map.of(
                StorageNamespaces.ORIGINALS, storage.originals().toString(),
                StorageNamespaces.DERIVATIVES, storage.derivatives().toString()));
        info.put("rendering", Map.of(
                "deduplicate", variantSettings.deduplicate(),
                "writeThroughFailure", variantSettings.writeThroughFailure().label(),
                "jpegQuality", variantSettings.jpegQuality()));
        info.put("variants", Arrays.stream(Variant.values()).map(Variant::label).toList());
        return info;
    }

    /** Target box per derived variant; embed reports its width cap only. */
    @GET
    @Path("/variants")
    public Map<String, String> variants() {
        Map<String, String> boxes = new LinkedHashMap<>();
        for (Variant variant : Variant.derived()) {
            boxes.put(variant.label(), variant == Variant.EMBED
                    ? "width<=" + Variant.EMBED_MAX_WIDTH
                    : variant.targetBox(Dimensions.of(1, 1)).toString());
        }
        return boxes;
    }
}
