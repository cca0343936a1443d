package com.libragraph.imagio.api;

import com.libragraph.imagio.core.catalog.ImageService;
import com.libragraph.imagio.core.image.ImageTypes;
import com.libragraph.imagio.types.Variant;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

/**
 * Serves image bytes: {@code GET /{uuid}/{variant}}.
 */
@Path("/{uuid}/{variant}")
public class VariantResource {

    private static final Logger log = Logger.getLogger(VariantResource.class);

    @Inject
    ImageService images;

    @GET
    public Response render(@PathParam("uuid") String uuid, @PathParam("variant") String variantLabel) {
        Variant variant = Variant.fromLabel(variantLabel);
        log.debugf("Requesting image %s variant %s", uuid, variant);
        byte[] body = images.render(uuid, variant);
        return Response.ok(body, ImageTypes.detect(body)).build();
    }
}
