package com.libragraph.imagio.api;

import com.libragraph.imagio.core.catalog.ImageService;
import com.libragraph.imagio.core.dao.ImageRecord;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.List;

/**
 * Image metadata and upload endpoints.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class ImageResource {

    private static final Logger log = Logger.getLogger(ImageResource.class);

    @Inject
    ImageService images;

    @GET
    @Path("/images/{category}/{limit}/{skip}")
    public List<ImageRecord> list(@PathParam("category") String category,
                                  @PathParam("limit") int limit,
                                  @PathParam("skip") int skip) {
        log.debugf("Listing images: category=%s limit=%d skip=%d", category, limit, skip);
        return images.list(category, limit, skip);
    }

    @GET
    @Path("/image/{uuid}")
    public ImageRecord get(@PathParam("uuid") String uuid) {
        return images.get(uuid);
    }

    /** Raw image bytes in the request body; the type is sniffed from the content. */
    @PUT
    @Path("/images/{category}")
    @Consumes(MediaType.WILDCARD)
    public ImageRecord upload(@PathParam("category") String category, byte[] body) {
        return images.upload(category, body);
    }

    /** Form upload: the first file part is the image, whatever its field name. */
    @PUT
    @Path("/images/{category}")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public ImageRecord uploadForm(@PathParam("category") String category,
                                  @RestForm(FileUpload.ALL) List<FileUpload> parts) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("Multipart upload has no file part");
        }
        FileUpload part = parts.get(0);
        log.debugf("Form upload: category=%s field=%s file=%s", category, part.name(), part.fileName());
        byte[] body;
        try {
            body = Files.readAllBytes(part.uploadedFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded part " + part.name(), e);
        }
        return images.upload(category, body);
    }

    @DELETE
    @Path("/image/{uuid}")
    public Response delete(@PathParam("uuid") String uuid) {
        images.delete(uuid);
        return Response.noContent().build();
    }

    @POST
    @Path("/image/{uuid}/warm")
    public Response warm(@PathParam("uuid") String uuid) {
        images.warm(uuid);
        return Response.noContent().build();
    }
}
