package com.libragraph.imagio.api;

import com.libragraph.imagio.core.catalog.ImageNotFoundException;
import com.libragraph.imagio.core.image.ImageDecodeException;
import com.libragraph.imagio.core.storage.ObjectNotFoundException;
import com.libragraph.imagio.core.storage.StorageConfigException;
import com.libragraph.imagio.core.storage.StorageException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps the core error taxonomy to HTTP: not found is 404, bad input is 400,
 * backend and configuration failures are 500.
 */
public final class ErrorMappers {

    private static final Logger log = Logger.getLogger(ErrorMappers.class);

    private ErrorMappers() {
    }

    @Provider
    public static class ImageNotFound implements ExceptionMapper<ImageNotFoundException> {
        @Override
        public Response toResponse(ImageNotFoundException e) {
            return ErrorBody.response(Response.Status.NOT_FOUND, e.getMessage());
        }
    }

    @Provider
    public static class ObjectNotFound implements ExceptionMapper<ObjectNotFoundException> {
        @Override
        public Response toResponse(ObjectNotFoundException e) {
            // record exists, bytes do not
            log.warnf("Missing stored object: %s", e.getMessage());
            return ErrorBody.response(Response.Status.NOT_FOUND, "Not found");
        }
    }

    @Provider
    public static class Decode implements ExceptionMapper<ImageDecodeException> {
        @Override
        public Response toResponse(ImageDecodeException e) {
            return ErrorBody.response(Response.Status.BAD_REQUEST, e.getMessage());
        }
    }

    @Provider
    public static class BadInput implements ExceptionMapper<IllegalArgumentException> {
        @Override
        public Response toResponse(IllegalArgumentException e) {
            return ErrorBody.response(Response.Status.BAD_REQUEST, e.getMessage());
        }
    }

    @Provider
    public static class Storage implements ExceptionMapper<StorageException> {
        @Override
        public Response toResponse(StorageException e) {
            log.error("Storage failure", e);
            return ErrorBody.response(Response.Status.INTERNAL_SERVER_ERROR, "Storage error");
        }
    }

    @Provider
    public static class Config implements ExceptionMapper<StorageConfigException> {
        @Override
        public Response toResponse(StorageConfigException e) {
            log.error("Storage misconfigured", e);
            return ErrorBody.response(Response.Status.INTERNAL_SERVER_ERROR, "Configuration error");
        }
    }
}
