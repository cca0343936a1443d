package com.libragraph.imagio.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * JSON error payload shared by the exception mappers.
 */
public record ErrorBody(int status, String error) {

    static Response response(Response.Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorBody(status.getStatusCode(), message))
                .build();
    }
}
