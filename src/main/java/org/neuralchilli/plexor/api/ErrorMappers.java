package org.neuralchilli.plexor.api;

import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;
import org.neuralchilli.plexor.service.ConflictException;
import org.neuralchilli.plexor.service.ResourceNotFoundException;
import org.neuralchilli.plexor.service.ValidationException;

/**
 * Maps service exceptions to HTTP statuses with a JSON error body.
 */
public class ErrorMappers {

    @ServerExceptionMapper
    public Response notFound(ResourceNotFoundException e) {
        return error(Response.Status.NOT_FOUND, e.getMessage());
    }

    @ServerExceptionMapper
    public Response conflict(ConflictException e) {
        return error(Response.Status.CONFLICT, e.getMessage());
    }

    @ServerExceptionMapper
    public Response badRequest(IllegalArgumentException e) {
        return error(Response.Status.BAD_REQUEST, e.getMessage());
    }

    @ServerExceptionMapper
    public Response invalid(ValidationException e) {
        return error(Response.Status.BAD_REQUEST, e.getMessage());
    }

    private Response error(Response.Status status, String message) {
        return Response.status(status)
                .entity(new ErrorResponse(message))
                .type("application/json")
                .build();
    }
}
