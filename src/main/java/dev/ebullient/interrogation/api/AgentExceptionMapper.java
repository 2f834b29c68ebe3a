package dev.ebullient.interrogation.api;

import java.util.Map;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import dev.ebullient.interrogation.AgentException;
import io.quarkus.logging.Log;

/**
 * Maps {@link AgentException} kinds to HTTP statuses with a JSON error body.
 */
public class AgentExceptionMapper {

    @ServerExceptionMapper
    public Response handleAgentException(AgentException e) {
        Response.Status status = statusFor(e.kind());
        if (status.getStatusCode() >= 500) {
            Log.errorf(e, "%s: %s", e.kind(), e.getMessage());
        } else {
            Log.debugf("%s: %s", e.kind(), e.getMessage());
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", e.getMessage() == null ? e.kind().name() : e.getMessage()))
                .build();
    }

    static Response.Status statusFor(AgentException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND -> Response.Status.NOT_FOUND;
            case BAD_INPUT -> Response.Status.BAD_REQUEST;
            case INVALID_AGENT_STATE -> Response.Status.INTERNAL_SERVER_ERROR;
            case UNAVAILABLE -> Response.Status.SERVICE_UNAVAILABLE;
        };
    }
}
