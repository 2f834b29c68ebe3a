package dev.ebullient.interrogation.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import jakarta.ws.rs.core.Response;

import org.junit.jupiter.api.Test;

import dev.ebullient.interrogation.AgentException;

class AgentExceptionMapperTest {

    @Test
    void statusFor_eachKind() {
        assertEquals(Response.Status.NOT_FOUND, AgentExceptionMapper.statusFor(AgentException.Kind.NOT_FOUND));
        assertEquals(Response.Status.BAD_REQUEST, AgentExceptionMapper.statusFor(AgentException.Kind.BAD_INPUT));
        assertEquals(Response.Status.INTERNAL_SERVER_ERROR,
                AgentExceptionMapper.statusFor(AgentException.Kind.INVALID_AGENT_STATE));
        assertEquals(Response.Status.SERVICE_UNAVAILABLE,
                AgentExceptionMapper.statusFor(AgentException.Kind.UNAVAILABLE));
    }
}
