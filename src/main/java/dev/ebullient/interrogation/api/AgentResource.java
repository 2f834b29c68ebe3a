package dev.ebullient.interrogation.api;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.resteasy.reactive.RestPath;
import org.jboss.resteasy.reactive.RestQuery;

import com.fasterxml.jackson.annotation.JsonAlias;

import dev.ebullient.interrogation.AgentException;
import dev.ebullient.interrogation.ConversationEngine;
import dev.ebullient.interrogation.model.HistoryPage;
import dev.ebullient.interrogation.model.MessageReply;
import io.quarkus.logging.Log;

@ApplicationScoped
@Path("/api/agents")
public class AgentResource {

    public record SpawnRequest(
            @JsonAlias("story_id") String storyId,
            @JsonAlias("character_id") String characterId) {
    }

    public record SpawnResponse(String agentId) {
    }

    public record MessageRequest(
            String message,
            @JsonAlias("presented_evidence") List<String> presentedEvidence,
            @JsonAlias("location_id") String locationId) {
    }

    @Inject
    ConversationEngine engine;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response spawn(SpawnRequest request) {
        if (request == null) {
            throw AgentException.badInput("Request body is required");
        }
        String agentId = engine.spawn(request.storyId(), request.characterId());
        return Response.status(Response.Status.CREATED).entity(new SpawnResponse(agentId)).build();
    }

    @POST
    @Path("/{agentId}/messages")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public MessageReply message(@RestPath String agentId, MessageRequest request) {
        if (request == null) {
            throw AgentException.badInput("Request body is required");
        }
        Log.debugf("Message for agent %s (location=%s, evidence=%s)", agentId, request.locationId(),
                request.presentedEvidence());
        return engine.sendMessage(agentId, request.message(), request.presentedEvidence(), request.locationId());
    }

    @GET
    @Path("/{agentId}/history")
    @Produces(MediaType.APPLICATION_JSON)
    public HistoryPage history(@RestPath String agentId,
            @RestQuery Integer limit,
            @RestQuery Integer offset,
            @RestQuery("include_full") boolean includeFull) {
        return engine.history(agentId,
                limit == null ? 0 : limit,
                offset == null ? 0 : offset,
                includeFull);
    }
}
