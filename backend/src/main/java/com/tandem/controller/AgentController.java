package com.tandem.controller;

import com.tandem.domain.ResourceKey;
import com.tandem.dto.*;
import com.tandem.protocol.PresenceUser;
import com.tandem.service.BroadcastService;
import com.tandem.service.BroadcastService.StreamSession;
import com.tandem.service.PresenceService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.*;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

import java.util.List;

/**
 * REST surface for autonomous agents that have no socket: they join
 * presence, move a cursor, stream output and push full-content writes.
 * Agent presence is kept alive by heartbeats and swept when they stop.
 */
@Controller("/api/v1")
@Validated
@Tag(name = "agents")
public class AgentController {

    private static final String DEFAULT_AGENT = "Agent";

    @Inject PresenceService presenceService;
    @Inject BroadcastService broadcastService;

    @Post("/{domain}/resources/{resourceId}/agents")
    @Operation(summary = "Join a resource as an agent")
    public HttpResponse<List<PresenceUser>> join(String domain, String resourceId, @Valid @Body AgentJoinRequest req) {
        ResourceKey key = ResourceKey.of(domain, resourceId);
        String agentName = req.agentName() != null ? req.agentName() : DEFAULT_AGENT;
        String username = req.username() != null ? req.username() : agentName;
        return HttpResponse.ok(presenceService.join(key, req.userId(), username, connectionId(req.userId()), agentName));
    }

    @Delete("/{domain}/resources/{resourceId}/agents/{userId}")
    @Operation(summary = "Leave a resource as an agent")
    public HttpResponse<Void> leave(String domain, String resourceId, String userId) {
        if (!presenceService.leave(ResourceKey.of(domain, resourceId), userId, true)) {
            throw new HttpStatusException(HttpStatus.NOT_FOUND, "Agent not joined: " + userId);
        }
        return HttpResponse.noContent();
    }

    @Post("/{domain}/resources/{resourceId}/agents/{userId}/heartbeat")
    @Operation(summary = "Keep agent presence alive")
    public HttpResponse<Void> heartbeat(String domain, String resourceId, String userId) {
        if (!presenceService.heartbeat(ResourceKey.of(domain, resourceId), connectionId(userId))) {
            throw new HttpStatusException(HttpStatus.NOT_FOUND, "Agent not joined: " + userId);
        }
        return HttpResponse.noContent();
    }

    @Post("/{domain}/resources/{resourceId}/agents/{userId}/cursor")
    @Operation(summary = "Move the agent's cursor")
    public HttpResponse<Void> cursor(String domain, String resourceId, String userId,
                                     @Valid @Body AgentCursorRequest req) {
        broadcastService.cursor(ResourceKey.of(domain, resourceId), connectionId(userId),
            req.line(), req.column(), req.position(), null, null);
        return HttpResponse.accepted();
    }

    @Put("/{domain}/resources/{resourceId}/agents/{userId}/content")
    @Operation(summary = "Push a full-content write to everyone in the room")
    public HttpResponse<Void> write(String domain, String resourceId, String userId,
                                    @Valid @Body AgentContentRequest req) {
        broadcastService.sync(ResourceKey.of(domain, resourceId), req.content(), req.revision());
        return HttpResponse.accepted();
    }

    // ── Streaming ───────────────────────────────────────────────────────────

    @Post("/{domain}/resources/{resourceId}/streams")
    @Operation(summary = "Open a streaming session")
    public HttpResponse<StreamSessionResponse> startStream(String domain, String resourceId,
                                                           @Valid @Body StreamStartRequest req) {
        String agentName = req.agentName() != null ? req.agentName() : DEFAULT_AGENT;
        StreamSession session = broadcastService.startStream(ResourceKey.of(domain, resourceId), req.userId(),
            req.username() != null ? req.username() : agentName, agentName, req.position());
        return HttpResponse.created(toResponse(session));
    }

    @Post("/streams/{sessionId}/chunks")
    @Operation(summary = "Stream a chunk of text")
    public HttpResponse<StreamSessionResponse> chunk(String sessionId, @Valid @Body StreamChunkRequest req) {
        broadcastService.streamChunk(sessionId, req.text(), req.position());
        return HttpResponse.ok(broadcastService.findStream(sessionId).map(this::toResponse)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "Stream session not found: " + sessionId)));
    }

    @Delete("/streams/{sessionId}")
    @Operation(summary = "End a streaming session")
    public HttpResponse<StreamSessionResponse> endStream(String sessionId) {
        return HttpResponse.ok(toResponse(broadcastService.endStream(sessionId)));
    }

    private StreamSessionResponse toResponse(StreamSession s) {
        return new StreamSessionResponse(s.id(), s.key().domain().wireName(), s.key().resourceId(),
            s.agentName(), s.startPosition(), s.currentPosition(), s.active());
    }

    static String connectionId(String userId) {
        return "agent:" + userId;
    }
}
