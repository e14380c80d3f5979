package com.tandem.controller;

import com.tandem.domain.ResourceKey;
import com.tandem.protocol.PresenceUser;
import com.tandem.service.PresenceService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;

import java.util.List;

@Controller("/api/v1/{domain}/resources/{resourceId}/presence")
@Tag(name = "presence")
public class PresenceController {

    @Inject
    PresenceService presenceService;

    @Get
    @Operation(summary = "Users and agents currently joined to the resource")
    public HttpResponse<List<PresenceUser>> list(String domain, String resourceId) {
        return HttpResponse.ok(presenceService.members(ResourceKey.of(domain, resourceId)));
    }
}
