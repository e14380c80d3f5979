package com.tandem.controller;

import com.tandem.dto.ContentUpdatedRequest;
import com.tandem.protocol.Domain;
import com.tandem.service.ChangeFeedService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

/** Inbound hooks the storage collaborator calls after committing a change. */
@Controller("/api/v1/{domain}/events")
@Validated
@Tag(name = "events")
public class StorageEventController {

    @Inject
    ChangeFeedService changeFeedService;

    @Post("/tree-changed")
    @Operation(summary = "Signal that the domain tree changed")
    public HttpResponse<Void> treeChanged(String domain) {
        changeFeedService.treeChanged(Domain.fromWire(domain));
        return HttpResponse.accepted();
    }

    @Post("/content-updated")
    @Operation(summary = "Signal that a resource's content was saved")
    public HttpResponse<Void> contentUpdated(String domain, @Valid @Body ContentUpdatedRequest req) {
        changeFeedService.contentUpdated(Domain.fromWire(domain), req.resourceId(), req.revision(),
            req.name(), req.userId());
        return HttpResponse.accepted();
    }
}
