package com.tandem.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;

@Serdeable
@Schema(description = "Notification from the storage collaborator that a resource's content was saved")
public record ContentUpdatedRequest(
    @NotBlank
    @Schema(description = "Resource whose content changed")
    String resourceId,

    @Nullable
    @Schema(description = "New revision marker, e.g. last-modified timestamp")
    String revision,

    @Nullable
    @Schema(description = "Display name of the resource")
    String name,

    @Nullable
    @Schema(description = "User who saved the change")
    String userId
) {}
