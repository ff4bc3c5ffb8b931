package com.onboarding.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.onboarding.core.model.Protocol;

import java.util.List;

public record ProtocolResponse(
    @JsonProperty("project_id") String projectId,
    int version,
    List<StepRequest> steps,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("created_at") String createdAt
) {

    public static ProtocolResponse from(Protocol protocol) {
        return new ProtocolResponse(
                protocol.projectId(),
                protocol.version(),
                protocol.steps().stream().map(StepRequest::from).toList(),
                protocol.createdBy(),
                protocol.createdAt() != null ? protocol.createdAt().toString() : null);
    }
}
