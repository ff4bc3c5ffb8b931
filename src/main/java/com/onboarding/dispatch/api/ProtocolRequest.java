package com.onboarding.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for PUT /api/v1/protocols/{projectId}.
 *
 * @param steps     the new ordered step list; must not be empty
 * @param updatedBy who is replacing the protocol; nullable, defaults to "api"
 */
public record ProtocolRequest(
    List<StepRequest> steps,
    @JsonProperty("updated_by") String updatedBy
) {}
