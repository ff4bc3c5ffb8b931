package com.onboarding.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.onboarding.core.model.StepSpec;

import java.util.Map;

/**
 * One step of a protocol in PUT /api/v1/protocols/{projectId} bodies and protocol responses.
 */
public record StepRequest(
    String kind,
    @JsonProperty("target_system") String targetSystem,
    Map<String, String> parameters,
    @JsonProperty("fatal_on_failure") Boolean fatalOnFailure
) {

    public StepSpec toStepSpec() {
        return new StepSpec(kind.trim(), targetSystem, parameters != null ? parameters : Map.of(),
                fatalOnFailure == null || fatalOnFailure);
    }

    public static StepRequest from(StepSpec spec) {
        return new StepRequest(spec.kind(), spec.targetSystem(), spec.parameters(), spec.fatalOnFailure());
    }
}
