package com.onboarding.core.model;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable step of an onboarding protocol.
 *
 * @param kind           capability that executes the step (e.g. "chat-provision")
 * @param targetSystem   downstream system the step acts on (e.g. "google-chat")
 * @param parameters     step-specific parameters; never null
 * @param fatalOnFailure whether a failure of this step aborts the mission
 */
public record StepSpec(
    String kind,
    String targetSystem,
    Map<String, String> parameters,
    boolean fatalOnFailure
) implements Serializable {

    public StepSpec {
        Objects.requireNonNull(kind, "kind must not be null");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public String parameter(String name) {
        return parameters.get(name);
    }
}
