package com.onboarding.core.protocol;

import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.Protocol;
import com.onboarding.core.model.StepSpec;

import java.util.List;
import java.util.Optional;

/**
 * Gateway to the onboarding protocol definitions, keyed by project id.
 * <p>
 * Implementations guarantee first-writer-wins on {@link #create}: when two
 * callers create a protocol for the same project, exactly one succeeds and
 * the other receives {@link ProtocolAlreadyExistsException}.
 * Unavailability of the backing store is signalled with
 * {@link ProtocolStoreUnavailableException}.
 */
public interface ProtocolStore {

    /**
     * Returns the current version of the project's protocol, or empty when none exists.
     */
    Optional<Protocol> get(String projectId, MissionContext context);

    /**
     * Stores version 1 of a protocol for a project that has none.
     *
     * @throws ProtocolAlreadyExistsException if a protocol already exists for the project
     * @throws InvalidProtocolException if the steps are rejected by the store's {@link ProtocolValidator}
     */
    Protocol create(String projectId, List<StepSpec> steps, MissionContext context);

    /**
     * Stores a new version of an existing protocol. Missions bound to older versions are unaffected.
     *
     * @throws ProtocolNotFoundException if the project has no protocol yet
     * @throws ProtocolConflictException if another replacement stored the same version first
     * @throws InvalidProtocolException if the steps are rejected by the store's {@link ProtocolValidator}
     */
    Protocol replace(String projectId, List<StepSpec> steps, MissionContext context);
}
