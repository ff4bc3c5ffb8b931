package com.onboarding.core.protocol;

import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.Protocol;
import com.onboarding.core.model.StepSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ProtocolStore} backed by a {@link ConcurrentHashMap}. Protocols are
 * lost on restart.
 */
public class InMemoryProtocolStore implements ProtocolStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProtocolStore.class);

    private final ConcurrentHashMap<String, Protocol> protocols = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ProtocolValidator validator;

    public InMemoryProtocolStore() {
        this(Clock.systemUTC());
    }

    public InMemoryProtocolStore(Clock clock) {
        this(clock, new ProtocolValidator());
    }

    public InMemoryProtocolStore(Clock clock, ProtocolValidator validator) {
        this.clock = clock;
        this.validator = validator;
    }

    @Override
    public Optional<Protocol> get(String projectId, MissionContext context) {
        log.debug("[{}] Looking up protocol for {}", context.traceId(), projectId);
        return Optional.ofNullable(protocols.get(projectId));
    }

    @Override
    public Protocol create(String projectId, List<StepSpec> steps, MissionContext context) {
        validator.validate(projectId, steps);
        var protocol = new Protocol(projectId, steps, 1, context.employeeId(), clock.instant());
        if (protocols.putIfAbsent(projectId, protocol) != null) {
            log.info("[{}] Protocol for {} was created concurrently", context.traceId(), projectId);
            throw new ProtocolAlreadyExistsException(projectId);
        }
        log.info("[{}] Created protocol v1 for {} with {} steps", context.traceId(), projectId, steps.size());
        return protocol;
    }

    @Override
    public Protocol replace(String projectId, List<StepSpec> steps, MissionContext context) {
        validator.validate(projectId, steps);
        Protocol replaced = protocols.computeIfPresent(projectId, (id, current) ->
                new Protocol(id, steps, current.version() + 1, context.employeeId(), clock.instant()));
        if (replaced == null) {
            throw new ProtocolNotFoundException(projectId);
        }
        log.info("[{}] Replaced protocol for {} with v{}", context.traceId(), projectId, replaced.version());
        return replaced;
    }
}
