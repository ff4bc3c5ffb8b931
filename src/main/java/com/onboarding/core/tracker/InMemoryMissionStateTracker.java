package com.onboarding.core.tracker;

import com.onboarding.core.engine.IllegalModeTransitionException;
import com.onboarding.core.engine.MissionTransitions;
import com.onboarding.core.model.AssignmentVerdict;
import com.onboarding.core.model.Mission;
import com.onboarding.core.model.MissionMode;
import com.onboarding.core.model.MissionSignal;
import com.onboarding.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory {@link MissionStateTracker}.
 * <p>
 * Each mission lives in its own slot guarded by the slot's monitor, so writes
 * to one mission are serialized while different missions never share a lock.
 * The current snapshot is published through a volatile field and can be read
 * without locking.
 */
@Service
public class InMemoryMissionStateTracker implements MissionStateTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMissionStateTracker.class);

    private final ConcurrentHashMap<String, Slot> missions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMissionStateTracker() {
        this(Clock.systemUTC());
    }

    InMemoryMissionStateTracker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String create(Mission mission) {
        var slot = new Slot(mission);
        if (missions.putIfAbsent(mission.missionId(), slot) != null) {
            throw new IllegalStateException("Mission already exists: " + mission.missionId());
        }
        log.debug("Tracking mission {} (trace {})", mission.missionId(), mission.traceId());
        return mission.missionId();
    }

    @Override
    public Mission get(String missionId) {
        return slot(missionId).snapshot;
    }

    @Override
    public List<Mission> list() {
        return missions.values().stream()
                .map(s -> s.snapshot)
                .sorted(Comparator.comparing(Mission::createdAt).thenComparing(Mission::missionId))
                .toList();
    }

    @Override
    public Mission appendStepResult(String missionId, StepResult result) {
        return update(missionId, m -> {
            if (m.mode() != MissionMode.EXECUTION) {
                throw new IllegalStateException("Mission " + missionId
                        + " cannot record step results in mode " + m.mode());
            }
            int expectedIndex = m.stepResults().size();
            if (result.stepIndex() != expectedIndex) {
                throw new IllegalStateException("Mission " + missionId + " expected result for step "
                        + expectedIndex + " but got " + result.stepIndex());
            }
            if (expectedIndex >= m.stepCount()) {
                throw new IllegalStateException("Mission " + missionId + " already has results for all "
                        + m.stepCount() + " steps");
            }
            return m.withStepResult(result);
        });
    }

    @Override
    public Mission setMode(String missionId, MissionMode mode) {
        return update(missionId, m -> {
            if (m.mode().isTerminal()) {
                throw new IllegalStateException("Mission " + missionId + " is already " + m.mode());
            }
            return m.withMode(mode, clock.instant());
        });
    }

    @Override
    public Mission transition(String missionId, MissionSignal signal, String reason) {
        return update(missionId, m -> {
            MissionMode next;
            try {
                next = MissionTransitions.next(m.mode(), signal);
            } catch (IllegalModeTransitionException e) {
                log.warn("Rejected signal {} for mission {} in mode {}", signal, missionId, m.mode());
                throw e;
            }
            Mission updated = m.withMode(next, clock.instant());
            return reason != null ? updated.withFailureReason(reason) : updated;
        });
    }

    @Override
    public Mission recordVerdict(String missionId, AssignmentVerdict verdict) {
        return update(missionId, m -> m.withVerdict(verdict));
    }

    @Override
    public Mission bindProtocol(String missionId, int protocolVersion, int stepCount) {
        return update(missionId, m -> {
            if (m.protocolVersion() != null) {
                throw new IllegalStateException("Mission " + missionId
                        + " is already bound to protocol version " + m.protocolVersion());
            }
            return m.withProtocol(protocolVersion, stepCount);
        });
    }

    @Override
    public Mission recordError(String missionId, String error) {
        return update(missionId, m -> m.withError(error));
    }

    @Override
    public int evictFinishedBefore(Instant cutoff) {
        int evicted = 0;
        for (var it = missions.values().iterator(); it.hasNext(); ) {
            Mission mission = it.next().snapshot;
            if (mission.mode().isTerminal() && mission.completedAt() != null
                    && mission.completedAt().isBefore(cutoff)) {
                it.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} mission(s) finished before {}", evicted, cutoff);
        }
        return evicted;
    }

    private Mission update(String missionId, UnaryOperator<Mission> mutation) {
        Slot slot = slot(missionId);
        synchronized (slot) {
            Mission next = mutation.apply(slot.snapshot);
            slot.snapshot = next;
            return next;
        }
    }

    private Slot slot(String missionId) {
        Slot slot = missions.get(missionId);
        if (slot == null) {
            throw new MissionNotFoundException(missionId);
        }
        return slot;
    }

    private static final class Slot {
        private volatile Mission snapshot;

        private Slot(Mission initial) {
            this.snapshot = initial;
        }
    }
}
