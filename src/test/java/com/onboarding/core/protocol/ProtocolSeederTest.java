package com.onboarding.core.protocol;

import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.Protocol;
import com.onboarding.core.model.StepKinds;
import com.onboarding.core.model.StepSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolSeederTest {

    private static ProtocolProperties.SeedStep seedStep(String kind, String space, boolean fatal) {
        var step = new ProtocolProperties.SeedStep();
        step.setKind(kind);
        step.setTargetSystem("google-chat");
        if (space != null) {
            step.getParameters().put("spaces", space);
        }
        step.setFatalOnFailure(fatal);
        return step;
    }

    @Test
    @DisplayName("seeds every configured project once")
    void seedsConfiguredProjects() {
        var properties = new ProtocolProperties();
        properties.getSeeds().put("PROJ-ALPHA", List.of(
                seedStep(StepKinds.ASSIGNMENT_CHECK, null, true),
                seedStep(StepKinds.CHAT_PROVISION, "spaces/ALPHA-GENERAL", true)));
        var store = new InMemoryProtocolStore();
        var seeder = new ProtocolSeeder(properties);

        assertEquals(1, seeder.seed(store));
        assertEquals(0, seeder.seed(store));

        Protocol alpha = store.get("PROJ-ALPHA", MissionContext.administrative("t", "PROJ-ALPHA")).orElseThrow();
        assertEquals(1, alpha.version());
        assertEquals("system", alpha.createdBy());
        assertEquals("spaces/ALPHA-GENERAL", alpha.steps().get(1).parameter("spaces"));
    }

    @Test
    @DisplayName("existing protocol is not overwritten by the seed")
    void existingProtocolKept() {
        var properties = new ProtocolProperties();
        properties.getSeeds().put("PROJ-ALPHA", List.of(seedStep(StepKinds.CHAT_PROVISION, "spaces/SEED", true)));
        var store = new InMemoryProtocolStore();
        var ctx = MissionContext.administrative("ops", "PROJ-ALPHA");
        store.create("PROJ-ALPHA", List.of(), ctx);

        new ProtocolSeeder(properties).seed(store);

        assertEquals(0, store.get("PROJ-ALPHA", ctx).orElseThrow().stepCount());
    }

    @Test
    @DisplayName("seed longer than the store limit fails instead of storing a truncated protocol")
    void oversizedSeedRejected() {
        var properties = new ProtocolProperties();
        properties.getSeeds().put("PROJ-ALPHA", List.of(
                seedStep(StepKinds.ASSIGNMENT_CHECK, null, true),
                seedStep(StepKinds.CHAT_PROVISION, "spaces/ALPHA-GENERAL", true)));
        var store = new InMemoryProtocolStore(Clock.systemUTC(), new ProtocolValidator(1));

        assertThrows(InvalidProtocolException.class, () -> new ProtocolSeeder(properties).seed(store));
        assertTrue(store.get("PROJ-ALPHA", MissionContext.administrative("t", "PROJ-ALPHA")).isEmpty());
    }

    @Test
    @DisplayName("default protocol verifies assignment then joins the project space")
    void defaultProtocol() {
        var factory = new DefaultProtocolFactory(new ProtocolProperties());

        List<StepSpec> steps = factory.defaultSteps("PROJ-BETA");

        assertEquals(List.of(StepKinds.ASSIGNMENT_CHECK, StepKinds.CHAT_PROVISION),
                steps.stream().map(StepSpec::kind).toList());
        assertTrue(steps.stream().allMatch(StepSpec::fatalOnFailure));
        assertEquals(Map.of("spaces", "spaces/PROJ-BETA-GENERAL"), steps.get(1).parameters());
    }
}
