package com.onboarding.core.provisioning;

import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.StepKinds;
import com.onboarding.core.model.StepOutcome;
import com.onboarding.core.model.StepSpec;
import com.onboarding.core.model.StepStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatSpaceProvisioningWorkerTest {

    private static final String MARIA = "maria.rosa@enterprise.com";
    private static final String SA = "onboarding-chat-sa@enterprise.iam";
    private static final MissionContext CTX = MissionContext.administrative("test", "PROJ-ALPHA");

    private ChatSpaceClient client;
    private ChatSpaceProvisioningWorker worker;

    @BeforeEach
    void setUp() {
        client = mock(ChatSpaceClient.class);
        var properties = new ChatProvisioningProperties();
        properties.setServiceAccountId(SA);
        worker = new ChatSpaceProvisioningWorker(client, properties);
    }

    private static StepSpec step(String spaces) {
        return new StepSpec(StepKinds.CHAT_PROVISION, "google-chat",
                spaces == null ? Map.of() : Map.of("spaces", spaces), true);
    }

    private static ChatMembership membership(String space, ChatMembership.Outcome outcome) {
        return new ChatMembership(space, outcome, space + "/members/maria", outcome.name());
    }

    @Test
    @DisplayName("adds the employee to every space as the service account")
    void addsToEverySpace() {
        when(client.addMember(anyString(), eq(MARIA), eq(SA), any())).thenAnswer(inv ->
                membership(inv.getArgument(0), ChatMembership.Outcome.CREATED));

        StepOutcome outcome = worker.executeStep(step("spaces/ALPHA-GENERAL, spaces/ALPHA-DEV"), MARIA, CTX);

        assertEquals(StepStatus.SUCCESS, outcome.status());
        assertEquals("Added to 2 of 2 space(s)", outcome.detail());
        verify(client).addMember("spaces/ALPHA-GENERAL", MARIA, SA, CTX);
        verify(client).addMember("spaces/ALPHA-DEV", MARIA, SA, CTX);
    }

    @Test
    @DisplayName("existing membership everywhere is a skipped step")
    void alreadyMemberSkipped() {
        when(client.addMember(anyString(), any(), any(), any())).thenAnswer(inv ->
                membership(inv.getArgument(0), ChatMembership.Outcome.ALREADY_MEMBER));

        StepOutcome outcome = worker.executeStep(step("spaces/ALPHA-GENERAL"), MARIA, CTX);

        assertEquals(StepStatus.SKIPPED, outcome.status());
    }

    @Test
    @DisplayName("a rejected space fails the step and names the space")
    void rejectedSpaceFails() {
        when(client.addMember(eq("spaces/ALPHA-GENERAL"), any(), any(), any()))
                .thenReturn(membership("spaces/ALPHA-GENERAL", ChatMembership.Outcome.CREATED));
        when(client.addMember(eq("spaces/SECRET"), any(), any(), any()))
                .thenReturn(new ChatMembership("spaces/SECRET", ChatMembership.Outcome.REJECTED, null, "permission denied"));

        StepOutcome outcome = worker.executeStep(step("spaces/ALPHA-GENERAL,spaces/SECRET"), MARIA, CTX);

        assertEquals(StepStatus.FAILURE, outcome.status());
        assertTrue(outcome.detail().contains("spaces/SECRET (permission denied)"));
    }

    @Test
    @DisplayName("a step without spaces fails without calling the chat API")
    void noSpaces() {
        StepOutcome outcome = worker.executeStep(step(null), MARIA, CTX);

        assertEquals(StepStatus.FAILURE, outcome.status());
        verify(client, never()).addMember(any(), any(), any(), any());
    }

    @Test
    @DisplayName("unavailability of the chat API propagates")
    void unavailablePropagates() {
        when(client.addMember(any(), any(), any(), any())).thenThrow(new WorkerUnreachableException("503", "t"));

        assertThrows(WorkerUnreachableException.class,
                () -> worker.executeStep(step("spaces/ALPHA-GENERAL"), MARIA, CTX));
    }

    @Test
    @DisplayName("space list parsing trims and drops blanks")
    void parseSpaces() {
        assertEquals(List.of("spaces/A", "spaces/B"), ChatSpaceProvisioningWorker.parseSpaces(" spaces/A ,, spaces/B,"));
        assertTrue(ChatSpaceProvisioningWorker.parseSpaces("  ").isEmpty());
    }
}
