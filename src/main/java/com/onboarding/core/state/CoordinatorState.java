package com.onboarding.core.state;

import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.Protocol;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.Map;
import java.util.Optional;

/**
 * Graph state for one coordinator run.
 * <p>
 * Only carries the mission's identity and the protocol it is bound to. Mode,
 * step results and errors live in the mission state tracker, which the graph
 * routers consult.
 */
public class CoordinatorState extends AgentState {

    public static final String MISSION_ID = "missionId";
    public static final String TRACE_ID = "traceId";
    public static final String EMPLOYEE_ID = "employeeId";
    public static final String PROJECT_ID = "projectId";
    public static final String PROTOCOL = "protocol";

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
        MISSION_ID,  Channels.base(() -> ""),
        TRACE_ID,    Channels.base(() -> ""),
        EMPLOYEE_ID, Channels.base(() -> ""),
        PROJECT_ID,  Channels.base(() -> ""),
        PROTOCOL,    Channels.base((Reducer<Protocol>) null)
    );

    public CoordinatorState(Map<String, Object> initData) {
        super(initData);
    }

    public static Map<String, Object> initial(MissionContext context) {
        return Map.of(
                MISSION_ID, context.missionId(),
                TRACE_ID, context.traceId(),
                EMPLOYEE_ID, context.employeeId(),
                PROJECT_ID, context.projectId());
    }

    public String missionId() {
        return this.<String>value(MISSION_ID).orElse("");
    }

    public String traceId() {
        return this.<String>value(TRACE_ID).orElse("");
    }

    public String employeeId() {
        return this.<String>value(EMPLOYEE_ID).orElse("");
    }

    public String projectId() {
        return this.<String>value(PROJECT_ID).orElse("");
    }

    public Optional<Protocol> protocol() {
        return this.value(PROTOCOL);
    }

    public MissionContext context() {
        return new MissionContext(missionId(), traceId(), employeeId(), projectId());
    }
}
