package com.onboarding.core.graph;

import com.onboarding.core.model.Mission;
import com.onboarding.core.model.MissionMode;
import com.onboarding.core.nodes.CheckAssignmentNode;
import com.onboarding.core.nodes.CreateProtocolNode;
import com.onboarding.core.nodes.DispatchStepNode;
import com.onboarding.core.nodes.FinalizeMissionNode;
import com.onboarding.core.nodes.ResolveProtocolNode;
import com.onboarding.core.protocol.ProtocolProperties;
import com.onboarding.core.state.CoordinatorState;
import com.onboarding.core.tracker.MissionStateTracker;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives
 * the onboarding state machine.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> resolve_protocol -> [routeAfterResolve]
 *            -> create_protocol -> [routeAfterCreate]
 *               -> check_assignment
 *               -> finalize_mission
 *            -> check_assignment -> [routeAfterAssignment]
 *               -> dispatch_step -> [routeAfterDispatch]
 *                  -> dispatch_step (loop until every step was attempted)
 *                  -> finalize_mission
 *               -> finalize_mission  (blocked, failed or empty protocol)
 *            -> finalize_mission  (lookup failed)
 *   finalize_mission -> END
 * </pre>
 * Routers read the mission mode from the {@link MissionStateTracker}, which
 * the nodes update through signals.
 * <p>
 * Every step costs one dispatch_step visit, so the iteration limit is derived
 * from the longest protocol the stores accept.
 */
@Component
public class CoordinatorGraph {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorGraph.class);

    static final String RESOLVE_PROTOCOL = "resolve_protocol";
    static final String CREATE_PROTOCOL = "create_protocol";
    static final String CHECK_ASSIGNMENT = "check_assignment";
    static final String DISPATCH_STEP = "dispatch_step";
    static final String FINALIZE_MISSION = "finalize_mission";

    /** resolve, create, check and finalize visits, with headroom for start and end. */
    static final int NON_STEP_VISITS = 10;

    private final MissionStateTracker tracker;
    private final CompiledGraph<CoordinatorState> compiledGraph;

    public CoordinatorGraph(
            ResolveProtocolNode resolveNode,
            CreateProtocolNode createNode,
            CheckAssignmentNode assignmentNode,
            DispatchStepNode dispatchNode,
            FinalizeMissionNode finalizeNode,
            MissionStateTracker tracker,
            ProtocolProperties protocolProperties) throws Exception {
        this.tracker = tracker;

        var graph = new StateGraph<>(CoordinatorState.SCHEMA, CoordinatorState::new)
                .addNode(RESOLVE_PROTOCOL, node_async(resolveNode::apply))
                .addNode(CREATE_PROTOCOL, node_async(createNode::apply))
                .addNode(CHECK_ASSIGNMENT, node_async(assignmentNode::apply))
                .addNode(DISPATCH_STEP, node_async(dispatchNode::apply))
                .addNode(FINALIZE_MISSION, node_async(finalizeNode::apply))
                .addEdge(START, RESOLVE_PROTOCOL)
                .addConditionalEdges(RESOLVE_PROTOCOL,
                        edge_async(this::routeAfterResolve),
                        Map.of(CREATE_PROTOCOL, CREATE_PROTOCOL,
                                CHECK_ASSIGNMENT, CHECK_ASSIGNMENT,
                                FINALIZE_MISSION, FINALIZE_MISSION))
                .addConditionalEdges(CREATE_PROTOCOL,
                        edge_async(this::routeAfterCreate),
                        Map.of(CHECK_ASSIGNMENT, CHECK_ASSIGNMENT,
                                FINALIZE_MISSION, FINALIZE_MISSION))
                .addConditionalEdges(CHECK_ASSIGNMENT,
                        edge_async(this::routeAfterAssignment),
                        Map.of(DISPATCH_STEP, DISPATCH_STEP,
                                FINALIZE_MISSION, FINALIZE_MISSION))
                .addConditionalEdges(DISPATCH_STEP,
                        edge_async(this::routeAfterDispatch),
                        Map.of(DISPATCH_STEP, DISPATCH_STEP,
                                FINALIZE_MISSION, FINALIZE_MISSION))
                .addEdge(FINALIZE_MISSION, END);

        int recursionLimit = recursionLimitFor(protocolProperties.getMaxSteps());
        this.compiledGraph = graph.compile(CompileConfig.builder()
                .recursionLimit(recursionLimit)
                .build());
        log.info("Coordinator graph compiled (recursion limit {} for up to {} steps)",
                recursionLimit, protocolProperties.getMaxSteps());
    }

    static int recursionLimitFor(int maxSteps) {
        return maxSteps + NON_STEP_VISITS;
    }

    String routeAfterResolve(CoordinatorState state) {
        return switch (mission(state).mode()) {
            case PROTOCOL_CREATION -> CREATE_PROTOCOL;
            case EXECUTION -> CHECK_ASSIGNMENT;
            default -> FINALIZE_MISSION;
        };
    }

    String routeAfterCreate(CoordinatorState state) {
        return mission(state).mode() == MissionMode.EXECUTION ? CHECK_ASSIGNMENT : FINALIZE_MISSION;
    }

    /**
     * Authorized missions with at least one step go on to dispatch; blocked
     * missions and empty protocols go straight to finalization.
     */
    String routeAfterAssignment(CoordinatorState state) {
        Mission mission = mission(state);
        if (mission.mode() == MissionMode.EXECUTION && mission.stepCount() > 0) {
            return DISPATCH_STEP;
        }
        return FINALIZE_MISSION;
    }

    String routeAfterDispatch(CoordinatorState state) {
        Mission mission = mission(state);
        if (mission.mode() != MissionMode.EXECUTION) {
            return FINALIZE_MISSION;
        }
        return mission.stepResults().size() < mission.stepCount() ? DISPATCH_STEP : FINALIZE_MISSION;
    }

    private Mission mission(CoordinatorState state) {
        return tracker.get(state.missionId());
    }

    public CompiledGraph<CoordinatorState> getCompiledGraph() {
        return compiledGraph;
    }
}
