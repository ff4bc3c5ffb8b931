package com.onboarding.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing onboarding-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String MISSION_ID = "missionId";
    public static final String TRACE_ID = "traceId";
    public static final String STEP_INDEX = "stepIndex";
    public static final String STEP_KIND = "stepKind";

    private MdcContext() {}

    public static void setMission(String missionId, String traceId) {
        MDC.put(MISSION_ID, missionId);
        MDC.put(TRACE_ID, traceId);
    }

    public static void setStep(String missionId, String traceId, int stepIndex, String kind) {
        setMission(missionId, traceId);
        MDC.put(STEP_INDEX, String.valueOf(stepIndex));
        MDC.put(STEP_KIND, kind);
    }

    public static void clearStep() {
        MDC.remove(STEP_INDEX);
        MDC.remove(STEP_KIND);
    }

    public static void clear() {
        MDC.remove(MISSION_ID);
        MDC.remove(TRACE_ID);
        clearStep();
    }
}
