package com.onboarding.core.tracker;

/**
 * Raised when a mission id is not known to the tracker.
 */
public class MissionNotFoundException extends RuntimeException {

    private final String missionId;

    public MissionNotFoundException(String missionId) {
        super("Mission not found: " + missionId);
        this.missionId = missionId;
    }

    public String getMissionId() {
        return missionId;
    }
}
