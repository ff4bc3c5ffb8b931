package com.onboarding.core.provisioning;

import com.onboarding.core.CollaboratorUnreachableException;

public class WorkerUnreachableException extends CollaboratorUnreachableException {

    public WorkerUnreachableException(String message, String traceId) {
        super(message, traceId);
    }

    public WorkerUnreachableException(String message, String traceId, Throwable cause) {
        super(message, traceId, cause);
    }
}
